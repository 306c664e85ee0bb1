package org.ndfcclient.cli.commands;

import org.ndfcclient.cli.ConfigCommand;
import org.ndfcclient.cli.ConfigFileReader;
import org.ndfcclient.fabric.FabricCreateRequest;
import org.ndfcclient.fabric.FabricService;
import org.ndfcclient.rest.Results;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Creates fabrics from the template of their FABRIC_TYPE.
 */
@Component
public class FabricCreateCommand extends ConfigCommand<FabricCreateRequest> {

    private final FabricService fabricService;

    public FabricCreateCommand(ConfigFileReader configFileReader, FabricService fabricService) {
        super("fabric-create", "Create fabrics", configFileReader, FabricCreateRequest.class);
        this.fabricService = fabricService;
    }

    @Override
    protected void process(List<FabricCreateRequest> items, Results results, PrintStream out) {
        for (FabricCreateRequest item : items) {
            fabricService.create(item, results);
        }
    }
}
