package org.ndfcclient.cli.commands;

import org.ndfcclient.cli.ConfigCommand;
import org.ndfcclient.cli.ConfigFileReader;
import org.ndfcclient.fabric.FabricRequest;
import org.ndfcclient.fabric.FabricService;
import org.ndfcclient.rest.Results;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Deletes fabrics that no longer contain switches.
 */
@Component
public class FabricDeleteCommand extends ConfigCommand<FabricRequest> {

    private final FabricService fabricService;

    public FabricDeleteCommand(ConfigFileReader configFileReader, FabricService fabricService) {
        super("fabric-delete", "Delete empty fabrics", configFileReader, FabricRequest.class);
        this.fabricService = fabricService;
    }

    @Override
    protected void process(List<FabricRequest> items, Results results, PrintStream out) {
        for (FabricRequest item : items) {
            fabricService.delete(item.getFabricName(), results);
        }
    }
}
