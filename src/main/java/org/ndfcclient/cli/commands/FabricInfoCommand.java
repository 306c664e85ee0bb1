package org.ndfcclient.cli.commands;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.ndfcclient.cli.ConfigCommand;
import org.ndfcclient.cli.ConfigFileReader;
import org.ndfcclient.fabric.FabricRequest;
import org.ndfcclient.fabric.FabricService;
import org.ndfcclient.rest.Results;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Shows the full details of the named fabrics, keyed on fabric name.
 */
@Component
public class FabricInfoCommand extends ConfigCommand<FabricRequest> {

    private final FabricService fabricService;

    public FabricInfoCommand(ConfigFileReader configFileReader, FabricService fabricService) {
        super("fabric-info", "Show the details of fabrics", configFileReader, FabricRequest.class);
        this.fabricService = fabricService;
    }

    @Override
    protected void process(List<FabricRequest> items, Results results, PrintStream out) {
        ObjectNode output = newObject();
        for (FabricRequest item : items) {
            output.set(item.getFabricName(), fabricService.getFabricDetails(item.getFabricName()));
        }
        print(out, output);
    }
}
