package org.ndfcclient.cli.commands;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.ndfcclient.cli.ConfigCommand;
import org.ndfcclient.cli.ConfigFileReader;
import org.ndfcclient.fabric.FabricInventoryService.SwitchInfo;
import org.ndfcclient.fabric.FabricInventoryService;
import org.ndfcclient.fabric.FabricRequest;
import org.ndfcclient.rest.Results;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Shows the switches of each named fabric.
 */
@Component
public class FabricInventoryCommand extends ConfigCommand<FabricRequest> {

    private final FabricInventoryService inventoryService;

    public FabricInventoryCommand(ConfigFileReader configFileReader, FabricInventoryService inventoryService) {
        super("fabric-inventory", "Show the switches of fabrics", configFileReader, FabricRequest.class);
        this.inventoryService = inventoryService;
    }

    @Override
    protected void process(List<FabricRequest> items, Results results, PrintStream out) {
        ObjectNode output = newObject();
        for (FabricRequest item : items) {
            ObjectNode switches = output.putObject(item.getFabricName());
            for (SwitchInfo switchInfo : inventoryService.getInventory(item.getFabricName()).values()) {
                switches.set(switchInfo.getLogicalName(), switchInfo.getRaw());
            }
        }
        print(out, output);
    }
}
