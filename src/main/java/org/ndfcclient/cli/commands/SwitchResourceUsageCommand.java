package org.ndfcclient.cli.commands;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.ndfcclient.cli.ConfigCommand;
import org.ndfcclient.cli.ConfigFileReader;
import org.ndfcclient.resource.ResourceUsageService;
import org.ndfcclient.resource.SwitchResourceUsageRequest;
import org.ndfcclient.rest.Results;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Shows the resources allocated on switches, grouped by fabric then switch.
 */
@Component
public class SwitchResourceUsageCommand extends ConfigCommand<SwitchResourceUsageRequest> {

    private final ResourceUsageService resourceUsageService;

    public SwitchResourceUsageCommand(ConfigFileReader configFileReader, ResourceUsageService resourceUsageService) {
        super("switch-resource-usage", "Show the resources allocated on switches", configFileReader,
                SwitchResourceUsageRequest.class);
        this.resourceUsageService = resourceUsageService;
    }

    @Override
    protected void process(List<SwitchResourceUsageRequest> items, Results results, PrintStream out) {
        ObjectNode output = newObject();
        for (SwitchResourceUsageRequest item : items) {
            ObjectNode fabric = output.has(item.getFabricName())
                    ? (ObjectNode) output.get(item.getFabricName()) : output.putObject(item.getFabricName());
            ArrayNode usage = fabric.putArray(item.getSwitchName());
            for (JsonNode resource : resourceUsageService.getSwitchResourceUsage(
                    item.getFabricName(), item.getSwitchName(), item.getPoolName())) {
                usage.add(resource);
            }
        }
        print(out, output);
    }
}
