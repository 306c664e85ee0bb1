package org.ndfcclient.cli.commands;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.ndfcclient.cli.ConfigCommand;
import org.ndfcclient.cli.ConfigFileReader;
import org.ndfcclient.rest.Results;
import org.ndfcclient.vrf.VrfRequest;
import org.ndfcclient.vrf.VrfService;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Shows VRFs by name.
 */
@Component
public class VrfInfoCommand extends ConfigCommand<VrfRequest> {

    private final VrfService vrfService;

    public VrfInfoCommand(ConfigFileReader configFileReader, VrfService vrfService) {
        super("vrf-info", "Show VRFs", configFileReader, VrfRequest.class);
        this.vrfService = vrfService;
    }

    @Override
    protected void process(List<VrfRequest> items, Results results, PrintStream out) {
        ObjectNode output = newObject();
        for (VrfRequest item : items) {
            ObjectNode fabric = output.has(item.getFabricName())
                    ? (ObjectNode) output.get(item.getFabricName()) : output.putObject(item.getFabricName());
            fabric.set(item.getVrfName(), vrfService.getVrf(item.getFabricName(), item.getVrfName()));
        }
        print(out, output);
    }
}
