package org.ndfcclient.cli.commands;

import org.ndfcclient.cli.ConfigCommand;
import org.ndfcclient.cli.ConfigFileReader;
import org.ndfcclient.rest.Results;
import org.ndfcclient.vrf.VrfAttachRequest;
import org.ndfcclient.vrf.VrfService;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Attaches VRFs to switches or vPC pairs.
 */
@Component
public class VrfAttachCommand extends ConfigCommand<VrfAttachRequest> {

    private final VrfService vrfService;

    public VrfAttachCommand(ConfigFileReader configFileReader, VrfService vrfService) {
        super("vrf-attach", "Attach VRFs to switches or vPC pairs", configFileReader, VrfAttachRequest.class);
        this.vrfService = vrfService;
    }

    @Override
    protected void process(List<VrfAttachRequest> items, Results results, PrintStream out) {
        for (VrfAttachRequest item : items) {
            vrfService.attach(item, results);
        }
    }
}
