package org.ndfcclient.cli.commands;

import org.ndfcclient.cli.ConfigCommand;
import org.ndfcclient.cli.ConfigFileReader;
import org.ndfcclient.rest.Results;
import org.ndfcclient.vrf.VrfCreateRequest;
import org.ndfcclient.vrf.VrfService;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Creates VRFs.
 */
@Component
public class VrfCreateCommand extends ConfigCommand<VrfCreateRequest> {

    private final VrfService vrfService;

    public VrfCreateCommand(ConfigFileReader configFileReader, VrfService vrfService) {
        super("vrf-create", "Create VRFs", configFileReader, VrfCreateRequest.class);
        this.vrfService = vrfService;
    }

    @Override
    protected void process(List<VrfCreateRequest> items, Results results, PrintStream out) {
        for (VrfCreateRequest item : items) {
            vrfService.create(item, results);
        }
    }
}
