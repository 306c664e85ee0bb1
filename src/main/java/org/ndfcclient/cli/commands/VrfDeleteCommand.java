package org.ndfcclient.cli.commands;

import org.ndfcclient.cli.ConfigCommand;
import org.ndfcclient.cli.ConfigFileReader;
import org.ndfcclient.rest.Results;
import org.ndfcclient.vrf.VrfDeleteRequest;
import org.ndfcclient.vrf.VrfService;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Deletes VRFs, one bulk request per request item.
 */
@Component
public class VrfDeleteCommand extends ConfigCommand<VrfDeleteRequest> {

    private final VrfService vrfService;

    public VrfDeleteCommand(ConfigFileReader configFileReader, VrfService vrfService) {
        super("vrf-delete", "Delete VRFs", configFileReader, VrfDeleteRequest.class);
        this.vrfService = vrfService;
    }

    @Override
    protected void process(List<VrfDeleteRequest> items, Results results, PrintStream out) {
        for (VrfDeleteRequest item : items) {
            vrfService.delete(item.getFabricName(), item.getVrfNames(), results);
        }
    }
}
