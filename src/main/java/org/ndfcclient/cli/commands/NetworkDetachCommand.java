package org.ndfcclient.cli.commands;

import org.ndfcclient.cli.ConfigCommand;
import org.ndfcclient.cli.ConfigFileReader;
import org.ndfcclient.network.NetworkAttachRequest;
import org.ndfcclient.network.NetworkService;
import org.ndfcclient.rest.Results;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Detaches networks from switch ports.
 */
@Component
public class NetworkDetachCommand extends ConfigCommand<NetworkAttachRequest> {

    private final NetworkService networkService;

    public NetworkDetachCommand(ConfigFileReader configFileReader, NetworkService networkService) {
        super("network-detach", "Detach networks from switch ports", configFileReader, NetworkAttachRequest.class);
        this.networkService = networkService;
    }

    @Override
    protected void process(List<NetworkAttachRequest> items, Results results, PrintStream out) {
        for (NetworkAttachRequest item : items) {
            networkService.detach(item, results);
        }
    }
}
