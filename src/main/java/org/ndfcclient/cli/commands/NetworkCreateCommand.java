package org.ndfcclient.cli.commands;

import org.ndfcclient.cli.ConfigCommand;
import org.ndfcclient.cli.ConfigFileReader;
import org.ndfcclient.network.NetworkCreateRequest;
import org.ndfcclient.network.NetworkService;
import org.ndfcclient.rest.Results;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Creates networks.
 */
@Component
public class NetworkCreateCommand extends ConfigCommand<NetworkCreateRequest> {

    private final NetworkService networkService;

    public NetworkCreateCommand(ConfigFileReader configFileReader, NetworkService networkService) {
        super("network-create", "Create networks", configFileReader, NetworkCreateRequest.class);
        this.networkService = networkService;
    }

    @Override
    protected void process(List<NetworkCreateRequest> items, Results results, PrintStream out) {
        for (NetworkCreateRequest item : items) {
            networkService.create(item, results);
        }
    }
}
