package org.ndfcclient.cli.commands;

import org.ndfcclient.cli.ConfigCommand;
import org.ndfcclient.cli.ConfigFileReader;
import org.ndfcclient.network.NetworkRequest;
import org.ndfcclient.network.NetworkService;
import org.ndfcclient.rest.Results;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Deletes networks.
 */
@Component
public class NetworkDeleteCommand extends ConfigCommand<NetworkRequest> {

    private final NetworkService networkService;

    public NetworkDeleteCommand(ConfigFileReader configFileReader, NetworkService networkService) {
        super("network-delete", "Delete networks", configFileReader, NetworkRequest.class);
        this.networkService = networkService;
    }

    @Override
    protected void process(List<NetworkRequest> items, Results results, PrintStream out) {
        for (NetworkRequest item : items) {
            networkService.delete(item.getFabricName(), item.getNetworkName(), results);
        }
    }
}
