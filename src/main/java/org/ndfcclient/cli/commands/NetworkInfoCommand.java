package org.ndfcclient.cli.commands;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.ndfcclient.cli.ConfigCommand;
import org.ndfcclient.cli.ConfigFileReader;
import org.ndfcclient.network.NetworkRequest;
import org.ndfcclient.network.NetworkService;
import org.ndfcclient.rest.Results;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Shows networks by name.
 */
@Component
public class NetworkInfoCommand extends ConfigCommand<NetworkRequest> {

    private final NetworkService networkService;

    public NetworkInfoCommand(ConfigFileReader configFileReader, NetworkService networkService) {
        super("network-info", "Show networks", configFileReader, NetworkRequest.class);
        this.networkService = networkService;
    }

    @Override
    protected void process(List<NetworkRequest> items, Results results, PrintStream out) {
        ObjectNode output = newObject();
        for (NetworkRequest item : items) {
            ObjectNode fabric = output.has(item.getFabricName())
                    ? (ObjectNode) output.get(item.getFabricName()) : output.putObject(item.getFabricName());
            fabric.set(item.getNetworkName(), networkService.getNetwork(item.getFabricName(), item.getNetworkName()));
        }
        print(out, output);
    }
}
