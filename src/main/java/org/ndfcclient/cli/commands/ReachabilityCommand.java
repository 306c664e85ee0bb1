package org.ndfcclient.cli.commands;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.ndfcclient.cli.ConfigCommand;
import org.ndfcclient.cli.ConfigFileReader;
import org.ndfcclient.discover.DiscoverService;
import org.ndfcclient.discover.ReachabilityRequest;
import org.ndfcclient.rest.Results;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Tests whether switches can be reached from a fabric before discovery.
 */
@Component
public class ReachabilityCommand extends ConfigCommand<ReachabilityRequest> {

    private final DiscoverService discoverService;

    public ReachabilityCommand(ConfigFileReader configFileReader, DiscoverService discoverService) {
        super("reachability", "Test whether the controller can reach switches", configFileReader,
              ReachabilityRequest.class);
        this.discoverService = discoverService;
    }

    @Override
    protected void process(List<ReachabilityRequest> items, Results results, PrintStream out) {
        ObjectNode output = newObject();
        for (ReachabilityRequest item : items) {
            output.set(item.getSeedIp(), discoverService.reachability(item).getRaw());
        }
        print(out, output);
    }
}
