package org.ndfcclient.cli.commands;

import org.ndfcclient.cli.ConfigCommand;
import org.ndfcclient.cli.ConfigFileReader;
import org.ndfcclient.discover.DiscoverService;
import org.ndfcclient.discover.ReachabilityRequest;
import org.ndfcclient.rest.Results;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Discovers switches into fabrics, optionally waiting until they are up.
 */
@Component
public class DiscoverCommand extends ConfigCommand<ReachabilityRequest> {

    private final DiscoverService discoverService;

    public DiscoverCommand(ConfigFileReader configFileReader, DiscoverService discoverService) {
        super("discover", "Discover switches into fabrics", configFileReader, ReachabilityRequest.class);
        this.discoverService = discoverService;
    }

    @Override
    protected void process(List<ReachabilityRequest> items, Results results, PrintStream out) {
        for (ReachabilityRequest item : items) {
            discoverService.discover(item, results);
        }
    }
}
