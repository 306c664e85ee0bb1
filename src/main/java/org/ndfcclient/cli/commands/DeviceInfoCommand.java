package org.ndfcclient.cli.commands;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.ndfcclient.cli.ConfigCommand;
import org.ndfcclient.cli.ConfigFileReader;
import org.ndfcclient.discover.DeviceInfoRequest;
import org.ndfcclient.discover.DiscoverService;
import org.ndfcclient.rest.Results;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Shows inventory details of switches, looked up by IP address.
 */
@Component
public class DeviceInfoCommand extends ConfigCommand<DeviceInfoRequest> {

    private final DiscoverService discoverService;

    public DeviceInfoCommand(ConfigFileReader configFileReader, DiscoverService discoverService) {
        super("device-info", "Show the inventory record of switches by IP address", configFileReader,
              DeviceInfoRequest.class);
        this.discoverService = discoverService;
    }

    @Override
    protected void process(List<DeviceInfoRequest> items, Results results, PrintStream out) {
        ObjectNode output = newObject();
        for (DeviceInfoRequest item : items) {
            output.set(item.getSwitchIp4(), discoverService.deviceInfo(item).getRaw());
        }
        print(out, output);
    }
}
