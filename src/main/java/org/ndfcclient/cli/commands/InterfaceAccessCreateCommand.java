package org.ndfcclient.cli.commands;

import org.ndfcclient.cli.ConfigCommand;
import org.ndfcclient.cli.ConfigFileReader;
import org.ndfcclient.interfaces.InterfaceAccessRequest;
import org.ndfcclient.interfaces.InterfaceService;
import org.ndfcclient.rest.Results;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Configures access-mode interfaces.
 */
@Component
public class InterfaceAccessCreateCommand extends ConfigCommand<InterfaceAccessRequest> {

    private final InterfaceService interfaceService;

    public InterfaceAccessCreateCommand(ConfigFileReader configFileReader, InterfaceService interfaceService) {
        super("interface-access-create", "Configure access-mode interfaces", configFileReader,
                InterfaceAccessRequest.class);
        this.interfaceService = interfaceService;
    }

    @Override
    protected void process(List<InterfaceAccessRequest> items, Results results, PrintStream out) {
        for (InterfaceAccessRequest item : items) {
            interfaceService.createAccess(item, results);
        }
    }
}
