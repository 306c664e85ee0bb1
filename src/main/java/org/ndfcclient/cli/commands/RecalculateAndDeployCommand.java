package org.ndfcclient.cli.commands;

import org.ndfcclient.cli.ConfigCommand;
import org.ndfcclient.cli.ConfigFileReader;
import org.ndfcclient.fabric.ConfigDeployService;
import org.ndfcclient.fabric.FabricRequest;
import org.ndfcclient.rest.Results;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Triggers recalculate-and-deploy on each named fabric.
 */
@Component
public class RecalculateAndDeployCommand extends ConfigCommand<FabricRequest> {

    private final ConfigDeployService configDeployService;

    public RecalculateAndDeployCommand(ConfigFileReader configFileReader, ConfigDeployService configDeployService) {
        super("recalculate-and-deploy", "Recalculate and deploy the configuration of fabrics",
                configFileReader, FabricRequest.class);
        this.configDeployService = configDeployService;
    }

    @Override
    protected void process(List<FabricRequest> items, Results results, PrintStream out) {
        for (FabricRequest item : items) {
            configDeployService.recalculateAndDeploy(item.getFabricName(), results);
        }
    }
}
