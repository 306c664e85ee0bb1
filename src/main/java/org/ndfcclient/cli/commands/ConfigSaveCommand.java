package org.ndfcclient.cli.commands;

import org.ndfcclient.cli.ConfigCommand;
import org.ndfcclient.cli.ConfigFileReader;
import org.ndfcclient.fabric.ConfigDeployService;
import org.ndfcclient.fabric.FabricRequest;
import org.ndfcclient.rest.Results;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Runs config-save on each named fabric.
 */
@Component
public class ConfigSaveCommand extends ConfigCommand<FabricRequest> {

    private static final Logger logger = LoggerFactory.getLogger(ConfigSaveCommand.class);

    private final ConfigDeployService configDeployService;

    public ConfigSaveCommand(ConfigFileReader configFileReader, ConfigDeployService configDeployService) {
        super("config-save", "Save the intended configuration of fabrics", configFileReader, FabricRequest.class);
        this.configDeployService = configDeployService;
    }

    @Override
    protected void process(List<FabricRequest> items, Results results, PrintStream out) {
        for (FabricRequest item : items) {
            String status = configDeployService.save(item.getFabricName(), results);
            logger.info("config-save of fabric {}: {}", item.getFabricName(), status);
        }
    }
}
