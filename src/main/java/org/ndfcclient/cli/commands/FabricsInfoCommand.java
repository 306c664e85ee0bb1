package org.ndfcclient.cli.commands;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.ndfcclient.cli.AbstractCommand;
import org.ndfcclient.fabric.FabricService;
import org.springframework.boot.ApplicationArguments;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Map;

/**
 * Shows every fabric on the controller, keyed on fabric name. Needs no request file.
 */
@Component
public class FabricsInfoCommand extends AbstractCommand {

    private final FabricService fabricService;

    public FabricsInfoCommand(FabricService fabricService) {
        super("fabrics-info", "Show every fabric on the controller");
        this.fabricService = fabricService;
    }

    @Override
    public void execute(ApplicationArguments args, PrintStream out) {
        ObjectNode fabrics = newObject();
        for (Map.Entry<String, JsonNode> entry : fabricService.getFabrics().entrySet()) {
            fabrics.set(entry.getKey(), entry.getValue());
        }
        print(out, fabrics);
    }
}
