package org.ndfcclient.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.PrintStream;

/**
 * Base class of the commands: name, description and JSON output.
 */
public abstract class AbstractCommand implements NdfcCommand {

    protected final ObjectMapper objectMapper = new ObjectMapper();

    private final String name;
    private final String description;

    protected AbstractCommand(String name, String description) {
        this.name = name;
        this.description = description;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return description;
    }

    protected ObjectNode newObject() {
        return objectMapper.createObjectNode();
    }

    /**
     * Writes a JSON document, pretty printed.
     */
    protected void print(PrintStream out, JsonNode json) {
        try {
            out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(json));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize output of " + name, e);
        }
    }
}
