package org.ndfcclient.rest;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Outcome flags derived from a {@link ControllerResponse} by the {@link ResponseHandler}.
 *
 * GET requests set {@code found}; write requests set {@code changed}.
 */
public class ControllerResult {

    private final boolean success;
    private final boolean found;
    private final boolean changed;

    private ControllerResult(boolean success, boolean found, boolean changed) {
        this.success = success;
        this.found = found;
        this.changed = changed;
    }

    public static ControllerResult ofGet(boolean success, boolean found) {
        return new ControllerResult(success, found, false);
    }

    public static ControllerResult ofWrite(boolean success, boolean changed) {
        return new ControllerResult(success, false, changed);
    }

    public boolean isSuccess() { return success; }

    public boolean isFound() { return found; }

    public boolean isChanged() { return changed; }

    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("success", success);
        node.put("found", found);
        node.put("changed", changed);
        return node;
    }

    @Override
    public String toString() {
        return "ControllerResult{success=" + success + ", found=" + found + ", changed=" + changed + '}';
    }
}
