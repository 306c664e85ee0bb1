package org.ndfcclient.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.HashSet;
import java.util.Set;

/**
 * Collects the outcome of every write an operation sends.
 *
 * Each {@link #register} call appends the last reply, result, payload (as "diff") and
 * metadata of a {@link RestSend} to the corresponding lists. {@link #finalResult()}
 * summarizes them as:
 *
 * <pre>
 * {
 *   "changed": true|false,
 *   "failed": true|false,
 *   "diff": [...], "response": [...], "result": [...], "metadata": [...]
 * }
 * </pre>
 *
 * The overall result is failed if any registered result failed, and changed if any
 * registered result changed the controller.
 */
public class Results {

    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    private final ArrayNode diff = nodes.arrayNode();
    private final ArrayNode response = nodes.arrayNode();
    private final ArrayNode result = nodes.arrayNode();
    private final ArrayNode metadata = nodes.arrayNode();

    private final Set<Boolean> failed = new HashSet<>();
    private final Set<Boolean> changed = new HashSet<>();

    private int sequenceNumber = 0;

    /**
     * Records the last request sent by {@code restSend}.
     *
     * @param action Operation name, for example "vrf_create"
     * @param state Requested state, for example "merged" or "deleted"
     * @param restSend The RestSend that sent the request
     */
    public void register(String action, String state, RestSend restSend) {
        ControllerResponse responseCurrent = restSend.getResponseCurrent();
        ControllerResult resultCurrent = restSend.getResultCurrent();
        if (responseCurrent == null || resultCurrent == null) {
            throw new IllegalStateException("RestSend.commit() must be called before registering " + action);
        }
        sequenceNumber++;

        ObjectNode meta = nodes.objectNode();
        meta.put("action", action);
        meta.put("check_mode", restSend.isCheckMode());
        meta.put("sequence_number", sequenceNumber);
        meta.put("state", state);

        JsonNode payload = restSend.getPayloadCurrent();
        ObjectNode diffEntry = nodes.objectNode();
        if (resultCurrent.isChanged() && payload != null) {
            diffEntry.set("payload", payload);
        }
        diffEntry.put("sequence_number", sequenceNumber);

        ObjectNode responseEntry = responseCurrent.toJson();
        responseEntry.put("sequence_number", sequenceNumber);
        ObjectNode resultEntry = resultCurrent.toJson();
        resultEntry.put("sequence_number", sequenceNumber);

        diff.add(diffEntry);
        response.add(responseEntry);
        result.add(resultEntry);
        metadata.add(meta);

        failed.add(!resultCurrent.isSuccess());
        changed.add(resultCurrent.isChanged());
    }

    public boolean isFailed() {
        return failed.contains(true);
    }

    public boolean isChanged() {
        return changed.contains(true);
    }

    public int size() {
        return sequenceNumber;
    }

    /**
     * Returns the summary of every registered request.
     */
    public ObjectNode finalResult() {
        ObjectNode node = nodes.objectNode();
        node.put("changed", isChanged());
        node.put("failed", isFailed());
        node.set("diff", diff.deepCopy());
        node.set("response", response.deepCopy());
        node.set("result", result.deepCopy());
        node.set("metadata", metadata.deepCopy());
        return node;
    }
}
