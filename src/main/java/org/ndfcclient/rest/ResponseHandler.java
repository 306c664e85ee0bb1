package org.ndfcclient.rest;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives success, found and changed flags from controller replies.
 *
 * GET replies:
 * - 404 with message "Not Found": success, not found
 * - return code other than 200 or 404, or message other than "OK": failure
 * - anything else: success, found
 *
 * POST, PUT and DELETE replies:
 * - an ERROR entry, a DATA.error entry, or a message other than "OK": failure, not changed
 * - anything else: success, changed
 */
@Component
public class ResponseHandler {

    private static final Logger logger = LoggerFactory.getLogger(ResponseHandler.class);

    /**
     * Evaluates a reply to the given verb.
     *
     * @param verb The HTTP verb the reply answers
     * @param response The normalized reply
     * @return The outcome flags
     */
    public ControllerResult handle(HttpMethod verb, ControllerResponse response) {
        ControllerResult result = HttpMethod.GET.equals(verb) ? handleGet(response) : handleWrite(response);
        logger.debug("{} {} -> {}", verb, response.getRequestPath(), result);
        return result;
    }

    private ControllerResult handleGet(ControllerResponse response) {
        if (response.getReturnCode() == 404 && "Not Found".equals(response.getMessage())) {
            return ControllerResult.ofGet(true, false);
        }
        if (!response.isReturnCode(200, 404) || !"OK".equals(response.getMessage())) {
            return ControllerResult.ofGet(false, false);
        }
        return ControllerResult.ofGet(true, true);
    }

    private ControllerResult handleWrite(ControllerResponse response) {
        JsonNode data = response.getData();
        boolean error = data.has("ERROR") || (data.isObject() && data.has("error"));
        if (error || !"OK".equals(response.getMessage())) {
            return ControllerResult.ofWrite(false, false);
        }
        return ControllerResult.ofWrite(true, true);
    }

    /**
     * Extracts the most readable error text from a failed reply.
     *
     * @param response The normalized reply
     * @return The controller's error text, or the HTTP reason phrase when DATA has none
     */
    public String errorMessage(ControllerResponse response) {
        JsonNode data = response.getData();
        List<String> messages = new ArrayList<>();
        if (data.isObject()) {
            JsonNode error = data.path("error");
            if (error.isTextual()) {
                addText(messages, error.asText());
            } else if (error.isObject()) {
                addText(messages, error.path("message").asText(error.path("detail").asText(error.toString())));
            }
            for (JsonNode failure : data.path("failureList")) {
                addText(messages, failure.path("message").asText("").replace("\t", " "));
            }
            if (messages.isEmpty() && data.path("message").isTextual()) {
                addText(messages, data.path("message").asText());
            }
            if (messages.isEmpty() && data.has("INVALID_JSON")) {
                addText(messages, data.path("INVALID_JSON").asText());
            }
        } else if (data.isArray()) {
            for (JsonNode item : data) {
                if (item.path("message").isTextual()) {
                    addText(messages, item.path("message").asText());
                }
            }
        }
        if (messages.isEmpty()) {
            return response.getReturnCode() + " " + response.getMessage();
        }
        return String.join("; ", messages);
    }

    // Blank texts fall through to the status line
    private static void addText(List<String> messages, String text) {
        if (text != null && !text.isBlank()) {
            messages.add(text);
        }
    }

    /**
     * Lists the entries of an attach or detach reply that did not succeed.
     *
     * Attachment replies map "&lt;name&gt;-[&lt;serial&gt;/&lt;switch&gt;]" to a status
     * such as "SUCCESS" or an error text.
     *
     * @param response The attachment reply
     * @return "key: status" for each entry whose status is not SUCCESS
     */
    public List<String> failedAttachments(ControllerResponse response) {
        List<String> failures = new ArrayList<>();
        JsonNode data = response.getData();
        if (!data.isObject() || data.has("INVALID_JSON")) {
            return failures;
        }
        data.fields().forEachRemaining(entry -> {
            String status = entry.getValue().asText(entry.getValue().toString());
            if (!"SUCCESS".equalsIgnoreCase(status)) {
                failures.add(entry.getKey() + ": " + status);
            }
        });
        return failures;
    }
}
