package org.ndfcclient.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A controller reply normalized into the fields every operation inspects.
 *
 * The JSON form produced by {@link #toJson()} uses the upper-case keys RETURN_CODE,
 * DATA, MESSAGE, METHOD and REQUEST_PATH, plus CHECK_MODE for simulated replies.
 */
public class ControllerResponse {

    private final int returnCode;
    private final String message;
    private final String method;
    private final String requestPath;
    private final JsonNode data;
    private final boolean checkMode;

    public ControllerResponse(int returnCode, String message, String method, String requestPath, JsonNode data) {
        this(returnCode, message, method, requestPath, data, false);
    }

    public ControllerResponse(int returnCode, String message, String method, String requestPath,
                              JsonNode data, boolean checkMode) {
        this.returnCode = returnCode;
        this.message = message;
        this.method = method;
        this.requestPath = requestPath;
        this.data = data == null ? MissingNode.getInstance() : data;
        this.checkMode = checkMode;
    }

    /**
     * Builds the reply RestSend produces instead of sending a write in check mode.
     *
     * @param method The HTTP verb that was not sent
     * @param requestPath The path that was not called
     * @return A 200 OK reply flagged as simulated
     */
    public static ControllerResponse simulated(String method, String requestPath) {
        ObjectNode data = JsonNodeFactory.instance.objectNode();
        data.put("simulated", "check-mode-response");
        data.put("status", "Success");
        return new ControllerResponse(200, "OK", method, requestPath, data, true);
    }

    public int getReturnCode() { return returnCode; }

    public String getMessage() { return message; }

    public String getMethod() { return method; }

    public String getRequestPath() { return requestPath; }

    /**
     * Gets the parsed reply body. Bodies that are not JSON are wrapped as
     * {"INVALID_JSON": "&lt;raw text&gt;"}.
     *
     * @return The reply body, never null
     */
    public JsonNode getData() { return data; }

    public boolean isCheckMode() { return checkMode; }

    public boolean isReturnCode(int... codes) {
        for (int code : codes) {
            if (code == returnCode) {
                return true;
            }
        }
        return false;
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("RETURN_CODE", returnCode);
        node.put("METHOD", method);
        node.put("REQUEST_PATH", requestPath);
        node.put("MESSAGE", message);
        node.set("DATA", data.isMissingNode() ? JsonNodeFactory.instance.objectNode() : data);
        if (checkMode) {
            node.put("CHECK_MODE", true);
        }
        return node;
    }

    @Override
    public String toString() {
        return "ControllerResponse{" +
                "returnCode=" + returnCode +
                ", message='" + message + '\'' +
                ", method='" + method + '\'' +
                ", requestPath='" + requestPath + '\'' +
                '}';
    }
}
