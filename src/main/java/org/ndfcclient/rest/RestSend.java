package org.ndfcclient.rest;

import com.fasterxml.jackson.databind.JsonNode;
import org.ndfcclient.config.NdfcConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;

/**
 * Sends a request through the {@link Sender} until it succeeds or the timeout expires.
 *
 * Each attempt is evaluated by the {@link ResponseHandler}. An unsuccessful attempt is
 * followed by a pause of {@code sendInterval} seconds, and {@code sendInterval} is
 * subtracted from the remaining timeout; sending stops once the remaining timeout is no
 * longer positive. A 401 reply triggers one token refresh and an immediate resend.
 *
 * In check mode, write requests are not sent and a simulated 200 OK reply is used
 * instead. Reads are always sent so existence checks stay accurate.
 *
 * The last verb, path, payload, reply and result are kept so that callers and
 * {@link Results} can inspect them after {@link #commit}. Instances are not thread-safe.
 */
@Component
public class RestSend {

    private static final Logger logger = LoggerFactory.getLogger(RestSend.class);

    private final Sender sender;
    private final ResponseHandler responseHandler;
    private final Sleeper sleeper;
    private final int timeout;
    private final int sendInterval;
    private final boolean checkMode;

    private HttpMethod verbCurrent;
    private String pathCurrent;
    private JsonNode payloadCurrent;
    private ControllerResponse responseCurrent;
    private ControllerResult resultCurrent;

    /**
     * Constructs a RestSend with the timeout, send interval and check mode of
     * "ndfc.rest.*".
     */
    @Autowired
    public RestSend(Sender sender, ResponseHandler responseHandler, NdfcConfig ndfcConfig) {
        this(sender, responseHandler, Sleeper.THREAD, ndfcConfig.getRest().getTimeout(),
             ndfcConfig.getRest().getSendInterval(), ndfcConfig.getRest().isCheckMode());
    }

    public RestSend(Sender sender, ResponseHandler responseHandler, Sleeper sleeper,
                    int timeout, int sendInterval, boolean checkMode) {
        this.sender = sender;
        this.responseHandler = responseHandler;
        this.sleeper = sleeper;
        this.timeout = timeout;
        this.sendInterval = sendInterval;
        this.checkMode = checkMode;
    }

    /**
     * Returns a copy of this RestSend that keeps resending for {@code timeout} seconds.
     */
    public RestSend withTimeout(int timeout) {
        return new RestSend(sender, responseHandler, sleeper, timeout, sendInterval, checkMode);
    }

    /**
     * Returns a copy of this RestSend with another timeout and send interval.
     */
    public RestSend withSettings(int timeout, int sendInterval) {
        return new RestSend(sender, responseHandler, sleeper, timeout, sendInterval, checkMode);
    }

    /**
     * Sends a request and retries it until success or timeout.
     *
     * @param verb HTTP verb
     * @param path Request path
     * @param payload Request body, or null
     * @return The reply of the last attempt, also available as {@link #getResponseCurrent()}
     * @throws NdfcException if the controller cannot be reached
     */
    public ControllerResponse commit(HttpMethod verb, String path, JsonNode payload) {
        this.verbCurrent = verb;
        this.pathCurrent = path;
        this.payloadCurrent = payload;

        if (checkMode && !HttpMethod.GET.equals(verb)) {
            logger.debug("Check mode: not sending {} {}", verb, path);
            responseCurrent = ControllerResponse.simulated(verb.name(), path);
            resultCurrent = responseHandler.handle(verb, responseCurrent);
            return responseCurrent;
        }

        int remaining = timeout;
        int attempt = 0;
        boolean refreshed = false;
        while (true) {
            attempt++;
            responseCurrent = sender.commit(verb, path, payload);
            if (responseCurrent.getReturnCode() == 401 && !refreshed) {
                logger.debug("Received 401 for {} {}, refreshing login", verb, path);
                sender.refreshLogin();
                refreshed = true;
                responseCurrent = sender.commit(verb, path, payload);
            }
            resultCurrent = responseHandler.handle(verb, responseCurrent);
            if (resultCurrent.isSuccess()) {
                break;
            }
            remaining -= sendInterval;
            if (sendInterval <= 0 || remaining <= 0) {
                break;
            }
            logger.debug("Attempt {} of {} {} unsuccessful ({} {}), retrying in {}s",
                         attempt, verb, path, responseCurrent.getReturnCode(),
                         responseCurrent.getMessage(), sendInterval);
            sleeper.sleep(sendInterval);
        }

        if (!resultCurrent.isSuccess()) {
            logger.debug("{} {} unsuccessful after {} attempt(s): {}", verb, path, attempt,
                         responseHandler.errorMessage(responseCurrent));
        }
        return responseCurrent;
    }

    /**
     * Returns the controller's error text for the last reply.
     */
    public String errorMessage() {
        return responseCurrent == null ? "" : responseHandler.errorMessage(responseCurrent);
    }

    public HttpMethod getVerbCurrent() { return verbCurrent; }

    public String getPathCurrent() { return pathCurrent; }

    public JsonNode getPayloadCurrent() { return payloadCurrent; }

    public ControllerResponse getResponseCurrent() { return responseCurrent; }

    public ControllerResult getResultCurrent() { return resultCurrent; }

    public int getTimeout() { return timeout; }

    public int getSendInterval() { return sendInterval; }

    public boolean isCheckMode() { return checkMode; }
}
