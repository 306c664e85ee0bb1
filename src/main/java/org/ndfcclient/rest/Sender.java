package org.ndfcclient.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.ndfcclient.config.NdfcConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Authenticates with the controller and sends single HTTP requests to it.
 *
 * The sender holds the controller's JWT after {@link #login()} and attaches it to every
 * request as the AuthCookie cookie and header and as the Authorization header. A
 * Set-Cookie reply header carrying a new AuthCookie replaces the held token.
 *
 * Each reply, whatever its status, is normalized into a {@link ControllerResponse}:
 * - RETURN_CODE: the HTTP status code
 * - DATA: the parsed JSON body, or {"INVALID_JSON": "&lt;body&gt;"} when it is not JSON
 * - MESSAGE: the HTTP reason phrase
 * - METHOD and REQUEST_PATH: the verb and URL that were sent
 *
 * The sender does not retry; see {@link RestSend}. It is not thread-safe.
 */
@Component
public class Sender {

    private static final Logger logger = LoggerFactory.getLogger(Sender.class);

    /** Number of replies kept in the request history */
    static final int HISTORY_SIZE = 50;

    private final NdfcConfig ndfcConfig;

    private final WebClient webClient;

    private final ObjectMapper objectMapper;

    private final Deque<HistoryEntry> history = new ArrayDeque<>();

    /** JWT returned by the controller at login */
    private String token;

    /** RBAC string returned by the controller at login */
    private String rbac;

    /**
     * Constructs a sender for the configured controller.
     *
     * @param ndfcConfig Controller address, credentials and request timeout
     * @param webClientBuilder Pre-configured WebClient.Builder with TLS settings
     */
    public Sender(NdfcConfig ndfcConfig, WebClient.Builder webClientBuilder) {
        this.ndfcConfig = ndfcConfig;
        this.webClient = webClientBuilder.build();
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Logs into the controller and stores the returned token.
     *
     * @throws NdfcException if the controller is unreachable or the reply holds no token
     */
    public void login() {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("userName", ndfcConfig.getUsername());
        payload.put("userPasswd", ndfcConfig.getPassword());
        payload.put("domain", ndfcConfig.getDomain());

        if (logger.isDebugEnabled()) {
            ObjectNode masked = payload.deepCopy();
            masked.put("userPasswd", "********");
            logger.debug("Logging into {} with payload {}", ndfcConfig.controllerHost(), masked);
        }

        ControllerResponse response = exchange(HttpMethod.POST, "/login", payload, false);
        JsonNode data = response.getData();
        if (!data.path("jwttoken").isTextual()) {
            logger.debug("Login reply: {}", response.toJson());
            throw new NdfcException("Unable to parse token from response", response.getReturnCode());
        }
        token = data.path("jwttoken").asText();
        rbac = data.path("rbac").asText(null);
        logger.debug("Logged into controller {} as {}", ndfcConfig.controllerHost(), ndfcConfig.getUsername());
    }

    /**
     * Refreshes the held token.
     *
     * @throws NdfcException if the controller rejects the refresh
     */
    public void refreshLogin() {
        if (token == null) {
            login();
            return;
        }
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("jwttoken", token);
        ControllerResponse response = exchange(HttpMethod.POST, "/refresh", payload, true);
        JsonNode data = response.getData();
        if (data.path("jwttoken").isTextual()) {
            token = data.path("jwttoken").asText();
            rbac = data.path("rbac").asText(rbac);
        } else if (!response.isReturnCode(200)) {
            throw new NdfcException("Unable to refresh login. Controller response: "
                    + response.getReturnCode() + " " + response.getMessage(), response.getReturnCode());
        }
        logger.debug("Refreshed controller login");
    }

    /**
     * Sends one request to the controller, logging in first if no token is held.
     *
     * @param verb HTTP verb
     * @param path Request path, with or without a leading "/"
     * @param payload Request body, or null for none
     * @return The normalized reply
     * @throws NdfcException if the controller address, verb or path is missing, or the
     *         controller cannot be reached
     */
    public ControllerResponse commit(HttpMethod verb, String path, JsonNode payload) {
        if (ndfcConfig.controllerHost() == null) {
            throw new NdfcException("ip4 or ip6 must be set before calling commit()");
        }
        if (verb == null) {
            throw new NdfcException("verb must be set before calling commit()");
        }
        if (path == null || path.isBlank()) {
            throw new NdfcException("path must be set before calling commit()");
        }
        if (token == null) {
            login();
        }
        return exchange(verb, path, payload, true);
    }

    private ControllerResponse exchange(HttpMethod verb, String path, JsonNode payload, boolean authenticated) {
        String host = ndfcConfig.controllerHost();
        if (host == null) {
            throw new NdfcException("ip4 or ip6 must be set before calling commit()");
        }
        String url = buildUrl(host, path);
        logger.debug("Sending {} {}", verb, url);

        WebClient.RequestBodySpec request = webClient.method(verb)
            .uri(URI.create(url))
            .contentType(MediaType.APPLICATION_JSON)
            .headers(headers -> {
                if (authenticated && token != null) {
                    headers.add(HttpHeaders.COOKIE, "AuthCookie=" + token);
                    headers.add("AuthCookie", token);
                    headers.add(HttpHeaders.AUTHORIZATION, token);
                }
            });
        WebClient.RequestHeadersSpec<?> spec = payload == null ? request : request.bodyValue(payload.toString());

        ControllerResponse response;
        try {
            response = spec
                .exchangeToMono(reply -> reply.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .map(body -> normalize(verb, url, reply.statusCode(), reply.headers().asHttpHeaders(), body)))
                .block(Duration.ofSeconds(ndfcConfig.getRequestTimeout()));
        } catch (WebClientException | IllegalStateException e) {
            logger.debug("Request {} {} failed: {}", verb, url, e.getMessage());
            throw new NdfcException("Error connecting to the controller. Error detail: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new NdfcException("Error connecting to the controller. Error detail: empty reply to " + verb + " " + url);
        }

        logger.debug("Reply {} {} to {} {}", response.getReturnCode(), response.getMessage(), verb, url);
        record(response);
        return response;
    }

    private ControllerResponse normalize(HttpMethod verb, String url, HttpStatusCode status, HttpHeaders headers, String body) {
        String setCookie = headers.getFirst(HttpHeaders.SET_COOKIE);
        if (setCookie != null) {
            String cookieToken = parseAuthCookie(setCookie);
            if (cookieToken != null && !cookieToken.isEmpty()) {
                token = cookieToken;
            }
        }
        HttpStatus resolved = HttpStatus.resolve(status.value());
        String message = resolved == null ? "" : resolved.getReasonPhrase();
        return new ControllerResponse(status.value(), message, verb.name(), url, parseBody(body));
    }

    private JsonNode parseBody(String body) {
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node != null && !node.isMissingNode()) {
                return node;
            }
        } catch (JsonProcessingException e) {
            logger.debug("Reply body is not JSON: {}", e.getOriginalMessage());
        }
        ObjectNode invalid = objectMapper.createObjectNode();
        invalid.put("INVALID_JSON", body);
        return invalid;
    }

    private void record(ControllerResponse response) {
        if (history.size() == HISTORY_SIZE) {
            history.removeFirst();
        }
        history.addLast(new HistoryEntry(response.getReturnCode(), response.getRequestPath()));
    }

    static String buildUrl(String host, String path) {
        return "https://" + host + (path.startsWith("/") ? path : "/" + path);
    }

    /**
     * Extracts the token from a Set-Cookie value such as "AuthCookie=abc; Path=/".
     */
    static String parseAuthCookie(String setCookie) {
        int equals = setCookie.indexOf('=');
        if (equals < 0) {
            return null;
        }
        String value = setCookie.substring(equals + 1);
        int semicolon = value.indexOf(';');
        return (semicolon < 0 ? value : value.substring(0, semicolon)).trim();
    }

    public String getToken() { return token; }

    public String getRbac() { return rbac; }

    public boolean isLoggedIn() { return token != null; }

    /**
     * Returns the most recent replies, oldest first.
     *
     * @return At most {@value #HISTORY_SIZE} entries
     */
    public List<HistoryEntry> getHistory() {
        return new ArrayList<>(history);
    }

    /**
     * Return code and URL of one reply.
     */
    public static class HistoryEntry {
        private final int returnCode;
        private final String requestPath;

        public HistoryEntry(int returnCode, String requestPath) {
            this.returnCode = returnCode;
            this.requestPath = requestPath;
        }

        public int getReturnCode() { return returnCode; }

        public String getRequestPath() { return requestPath; }

        @Override
        public String toString() {
            return returnCode + " " + requestPath;
        }
    }
}
