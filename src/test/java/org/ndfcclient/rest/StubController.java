package org.ndfcclient.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.ndfcclient.config.NdfcConfig;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.codec.HttpMessageWriter;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.BodyInserter;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Plays the controller for tests: replies are routed on verb and path (with query), and
 * every request is recorded. A route with several replies returns them in order and
 * repeats the last one. Unrouted requests get a 404. A connection-failure route
 * fails the exchange with a {@link WebClientRequestException}.
 */
public class StubController implements ExchangeFunction {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, Deque<Reply>> routes = new HashMap<>();
    private final List<RecordedRequest> requests = new ArrayList<>();
    private final List<Integer> sleeps = new ArrayList<>();
    private final NdfcConfig config = new NdfcConfig();

    public StubController() {
        config.setIp4("192.0.2.10");
        config.setUsername("admin");
        config.setPassword("secret");
        config.setDomain("local");
        on(HttpMethod.POST, "/login", 200, "{\"jwttoken\": \"token-1\", \"rbac\": \"network-admin\"}");
    }

    public StubController on(HttpMethod verb, String path, int status, String body) {
        routes.computeIfAbsent(key(verb, path), k -> new ArrayDeque<>()).add(new Reply(status, body, null));
        return this;
    }

    /**
     * Replaces every reply of a route.
     */
    public StubController reset(HttpMethod verb, String path, int status, String body) {
        routes.remove(key(verb, path));
        return on(verb, path, status, body);
    }

    public StubController onFixture(HttpMethod verb, String path, int status, String fixture) {
        return on(verb, path, status, fixture(fixture));
    }

    /**
     * Adds a reply carrying a Set-Cookie header.
     */
    public StubController onWithCookie(HttpMethod verb, String path, int status, String body, String setCookie) {
        routes.computeIfAbsent(key(verb, path), k -> new ArrayDeque<>()).add(new Reply(status, body, setCookie));
        return this;
    }

    /**
     * Makes a route fail as if the controller could not be reached.
     */
    public StubController onConnectionFailure(HttpMethod verb, String path, String detail) {
        routes.computeIfAbsent(key(verb, path), k -> new ArrayDeque<>()).add(new Reply(0, detail, null));
        return this;
    }

    public static String fixture(String name) {
        try (InputStream in = StubController.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("No fixture " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public Mono<ClientResponse> exchange(ClientRequest request) {
        String path = request.url().getRawPath()
                + (request.url().getRawQuery() == null ? "" : "?" + request.url().getRawQuery());
        requests.add(new RecordedRequest(request.method(), path, request.headers(), body(request)));

        Deque<Reply> replies = routes.get(key(request.method(), path));
        Reply reply;
        if (replies == null || replies.isEmpty()) {
            reply = new Reply(404, "{\"message\": \"no route for " + path + "\"}", null);
        } else {
            reply = replies.size() > 1 ? replies.poll() : replies.peek();
        }
        if (reply.status == 0) {
            return Mono.error(new WebClientRequestException(new ConnectException(reply.body),
                    request.method(), request.url(), request.headers()));
        }
        ClientResponse.Builder response = ClientResponse.create(HttpStatusCode.valueOf(reply.status))
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(reply.body);
        if (reply.setCookie != null) {
            response.header(HttpHeaders.SET_COOKIE, reply.setCookie);
        }
        return Mono.just(response.build());
    }

    private static String body(ClientRequest request) {
        MockClientHttpRequest mock = new MockClientHttpRequest(request.method(), request.url());
        request.body().insert(mock, new BodyInserter.Context() {
            @Override
            public List<HttpMessageWriter<?>> messageWriters() {
                return ExchangeStrategies.withDefaults().messageWriters();
            }

            @Override
            public Optional<ServerHttpRequest> serverRequest() {
                return Optional.empty();
            }

            @Override
            public Map<String, Object> hints() {
                return Map.of();
            }
        }).block();
        return mock.getBodyAsString().block();
    }

    private static String key(HttpMethod verb, String path) {
        return verb.name() + " " + path;
    }

    public NdfcConfig config() {
        return config;
    }

    public Sender sender() {
        return new Sender(config, WebClient.builder().exchangeFunction(this));
    }

    /**
     * RestSend that sends each request once.
     */
    public RestSend restSend() {
        return restSend(1, 1, false);
    }

    public RestSend restSend(int timeout, int sendInterval, boolean checkMode) {
        return new RestSend(sender(), new ResponseHandler(), sleeps::add, timeout, sendInterval, checkMode);
    }

    public List<Integer> sleeps() {
        return sleeps;
    }

    public List<RecordedRequest> requests() {
        return requests;
    }

    public List<RecordedRequest> requests(HttpMethod verb, String path) {
        List<RecordedRequest> matching = new ArrayList<>();
        for (RecordedRequest request : requests) {
            if (request.verb.equals(verb) && request.path.equals(path)) {
                matching.add(request);
            }
        }
        return matching;
    }

    /**
     * Body of the last request sent to a route, parsed as JSON.
     */
    public JsonNode lastBody(HttpMethod verb, String path) {
        List<RecordedRequest> matching = requests(verb, path);
        if (matching.isEmpty()) {
            throw new AssertionError("No " + verb + " " + path + " was sent. Sent: " + requests);
        }
        return matching.get(matching.size() - 1).json();
    }

    private static final class Reply {
        private final int status;
        private final String body;
        private final String setCookie;

        private Reply(int status, String body, String setCookie) {
            this.status = status;
            this.body = body;
            this.setCookie = setCookie;
        }
    }

    /**
     * A request received by the stub.
     */
    public static final class RecordedRequest {
        private final HttpMethod verb;
        private final String path;
        private final HttpHeaders headers;
        private final String body;

        RecordedRequest(HttpMethod verb, String path, HttpHeaders headers, String body) {
            this.verb = verb;
            this.path = path;
            this.headers = headers;
            this.body = body;
        }

        public HttpMethod getVerb() { return verb; }

        public String getPath() { return path; }

        public HttpHeaders getHeaders() { return headers; }

        public String getBody() { return body; }

        public JsonNode json() {
            try {
                return MAPPER.readTree(body);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        @Override
        public String toString() {
            return verb + " " + path;
        }
    }
}
