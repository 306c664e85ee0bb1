package org.ndfcclient.rest;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

import static org.assertj.core.api.Assertions.assertThat;

class RestSendTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void commit_retriesUntilSuccess() {
        StubController controller = new StubController()
                .on(HttpMethod.GET, "/api/flaky", 500, "{}")
                .on(HttpMethod.GET, "/api/flaky", 500, "{}")
                .on(HttpMethod.GET, "/api/flaky", 200, "{\"ok\": true}");
        RestSend restSend = controller.restSend(20, 5, false);

        ControllerResponse response = restSend.commit(HttpMethod.GET, "/api/flaky", null);

        assertThat(response.getReturnCode()).isEqualTo(200);
        assertThat(restSend.getResultCurrent().isSuccess()).isTrue();
        assertThat(controller.requests(HttpMethod.GET, "/api/flaky")).hasSize(3);
        assertThat(controller.sleeps()).containsExactly(5, 5);
    }

    @Test
    void commit_stopsWhenTimeoutIsUsedUp() {
        StubController controller = new StubController()
                .on(HttpMethod.GET, "/api/broken", 500, "{\"message\": \"boom\"}");
        RestSend restSend = controller.restSend(10, 5, false);

        ControllerResponse response = restSend.commit(HttpMethod.GET, "/api/broken", null);

        assertThat(response.getReturnCode()).isEqualTo(500);
        assertThat(restSend.getResultCurrent().isSuccess()).isFalse();
        assertThat(controller.requests(HttpMethod.GET, "/api/broken")).hasSize(2);
        assertThat(controller.sleeps()).containsExactly(5);
        assertThat(restSend.errorMessage()).isEqualTo("boom");
    }

    @Test
    void commit_sendsOnceWhenIntervalIsNotPositive() {
        StubController controller = new StubController()
                .on(HttpMethod.GET, "/api/broken", 500, "{}");
        RestSend restSend = controller.restSend(300, 0, false);

        restSend.commit(HttpMethod.GET, "/api/broken", null);

        assertThat(controller.requests(HttpMethod.GET, "/api/broken")).hasSize(1);
        assertThat(controller.sleeps()).isEmpty();
    }

    @Test
    void commit_refreshesLoginOn401AndResends() {
        StubController controller = new StubController()
                .on(HttpMethod.GET, "/api/things", 401, "{}")
                .on(HttpMethod.GET, "/api/things", 200, "[]")
                .on(HttpMethod.POST, "/refresh", 200, "{\"jwttoken\": \"token-2\"}");
        RestSend restSend = controller.restSend(1, 1, false);

        ControllerResponse response = restSend.commit(HttpMethod.GET, "/api/things", null);

        assertThat(response.getReturnCode()).isEqualTo(200);
        assertThat(controller.requests(HttpMethod.POST, "/refresh")).hasSize(1);
        assertThat(controller.requests(HttpMethod.GET, "/api/things").get(1).getHeaders()
                .getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("token-2");
    }

    @Test
    void commit_inCheckModeSimulatesWritesButSendsReads() {
        StubController controller = new StubController()
                .on(HttpMethod.GET, "/api/things", 200, "[]");
        RestSend restSend = controller.restSend(1, 1, true);

        ControllerResponse write = restSend.commit(HttpMethod.POST, "/api/things",
                objectMapper.createObjectNode().put("name", "x"));

        assertThat(controller.requests(HttpMethod.POST, "/api/things")).isEmpty();
        assertThat(write.isCheckMode()).isTrue();
        assertThat(write.getReturnCode()).isEqualTo(200);
        assertThat(write.getData().path("simulated").asText()).isEqualTo("check-mode-response");
        assertThat(restSend.getResultCurrent().isChanged()).isTrue();
        assertThat(restSend.getPayloadCurrent().path("name").asText()).isEqualTo("x");

        restSend.commit(HttpMethod.GET, "/api/things", null);

        assertThat(controller.requests(HttpMethod.GET, "/api/things")).hasSize(1);
    }

    @Test
    void withSettings_returnsIndependentCopy() {
        StubController controller = new StubController();
        RestSend restSend = controller.restSend(300, 5, false);

        RestSend copy = restSend.withSettings(9, 3);
        RestSend longer = restSend.withTimeout(600);

        assertThat(copy.getTimeout()).isEqualTo(9);
        assertThat(copy.getSendInterval()).isEqualTo(3);
        assertThat(longer.getTimeout()).isEqualTo(600);
        assertThat(longer.getSendInterval()).isEqualTo(5);
        assertThat(restSend.getTimeout()).isEqualTo(300);
        assertThat(restSend.getSendInterval()).isEqualTo(5);
    }
}
