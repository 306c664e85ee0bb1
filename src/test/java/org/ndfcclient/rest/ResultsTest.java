package org.ndfcclient.rest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResultsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private RestSend restSend;

    private void lastSend(int code, String message, ControllerResult result, ObjectNode payload) {
        when(restSend.getResponseCurrent()).thenReturn(
                new ControllerResponse(code, message, "POST", "https://192.0.2.10/api/things",
                        objectMapper.createObjectNode()));
        when(restSend.getResultCurrent()).thenReturn(result);
        when(restSend.isCheckMode()).thenReturn(false);
        when(restSend.getPayloadCurrent()).thenReturn(payload);
    }

    @Test
    void finalResult_isEmptyAndUnchangedWithoutRegistrations() {
        Results results = new Results();

        ObjectNode summary = results.finalResult();

        assertThat(results.size()).isZero();
        assertThat(summary.path("changed").asBoolean()).isFalse();
        assertThat(summary.path("failed").asBoolean()).isFalse();
        assertThat(summary.path("response")).isEmpty();
    }

    @Test
    void register_recordsChangedWriteWithPayloadDiff() {
        Results results = new Results();
        lastSend(200, "OK", ControllerResult.ofWrite(true, true), objectMapper.createObjectNode().put("vrfName", "vrf1"));

        results.register("vrf_create", "merged", restSend);

        ObjectNode summary = results.finalResult();
        assertThat(results.size()).isEqualTo(1);
        assertThat(summary.path("changed").asBoolean()).isTrue();
        assertThat(summary.path("failed").asBoolean()).isFalse();
        assertThat(summary.at("/diff/0/payload/vrfName").asText()).isEqualTo("vrf1");
        assertThat(summary.at("/metadata/0/action").asText()).isEqualTo("vrf_create");
        assertThat(summary.at("/metadata/0/state").asText()).isEqualTo("merged");
        assertThat(summary.at("/metadata/0/sequence_number").asInt()).isEqualTo(1);
        assertThat(summary.at("/response/0/RETURN_CODE").asInt()).isEqualTo(200);
        assertThat(summary.at("/result/0/changed").asBoolean()).isTrue();
    }

    @Test
    void register_omitsPayloadAndMarksFailedWhenWriteFails() {
        Results results = new Results();
        lastSend(200, "OK", ControllerResult.ofWrite(true, true), objectMapper.createObjectNode().put("n", 1));
        results.register("network_create", "merged", restSend);

        lastSend(500, "Internal Server Error", ControllerResult.ofWrite(false, false),
                objectMapper.createObjectNode().put("n", 2));
        results.register("network_create", "merged", restSend);

        ObjectNode summary = results.finalResult();
        assertThat(results.isFailed()).isTrue();
        assertThat(results.isChanged()).isTrue();
        assertThat(summary.at("/diff/1/sequence_number").asInt()).isEqualTo(2);
        assertThat(summary.at("/diff/1").has("payload")).isFalse();
        assertThat(summary.at("/result/1/success").asBoolean()).isFalse();
    }

    @Test
    void register_requiresACommittedRequest() {
        Results results = new Results();

        assertThatThrownBy(() -> results.register("fabric_create", "merged", restSend))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("fabric_create");
    }
}
