package org.ndfcclient.interfaces;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.ndfcclient.rest.Endpoints;
import org.ndfcclient.rest.NdfcException;
import org.ndfcclient.rest.Results;
import org.ndfcclient.rest.StubController;
import org.springframework.http.HttpMethod;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InterfaceServiceTest {

    private StubController controller;
    private InterfaceService interfaceService;
    private Results results;

    @BeforeEach
    void setUp() {
        controller = new StubController();
        interfaceService = new InterfaceService(controller.restSend());
        results = new Results();
    }

    private static InterfaceAccessRequest request() {
        InterfaceAccessRequest request = new InterfaceAccessRequest();
        request.setSerialNumber("FDO211218GC");
        request.setInterfaceName("Ethernet1/2");
        return request;
    }

    @Test
    void createAccess_sendsPolicyAndStringNvPairs() {
        controller.on(HttpMethod.POST, Endpoints.INTERFACE, 200, "{}");
        InterfaceAccessRequest request = request();
        request.setAccessVlan(10);
        request.setDesc("Eth1/2: Connected to HO1");
        request.setMtu("9216");

        interfaceService.createAccess(request, results);

        JsonNode payload = controller.lastBody(HttpMethod.POST, Endpoints.INTERFACE);
        assertThat(payload.path("policy").asText()).isEqualTo("int_access_host");
        assertThat(payload.path("interfaceType").asText()).isEqualTo("INTERFACE_ETHERNET");
        JsonNode item = payload.path("interfaces").get(0);
        assertThat(item.path("serialNumber").asText()).isEqualTo("FDO211218GC");
        assertThat(item.path("ifName").asText()).isEqualTo("Ethernet1/2");
        JsonNode nvPairs = item.path("nvPairs");
        assertThat(nvPairs.path("INTF_NAME").asText()).isEqualTo("Ethernet1/2");
        assertThat(nvPairs.path("ACCESS_VLAN").isTextual()).isTrue();
        assertThat(nvPairs.path("ACCESS_VLAN").asText()).isEqualTo("10");
        assertThat(nvPairs.path("MTU").asText()).isEqualTo("9216");
        assertThat(nvPairs.path("ADMIN_STATE").asText()).isEqualTo("true");
        assertThat(nvPairs.path("PTP").asText()).isEqualTo("false");
        assertThat(nvPairs.path("DESC").asText()).isEqualTo("Eth1/2: Connected to HO1");
        assertThat(results.isChanged()).isTrue();
    }

    @Test
    void createAccess_appliesPolicyDefaults() {
        JsonNode nvPairs = interfaceService.buildAccessPayload(request()).at("/interfaces/0/nvPairs");

        assertThat(nvPairs.path("ACCESS_VLAN").asText()).isEmpty();
        assertThat(nvPairs.path("BPDUGUARD_ENABLED").asText()).isEqualTo("true");
        assertThat(nvPairs.path("PORTTYPE_FAST_ENABLED").asText()).isEqualTo("true");
        assertThat(nvPairs.path("ENABLE_NETFLOW").asText()).isEqualTo("false");
        assertThat(nvPairs.path("MTU").asText()).isEqualTo("jumbo");
        assertThat(nvPairs.path("SPEED").asText()).isEqualTo("Auto");
        assertThat(nvPairs.path("CONF").asText()).isEmpty();
    }

    @Test
    void createAccess_reportsControllerFailure() {
        controller.on(HttpMethod.POST, Endpoints.INTERFACE, 400,
                "{\"error\": \"Interface Ethernet1/2 is part of a port-channel\"}");

        assertThatThrownBy(() -> interfaceService.createAccess(request(), results))
                .isInstanceOf(NdfcException.class)
                .hasMessage("Unable to create interface Ethernet1/2 on switch FDO211218GC. "
                        + "Error detail: Interface Ethernet1/2 is part of a port-channel");
        assertThat(results.isFailed()).isTrue();
    }

    @Test
    void createAccess_simulatedInCheckMode() {
        InterfaceService checkModeService = new InterfaceService(controller.restSend(1, 1, true));

        checkModeService.createAccess(request(), results);

        assertThat(controller.requests(HttpMethod.POST, Endpoints.INTERFACE)).isEmpty();
        assertThat(results.isChanged()).isTrue();
    }
}
