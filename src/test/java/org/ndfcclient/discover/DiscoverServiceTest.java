package org.ndfcclient.discover;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.ndfcclient.fabric.FabricInventoryService;
import org.ndfcclient.fabric.FabricService;
import org.ndfcclient.rest.Endpoints;
import org.ndfcclient.rest.NdfcException;
import org.ndfcclient.rest.RestSend;
import org.ndfcclient.rest.Results;
import org.ndfcclient.rest.StubController;
import org.springframework.http.HttpMethod;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiscoverServiceTest {

    private static final String REACHABILITY = Endpoints.testReachability("f1");
    private static final String DISCOVER = Endpoints.discover("f1");

    private StubController controller;
    private DiscoverService discoverService;
    private Results results;

    @BeforeEach
    void setUp() {
        controller = new StubController()
                .onFixture(HttpMethod.GET, Endpoints.CONTROL_FABRICS, 200, "fabrics.json")
                .onFixture(HttpMethod.GET, Endpoints.inventory("f1"), 200, "inventory-f1.json");
        controller.config().setNxosUsername("switchadmin");
        controller.config().setNxosPassword("switchsecret");
        controller.config().getDiscover().setRetries(2);
        controller.config().getDiscover().setRetryInterval(7);
        discoverService = newService(controller.restSend());
        results = new Results();
    }

    private DiscoverService newService(RestSend restSend) {
        FabricInventoryService inventoryService = new FabricInventoryService(restSend);
        return new DiscoverService(restSend, new FabricService(restSend, inventoryService), inventoryService,
                controller.config(), controller.sleeps()::add);
    }

    private static ReachabilityRequest request(String seedIp) {
        ReachabilityRequest request = new ReachabilityRequest();
        request.setFabricName("f1");
        request.setSeedIp(seedIp);
        return request;
    }

    @Test
    void buildPayload_fallsBackToSwitchCredentialsFromConfig() {
        ObjectNode payload = discoverService.buildPayload(request("10.1.1.4"));

        assertThat(payload.path("seedIP").asText()).isEqualTo("10.1.1.4");
        assertThat(payload.path("username").asText()).isEqualTo("switchadmin");
        assertThat(payload.path("password").asText()).isEqualTo("switchsecret");
        assertThat(payload.path("cdpSecondTimeout").asInt()).isEqualTo(5);
        assertThat(payload.path("maxHops").asInt()).isZero();
        assertThat(payload.path("preserveConfig").asBoolean()).isTrue();
        assertThat(payload.path("snmpV3AuthProtocol").asInt()).isZero();
    }

    @Test
    void buildPayload_prefersRequestCredentials() {
        ReachabilityRequest request = request("10.1.1.4");
        request.setUsername("other");
        request.setPassword("otherpass");

        ObjectNode payload = discoverService.buildPayload(request);

        assertThat(payload.path("username").asText()).isEqualTo("other");
        assertThat(payload.path("password").asText()).isEqualTo("otherpass");
    }

    @Test
    void buildPayload_requiresCredentials() {
        controller.config().setNxosPassword(null);

        assertThatThrownBy(() -> discoverService.buildPayload(request("10.1.1.4")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("password must be set, either in the request or via NXOS_PASSWORD");
        assertThatThrownBy(() -> discoverService.buildPayload(request("10.1.1")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid IPv4 address: 10.1.1");
    }

    @Test
    void reachability_returnsFirstEntry() {
        controller.onFixture(HttpMethod.POST, REACHABILITY, 200, "reachability-reachable.json");

        ReachabilityResult result = discoverService.reachability(request("10.1.1.4"));

        assertThat(result.isReachable()).isTrue();
        assertThat(result.getSysName()).isEqualTo("leaf3");
        assertThat(result.getSerialNumber()).isEqualTo("FDO211218JJ");
    }

    @Test
    void reachability_rejectsEmptyReply() {
        controller.on(HttpMethod.POST, REACHABILITY, 200, "[]");

        assertThatThrownBy(() -> discoverService.reachability(request("10.1.1.4")))
                .isInstanceOf(NdfcException.class)
                .hasMessageStartingWith("Unexpected test-reachability response for 10.1.1.4");
    }

    @Test
    void discover_retriesReachabilityThenSendsSwitch() {
        controller.onFixture(HttpMethod.POST, REACHABILITY, 200, "reachability-unreachable.json")
                .onFixture(HttpMethod.POST, REACHABILITY, 200, "reachability-reachable.json")
                .on(HttpMethod.POST, DISCOVER, 200, "{\"status\": \"Success\"}");

        discoverService.discover(request("10.1.1.4"), results);

        assertThat(controller.requests(HttpMethod.POST, REACHABILITY)).hasSize(2);
        assertThat(controller.sleeps()).containsExactly(7);
        JsonNode body = controller.lastBody(HttpMethod.POST, DISCOVER);
        assertThat(body.at("/switches/0/serialNumber").asText()).isEqualTo("FDO211218JJ");
        assertThat(body.path("seedIP").asText()).isEqualTo("10.1.1.4");
        assertThat(controller.lastBody(HttpMethod.POST, REACHABILITY).has("switches")).isFalse();
        assertThat(results.finalResult().at("/metadata/0/action").asText()).isEqualTo("discover");
    }

    @Test
    void discover_givesUpWhenSwitchStaysUnreachable() {
        controller.onFixture(HttpMethod.POST, REACHABILITY, 200, "reachability-unreachable.json");

        assertThatThrownBy(() -> discoverService.discover(request("10.1.1.4"), results))
                .isInstanceOf(NdfcException.class)
                .hasMessage("Switch 10.1.1.4 not reachable after 2 retries. statusReason: Not reachable");
        assertThat(controller.requests(HttpMethod.POST, REACHABILITY)).hasSize(3);
        assertThat(controller.sleeps()).containsExactly(7, 7);
        assertThat(controller.requests(HttpMethod.POST, DISCOVER)).isEmpty();
    }

    @Test
    void discover_inCheckModeSkipsReachability() {
        DiscoverService checkMode = newService(controller.restSend(1, 1, true));

        checkMode.discover(request("10.1.1.4"), results);

        assertThat(controller.requests(HttpMethod.POST, REACHABILITY)).isEmpty();
        assertThat(controller.requests(HttpMethod.POST, DISCOVER)).isEmpty();
        assertThat(results.finalResult().at("/metadata/0/check_mode").asBoolean()).isTrue();
    }

    @Test
    void discover_waitsUntilSwitchIsManageable() {
        controller.onFixture(HttpMethod.POST, REACHABILITY, 200, "reachability-reachable.json")
                .on(HttpMethod.POST, DISCOVER, 200, "{}");
        ReachabilityRequest request = request("10.1.1.1");
        request.setWaitUntilUp(true);

        assertThatThrownBy(() -> discoverService.discover(request, results))
                .isInstanceOf(NdfcException.class)
                .hasMessage("Switch 10.1.1.1 did not become manageable in fabric f1");
        assertThat(controller.sleeps()).containsExactly(7, 7);
    }

    @Test
    void isUp_andDeviceInfo() {
        assertThat(discoverService.isUp("f1", "10.1.1.2")).isTrue();
        assertThat(discoverService.isUp("f1", "10.1.1.1")).isFalse();
        assertThat(discoverService.waitUntilUp("f1", "10.1.1.2")).isTrue();
        assertThat(controller.sleeps()).isEmpty();

        DeviceInfoRequest deviceInfo = new DeviceInfoRequest();
        deviceInfo.setFabricName("f1");
        deviceInfo.setSwitchIp4("10.1.1.3");
        assertThat(discoverService.deviceInfo(deviceInfo).getLogicalName()).isEqualTo("leaf2");
    }
}
