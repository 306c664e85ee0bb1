package org.ndfcclient.resource;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.ndfcclient.fabric.FabricInventoryService;
import org.ndfcclient.fabric.FabricService;
import org.ndfcclient.rest.Endpoints;
import org.ndfcclient.rest.NdfcException;
import org.ndfcclient.rest.RestSend;
import org.ndfcclient.rest.StubController;
import org.springframework.http.HttpMethod;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourceUsageServiceTest {

    private static final String LEAF1_USAGE = Endpoints.switchResourceUsage("FDO211218GC");

    private StubController controller;
    private ResourceUsageService resourceUsageService;

    @BeforeEach
    void setUp() {
        controller = new StubController()
                .onFixture(HttpMethod.GET, Endpoints.CONTROL_FABRICS, 200, "fabrics.json")
                .onFixture(HttpMethod.GET, Endpoints.inventory("f1"), 200, "inventory-f1.json")
                .onFixture(HttpMethod.GET, LEAF1_USAGE, 200, "resource-usage-leaf1.json");
        RestSend restSend = controller.restSend();
        FabricInventoryService inventoryService = new FabricInventoryService(restSend);
        resourceUsageService = new ResourceUsageService(restSend, new FabricService(restSend, inventoryService),
                inventoryService);
    }

    @Test
    void getSwitchResourceUsage_queriesSwitchViewBySerialNumber() {
        List<JsonNode> usage = resourceUsageService.getSwitchResourceUsage("f1", "leaf1", ResourcePool.ALL);

        assertThat(usage).hasSize(3);
        assertThat(controller.requests(HttpMethod.GET, LEAF1_USAGE)).hasSize(1);
        assertThat(LEAF1_USAGE).endsWith("/lan-fabric/rest/resource-manager/switchView/FDO211218GC");
    }

    @Test
    void getSwitchResourceUsage_filtersOnPoolName() {
        List<JsonNode> usage = resourceUsageService.getSwitchResourceUsage("f1", "leaf1",
                ResourcePool.TOP_DOWN_NETWORK_VLAN);

        assertThat(usage).extracting(item -> item.path("entityName").asText()).containsExactly("net1", "net2");
        assertThat(resourceUsageService.getSwitchResourceUsage("f1", "leaf1", ResourcePool.VPC_PEER_LINK_VLAN))
                .isEmpty();
    }

    @Test
    void getSwitchResourceUsage_requiresSwitchInFabric() {
        assertThatThrownBy(() -> resourceUsageService.getSwitchResourceUsage("f1", "leaf9", ResourcePool.ALL))
                .isInstanceOf(NdfcException.class)
                .hasMessage("switch_name leaf9 not found in fabric f1.");
    }

    @Test
    void getSwitchResourceUsage_reportsControllerFailure() {
        controller.reset(HttpMethod.GET, LEAF1_USAGE, 500, "{\"message\": \"Resource manager unavailable\"}");

        assertThatThrownBy(() -> resourceUsageService.getSwitchResourceUsage("f1", "leaf1", ResourcePool.ALL))
                .isInstanceOf(NdfcException.class)
                .hasMessage("Unable to retrieve resource usage of switch leaf1. Error detail: Resource manager unavailable");
    }
}
