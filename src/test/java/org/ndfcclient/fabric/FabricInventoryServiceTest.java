package org.ndfcclient.fabric;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.ndfcclient.fabric.FabricInventoryService.SwitchInfo;
import org.ndfcclient.rest.Endpoints;
import org.ndfcclient.rest.NdfcException;
import org.ndfcclient.rest.StubController;
import org.springframework.http.HttpMethod;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FabricInventoryServiceTest {

    private StubController controller;
    private FabricInventoryService inventoryService;

    @BeforeEach
    void setUp() {
        controller = new StubController()
                .onFixture(HttpMethod.GET, Endpoints.inventory("f1"), 200, "inventory-f1.json");
        inventoryService = new FabricInventoryService(controller.restSend());
    }

    @Test
    void getInventory_keysOnLogicalName() {
        Map<String, SwitchInfo> inventory = inventoryService.getInventory("f1");

        assertThat(inventory).containsOnlyKeys("leaf1", "leaf2", "spine1");
        SwitchInfo leaf1 = inventory.get("leaf1");
        assertThat(leaf1.getSerialNumber()).isEqualTo("FDO211218GC");
        assertThat(leaf1.getIpAddress()).isEqualTo("10.1.1.2");
        assertThat(leaf1.isManagable()).isTrue();
        assertThat(inventory.get("spine1").getPeerSerialNumber()).isEmpty();
    }

    @Test
    void getInventory_reportsMissingFabric() {
        assertThatThrownBy(() -> inventoryService.getInventory("f9"))
                .isInstanceOf(NdfcException.class)
                .hasMessage("Fabric f9 does not exist on the controller");
    }

    @Test
    void getInventory_reportsControllerError() {
        controller.on(HttpMethod.GET, Endpoints.inventory("f2"), 500, "{\"message\": \"db down\"}");

        assertThatThrownBy(() -> inventoryService.getInventory("f2"))
                .isInstanceOf(NdfcException.class)
                .hasMessage("Unable to retrieve inventory of fabric f2. RETURN_CODE 500. Error detail: db down");
    }

    @Test
    void switchLookups() {
        assertThat(inventoryService.switchNameToSerialNumber("f1", "leaf2")).isEqualTo("FDO211218HH");
        assertThat(inventoryService.switchNameToIpAddress("f1", "spine1")).isEqualTo("10.1.1.1");
        assertThat(inventoryService.findByIpAddress("f1", "10.1.1.3").getLogicalName()).isEqualTo("leaf2");

        assertThatThrownBy(() -> inventoryService.getSwitch("f1", "leaf9"))
                .isInstanceOf(NdfcException.class)
                .hasMessage("switch_name leaf9 not found in fabric f1.");
        assertThatThrownBy(() -> inventoryService.findByIpAddress("f1", "10.9.9.9"))
                .hasMessage("device 10.9.9.9 not found in fabric f1");
    }

    @Test
    void isVpcPeer_requiresMutualPairing() {
        Map<String, SwitchInfo> inventory = inventoryService.getInventory("f1");

        assertThat(FabricInventoryService.isVpcPeer(inventory.get("leaf1"), inventory.get("leaf2"))).isTrue();
        assertThat(FabricInventoryService.isVpcPeer(inventory.get("leaf2"), inventory.get("leaf1"))).isTrue();
        assertThat(FabricInventoryService.isVpcPeer(inventory.get("leaf1"), inventory.get("spine1"))).isFalse();
    }
}
