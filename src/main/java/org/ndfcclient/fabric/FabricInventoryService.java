package org.ndfcclient.fabric;

import com.fasterxml.jackson.databind.JsonNode;
import org.ndfcclient.rest.ControllerResponse;
import org.ndfcclient.rest.Endpoints;
import org.ndfcclient.rest.NdfcException;
import org.ndfcclient.rest.RestSend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Switch inventory of a fabric.
 *
 * The inventory is read from switchesByFabric and keyed on each switch's logicalName
 * (its hostname as known to the controller). Other services use it to resolve switch
 * names to serial numbers and IP addresses, and to check vPC pairing.
 */
@Service
public class FabricInventoryService {

    private static final Logger logger = LoggerFactory.getLogger(FabricInventoryService.class);

    private final RestSend restSend;

    public FabricInventoryService(RestSend restSend) {
        this.restSend = restSend;
    }

    /**
     * Retrieves the switches of a fabric.
     *
     * @param fabricName Fabric to query
     * @return Switches keyed on logicalName, in controller order
     * @throws NdfcException if the fabric does not exist or the reply is not 200/201
     */
    public Map<String, SwitchInfo> getInventory(String fabricName) {
        logger.debug("Retrieving inventory of fabric {}", fabricName);
        ControllerResponse response = restSend.commit(HttpMethod.GET, Endpoints.inventory(fabricName), null);

        if (response.getReturnCode() == 404) {
            throw new NdfcException("Fabric " + fabricName + " does not exist on the controller", 404);
        }
        if (!response.isReturnCode(200, 201)) {
            throw new NdfcException("Unable to retrieve inventory of fabric " + fabricName
                    + ". RETURN_CODE " + response.getReturnCode() + ". Error detail: " + restSend.errorMessage(),
                    response.getReturnCode());
        }

        Map<String, SwitchInfo> inventory = new LinkedHashMap<>();
        for (JsonNode item : response.getData()) {
            SwitchInfo switchInfo = new SwitchInfo(item);
            if (switchInfo.getLogicalName() != null) {
                inventory.put(switchInfo.getLogicalName(), switchInfo);
            }
        }
        logger.debug("Fabric {} has {} switch(es)", fabricName, inventory.size());
        return inventory;
    }

    /**
     * Looks up a switch by name.
     *
     * @throws NdfcException if the switch is not in the fabric
     */
    public SwitchInfo getSwitch(String fabricName, String switchName) {
        return getSwitch(getInventory(fabricName), fabricName, switchName);
    }

    /**
     * Looks up a switch by name in an inventory already retrieved.
     *
     * @throws NdfcException if the switch is not in the inventory
     */
    public SwitchInfo getSwitch(Map<String, SwitchInfo> inventory, String fabricName, String switchName) {
        SwitchInfo switchInfo = inventory.get(switchName);
        if (switchInfo == null) {
            throw new NdfcException("switch_name " + switchName + " not found in fabric " + fabricName + ".");
        }
        return switchInfo;
    }

    public String switchNameToSerialNumber(String fabricName, String switchName) {
        return getSwitch(fabricName, switchName).getSerialNumber();
    }

    public String switchNameToIpAddress(String fabricName, String switchName) {
        return getSwitch(fabricName, switchName).getIpAddress();
    }

    /**
     * Looks up a switch by management IP address.
     *
     * @throws NdfcException if no switch in the fabric has this address
     */
    public SwitchInfo findByIpAddress(String fabricName, String ipAddress) {
        for (SwitchInfo switchInfo : getInventory(fabricName).values()) {
            if (ipAddress.equals(switchInfo.getIpAddress())) {
                return switchInfo;
            }
        }
        throw new NdfcException("device " + ipAddress + " not found in fabric " + fabricName);
    }

    /**
     * Two switches are vPC peers when both have vPC configured and each one's peer
     * serial number is the other's serial number.
     */
    public static boolean isVpcPeer(SwitchInfo switchInfo, SwitchInfo peer) {
        if (!switchInfo.isVpcConfigured() || !peer.isVpcConfigured()) {
            return false;
        }
        return peer.getSerialNumber().equals(switchInfo.getPeerSerialNumber())
                && switchInfo.getSerialNumber().equals(peer.getPeerSerialNumber());
    }

    /**
     * One switch of the inventory.
     */
    public static class SwitchInfo {
        private final String logicalName;
        private final String serialNumber;
        private final String ipAddress;
        private final String model;
        private final String release;
        private final String switchRole;
        private final String status;
        private final String mode;
        private final boolean managable;
        private final boolean vpcConfigured;
        private final String peerSerialNumber;
        private final String vpcDomain;
        private final JsonNode raw;

        public SwitchInfo(JsonNode item) {
            this.logicalName = item.path("logicalName").asText(null);
            this.serialNumber = item.path("serialNumber").asText("");
            this.ipAddress = item.path("ipAddress").asText("");
            this.model = item.path("model").asText("");
            this.release = item.path("release").asText("");
            this.switchRole = item.path("switchRole").asText("");
            this.status = item.path("status").asText("");
            this.mode = item.path("mode").asText("");
            this.managable = item.path("managable").asBoolean(false);
            this.vpcConfigured = item.path("isVpcConfigured").asBoolean(false);
            this.peerSerialNumber = item.path("peerSerialNumber").asText("");
            this.vpcDomain = item.path("vpcDomain").asText("");
            this.raw = item;
        }

        public String getLogicalName() { return logicalName; }
        public String getSerialNumber() { return serialNumber; }
        public String getIpAddress() { return ipAddress; }
        public String getModel() { return model; }
        public String getRelease() { return release; }
        public String getSwitchRole() { return switchRole; }
        public String getStatus() { return status; }
        public String getMode() { return mode; }
        public boolean isManagable() { return managable; }
        public boolean isVpcConfigured() { return vpcConfigured; }
        public String getPeerSerialNumber() { return peerSerialNumber; }
        public String getVpcDomain() { return vpcDomain; }

        /**
         * Gets the inventory record as returned by the controller.
         */
        public JsonNode getRaw() { return raw; }

        @Override
        public String toString() {
            return "SwitchInfo{" +
                    "logicalName='" + logicalName + '\'' +
                    ", serialNumber='" + serialNumber + '\'' +
                    ", ipAddress='" + ipAddress + '\'' +
                    ", model='" + model + '\'' +
                    ", switchRole='" + switchRole + '\'' +
                    ", managable=" + managable +
                    '}';
        }
    }
}
