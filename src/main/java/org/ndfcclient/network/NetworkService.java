package org.ndfcclient.network;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.ndfcclient.fabric.FabricInventoryService;
import org.ndfcclient.fabric.FabricInventoryService.SwitchInfo;
import org.ndfcclient.fabric.FabricService;
import org.ndfcclient.rest.ControllerResponse;
import org.ndfcclient.rest.Endpoints;
import org.ndfcclient.rest.NdfcException;
import org.ndfcclient.rest.ResponseHandler;
import org.ndfcclient.rest.RestSend;
import org.ndfcclient.rest.Results;
import org.ndfcclient.validation.Validations;
import org.ndfcclient.vrf.VrfService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Network creation, deletion, attachment, detachment and queries through the
 * top-down API.
 */
@Service
public class NetworkService {

    private static final Logger logger = LoggerFactory.getLogger(NetworkService.class);

    private final RestSend restSend;
    private final FabricService fabricService;
    private final FabricInventoryService inventoryService;
    private final VrfService vrfService;
    private final ResponseHandler responseHandler;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public NetworkService(RestSend restSend, FabricService fabricService, FabricInventoryService inventoryService,
                          VrfService vrfService, ResponseHandler responseHandler) {
        this.restSend = restSend;
        this.fabricService = fabricService;
        this.inventoryService = inventoryService;
        this.vrfService = vrfService;
        this.responseHandler = responseHandler;
    }

    /**
     * Retrieves the networks of a fabric.
     */
    public List<JsonNode> getNetworks(String fabricName) {
        ControllerResponse response = restSend.commit(HttpMethod.GET, networksPath(fabricName), null);
        if (!restSend.getResultCurrent().isSuccess()) {
            throw new NdfcException("Unable to retrieve networks of fabric " + fabricName + ". Error detail: "
                    + restSend.errorMessage(), response.getReturnCode());
        }
        List<JsonNode> networks = new ArrayList<>();
        if (response.getData().isArray()) {
            response.getData().forEach(networks::add);
        }
        return networks;
    }

    public boolean networkExists(String fabricName, String networkName) {
        for (JsonNode network : getNetworks(fabricName)) {
            if (networkName.equals(network.path("networkName").asText())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Retrieves one network, including its template configuration.
     *
     * @throws NdfcException if the fabric or the network does not exist
     */
    public JsonNode getNetwork(String fabricName, String networkName) {
        fabricService.verifyFabricExists(fabricName);
        if (!networkExists(fabricName, networkName)) {
            throw new NdfcException("networkName " + networkName + " does not exist in fabric " + fabricName);
        }
        ControllerResponse response = restSend.commit(HttpMethod.GET,
                networksPath(fabricName) + "/" + Endpoints.encode(networkName), null);
        if (!restSend.getResultCurrent().isFound()) {
            throw new NdfcException("Unable to retrieve network " + networkName + " in fabric " + fabricName
                    + ". Error detail: " + restSend.errorMessage(), response.getReturnCode());
        }
        return response.getData();
    }

    /**
     * Creates a network.
     *
     * @throws IllegalArgumentException if a parameter is out of range
     * @throws NdfcException if the fabric or VRF is missing, the networkId is in use, or
     *         the controller rejects the request
     */
    public void create(NetworkCreateRequest request, Results results) {
        validate(request);
        String fabricName = request.getFabricName();
        fabricService.verifyFabricExists(fabricName);
        if (!vrfService.vrfExists(fabricName, request.getVrfName())) {
            throw new NdfcException("VRF " + request.getVrfName() + " does not exist in fabric " + fabricName
                    + ". Create it before creating networks that use it.");
        }
        for (JsonNode network : getNetworks(fabricName)) {
            if (network.path("networkId").asLong(-1) == request.getNetworkId()) {
                throw new NdfcException("networkId " + request.getNetworkId() + " already exists in fabric "
                        + fabricName + ". Delete it before creating network "
                        + networkName(request) + " with this networkId.");
            }
        }

        ObjectNode payload = buildCreatePayload(request);
        logger.info("Creating network {} (networkId {}) in fabric {}", networkName(request), request.getNetworkId(), fabricName);
        restSend.commit(HttpMethod.POST, networksPath(fabricName), payload);
        results.register("network_create", "merged", restSend);
        verifySuccess("create network " + networkName(request) + " in fabric " + fabricName);
    }

    ObjectNode buildCreatePayload(NetworkCreateRequest request) {
        String networkName = networkName(request);
        long segmentId = request.getSegmentId() == null ? request.getNetworkId() : request.getSegmentId();

        ObjectNode templateConfig = objectMapper.createObjectNode();
        templateConfig.put("dhcpServerAddr1", orEmpty(request.getDhcpServerAddr1()));
        templateConfig.put("enableL3OnBorder", false);
        templateConfig.put("enableL3OnBorderVpcBgw", false);
        templateConfig.put("gatewayIpAddress", orEmpty(request.getGatewayIpAddress()));
        templateConfig.put("gatewayIpV6Address", orEmpty(request.getGatewayIpv6Address()));
        templateConfig.put("intfDescription", orEmpty(request.getIntfDescription()));
        templateConfig.put("isLayer2Only", request.getLayer2Only() != null && request.getLayer2Only());
        templateConfig.put("loopbackId", request.getLoopbackId() == null ? "" : request.getLoopbackId().toString());
        templateConfig.put("mcastGroup", orEmpty(request.getMcastGroup()));
        templateConfig.put("mtu", request.getMtu() == null ? 9216 : request.getMtu());
        templateConfig.put("networkName", networkName);
        templateConfig.put("nveId", 1);
        templateConfig.put("rtBothAuto", false);
        templateConfig.put("segmentId", segmentId);
        templateConfig.put("suppressArp", request.getSuppressArp() == null || request.getSuppressArp());
        templateConfig.put("tag", request.getTag() == null ? "12345" : request.getTag().toString());
        templateConfig.put("trmEnabled", request.getTrmEnabled() != null && request.getTrmEnabled());
        templateConfig.put("trmV6Enabled", false);
        templateConfig.put("vlanId", request.getVlanId());
        templateConfig.put("vlanName", orEmpty(request.getVlanName()));
        templateConfig.put("vrfDhcp", orEmpty(request.getVrfDhcp()));
        templateConfig.put("vrfName", request.getVrfName());

        ObjectNode payload = objectMapper.createObjectNode();
        String displayName = request.getDisplayName();
        payload.put("displayName", displayName == null || displayName.isBlank() ? networkName : displayName);
        payload.put("fabric", request.getFabricName());
        payload.put("networkExtensionTemplate", request.getNetworkExtensionTemplate());
        payload.put("networkId", request.getNetworkId());
        payload.put("networkName", networkName);
        payload.put("networkTemplate", request.getNetworkTemplate());
        payload.put("serviceNetworkTemplate", "");
        // The controller rejects an empty source.
        if (request.getSource() != null && !request.getSource().isEmpty()) {
            payload.put("source", request.getSource());
        }
        payload.put("vrf", request.getVrfName());
        payload.put("networkTemplateConfig", toJsonString(templateConfig));
        return payload;
    }

    /**
     * Deletes a network.
     *
     * @throws NdfcException if the network does not exist or the controller rejects the
     *         deletion
     */
    public void delete(String fabricName, String networkName, Results results) {
        fabricService.verifyFabricExists(fabricName);
        if (!networkExists(fabricName, networkName)) {
            throw new NdfcException("networkName " + networkName + " does not exist in fabric " + fabricName);
        }
        logger.info("Deleting network {} from fabric {}", networkName, fabricName);
        restSend.commit(HttpMethod.DELETE, networksPath(fabricName) + "/" + Endpoints.encode(networkName), null);
        results.register("network_delete", "deleted", restSend);
        verifySuccess("delete network " + networkName + " from fabric " + fabricName);
    }

    /**
     * Attaches a network to a switch, and to its vPC peer when one is named.
     */
    public void attach(NetworkAttachRequest request, Results results) {
        Map<String, SwitchInfo> inventory = verifyAttachment(request);
        ArrayNode payload = buildAttachPayload(request, inventory, true);
        logger.info("Attaching network {} to {} in fabric {}", request.getNetworkName(), switchNames(request), request.getFabricName());
        restSend.commit(HttpMethod.POST, networksPath(request.getFabricName()) + "/attachments", payload);
        results.register("network_attach", "merged", restSend);
        verifyAttachmentSuccess("attach network " + request.getNetworkName() + " to " + switchNames(request));
    }

    /**
     * Detaches a network from a switch, and from its vPC peer when one is named.
     */
    public void detach(NetworkAttachRequest request, Results results) {
        Map<String, SwitchInfo> inventory = verifyAttachment(request);
        ArrayNode payload = buildAttachPayload(request, inventory, false);
        logger.info("Detaching network {} from {} in fabric {}", request.getNetworkName(), switchNames(request), request.getFabricName());
        restSend.commit(HttpMethod.POST, networksPath(request.getFabricName()) + "/attachments", payload);
        results.register("network_detach", "deleted", restSend);
        verifyAttachmentSuccess("detach network " + request.getNetworkName() + " from " + switchNames(request));
    }

    private Map<String, SwitchInfo> verifyAttachment(NetworkAttachRequest request) {
        String fabricName = request.getFabricName();
        if (request.hasPeer() && request.getPeerSwitchName().equals(request.getSwitchName())) {
            throw new IllegalArgumentException("peer_switch_name " + request.getPeerSwitchName()
                    + " must be different from switch_name " + request.getSwitchName());
        }
        fabricService.verifyFabricExists(fabricName);
        Map<String, SwitchInfo> inventory = inventoryService.getInventory(fabricName);
        if (!networkExists(fabricName, request.getNetworkName())) {
            throw new NdfcException("networkName " + request.getNetworkName() + " does not exist in fabric "
                    + fabricName + ". Create it first.");
        }
        SwitchInfo switchInfo = inventoryService.getSwitch(inventory, fabricName, request.getSwitchName());
        if (request.hasPeer()) {
            SwitchInfo peer = inventory.get(request.getPeerSwitchName());
            if (peer == null) {
                throw new NdfcException("peer_switch_name " + request.getPeerSwitchName()
                        + " not found in fabric " + fabricName + ".");
            }
            if (!FabricInventoryService.isVpcPeer(switchInfo, peer)) {
                throw new NdfcException("switch_name " + request.getSwitchName() + " and peer_switch_name "
                        + request.getPeerSwitchName() + " are not vPC peer switches.");
            }
        }
        return inventory;
    }

    ArrayNode buildAttachPayload(NetworkAttachRequest request, Map<String, SwitchInfo> inventory, boolean deployment) {
        ArrayNode lanAttachList = objectMapper.createArrayNode();
        lanAttachList.add(lanAttachItem(request, inventory.get(request.getSwitchName()), deployment));
        if (request.hasPeer()) {
            lanAttachList.add(lanAttachItem(request, inventory.get(request.getPeerSwitchName()), deployment));
        }
        ObjectNode item = objectMapper.createObjectNode();
        item.put("networkName", request.getNetworkName());
        item.set("lanAttachList", lanAttachList);
        ArrayNode payload = objectMapper.createArrayNode();
        payload.add(item);
        return payload;
    }

    private ObjectNode lanAttachItem(NetworkAttachRequest request, SwitchInfo switchInfo, boolean deployment) {
        ObjectNode item = objectMapper.createObjectNode();
        item.put("deployment", deployment);
        item.put("detachSwitchPorts", String.join(",", request.getDetachSwitchPorts()));
        if (request.getDot1qVlan() == null) {
            item.put("dot1QVlan", "");
        } else {
            item.put("dot1QVlan", request.getDot1qVlan());
        }
        if (deployment) {
            item.put("extensionValues", request.getExtensionValues());
        }
        item.put("fabric", request.getFabricName());
        if (deployment) {
            item.put("freeformConfig", String.join("\n", request.getFreeformConfig()));
            item.put("instanceValues", request.getInstanceValues());
        }
        item.put("networkName", request.getNetworkName());
        item.put("serialNumber", switchInfo.getSerialNumber());
        if (deployment) {
            item.put("switchPorts", String.join(",", request.getSwitchPorts()));
            item.put("torPorts", String.join(",", request.getTorPorts()));
            item.put("untagged", request.isUntagged());
        }
        if (request.getVlan() == null) {
            item.put("vlan", "");
        } else {
            item.put("vlan", request.getVlan());
        }
        return item;
    }

    private void validate(NetworkCreateRequest request) {
        if (request.getFabricName() == null || request.getFabricName().isBlank()
                || request.getVrfName() == null || request.getVrfName().isBlank()
                || request.getNetworkId() == null || request.getVlanId() == null) {
            throw new IllegalArgumentException("fabric_name, network_id, vrf_name and vlan_id must be set before creating a network");
        }
        Validations.verifyVlan(request.getVlanId());
        Validations.verifyVni(request.getNetworkId());
        if (request.getSegmentId() != null) {
            Validations.verifyVni(request.getSegmentId());
        }
        if (request.getMtu() != null) {
            Validations.verifyMtu(request.getMtu());
        }
        if (request.getTag() != null) {
            Validations.verifyRoutingTag(request.getTag());
        }
        if (request.getLoopbackId() != null) {
            Validations.verifyLoopbackId(request.getLoopbackId());
        }
        if (notBlank(request.getGatewayIpAddress())) {
            Validations.verifyIpv4AddressWithPrefix(request.getGatewayIpAddress());
        }
        if (notBlank(request.getGatewayIpv6Address())) {
            Validations.verifyIpv6AddressWithPrefix(request.getGatewayIpv6Address());
        }
        if (notBlank(request.getMcastGroup())) {
            Validations.verifyIpv4MulticastAddress(request.getMcastGroup());
        }
        if (notBlank(request.getDhcpServerAddr1())) {
            Validations.verifyIpv4Address(request.getDhcpServerAddr1());
        }
    }

    private void verifySuccess(String operation) {
        if (!restSend.getResultCurrent().isSuccess()) {
            throw new NdfcException("Unable to " + operation + ". Error detail: " + restSend.errorMessage(),
                    restSend.getResponseCurrent().getReturnCode());
        }
    }

    private void verifyAttachmentSuccess(String operation) {
        verifySuccess(operation);
        List<String> failures = responseHandler.failedAttachments(restSend.getResponseCurrent());
        if (!failures.isEmpty()) {
            throw new NdfcException("Unable to " + operation + ". Controller response: " + String.join(", ", failures),
                    restSend.getResponseCurrent().getReturnCode());
        }
    }

    static String networkName(NetworkCreateRequest request) {
        String name = request.getNetworkName();
        return name == null || name.isBlank() ? "MyNetwork_" + request.getNetworkId() : name;
    }

    private static String switchNames(NetworkAttachRequest request) {
        return request.hasPeer() ? request.getSwitchName() + "," + request.getPeerSwitchName() : request.getSwitchName();
    }

    private static String networksPath(String fabricName) {
        return Endpoints.topDown(fabricName) + "/networks";
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }

    private String toJsonString(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize template config: " + e.getMessage(), e);
        }
    }
}
