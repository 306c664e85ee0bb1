package org.ndfcclient.vrf;

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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * VRF creation, deletion, attachment and detachment through the top-down API.
 */
@Service
public class VrfService {

    private static final Logger logger = LoggerFactory.getLogger(VrfService.class);

    private final RestSend restSend;
    private final FabricService fabricService;
    private final FabricInventoryService inventoryService;
    private final ResponseHandler responseHandler;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public VrfService(RestSend restSend, FabricService fabricService,
                      FabricInventoryService inventoryService, ResponseHandler responseHandler) {
        this.restSend = restSend;
        this.fabricService = fabricService;
        this.inventoryService = inventoryService;
        this.responseHandler = responseHandler;
    }

    /**
     * Retrieves the VRFs of a fabric.
     *
     * @throws NdfcException if the fabric does not exist or the request fails
     */
    public List<JsonNode> getVrfs(String fabricName) {
        ControllerResponse response = restSend.commit(HttpMethod.GET, vrfsPath(fabricName), null);
        JsonNode data = response.getData();
        if (!data.isArray()) {
            if ("Resource not found".equals(data.path("message").asText()) || response.getReturnCode() == 404) {
                throw new NdfcException("Fabric " + fabricName + " does not exist on the controller",
                        response.getReturnCode());
            }
            throw new NdfcException("Unable to retrieve VRFs of fabric " + fabricName + ". Error detail: "
                    + restSend.errorMessage(), response.getReturnCode());
        }
        List<JsonNode> vrfs = new ArrayList<>();
        data.forEach(vrfs::add);
        return vrfs;
    }

    public boolean vrfExists(String fabricName, String vrfName) {
        return findVrf(fabricName, vrfName) != null;
    }

    /**
     * Retrieves one VRF.
     *
     * @throws NdfcException if the VRF does not exist in the fabric
     */
    public JsonNode getVrf(String fabricName, String vrfName) {
        JsonNode vrf = findVrf(fabricName, vrfName);
        if (vrf == null) {
            throw new NdfcException("VRF " + vrfName + " does not exist in fabric " + fabricName);
        }
        return vrf;
    }

    private JsonNode findVrf(String fabricName, String vrfName) {
        for (JsonNode vrf : getVrfs(fabricName)) {
            if (vrfName.equals(vrf.path("vrfName").asText())) {
                return vrf;
            }
        }
        return null;
    }

    /**
     * Creates a VRF.
     *
     * @throws IllegalArgumentException if a parameter is out of range
     * @throws NdfcException if the fabric is missing, the VRF exists, or the controller
     *         rejects the request
     */
    public void create(VrfCreateRequest request, Results results) {
        validate(request);
        String fabricName = request.getFabricName();
        fabricService.verifyFabricExists(fabricName);
        if (vrfExists(fabricName, request.getVrfName())) {
            throw new NdfcException("VRF " + request.getVrfName() + " already exists in fabric " + fabricName);
        }

        ObjectNode payload = buildCreatePayload(request);
        logger.info("Creating VRF {} (vrfId {}) in fabric {}", request.getVrfName(), request.getVrfId(), fabricName);
        restSend.commit(HttpMethod.POST, vrfsPath(fabricName), payload);
        results.register("vrf_create", "merged", restSend);
        verifySuccess("create VRF " + request.getVrfName() + " in fabric " + fabricName);
    }

    ObjectNode buildCreatePayload(VrfCreateRequest request) {
        ObjectNode templateConfig = objectMapper.createObjectNode();
        templateConfig.put("advertiseDefaultRouteFlag", orDefault(request.getAdvertiseDefaultRoute(), true));
        templateConfig.put("advertiseHostRouteFlag", orDefault(request.getAdvertiseHostRoute(), false));
        templateConfig.put("bgpPassword", orEmpty(request.getBgpPassword()));
        templateConfig.put("bgpPasswordKeyType", request.getBgpPasswordKeyType() == null ? 3 : request.getBgpPasswordKeyType());
        templateConfig.put("configureStaticDefaultRouteFlag", true);
        templateConfig.put("ENABLE_NETFLOW", false);
        templateConfig.put("ipv6LinkLocalFlag", true);
        templateConfig.put("isRPExternal", false);
        templateConfig.put("loopbackNumber", request.getLoopbackNumber() == null ? "" : request.getLoopbackNumber().toString());
        templateConfig.put("L3VniMcastGroup", "");
        templateConfig.put("maxBgpPaths", request.getMaxBgpPaths() == null ? "1" : request.getMaxBgpPaths().toString());
        templateConfig.put("maxIbgpPaths", request.getMaxIbgpPaths() == null ? "2" : request.getMaxIbgpPaths().toString());
        templateConfig.put("multicastGroup", orEmpty(request.getMulticastGroup()));
        templateConfig.put("mtu", request.getMtu() == null ? 9216 : request.getMtu());
        templateConfig.put("NETFLOW_MONITOR", "");
        templateConfig.put("nveId", 1);
        templateConfig.put("rpAddress", orEmpty(request.getRpAddress()));
        templateConfig.put("tag", request.getTag() == null ? "12345" : request.getTag().toString());
        templateConfig.put("trmEnabled", orDefault(request.getTrmEnabled(), false));
        templateConfig.put("trmBGWMSiteEnabled", false);
        templateConfig.put("vrfDescription", orEmpty(request.getVrfDescription()));
        templateConfig.put("vrfIntfDescription", orEmpty(request.getVrfIntfDescription()));
        templateConfig.put("vrfName", request.getVrfName());
        templateConfig.put("vrfRouteMap", "FABRIC-RMAP-REDIST-SUBNET");
        templateConfig.put("vrfSegmentId", request.getVrfId());
        templateConfig.put("vrfVlanId", request.getVrfVlanId());
        templateConfig.put("vrfVlanName", orEmpty(request.getVrfVlanName()));

        ObjectNode payload = objectMapper.createObjectNode();
        String displayName = request.getDisplayName();
        payload.put("displayName", displayName == null || displayName.isBlank() ? request.getVrfName() : displayName);
        payload.put("fabric", request.getFabricName());
        payload.put("serviceVrfTemplate", "");
        payload.put("source", "");
        payload.put("vrfExtensionTemplate", request.getVrfExtensionTemplate());
        payload.put("vrfId", request.getVrfId());
        payload.put("vrfName", request.getVrfName());
        payload.put("vrfTemplate", request.getVrfTemplate());
        payload.put("vrfTemplateConfig", toJsonString(templateConfig));
        return payload;
    }

    /**
     * Deletes VRFs in one bulk request. Every VRF must exist.
     *
     * @throws NdfcException if the fabric or a VRF is missing, or the controller rejects
     *         the deletion
     */
    public void delete(String fabricName, List<String> vrfNames, Results results) {
        if (vrfNames == null || vrfNames.isEmpty()) {
            throw new IllegalArgumentException("vrf_names must contain at least one VRF");
        }
        List<String> existing = new ArrayList<>();
        for (JsonNode vrf : getVrfs(fabricName)) {
            existing.add(vrf.path("vrfName").asText());
        }
        for (String vrfName : vrfNames) {
            if (!existing.contains(vrfName)) {
                throw new NdfcException("VRF " + vrfName + " does not exist in fabric " + fabricName);
            }
        }

        String path = Endpoints.topDown(fabricName) + "/bulk-delete/vrfs?vrf-names=" + Endpoints.joinQuery(vrfNames);
        logger.info("Deleting VRF(s) {} from fabric {}", vrfNames, fabricName);
        restSend.commit(HttpMethod.DELETE, path, null);
        results.register("vrf_delete", "deleted", restSend);
        verifySuccess("delete VRF(s) " + String.join(",", vrfNames) + " from fabric " + fabricName);
    }

    /**
     * Attaches a VRF to a switch, and to its vPC peer when one is named.
     *
     * @throws NdfcException if the fabric, VRF or a switch is missing, the switches are
     *         not vPC peers, or the controller rejects the attachment
     */
    public void attach(VrfAttachRequest request, Results results) {
        Map<String, SwitchInfo> inventory = verifyAttachment(request);
        ArrayNode payload = buildAttachPayload(request, inventory, true);
        logger.info("Attaching VRF {} to {} in fabric {}", request.getVrfName(), switchNames(request), request.getFabricName());
        restSend.commit(HttpMethod.POST, vrfsPath(request.getFabricName()) + "/attachments?quick-attach=true", payload);
        results.register("vrf_attach", "merged", restSend);
        verifyAttachmentSuccess("attach VRF " + request.getVrfName() + " to " + switchNames(request));
    }

    /**
     * Detaches a VRF from a switch, and from its vPC peer when one is named.
     */
    public void detach(VrfAttachRequest request, Results results) {
        Map<String, SwitchInfo> inventory = verifyAttachment(request);
        ArrayNode payload = buildAttachPayload(request, inventory, false);
        logger.info("Detaching VRF {} from {} in fabric {}", request.getVrfName(), switchNames(request), request.getFabricName());
        restSend.commit(HttpMethod.POST, vrfsPath(request.getFabricName()) + "/attachments", payload);
        results.register("vrf_detach", "deleted", restSend);
        verifyAttachmentSuccess("detach VRF " + request.getVrfName() + " from " + switchNames(request));
    }

    private Map<String, SwitchInfo> verifyAttachment(VrfAttachRequest request) {
        String fabricName = request.getFabricName();
        if (request.hasPeer() && request.getPeerSwitchName().equals(request.getSwitchName())) {
            throw new IllegalArgumentException("peer_switch_name must be different from switch_name");
        }
        fabricService.verifyFabricExists(fabricName);
        if (!vrfExists(fabricName, request.getVrfName())) {
            throw new NdfcException("vrfName " + request.getVrfName() + " does not exist in fabric "
                    + fabricName + ". Create it first.");
        }
        Map<String, SwitchInfo> inventory = inventoryService.getInventory(fabricName);
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

    ArrayNode buildAttachPayload(VrfAttachRequest request, Map<String, SwitchInfo> inventory, boolean deployment) {
        ArrayNode lanAttachList = objectMapper.createArrayNode();
        lanAttachList.add(lanAttachItem(request, inventory.get(request.getSwitchName()), deployment));
        if (request.hasPeer()) {
            lanAttachList.add(lanAttachItem(request, inventory.get(request.getPeerSwitchName()), deployment));
        }
        ObjectNode item = objectMapper.createObjectNode();
        item.put("vrfName", request.getVrfName());
        item.set("lanAttachList", lanAttachList);
        ArrayNode payload = objectMapper.createArrayNode();
        payload.add(item);
        return payload;
    }

    private ObjectNode lanAttachItem(VrfAttachRequest request, SwitchInfo switchInfo, boolean deployment) {
        ObjectNode item = objectMapper.createObjectNode();
        item.put("deployment", deployment);
        if (deployment) {
            item.put("extensionValues", extensionValues(request.getVrfLite()));
        }
        item.put("fabric", request.getFabricName());
        if (deployment) {
            item.put("freeformConfig", String.join("\n", request.getFreeformConfig()));
            item.put("instanceValues", request.getInstanceValues().isEmpty()
                    ? "" : toJsonString(objectMapper.valueToTree(request.getInstanceValues())));
        }
        item.put("serialNumber", switchInfo.getSerialNumber());
        if (request.getVlan() == null) {
            item.put("vlan", "");
        } else {
            item.put("vlan", request.getVlan());
        }
        item.put("vrfName", request.getVrfName());
        return item;
    }

    /**
     * Encodes VRF-Lite entries the way the controller expects them: a JSON string holding
     * VRF_LITE_CONN and MULTISITE_CONN, each itself a JSON string.
     */
    String extensionValues(List<Map<String, Object>> vrfLite) {
        if (vrfLite == null || vrfLite.isEmpty()) {
            return "";
        }
        ArrayNode connections = objectMapper.createArrayNode();
        for (Map<String, Object> entry : vrfLite) {
            if (!entry.containsKey("IF_NAME")) {
                throw new IllegalArgumentException("vrf_lite entries must contain IF_NAME");
            }
            Map<String, Object> connection = new LinkedHashMap<>(entry);
            Object autoFlag = connection.getOrDefault("AUTO_VRF_LITE_FLAG", true);
            connection.put("AUTO_VRF_LITE_FLAG", String.valueOf(autoFlag).toLowerCase());
            connections.add(objectMapper.<JsonNode>valueToTree(connection));
        }
        ObjectNode vrfLiteConn = objectMapper.createObjectNode();
        vrfLiteConn.set("VRF_LITE_CONN", connections);
        ObjectNode multisiteConn = objectMapper.createObjectNode();
        multisiteConn.set("MULTISITE_CONN", objectMapper.createArrayNode());

        ObjectNode outer = objectMapper.createObjectNode();
        outer.put("VRF_LITE_CONN", toJsonString(vrfLiteConn));
        outer.put("MULTISITE_CONN", toJsonString(multisiteConn));
        return toJsonString(outer);
    }

    private void validate(VrfCreateRequest request) {
        if (isBlank(request.getFabricName()) || isBlank(request.getVrfName())
                || request.getVrfId() == null || request.getVrfVlanId() == null) {
            throw new IllegalArgumentException("fabric_name, vrf_name, vrf_id and vrf_vlan_id must be set before creating a VRF");
        }
        Validations.verifyVrfVlanId(request.getVrfVlanId());
        Validations.verifyVni(request.getVrfId());
        if (request.getMtu() != null) {
            Validations.verifyMtu(request.getMtu());
        }
        if (request.getMaxBgpPaths() != null) {
            Validations.verifyMaxBgpPaths(request.getMaxBgpPaths());
        }
        if (request.getMaxIbgpPaths() != null) {
            Validations.verifyMaxBgpPaths(request.getMaxIbgpPaths());
        }
        if (request.getTag() != null) {
            Validations.verifyRoutingTag(request.getTag());
        }
        if (request.getLoopbackNumber() != null) {
            Validations.verifyLoopbackId(request.getLoopbackNumber());
        }
        if (request.getBgpPasswordKeyType() != null) {
            Validations.verifyBgpPasswordKeyType(request.getBgpPasswordKeyType());
        }
        if (request.getMulticastGroup() != null && !request.getMulticastGroup().isBlank()) {
            Validations.verifyIpv4MulticastAddress(request.getMulticastGroup());
        }
        if (request.getRpAddress() != null && !request.getRpAddress().isBlank()) {
            Validations.verifyIpv4Address(request.getRpAddress());
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

    private static String switchNames(VrfAttachRequest request) {
        return request.hasPeer() ? request.getSwitchName() + "," + request.getPeerSwitchName() : request.getSwitchName();
    }

    private static String vrfsPath(String fabricName) {
        return Endpoints.topDown(fabricName) + "/vrfs";
    }

    private static boolean orDefault(Boolean value, boolean defaultValue) {
        return value == null ? defaultValue : value;
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private String toJsonString(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize template config: " + e.getMessage(), e);
        }
    }
}
