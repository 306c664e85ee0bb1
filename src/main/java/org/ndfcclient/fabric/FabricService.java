package org.ndfcclient.fabric;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.ndfcclient.rest.ControllerResponse;
import org.ndfcclient.rest.Endpoints;
import org.ndfcclient.rest.NdfcException;
import org.ndfcclient.rest.RestSend;
import org.ndfcclient.rest.Results;
import org.ndfcclient.validation.Validations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Fabric queries, creation and deletion.
 */
@Service
public class FabricService {

    private static final Logger logger = LoggerFactory.getLogger(FabricService.class);

    /** Fabric creation is retried for 9 seconds, every 3 seconds */
    static final int CREATE_TIMEOUT = 9;
    static final int CREATE_SEND_INTERVAL = 3;

    private final RestSend restSend;
    private final FabricInventoryService inventoryService;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public FabricService(RestSend restSend, FabricInventoryService inventoryService) {
        this.restSend = restSend;
        this.inventoryService = inventoryService;
    }

    /**
     * Retrieves every fabric on the controller.
     *
     * @return Fabric records keyed on nvPairs.FABRIC_NAME
     * @throws NdfcException if the controller rejects the request
     */
    public Map<String, JsonNode> getFabrics() {
        ControllerResponse response = restSend.commit(HttpMethod.GET, Endpoints.CONTROL_FABRICS, null);
        if (!restSend.getResultCurrent().isSuccess()) {
            throw new NdfcException("Unable to retrieve fabrics. Error detail: " + restSend.errorMessage(),
                    response.getReturnCode());
        }
        Map<String, JsonNode> fabrics = new LinkedHashMap<>();
        for (JsonNode fabric : response.getData()) {
            String name = fabric.path("nvPairs").path("FABRIC_NAME").asText(fabric.path("fabricName").asText(""));
            if (!name.isEmpty()) {
                fabrics.put(name, fabric);
            }
        }
        logger.debug("Controller has {} fabric(s)", fabrics.size());
        return fabrics;
    }

    public Set<String> fabricNames() {
        return getFabrics().keySet();
    }

    public boolean fabricExists(String fabricName) {
        return getFabrics().containsKey(fabricName);
    }

    /**
     * Retrieves one fabric.
     *
     * @throws NdfcException if the fabric does not exist
     */
    public JsonNode getFabric(String fabricName) {
        JsonNode fabric = getFabrics().get(fabricName);
        if (fabric == null) {
            throw new NdfcException("Fabric " + fabricName + " does not exist on the controller");
        }
        return fabric;
    }

    /**
     * Retrieves the full details of one fabric from its own endpoint, including the
     * fabric's template and every nvPair.
     *
     * @throws NdfcException if the fabric does not exist or the request fails
     */
    public JsonNode getFabricDetails(String fabricName) {
        ControllerResponse response = restSend.commit(HttpMethod.GET, Endpoints.fabric(fabricName), null);
        if (!restSend.getResultCurrent().isSuccess()) {
            throw new NdfcException("Unable to retrieve fabric " + fabricName + ". Error detail: "
                    + restSend.errorMessage(), response.getReturnCode());
        }
        if (!restSend.getResultCurrent().isFound()) {
            throw new NdfcException("Fabric " + fabricName + " does not exist on the controller",
                    response.getReturnCode());
        }
        return response.getData();
    }

    /**
     * Throws unless the fabric exists.
     */
    public void verifyFabricExists(String fabricName) {
        if (!fabricExists(fabricName)) {
            throw new NdfcException("Fabric " + fabricName + " does not exist on the controller");
        }
    }

    /**
     * Creates a fabric from the template matching its FABRIC_TYPE.
     *
     * @param request Fabric parameters
     * @param results Collects the controller reply
     * @throws IllegalArgumentException if a parameter is malformed
     * @throws NdfcException if the fabric exists or the controller rejects it
     */
    public void create(FabricCreateRequest request, Results results) {
        Validations.verifyFabricName(request.getFabricName());
        FabricType type = FabricType.fromValue(request.getFabricType());
        if (type == FabricType.VXLAN_EVPN && (request.getBgpAs() == null || request.getBgpAs().isBlank())) {
            throw new IllegalArgumentException("BGP_AS is mandatory for FABRIC_TYPE " + type.name());
        }
        if (request.getBgpAs() != null) {
            Validations.verifyBgpAsn(request.getBgpAs());
        }

        if (fabricExists(request.getFabricName())) {
            throw new NdfcException("Fabric " + request.getFabricName() + " already exists on the controller");
        }

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("FABRIC_NAME", request.getFabricName());
        payload.put("FABRIC_TYPE", type.name());
        if (request.getBgpAs() != null) {
            payload.put("BGP_AS", request.getBgpAs());
        }
        request.getParameters().forEach((name, value) -> payload.set(name, objectMapper.valueToTree(value)));

        String path = Endpoints.REST_CONTROL_FABRICS + "/" + Endpoints.encode(request.getFabricName())
                + "/" + type.getTemplateName();
        logger.info("Creating fabric {} from template {}", request.getFabricName(), type.getTemplateName());

        RestSend send = restSend.withSettings(CREATE_TIMEOUT, CREATE_SEND_INTERVAL);
        send.commit(HttpMethod.POST, path, payload);
        results.register("fabric_create", "merged", send);
        if (!send.getResultCurrent().isSuccess()) {
            throw new NdfcException("Unable to create fabric " + request.getFabricName()
                    + ". Error detail: " + send.errorMessage(), send.getResponseCurrent().getReturnCode());
        }
    }

    /**
     * Deletes an empty fabric.
     *
     * @throws NdfcException if the fabric does not exist, still has switches, or the
     *         controller rejects the deletion
     */
    public void delete(String fabricName, Results results) {
        verifyFabricExists(fabricName);
        int switches = inventoryService.getInventory(fabricName).size();
        if (switches > 0) {
            throw new NdfcException("Fabric " + fabricName + " cannot be deleted since it contains "
                    + switches + " switch(es). Remove the switches first.");
        }

        logger.info("Deleting fabric {}", fabricName);
        restSend.commit(HttpMethod.DELETE, Endpoints.REST_CONTROL_FABRICS + "/" + Endpoints.encode(fabricName), null);
        results.register("fabric_delete", "deleted", restSend);
        if (!restSend.getResultCurrent().isSuccess()) {
            throw new NdfcException("Unable to delete fabric " + fabricName + ". Error detail: "
                    + restSend.errorMessage(), restSend.getResponseCurrent().getReturnCode());
        }
    }
}
