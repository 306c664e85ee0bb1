package org.ndfcclient.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.ndfcclient.fabric.FabricInventoryService;
import org.ndfcclient.fabric.FabricInventoryService.SwitchInfo;
import org.ndfcclient.fabric.FabricService;
import org.ndfcclient.rest.ControllerResponse;
import org.ndfcclient.rest.Endpoints;
import org.ndfcclient.rest.NdfcException;
import org.ndfcclient.rest.RestSend;
import org.ndfcclient.rest.Results;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Switch policies: creation, deletion by description, and per-switch queries.
 */
@Service
public class PolicyService {

    private static final Logger logger = LoggerFactory.getLogger(PolicyService.class);

    private final RestSend restSend;
    private final FabricService fabricService;
    private final FabricInventoryService inventoryService;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public PolicyService(RestSend restSend, FabricService fabricService, FabricInventoryService inventoryService) {
        this.restSend = restSend;
        this.fabricService = fabricService;
        this.inventoryService = inventoryService;
    }

    /**
     * Retrieves the policies of a switch.
     *
     * @throws NdfcException if the fabric or switch does not exist
     */
    public List<JsonNode> getSwitchPolicies(String fabricName, String switchName) {
        fabricService.verifyFabricExists(fabricName);
        SwitchInfo switchInfo = inventoryService.getSwitch(fabricName, switchName);
        return getPoliciesBySerialNumber(switchInfo.getSerialNumber());
    }

    private List<JsonNode> getPoliciesBySerialNumber(String serialNumber) {
        ControllerResponse response = restSend.commit(HttpMethod.GET,
                Endpoints.POLICIES + "/switches?serialNumber=" + Endpoints.encode(serialNumber), null);
        if (!restSend.getResultCurrent().isSuccess()) {
            throw new NdfcException("Unable to retrieve policies of switch " + serialNumber + ". Error detail: "
                    + restSend.errorMessage(), response.getReturnCode());
        }
        List<JsonNode> policies = new ArrayList<>();
        if (response.getData().isArray()) {
            response.getData().forEach(policies::add);
        }
        return policies;
    }

    /**
     * Creates a policy on a switch.
     *
     * @throws NdfcException if the switch is missing, a policy with the same description
     *         exists on it, or the controller rejects the request
     */
    public void create(PolicyCreateRequest request, Results results) {
        String fabricName = request.getFabricName();
        fabricService.verifyFabricExists(fabricName);
        SwitchInfo switchInfo = inventoryService.getSwitch(fabricName, request.getSwitchName());

        for (JsonNode policy : getPoliciesBySerialNumber(switchInfo.getSerialNumber())) {
            if (request.getDescription().equals(policy.path("description").asText())) {
                throw new NdfcException("Policy ID " + policy.path("policyId").asText() + " with description '"
                        + request.getDescription() + "' already exists on switch " + request.getSwitchName()
                        + " in fabric " + fabricName + ". Use a unique policy description or delete the existing policy.");
            }
        }

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("description", request.getDescription());
        payload.put("entityName", request.getEntityName());
        payload.put("entityType", request.getEntityType());
        payload.put("ipAddress", switchInfo.getIpAddress());
        payload.set("nvPairs", objectMapper.valueToTree(request.getNvPairs()));
        payload.put("priority", request.getPriority());
        payload.put("serialNumber", switchInfo.getSerialNumber());
        payload.put("source", request.getSource());
        payload.put("templateName", request.getTemplateName());
        payload.put("templateContentType", request.getTemplateContentType());

        logger.info("Creating policy '{}' from template {} on switch {}", request.getDescription(),
                    request.getTemplateName(), request.getSwitchName());
        restSend.commit(HttpMethod.POST, Endpoints.POLICIES, payload);
        results.register("policy_create", "merged", restSend);
        if (!restSend.getResultCurrent().isSuccess()) {
            throw new NdfcException("Request unsuccessful. " + restSend.getResultCurrent()
                    + ". More detail (if any): " + restSend.errorMessage(),
                    restSend.getResponseCurrent().getReturnCode());
        }
    }

    /**
     * Deletes the one policy on a switch whose description matches.
     *
     * @return The id of the deleted policy
     * @throws NdfcException if no policy, or more than one, has the description
     */
    public String delete(SwitchPolicyRequest request, Results results) {
        if (request.getDescription() == null || request.getDescription().isBlank()) {
            throw new IllegalArgumentException("description must be set before deleting a policy");
        }
        List<String> policyIds = new ArrayList<>();
        for (JsonNode policy : getSwitchPolicies(request.getFabricName(), request.getSwitchName())) {
            if (request.getDescription().equals(policy.path("description").asText())) {
                policyIds.add(policy.path("policyId").asText());
            }
        }
        if (policyIds.isEmpty()) {
            throw new NdfcException("fabric_name " + request.getFabricName() + ", switch_name " + request.getSwitchName()
                    + ": No policies found with description '" + request.getDescription() + "'");
        }
        if (policyIds.size() > 1) {
            throw new NdfcException("Expected to find exactly one policy with description '" + request.getDescription()
                    + "' on switch " + request.getSwitchName() + " in fabric " + request.getFabricName()
                    + ". Found " + policyIds.size() + " policies with that description. "
                    + "Manually delete the duplicate policies and try again. policy_ids: " + policyIds);
        }
        deleteByIds(policyIds, results);
        return policyIds.get(0);
    }

    /**
     * Deletes policies by id.
     */
    public void deleteByIds(List<String> policyIds, Results results) {
        if (policyIds == null || policyIds.isEmpty()) {
            throw new IllegalArgumentException("policy_ids must contain at least one policy id");
        }
        logger.info("Deleting policies {}", policyIds);
        restSend.commit(HttpMethod.DELETE, Endpoints.POLICIES + "/policyIds?policyIds=" + Endpoints.joinQuery(policyIds), null);
        results.register("policy_delete", "deleted", restSend);
        if (!restSend.getResultCurrent().isSuccess()) {
            throw new NdfcException("Request unsuccessful. " + restSend.getResultCurrent()
                    + ". More detail (if any): " + restSend.errorMessage(),
                    restSend.getResponseCurrent().getReturnCode());
        }
    }
}
