package org.ndfcclient.imagepolicy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.ndfcclient.rest.ControllerResponse;
import org.ndfcclient.rest.Endpoints;
import org.ndfcclient.rest.NdfcException;
import org.ndfcclient.rest.RestSend;
import org.ndfcclient.rest.Results;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class ImagePolicyService {

    private static final Logger logger = LoggerFactory.getLogger(ImagePolicyService.class);

    private final RestSend restSend;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ImagePolicyService(RestSend restSend) {
        this.restSend = restSend;
    }

    /**
     * Retrieves every image policy on the controller, keyed on policy name.
     */
    public Map<String, JsonNode> getPolicies() {
        ControllerResponse response = restSend.commit(HttpMethod.GET, Endpoints.IMAGE_POLICY_MGNT + "/policies", null);
        if (!restSend.getResultCurrent().isSuccess()) {
            throw new NdfcException("Unable to retrieve image policies. Error detail: " + restSend.errorMessage(),
                    response.getReturnCode());
        }
        Map<String, JsonNode> policies = new LinkedHashMap<>();
        for (JsonNode policy : response.getData().path("lastOperDataObject")) {
            policies.put(policy.path("policyName").asText(), policy);
        }
        logger.debug("Found {} image policies", policies.size());
        return policies;
    }

    /**
     * Returns the named policies that exist. Names not on the controller are skipped.
     */
    public Map<String, JsonNode> getPolicies(List<String> names) {
        Map<String, JsonNode> all = getPolicies();
        Map<String, JsonNode> selected = new LinkedHashMap<>();
        for (String name : names) {
            JsonNode policy = all.get(name);
            if (policy == null) {
                logger.warn("Image policy {} does not exist on the controller", name);
            } else {
                selected.put(name, policy);
            }
        }
        return selected;
    }

    /**
     * Creates an image policy.
     *
     * @throws NdfcException if a policy with this name exists or the controller rejects it
     */
    public void create(ImagePolicyCreateRequest request, Results results) {
        if (getPolicies().containsKey(request.getName())) {
            throw new NdfcException("Image policy " + request.getName() + " already exists on the controller");
        }
        logger.info("Creating image policy {} for platform {} release {}", request.getName(),
                    request.getPlatform(), request.getRelease());
        restSend.commit(HttpMethod.POST, Endpoints.IMAGE_POLICY_MGNT + "/platform-policy", buildCreatePayload(request));
        results.register("image_policy_create", "merged", restSend);
        if (!restSend.getResultCurrent().isSuccess()) {
            throw new NdfcException("Unable to create image policy " + request.getName() + ". Error detail: "
                    + restSend.errorMessage(), restSend.getResponseCurrent().getReturnCode());
        }
    }

    /**
     * Deletes image policies in one request.
     *
     * @throws NdfcException if any of the policies does not exist
     */
    public void delete(List<String> names, Results results) {
        if (names.isEmpty()) {
            throw new IllegalArgumentException("At least one image policy name is required");
        }
        Map<String, JsonNode> existing = getPolicies();
        for (String name : names) {
            if (!existing.containsKey(name)) {
                throw new NdfcException("Image policy " + name + " does not exist on the controller");
            }
        }
        ObjectNode payload = objectMapper.createObjectNode();
        payload.set("policyNames", objectMapper.valueToTree(names));

        logger.info("Deleting image policies {}", names);
        restSend.commit(HttpMethod.DELETE, Endpoints.IMAGE_POLICY_MGNT + "/policy", payload);
        results.register("image_policy_delete", "deleted", restSend);
        if (!restSend.getResultCurrent().isSuccess()) {
            throw new NdfcException("Unable to delete image policies " + names + ". Error detail: "
                    + restSend.errorMessage(), restSend.getResponseCurrent().getReturnCode());
        }
    }

    ObjectNode buildCreatePayload(ImagePolicyCreateRequest request) {
        ImagePolicyCreateRequest.Packages packages = request.getPackages() != null
                ? request.getPackages() : new ImagePolicyCreateRequest.Packages();
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("agnostic", request.isAgnostic());
        payload.put("epldImgName", request.getEpldImage());
        payload.put("nxosVersion", request.getRelease());
        payload.put("packageName", joinPackages(packages.getInstall()));
        payload.put("platform", request.getPlatform());
        payload.put("policyDescr", request.getDescription());
        payload.put("policyName", request.getName());
        payload.put("policyType", request.getType());
        payload.put("rpmimages", joinPackages(packages.getUninstall()));
        return payload;
    }

    private static String joinPackages(List<String> names) {
        return names == null ? "" : String.join(",", names);
    }
}
