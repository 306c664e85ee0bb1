package org.ndfcclient.resource;

import com.fasterxml.jackson.databind.JsonNode;
import org.ndfcclient.fabric.FabricInventoryService;
import org.ndfcclient.fabric.FabricService;
import org.ndfcclient.rest.ControllerResponse;
import org.ndfcclient.rest.Endpoints;
import org.ndfcclient.rest.NdfcException;
import org.ndfcclient.rest.RestSend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Resource manager view of the pools (VLANs, IDs) allocated on a switch.
 */
@Service
public class ResourceUsageService {

    private static final Logger logger = LoggerFactory.getLogger(ResourceUsageService.class);

    private final RestSend restSend;
    private final FabricService fabricService;
    private final FabricInventoryService inventoryService;

    public ResourceUsageService(RestSend restSend, FabricService fabricService,
                                FabricInventoryService inventoryService) {
        this.restSend = restSend;
        this.fabricService = fabricService;
        this.inventoryService = inventoryService;
    }

    /**
     * Retrieves the resources allocated on a switch.
     *
     * @param fabricName Fabric the switch belongs to
     * @param switchName Switch logical name
     * @param pool Pool to keep, or ALL
     * @return Resource entries whose resourcePool.poolName matches the pool
     * @throws NdfcException if the fabric or switch does not exist or the request fails
     */
    public List<JsonNode> getSwitchResourceUsage(String fabricName, String switchName, ResourcePool pool) {
        fabricService.verifyFabricExists(fabricName);
        String serialNumber = inventoryService.switchNameToSerialNumber(fabricName, switchName);

        ControllerResponse response = restSend.commit(HttpMethod.GET, Endpoints.switchResourceUsage(serialNumber), null);
        if (!restSend.getResultCurrent().isSuccess()) {
            throw new NdfcException("Unable to retrieve resource usage of switch " + switchName + ". Error detail: "
                    + restSend.errorMessage(), response.getReturnCode());
        }

        List<JsonNode> usage = new ArrayList<>();
        if (!response.getData().isArray()) {
            return usage;
        }
        for (JsonNode item : response.getData()) {
            if (pool == null || pool == ResourcePool.ALL
                    || pool.name().equals(item.path("resourcePool").path("poolName").asText())) {
                usage.add(item);
            }
        }
        logger.debug("Switch {} in fabric {}: {} resource(s) in pool {}", switchName, fabricName, usage.size(), pool);
        return usage;
    }
}
