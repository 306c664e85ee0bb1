package org.ndfcclient.discover;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.ndfcclient.config.NdfcConfig;
import org.ndfcclient.fabric.FabricInventoryService;
import org.ndfcclient.fabric.FabricInventoryService.SwitchInfo;
import org.ndfcclient.fabric.FabricService;
import org.ndfcclient.rest.ControllerResponse;
import org.ndfcclient.rest.Endpoints;
import org.ndfcclient.rest.NdfcException;
import org.ndfcclient.rest.RestSend;
import org.ndfcclient.rest.Results;
import org.ndfcclient.rest.Sleeper;
import org.ndfcclient.validation.Validations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;

/**
 * Switch reachability tests, discovery of switches into a fabric, and polling of the
 * fabric inventory until a discovered switch is manageable.
 */
@Service
public class DiscoverService {

    private static final Logger logger = LoggerFactory.getLogger(DiscoverService.class);

    private static final int REACHABILITY_TIMEOUT = 10;

    private final RestSend restSend;
    private final FabricService fabricService;
    private final FabricInventoryService inventoryService;
    private final NdfcConfig ndfcConfig;
    private final Sleeper sleeper;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Autowired
    public DiscoverService(RestSend restSend, FabricService fabricService,
                           FabricInventoryService inventoryService, NdfcConfig ndfcConfig) {
        this(restSend, fabricService, inventoryService, ndfcConfig, Sleeper.THREAD);
    }

    public DiscoverService(RestSend restSend, FabricService fabricService,
                           FabricInventoryService inventoryService, NdfcConfig ndfcConfig, Sleeper sleeper) {
        this.restSend = restSend;
        this.fabricService = fabricService;
        this.inventoryService = inventoryService;
        this.ndfcConfig = ndfcConfig;
        this.sleeper = sleeper;
    }

    /**
     * Asks the controller whether it can reach and log in to the seed switch.
     *
     * @throws IllegalArgumentException if the seed IP is not an IPv4 address or no
     *         switch credentials are available
     * @throws NdfcException if the fabric does not exist or the controller rejects the request
     */
    public ReachabilityResult reachability(ReachabilityRequest request) {
        fabricService.verifyFabricExists(request.getFabricName());
        return testReachability(buildPayload(request));
    }

    private ReachabilityResult testReachability(ObjectNode payload) {
        String fabricName = payload.path("fabric").asText();
        String seedIp = payload.path("seedIP").asText();
        RestSend send = restSend.withTimeout(REACHABILITY_TIMEOUT);
        ControllerResponse response = send.commit(HttpMethod.POST, Endpoints.testReachability(fabricName), payload);
        if (!send.getResultCurrent().isSuccess()) {
            throw new NdfcException("Unable to test reachability of " + seedIp + " in fabric " + fabricName
                    + ". Error detail: " + send.errorMessage(), response.getReturnCode());
        }
        JsonNode data = response.getData();
        if (!data.isArray() || data.isEmpty()) {
            throw new NdfcException("Unexpected test-reachability response for " + seedIp + ": " + data);
        }
        ReachabilityResult result = new ReachabilityResult(data.get(0));
        logger.debug("Reachability of {}: {}", seedIp, result);
        return result;
    }

    /**
     * Discovers the seed switch into the fabric. Reachability is retried
     * "ndfc.discover.retries" times, "ndfc.discover.retry-interval" seconds apart. With
     * wait_until_up set, the inventory is then polled the same way until the switch is
     * manageable.
     *
     * @throws NdfcException if the switch stays unreachable, discovery fails, or the switch
     *         does not become manageable
     */
    public void discover(ReachabilityRequest request, Results results) {
        fabricService.verifyFabricExists(request.getFabricName());
        ObjectNode payload = buildPayload(request);
        ObjectNode discoverPayload = payload.deepCopy();
        ArrayNode switches = discoverPayload.putArray("switches");

        if (restSend.isCheckMode()) {
            logger.info("Check mode: skipping reachability test of {}", request.getSeedIp());
        } else {
            ReachabilityResult reachability = testReachability(payload);
            int retries = ndfcConfig.getDiscover().getRetries();
            while (!reachability.isReachable() && retries > 0) {
                logger.info("Switch {} is not reachable, {} retries left", request.getSeedIp(), retries);
                sleeper.sleep(ndfcConfig.getDiscover().getRetryInterval());
                retries--;
                reachability = testReachability(payload);
            }
            if (!reachability.isReachable()) {
                throw new NdfcException("Switch " + request.getSeedIp() + " not reachable after "
                        + ndfcConfig.getDiscover().getRetries() + " retries. statusReason: "
                        + reachability.getStatusReason());
            }
            switches.add(reachability.getRaw());
        }

        logger.info("Discovering switch {} into fabric {}", request.getSeedIp(), request.getFabricName());
        restSend.commit(HttpMethod.POST, Endpoints.discover(request.getFabricName()), discoverPayload);
        results.register("discover", "merged", restSend);
        if (!restSend.getResultCurrent().isSuccess()) {
            throw new NdfcException("Unable to discover switch " + request.getSeedIp() + " in fabric "
                    + request.getFabricName() + ". Error detail: " + restSend.errorMessage(),
                    restSend.getResponseCurrent().getReturnCode());
        }

        if (request.isWaitUntilUp() && !restSend.isCheckMode()) {
            if (!waitUntilUp(request.getFabricName(), request.getSeedIp())) {
                throw new NdfcException("Switch " + request.getSeedIp() + " did not become manageable in fabric "
                        + request.getFabricName());
            }
            logger.info("Switch {} is up in fabric {}", request.getSeedIp(), request.getFabricName());
        }
    }

    /**
     * Returns true if the fabric inventory has a manageable switch with this IP address.
     */
    public boolean isUp(String fabricName, String ipAddress) {
        for (SwitchInfo switchInfo : inventoryService.getInventory(fabricName).values()) {
            if (ipAddress.equals(switchInfo.getIpAddress())) {
                return switchInfo.isManagable();
            }
        }
        return false;
    }

    /**
     * Polls {@link #isUp} until it is true or the discover retries are used up.
     *
     * @return Whether the switch became manageable
     */
    public boolean waitUntilUp(String fabricName, String ipAddress) {
        int retries = ndfcConfig.getDiscover().getRetries();
        while (true) {
            if (isUp(fabricName, ipAddress)) {
                return true;
            }
            if (retries-- <= 0) {
                return false;
            }
            logger.info("Waiting for switch {} in fabric {} to become manageable", ipAddress, fabricName);
            sleeper.sleep(ndfcConfig.getDiscover().getRetryInterval());
        }
    }

    /**
     * Returns the inventory record of the switch with this IP address.
     *
     * @throws NdfcException if the fabric does not contain the device
     */
    public SwitchInfo deviceInfo(DeviceInfoRequest request) {
        Validations.verifyIpv4Address(request.getSwitchIp4());
        return inventoryService.findByIpAddress(request.getFabricName(), request.getSwitchIp4());
    }

    ObjectNode buildPayload(ReachabilityRequest request) {
        Validations.verifyIpv4Address(request.getSeedIp());
        String username = firstNonBlank(request.getUsername(), ndfcConfig.getNxosUsername());
        String password = firstNonBlank(request.getPassword(), ndfcConfig.getNxosPassword());
        if (username == null) {
            throw new IllegalArgumentException("username must be set, either in the request or via NXOS_USERNAME");
        }
        if (password == null) {
            throw new IllegalArgumentException("password must be set, either in the request or via NXOS_PASSWORD");
        }

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("cdpSecondTimeout", request.getCdpSecondTimeout());
        payload.put("fabric", request.getFabricName());
        payload.put("maxHops", request.getMaxHops());
        payload.put("password", password);
        payload.put("preserveConfig", request.isPreserveConfig());
        payload.put("seedIP", request.getSeedIp());
        payload.put("snmpV3AuthProtocol", 0);
        payload.put("username", username);
        return payload;
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        if (second != null && !second.isBlank()) {
            return second;
        }
        return null;
    }
}
