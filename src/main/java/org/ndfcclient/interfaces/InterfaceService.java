package org.ndfcclient.interfaces;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.ndfcclient.rest.Endpoints;
import org.ndfcclient.rest.NdfcException;
import org.ndfcclient.rest.RestSend;
import org.ndfcclient.rest.Results;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;

/**
 * Interface creation through the lan-fabric interface endpoint.
 */
@Service
public class InterfaceService {

    private static final Logger logger = LoggerFactory.getLogger(InterfaceService.class);

    static final String INTERFACE_TYPE = "INTERFACE_ETHERNET";

    private final RestSend restSend;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public InterfaceService(RestSend restSend) {
        this.restSend = restSend;
    }

    /**
     * Configures an access-mode interface.
     *
     * @throws NdfcException if the controller rejects the interface
     */
    public void createAccess(InterfaceAccessRequest request, Results results) {
        ObjectNode payload = buildAccessPayload(request);
        logger.info("Creating access interface {} on switch {}", request.getInterfaceName(), request.getSerialNumber());
        restSend.commit(HttpMethod.POST, Endpoints.INTERFACE, payload);
        results.register("interface_access_create", "merged", restSend);
        if (!restSend.getResultCurrent().isSuccess()) {
            throw new NdfcException("Unable to create interface " + request.getInterfaceName() + " on switch "
                    + request.getSerialNumber() + ". Error detail: " + restSend.errorMessage(),
                    restSend.getResponseCurrent().getReturnCode());
        }
    }

    ObjectNode buildAccessPayload(InterfaceAccessRequest request) {
        // The controller takes every nvPair as a string
        ObjectNode nvPairs = objectMapper.createObjectNode();
        nvPairs.put("INTF_NAME", request.getInterfaceName());
        nvPairs.put("SERIAL_NUMBER", request.getSerialNumber());
        nvPairs.put("ACCESS_VLAN", request.getAccessVlan() == null ? "" : request.getAccessVlan().toString());
        nvPairs.put("ADMIN_STATE", String.valueOf(request.isAdminState()));
        nvPairs.put("BPDUGUARD_ENABLED", String.valueOf(request.isBpduguardEnabled()));
        nvPairs.put("PORTTYPE_FAST_ENABLED", String.valueOf(request.isPorttypeFastEnabled()));
        nvPairs.put("MTU", request.getMtu());
        nvPairs.put("SPEED", request.getSpeed());
        nvPairs.put("DESC", request.getDesc());
        nvPairs.put("CONF", request.getFreeformConfig());
        nvPairs.put("PTP", String.valueOf(request.isPtp()));
        nvPairs.put("ENABLE_NETFLOW", String.valueOf(request.isEnableNetflow()));
        nvPairs.put("NETFLOW_MONITOR", request.getNetflowMonitor());

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("policy", request.getPolicy());
        payload.put("interfaceType", INTERFACE_TYPE);
        ObjectNode item = payload.putArray("interfaces").addObject();
        item.put("serialNumber", request.getSerialNumber());
        item.put("ifName", request.getInterfaceName());
        item.set("nvPairs", nvPairs);
        return payload;
    }
}
