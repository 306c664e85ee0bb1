package org.ndfcclient.fabric;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.ndfcclient.rest.Endpoints;
import org.ndfcclient.rest.NdfcException;
import org.ndfcclient.rest.RestSend;
import org.ndfcclient.rest.Results;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;

/**
 * Recalculates (config-save) and deploys (config-deploy) a fabric's configuration,
 * separately or in one recalculateAndDeploy request.
 */
@Service
public class ConfigDeployService {

    private static final Logger logger = LoggerFactory.getLogger(ConfigDeployService.class);

    /** Deployment can take minutes on large fabrics */
    static final int DEPLOY_TIMEOUT = 300;

    private final RestSend restSend;
    private final FabricService fabricService;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ConfigDeployService(RestSend restSend, FabricService fabricService) {
        this.restSend = restSend;
        this.fabricService = fabricService;
    }

    /**
     * Recalculates the fabric's intended configuration.
     *
     * @return The status reported by the controller
     */
    public String save(String fabricName, Results results) {
        fabricService.verifyFabricExists(fabricName);
        logger.info("Saving configuration of fabric {}", fabricName);
        restSend.commit(HttpMethod.POST, Endpoints.configSave(fabricName), null);
        results.register("config_save", "merged", restSend);
        return status("config-save", fabricName, restSend);
    }

    /**
     * Deploys the fabric's pending configuration to its switches.
     *
     * @return The status reported by the controller
     */
    public String deploy(String fabricName, Results results) {
        fabricService.verifyFabricExists(fabricName);
        logger.info("Deploying configuration of fabric {}", fabricName);
        RestSend send = restSend.withTimeout(DEPLOY_TIMEOUT);
        send.commit(HttpMethod.POST, Endpoints.configDeploy(fabricName), null);
        results.register("config_deploy", "merged", send);
        return status("config-deploy", fabricName, send);
    }

    /**
     * Recalculates the fabric's intended configuration and deploys it in one request.
     *
     * @return The controller's reply DATA
     * @throws NdfcException if the fabric does not exist or the controller rejects the request
     */
    public JsonNode recalculateAndDeploy(String fabricName, Results results) {
        fabricService.verifyFabricExists(fabricName);
        logger.info("Recalculating and deploying fabric {}", fabricName);
        RestSend send = restSend.withTimeout(DEPLOY_TIMEOUT);
        send.commit(HttpMethod.POST, Endpoints.recalculateAndDeploy(fabricName), objectMapper.createObjectNode());
        results.register("recalculate_and_deploy", "merged", send);
        if (!send.getResultCurrent().isSuccess()) {
            throw new NdfcException("Unable to recalculate and deploy fabric " + fabricName + ". Error detail: "
                    + send.errorMessage(), send.getResponseCurrent().getReturnCode());
        }
        return send.getResponseCurrent().getData();
    }

    private String status(String operation, String fabricName, RestSend send) {
        if (!send.getResultCurrent().isSuccess()) {
            throw new NdfcException(operation + " failed for fabric " + fabricName + ". Error detail: "
                    + send.errorMessage(), send.getResponseCurrent().getReturnCode());
        }
        JsonNode data = send.getResponseCurrent().getData();
        if (data.isMissingNode() || data.isNull() || data.has("INVALID_JSON")) {
            throw new NdfcException("Unable to parse " + operation + " response for fabric " + fabricName
                    + ". DATA is missing.");
        }
        String status = data.path("status").asText("");
        logger.info("{} fabric {}: {}", operation, fabricName, status);
        return status;
    }
}
