package org.ndfcclient.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;

import java.util.function.Consumer;

/**
 * Fills controller settings from the ND_* environment variables.
 *
 * Scripts driving the controller conventionally export ND_IP4, ND_IP6, ND_USERNAME,
 * ND_PASSWORD and ND_DOMAIN, plus NXOS_USERNAME and NXOS_PASSWORD for switch credentials.
 * This processor runs after {@link NdfcConfig} is bound and copies each of these
 * variables into the configuration, but only where the bound value is missing, blank,
 * or an unresolved placeholder.
 *
 * Configuration priority (highest to lowest):
 * 1. Command line arguments (--ndfc.ip4=...)
 * 2. NDFC_* environment variables and application.properties
 * 3. ND_* and NXOS_* environment variables
 * 4. Default values
 */
@Component
public class NdfcConfigProcessor {

    private static final Logger logger = LoggerFactory.getLogger(NdfcConfigProcessor.class);

    /** The controller configuration to be updated */
    @Autowired
    private NdfcConfig ndfcConfig;

    /** Spring environment for accessing environment variables */
    @Autowired
    private Environment environment;

    /**
     * Applies the ND_* environment fallback to the bound configuration.
     */
    @PostConstruct
    public void processEnvironment() {
        logger.debug("Processing controller configuration...");

        applyIfIncomplete(ndfcConfig.getIp4(), "ND_IP4", ndfcConfig::setIp4, false);
        applyIfIncomplete(ndfcConfig.getIp6(), "ND_IP6", ndfcConfig::setIp6, false);
        applyIfIncomplete(ndfcConfig.getUsername(), "ND_USERNAME", ndfcConfig::setUsername, false);
        applyIfIncomplete(ndfcConfig.getPassword(), "ND_PASSWORD", ndfcConfig::setPassword, true);
        applyIfIncomplete(ndfcConfig.getDomain(), "ND_DOMAIN", ndfcConfig::setDomain, false);
        applyIfIncomplete(ndfcConfig.getNxosUsername(), "NXOS_USERNAME", ndfcConfig::setNxosUsername, false);
        applyIfIncomplete(ndfcConfig.getNxosPassword(), "NXOS_PASSWORD", ndfcConfig::setNxosPassword, true);

        if (isBlank(ndfcConfig.getUsername())) {
            ndfcConfig.setUsername("admin");
        }
        if (isBlank(ndfcConfig.getDomain())) {
            ndfcConfig.setDomain("local");
        }

        if (ndfcConfig.controllerHost() == null) {
            logger.debug("No controller address configured; set ndfc.ip4, ndfc.ip6, ND_IP4 or ND_IP6");
        }
        logger.debug("Final config: {}", ndfcConfig);
    }

    /**
     * Copies an environment variable into the configuration when the current value is
     * incomplete. A value is incomplete when it is null, blank, or contains "${".
     *
     * @param current The currently bound value
     * @param variable The environment variable name
     * @param setter Setter receiving the environment value
     * @param secret Whether the value must be masked in logs
     */
    private void applyIfIncomplete(String current, String variable, Consumer<String> setter, boolean secret) {
        if (!isIncomplete(current)) {
            return;
        }
        String value = environment.getProperty(variable);
        if (isBlank(value)) {
            return;
        }
        setter.accept(value);
        logger.debug("Set {} from environment: {}", variable, secret ? "***" : value);
    }

    private static boolean isIncomplete(String value) {
        return isBlank(value) || value.contains("${");
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
