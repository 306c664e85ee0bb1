package org.ndfcclient.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Connection settings for the Nexus Dashboard Fabric Controller.
 *
 * Properties are bound with the "ndfc" prefix, so "ndfc.ip4", "ndfc.username" and so on
 * can come from application.properties, from NDFC_* environment variables or from
 * "--ndfc.*" command line arguments. Values still missing after binding are filled from
 * the ND_* environment variables by {@link NdfcConfigProcessor}.
 */
@Component
@ConfigurationProperties(prefix = "ndfc")
public class NdfcConfig {

    /** Controller IPv4 address */
    private String ip4;

    /** Controller IPv6 address, used when ip4 is not set */
    private String ip6;

    /** Username for controller authentication, admin unless set here or via ND_USERNAME */
    private String username;

    /** Password for controller authentication */
    private String password;

    /** Login domain, local unless set here or via ND_DOMAIN */
    private String domain;

    /** Whether to skip TLS certificate validation (default: true) */
    private boolean insecure = true;

    /** Username used by the controller to log into switches during discovery */
    private String nxosUsername;

    /** Password used by the controller to log into switches during discovery */
    private String nxosPassword;

    /** Timeout, in seconds, of a single HTTP request */
    private int requestTimeout = 10;

    private final Rest rest = new Rest();

    private final Discover discover = new Discover();

    /**
     * Gets the controller IPv4 address.
     * @return The IPv4 address, or null
     */
    public String getIp4() { return ip4; }

    /**
     * Sets the controller IPv4 address.
     * @param ip4 The IPv4 address
     */
    public void setIp4(String ip4) { this.ip4 = ip4; }

    /**
     * Gets the controller IPv6 address.
     * @return The IPv6 address, or null
     */
    public String getIp6() { return ip6; }

    /**
     * Sets the controller IPv6 address.
     * @param ip6 The IPv6 address
     */
    public void setIp6(String ip6) { this.ip6 = ip6; }

    /**
     * Gets the username for controller authentication.
     * @return The username
     */
    public String getUsername() { return username; }

    /**
     * Sets the username for controller authentication.
     * @param username The username
     */
    public void setUsername(String username) { this.username = username; }

    /**
     * Gets the password for controller authentication.
     * @return The password
     */
    public String getPassword() { return password; }

    /**
     * Sets the password for controller authentication.
     * @param password The password
     */
    public void setPassword(String password) { this.password = password; }

    /**
     * Gets the login domain.
     * @return The login domain (default: local)
     */
    public String getDomain() { return domain; }

    /**
     * Sets the login domain.
     * @param domain The login domain
     */
    public void setDomain(String domain) { this.domain = domain; }

    /**
     * Checks if TLS certificate validation should be skipped.
     * @return true if certificate validation is disabled
     */
    public boolean isInsecure() { return insecure; }

    /**
     * Sets whether TLS certificate validation should be skipped.
     * @param insecure true to disable certificate validation
     */
    public void setInsecure(boolean insecure) { this.insecure = insecure; }

    public String getNxosUsername() { return nxosUsername; }

    public void setNxosUsername(String nxosUsername) { this.nxosUsername = nxosUsername; }

    public String getNxosPassword() { return nxosPassword; }

    public void setNxosPassword(String nxosPassword) { this.nxosPassword = nxosPassword; }

    /**
     * Gets the timeout of a single HTTP request.
     * @return The timeout in seconds (default: 10)
     */
    public int getRequestTimeout() { return requestTimeout; }

    /**
     * Sets the timeout of a single HTTP request.
     * @param requestTimeout The timeout in seconds
     */
    public void setRequestTimeout(int requestTimeout) { this.requestTimeout = requestTimeout; }

    public Rest getRest() { return rest; }

    public Discover getDiscover() { return discover; }

    /**
     * Returns the address the controller is reached at, preferring IPv4.
     * IPv6 addresses are bracketed so they can be used in a URL.
     *
     * @return The URL host part, or null if neither ip4 nor ip6 is set
     */
    public String controllerHost() {
        if (ip4 != null && !ip4.isBlank()) {
            return ip4;
        }
        if (ip6 != null && !ip6.isBlank()) {
            return ip6.startsWith("[") ? ip6 : "[" + ip6 + "]";
        }
        return null;
    }

    /**
     * Returns a string representation of the configuration.
     *
     * Passwords are hidden so they never appear in logs.
     *
     * @return String representation with passwords hidden
     */
    @Override
    public String toString() {
        return "NdfcConfig{" +
                "ip4='" + ip4 + '\'' +
                ", ip6='" + ip6 + '\'' +
                ", username='" + username + '\'' +
                ", password='[HIDDEN]'" +
                ", domain='" + domain + '\'' +
                ", insecure=" + insecure +
                ", nxosUsername='" + nxosUsername + '\'' +
                ", nxosPassword='[HIDDEN]'" +
                ", requestTimeout=" + requestTimeout +
                ", rest=" + rest +
                ", discover=" + discover +
                '}';
    }

    /**
     * Retry settings of the RestSend layer.
     */
    public static class Rest {

        /** Seconds RestSend keeps resending an unsuccessful request */
        private int timeout = 300;

        /** Seconds between two sends of the same request */
        private int sendInterval = 5;

        /** When true, write requests are simulated instead of sent */
        private boolean checkMode = false;

        public int getTimeout() { return timeout; }

        public void setTimeout(int timeout) { this.timeout = timeout; }

        public int getSendInterval() { return sendInterval; }

        public void setSendInterval(int sendInterval) { this.sendInterval = sendInterval; }

        public boolean isCheckMode() { return checkMode; }

        public void setCheckMode(boolean checkMode) { this.checkMode = checkMode; }

        @Override
        public String toString() {
            return "Rest{timeout=" + timeout + ", sendInterval=" + sendInterval + ", checkMode=" + checkMode + '}';
        }
    }

    /**
     * Polling settings used while waiting for switches during discovery.
     */
    public static class Discover {

        /** Number of reachability or inventory polls */
        private int retries = 4;

        /** Seconds between two polls */
        private int retryInterval = 10;

        public int getRetries() { return retries; }

        public void setRetries(int retries) { this.retries = retries; }

        public int getRetryInterval() { return retryInterval; }

        public void setRetryInterval(int retryInterval) { this.retryInterval = retryInterval; }

        @Override
        public String toString() {
            return "Discover{retries=" + retries + ", retryInterval=" + retryInterval + '}';
        }
    }
}
