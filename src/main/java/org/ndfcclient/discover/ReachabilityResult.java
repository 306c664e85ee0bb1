package org.ndfcclient.discover;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * First entry of a test-reachability reply.
 */
public class ReachabilityResult {

    private final boolean auth;
    private final boolean known;
    private final boolean reachable;
    private final boolean selectable;
    private final boolean valid;
    private final String sysName;
    private final String serialNumber;
    private final String deviceIndex;
    private final String platform;
    private final String version;
    private final String statusReason;
    private final JsonNode raw;

    public ReachabilityResult(JsonNode item) {
        this.auth = item.path("auth").asBoolean(false);
        this.known = item.path("known").asBoolean(false);
        this.reachable = item.path("reachable").asBoolean(false);
        this.selectable = item.path("selectable").asBoolean(false);
        this.valid = item.path("valid").asBoolean(false);
        this.sysName = item.path("sysName").asText("");
        this.serialNumber = item.path("serialNumber").asText("");
        this.deviceIndex = item.path("deviceIndex").asText("");
        this.platform = item.path("platform").asText("");
        this.version = item.path("version").asText("");
        this.statusReason = item.path("statusReason").asText("");
        this.raw = item;
    }

    public boolean isAuth() { return auth; }
    public boolean isKnown() { return known; }
    public boolean isReachable() { return reachable; }
    public boolean isSelectable() { return selectable; }
    public boolean isValid() { return valid; }
    public String getSysName() { return sysName; }
    public String getSerialNumber() { return serialNumber; }
    public String getDeviceIndex() { return deviceIndex; }
    public String getPlatform() { return platform; }
    public String getVersion() { return version; }
    public String getStatusReason() { return statusReason; }

    /**
     * The entry as returned by the controller. Discovery posts it back unchanged.
     */
    public JsonNode getRaw() { return raw; }

    @Override
    public String toString() {
        return "ReachabilityResult{sysName='" + sysName + "', serialNumber='" + serialNumber
                + "', reachable=" + reachable + ", auth=" + auth + ", known=" + known
                + ", statusReason='" + statusReason + "'}";
    }
}
