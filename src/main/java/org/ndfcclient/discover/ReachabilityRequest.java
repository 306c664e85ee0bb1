package org.ndfcclient.discover;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * A seed switch to test for reachability or to discover into a fabric.
 *
 * When username or password are not given, the NX-OS credentials of the
 * "ndfc.nxos-*" properties are used.
 */
public class ReachabilityRequest {

    @NotBlank
    @JsonProperty("fabric_name")
    private String fabricName;

    @NotBlank
    @JsonProperty("seed_ip")
    private String seedIp;

    @JsonProperty("username")
    private String username;

    @JsonProperty("password")
    private String password;

    @Min(1)
    @JsonProperty("cdp_second_timeout")
    private int cdpSecondTimeout = 5;

    @Min(0)
    @JsonProperty("max_hops")
    private int maxHops = 0;

    @JsonProperty("preserve_config")
    private boolean preserveConfig = true;

    /** discover only: poll the inventory until the switch is manageable */
    @JsonProperty("wait_until_up")
    private boolean waitUntilUp = false;

    public String getFabricName() { return fabricName; }
    public void setFabricName(String fabricName) { this.fabricName = fabricName; }
    public String getSeedIp() { return seedIp; }
    public void setSeedIp(String seedIp) { this.seedIp = seedIp; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public int getCdpSecondTimeout() { return cdpSecondTimeout; }
    public void setCdpSecondTimeout(int cdpSecondTimeout) { this.cdpSecondTimeout = cdpSecondTimeout; }
    public int getMaxHops() { return maxHops; }
    public void setMaxHops(int maxHops) { this.maxHops = maxHops; }
    public boolean isPreserveConfig() { return preserveConfig; }
    public void setPreserveConfig(boolean preserveConfig) { this.preserveConfig = preserveConfig; }
    public boolean isWaitUntilUp() { return waitUntilUp; }
    public void setWaitUntilUp(boolean waitUntilUp) { this.waitUntilUp = waitUntilUp; }

    @Override
    public String toString() {
        return "ReachabilityRequest{fabricName='" + fabricName + "', seedIp='" + seedIp
                + "', username='" + username + "', password='" + (password != null ? "***" : "null")
                + "', maxHops=" + maxHops + ", preserveConfig=" + preserveConfig + '}';
    }
}
