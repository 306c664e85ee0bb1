package org.ndfcclient.resource;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Selects a switch whose resource usage is shown, optionally limited to one pool.
 */
public class SwitchResourceUsageRequest {

    @NotBlank
    @JsonProperty("fabric_name")
    private String fabricName;

    @NotBlank
    @JsonProperty("switch_name")
    private String switchName;

    @NotNull
    @JsonProperty("pool_name")
    private ResourcePool poolName = ResourcePool.ALL;

    public String getFabricName() { return fabricName; }

    public void setFabricName(String fabricName) { this.fabricName = fabricName; }

    public String getSwitchName() { return switchName; }

    public void setSwitchName(String switchName) { this.switchName = switchName; }

    public ResourcePool getPoolName() { return poolName; }

    public void setPoolName(ResourcePool poolName) { this.poolName = poolName; }

    @Override
    public String toString() {
        return "SwitchResourceUsageRequest{fabricName='" + fabricName + "', switchName='" + switchName
                + "', poolName=" + poolName + '}';
    }
}
