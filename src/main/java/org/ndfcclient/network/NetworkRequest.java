package org.ndfcclient.network;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Names a network in a fabric. Used by the network delete and info commands.
 */
public class NetworkRequest {

    @NotBlank
    @JsonProperty("fabric_name")
    private String fabricName;

    @NotBlank
    @JsonProperty("network_name")
    private String networkName;

    public String getFabricName() { return fabricName; }

    public void setFabricName(String fabricName) { this.fabricName = fabricName; }

    public String getNetworkName() { return networkName; }

    public void setNetworkName(String networkName) { this.networkName = networkName; }

    @Override
    public String toString() {
        return "NetworkRequest{fabricName='" + fabricName + "', networkName='" + networkName + "'}";
    }
}
