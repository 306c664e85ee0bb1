package org.ndfcclient.vrf;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Names one VRF in a fabric.
 */
public class VrfRequest {

    @NotBlank
    @JsonProperty("fabric_name")
    private String fabricName;

    @NotBlank
    @JsonProperty("vrf_name")
    private String vrfName;

    public String getFabricName() { return fabricName; }

    public void setFabricName(String fabricName) { this.fabricName = fabricName; }

    public String getVrfName() { return vrfName; }

    public void setVrfName(String vrfName) { this.vrfName = vrfName; }

    @Override
    public String toString() {
        return "VrfRequest{fabricName='" + fabricName + "', vrfName='" + vrfName + "'}";
    }
}
