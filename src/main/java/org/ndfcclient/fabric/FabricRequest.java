package org.ndfcclient.fabric;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Names a single fabric. Used by the fabric info, inventory, delete, config-save and
 * config-deploy commands.
 */
public class FabricRequest {

    @NotBlank
    @Size(max = 64)
    @JsonProperty("fabric_name")
    private String fabricName;

    public FabricRequest() {
    }

    public FabricRequest(String fabricName) {
        this.fabricName = fabricName;
    }

    public String getFabricName() { return fabricName; }

    public void setFabricName(String fabricName) { this.fabricName = fabricName; }

    @Override
    public String toString() {
        return "FabricRequest{fabricName='" + fabricName + "'}";
    }
}
