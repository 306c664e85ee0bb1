package org.ndfcclient.policy;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Selects a switch, and for deletion a policy on it by description.
 */
public class SwitchPolicyRequest {

    @NotBlank
    @JsonProperty("fabric_name")
    private String fabricName;

    @NotBlank
    @JsonProperty("switch_name")
    private String switchName;

    /** Required by policy-delete; ignored by policy-info-switch */
    @JsonProperty("description")
    private String description;

    public String getFabricName() { return fabricName; }

    public void setFabricName(String fabricName) { this.fabricName = fabricName; }

    public String getSwitchName() { return switchName; }

    public void setSwitchName(String switchName) { this.switchName = switchName; }

    public String getDescription() { return description; }

    public void setDescription(String description) { this.description = description; }

    @Override
    public String toString() {
        return "SwitchPolicyRequest{fabricName='" + fabricName + "', switchName='" + switchName
                + "', description='" + description + "'}";
    }
}
