package org.ndfcclient.vrf;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.ArrayList;
import java.util.List;

/**
 * Names the VRFs to delete from one fabric.
 */
public class VrfDeleteRequest {

    @NotBlank
    @JsonProperty("fabric_name")
    private String fabricName;

    @NotEmpty
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("vrf_names")
    private List<@NotBlank String> vrfNames = new ArrayList<>();

    public String getFabricName() { return fabricName; }

    public void setFabricName(String fabricName) { this.fabricName = fabricName; }

    public List<String> getVrfNames() { return vrfNames; }

    public void setVrfNames(List<String> vrfNames) { this.vrfNames = vrfNames; }

    @Override
    public String toString() {
        return "VrfDeleteRequest{fabricName='" + fabricName + "', vrfNames=" + vrfNames + '}';
    }
}
