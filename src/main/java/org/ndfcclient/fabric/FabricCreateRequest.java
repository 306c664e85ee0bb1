package org.ndfcclient.fabric;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parameters of a new fabric.
 *
 * FABRIC_NAME and FABRIC_TYPE are required. BGP_AS is required for VXLAN_EVPN fabrics.
 * Any other upper-case key (REPLICATION_MODE, UNDERLAY_IS_V6, ...) is passed to the
 * controller unchanged as a fabric template parameter.
 */
public class FabricCreateRequest {

    @NotBlank
    @JsonProperty("FABRIC_NAME")
    private String fabricName;

    @NotBlank
    @JsonProperty("FABRIC_TYPE")
    private String fabricType;

    @JsonProperty("BGP_AS")
    private String bgpAs;

    private final Map<String, Object> parameters = new LinkedHashMap<>();

    public String getFabricName() { return fabricName; }

    public void setFabricName(String fabricName) { this.fabricName = fabricName; }

    public String getFabricType() { return fabricType; }

    public void setFabricType(String fabricType) { this.fabricType = fabricType; }

    public String getBgpAs() { return bgpAs; }

    public void setBgpAs(String bgpAs) { this.bgpAs = bgpAs; }

    @JsonAnyGetter
    public Map<String, Object> getParameters() { return parameters; }

    @JsonAnySetter
    public void setParameter(String name, Object value) {
        if (!name.equals(name.toUpperCase())) {
            throw new IllegalArgumentException("Fabric parameter names must be upper case: " + name);
        }
        parameters.put(name, value);
    }

    @Override
    public String toString() {
        return "FabricCreateRequest{fabricName='" + fabricName + "', fabricType='" + fabricType
                + "', bgpAs='" + bgpAs + "', parameters=" + parameters.keySet() + '}';
    }
}
