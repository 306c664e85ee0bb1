package org.ndfcclient.vrf;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Attaches a VRF to a switch, or to a vPC pair when peer_switch_name is set.
 * Also used to detach, in which case only the names and vlan are read.
 */
public class VrfAttachRequest {

    @NotBlank
    @JsonProperty("fabric_name")
    private String fabricName;

    @NotBlank
    @JsonProperty("vrf_name")
    private String vrfName;

    @NotBlank
    @JsonProperty("switch_name")
    private String switchName;

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("peer_switch_name")
    private String peerSwitchName = "";

    @Min(1)
    @Max(4094)
    @JsonProperty("vlan")
    private Integer vlan;

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("freeform_config")
    private List<String> freeformConfig = new ArrayList<>();

    /** Per-switch loopback and route-target values, sent as a JSON string */
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("instance_values")
    private Map<String, Object> instanceValues = new LinkedHashMap<>();

    /** VRF-Lite extension entries; each needs IF_NAME and may set AUTO_VRF_LITE_FLAG */
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("vrf_lite")
    private List<Map<String, Object>> vrfLite = new ArrayList<>();

    public String getFabricName() { return fabricName; }
    public void setFabricName(String fabricName) { this.fabricName = fabricName; }
    public String getVrfName() { return vrfName; }
    public void setVrfName(String vrfName) { this.vrfName = vrfName; }
    public String getSwitchName() { return switchName; }
    public void setSwitchName(String switchName) { this.switchName = switchName; }
    public String getPeerSwitchName() { return peerSwitchName; }
    public void setPeerSwitchName(String peerSwitchName) { this.peerSwitchName = peerSwitchName; }
    public Integer getVlan() { return vlan; }
    public void setVlan(Integer vlan) { this.vlan = vlan; }
    public List<String> getFreeformConfig() { return freeformConfig; }
    public void setFreeformConfig(List<String> freeformConfig) { this.freeformConfig = freeformConfig; }
    public Map<String, Object> getInstanceValues() { return instanceValues; }
    public void setInstanceValues(Map<String, Object> instanceValues) { this.instanceValues = instanceValues; }
    public List<Map<String, Object>> getVrfLite() { return vrfLite; }
    public void setVrfLite(List<Map<String, Object>> vrfLite) { this.vrfLite = vrfLite; }

    public boolean hasPeer() {
        return peerSwitchName != null && !peerSwitchName.isBlank();
    }

    @Override
    public String toString() {
        return "VrfAttachRequest{fabricName='" + fabricName + "', vrfName='" + vrfName
                + "', switchName='" + switchName + "', peerSwitchName='" + peerSwitchName
                + "', vlan=" + vlan + '}';
    }
}
