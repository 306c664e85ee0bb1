package org.ndfcclient.network;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import java.util.ArrayList;
import java.util.List;

/**
 * Attaches a network to switch ports of a switch, or of a vPC pair when
 * peer_switch_name is set. Detach requests read the names, vlan and
 * detach_switch_ports only.
 */
public class NetworkAttachRequest {

    @NotBlank
    @JsonProperty("fabric_name")
    private String fabricName;

    @NotBlank
    @JsonProperty("network_name")
    private String networkName;

    @NotBlank
    @JsonProperty("switch_name")
    private String switchName;

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("peer_switch_name")
    private String peerSwitchName = "";

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("switch_ports")
    private List<String> switchPorts = new ArrayList<>();

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("detach_switch_ports")
    private List<String> detachSwitchPorts = new ArrayList<>();

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("tor_ports")
    private List<String> torPorts = new ArrayList<>();

    @Min(1)
    @Max(4094)
    @JsonProperty("vlan")
    private Integer vlan;

    @Min(1)
    @Max(4094)
    @JsonProperty("dot1q_vlan")
    private Integer dot1qVlan;

    @JsonProperty("untagged")
    private boolean untagged = true;

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("freeform_config")
    private List<String> freeformConfig = new ArrayList<>();

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("extension_values")
    private String extensionValues = "";

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("instance_values")
    private String instanceValues = "";

    public String getFabricName() { return fabricName; }
    public void setFabricName(String fabricName) { this.fabricName = fabricName; }
    public String getNetworkName() { return networkName; }
    public void setNetworkName(String networkName) { this.networkName = networkName; }
    public String getSwitchName() { return switchName; }
    public void setSwitchName(String switchName) { this.switchName = switchName; }
    public String getPeerSwitchName() { return peerSwitchName; }
    public void setPeerSwitchName(String peerSwitchName) { this.peerSwitchName = peerSwitchName; }
    public List<String> getSwitchPorts() { return switchPorts; }
    public void setSwitchPorts(List<String> switchPorts) { this.switchPorts = switchPorts; }
    public List<String> getDetachSwitchPorts() { return detachSwitchPorts; }
    public void setDetachSwitchPorts(List<String> detachSwitchPorts) { this.detachSwitchPorts = detachSwitchPorts; }
    public List<String> getTorPorts() { return torPorts; }
    public void setTorPorts(List<String> torPorts) { this.torPorts = torPorts; }
    public Integer getVlan() { return vlan; }
    public void setVlan(Integer vlan) { this.vlan = vlan; }
    public Integer getDot1qVlan() { return dot1qVlan; }
    public void setDot1qVlan(Integer dot1qVlan) { this.dot1qVlan = dot1qVlan; }
    public boolean isUntagged() { return untagged; }
    public void setUntagged(boolean untagged) { this.untagged = untagged; }
    public List<String> getFreeformConfig() { return freeformConfig; }
    public void setFreeformConfig(List<String> freeformConfig) { this.freeformConfig = freeformConfig; }
    public String getExtensionValues() { return extensionValues; }
    public void setExtensionValues(String extensionValues) { this.extensionValues = extensionValues; }
    public String getInstanceValues() { return instanceValues; }
    public void setInstanceValues(String instanceValues) { this.instanceValues = instanceValues; }

    public boolean hasPeer() {
        return peerSwitchName != null && !peerSwitchName.isBlank();
    }

    @Override
    public String toString() {
        return "NetworkAttachRequest{fabricName='" + fabricName + "', networkName='" + networkName
                + "', switchName='" + switchName + "', peerSwitchName='" + peerSwitchName
                + "', switchPorts=" + switchPorts + ", vlan=" + vlan + '}';
    }
}
