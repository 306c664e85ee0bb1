package org.ndfcclient.vrf;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Parameters of a new VRF.
 *
 * fabric_name, vrf_name, vrf_id and vrf_vlan_id are required. Optional template
 * parameters left unset take the controller's defaults.
 */
public class VrfCreateRequest {

    @NotBlank
    @JsonProperty("fabric_name")
    private String fabricName;

    @NotBlank
    @JsonProperty("vrf_name")
    private String vrfName;

    @NotNull
    @Positive
    @JsonProperty("vrf_id")
    private Long vrfId;

    @NotNull
    @Min(2)
    @Max(3967)
    @JsonProperty("vrf_vlan_id")
    private Integer vrfVlanId;

    @JsonProperty("vrf_display_name")
    private String displayName;

    @JsonProperty("vrf_template")
    private String vrfTemplate = "Default_VRF_Universal";

    @JsonProperty("vrf_extension_template")
    private String vrfExtensionTemplate = "Default_VRF_Extension_Universal";

    @JsonProperty("vrf_description")
    private String vrfDescription;

    @JsonProperty("vrf_intf_description")
    private String vrfIntfDescription;

    @JsonProperty("vrf_vlan_name")
    private String vrfVlanName;

    @JsonProperty("mtu")
    private Integer mtu;

    @JsonProperty("max_bgp_paths")
    private Integer maxBgpPaths;

    @JsonProperty("max_ibgp_paths")
    private Integer maxIbgpPaths;

    @JsonProperty("tag")
    private Long tag;

    @JsonProperty("loopback_number")
    private Integer loopbackNumber;

    @JsonProperty("bgp_password")
    private String bgpPassword;

    @JsonProperty("bgp_password_key_type")
    private Integer bgpPasswordKeyType;

    @JsonProperty("advertise_host_route")
    private Boolean advertiseHostRoute;

    @JsonProperty("advertise_default_route")
    private Boolean advertiseDefaultRoute;

    @JsonProperty("trm_enabled")
    private Boolean trmEnabled;

    @JsonProperty("multicast_group")
    private String multicastGroup;

    @JsonProperty("rp_address")
    private String rpAddress;

    public String getFabricName() { return fabricName; }
    public void setFabricName(String fabricName) { this.fabricName = fabricName; }
    public String getVrfName() { return vrfName; }
    public void setVrfName(String vrfName) { this.vrfName = vrfName; }
    public Long getVrfId() { return vrfId; }
    public void setVrfId(Long vrfId) { this.vrfId = vrfId; }
    public Integer getVrfVlanId() { return vrfVlanId; }
    public void setVrfVlanId(Integer vrfVlanId) { this.vrfVlanId = vrfVlanId; }
    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }
    public String getVrfTemplate() { return vrfTemplate; }
    public void setVrfTemplate(String vrfTemplate) { this.vrfTemplate = vrfTemplate; }
    public String getVrfExtensionTemplate() { return vrfExtensionTemplate; }
    public void setVrfExtensionTemplate(String vrfExtensionTemplate) { this.vrfExtensionTemplate = vrfExtensionTemplate; }
    public String getVrfDescription() { return vrfDescription; }
    public void setVrfDescription(String vrfDescription) { this.vrfDescription = vrfDescription; }
    public String getVrfIntfDescription() { return vrfIntfDescription; }
    public void setVrfIntfDescription(String vrfIntfDescription) { this.vrfIntfDescription = vrfIntfDescription; }
    public String getVrfVlanName() { return vrfVlanName; }
    public void setVrfVlanName(String vrfVlanName) { this.vrfVlanName = vrfVlanName; }
    public Integer getMtu() { return mtu; }
    public void setMtu(Integer mtu) { this.mtu = mtu; }
    public Integer getMaxBgpPaths() { return maxBgpPaths; }
    public void setMaxBgpPaths(Integer maxBgpPaths) { this.maxBgpPaths = maxBgpPaths; }
    public Integer getMaxIbgpPaths() { return maxIbgpPaths; }
    public void setMaxIbgpPaths(Integer maxIbgpPaths) { this.maxIbgpPaths = maxIbgpPaths; }
    public Long getTag() { return tag; }
    public void setTag(Long tag) { this.tag = tag; }
    public Integer getLoopbackNumber() { return loopbackNumber; }
    public void setLoopbackNumber(Integer loopbackNumber) { this.loopbackNumber = loopbackNumber; }
    public String getBgpPassword() { return bgpPassword; }
    public void setBgpPassword(String bgpPassword) { this.bgpPassword = bgpPassword; }
    public Integer getBgpPasswordKeyType() { return bgpPasswordKeyType; }
    public void setBgpPasswordKeyType(Integer bgpPasswordKeyType) { this.bgpPasswordKeyType = bgpPasswordKeyType; }
    public Boolean getAdvertiseHostRoute() { return advertiseHostRoute; }
    public void setAdvertiseHostRoute(Boolean advertiseHostRoute) { this.advertiseHostRoute = advertiseHostRoute; }
    public Boolean getAdvertiseDefaultRoute() { return advertiseDefaultRoute; }
    public void setAdvertiseDefaultRoute(Boolean advertiseDefaultRoute) { this.advertiseDefaultRoute = advertiseDefaultRoute; }
    public Boolean getTrmEnabled() { return trmEnabled; }
    public void setTrmEnabled(Boolean trmEnabled) { this.trmEnabled = trmEnabled; }
    public String getMulticastGroup() { return multicastGroup; }
    public void setMulticastGroup(String multicastGroup) { this.multicastGroup = multicastGroup; }
    public String getRpAddress() { return rpAddress; }
    public void setRpAddress(String rpAddress) { this.rpAddress = rpAddress; }

    @Override
    public String toString() {
        return "VrfCreateRequest{fabricName='" + fabricName + "', vrfName='" + vrfName
                + "', vrfId=" + vrfId + ", vrfVlanId=" + vrfVlanId + '}';
    }
}
