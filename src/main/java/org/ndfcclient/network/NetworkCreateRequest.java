package org.ndfcclient.network;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Parameters of a new network.
 *
 * fabric_name, network_id, vrf_name and vlan_id are required. network_name defaults to
 * MyNetwork_&lt;network_id&gt; and display_name to the network name.
 */
public class NetworkCreateRequest {

    @NotBlank
    @JsonProperty("fabric_name")
    private String fabricName;

    @JsonProperty("network_name")
    private String networkName;

    @NotNull
    @Positive
    @JsonProperty("network_id")
    private Long networkId;

    @NotBlank
    @JsonProperty("vrf_name")
    private String vrfName;

    @NotNull
    @Min(1)
    @Max(4094)
    @JsonProperty("vlan_id")
    private Integer vlanId;

    @JsonProperty("display_name")
    private String displayName;

    @JsonProperty("network_template")
    private String networkTemplate = "Default_Network_Universal";

    @JsonProperty("network_extension_template")
    private String networkExtensionTemplate = "Default_Network_Extension_Universal";

    @JsonProperty("source")
    private String source;

    @JsonProperty("segment_id")
    private Long segmentId;

    @JsonProperty("gateway_ip_address")
    private String gatewayIpAddress;

    @JsonProperty("gateway_ipv6_address")
    private String gatewayIpv6Address;

    @JsonProperty("intf_description")
    private String intfDescription;

    @JsonProperty("is_layer2_only")
    private Boolean layer2Only;

    @JsonProperty("loopback_id")
    private Integer loopbackId;

    @JsonProperty("mcast_group")
    private String mcastGroup;

    @JsonProperty("mtu")
    private Integer mtu;

    @JsonProperty("suppress_arp")
    private Boolean suppressArp;

    @JsonProperty("tag")
    private Long tag;

    @JsonProperty("trm_enabled")
    private Boolean trmEnabled;

    @JsonProperty("vlan_name")
    private String vlanName;

    @JsonProperty("dhcp_server_addr_1")
    private String dhcpServerAddr1;

    @JsonProperty("vrf_dhcp")
    private String vrfDhcp;

    public String getFabricName() { return fabricName; }
    public void setFabricName(String fabricName) { this.fabricName = fabricName; }
    public String getNetworkName() { return networkName; }
    public void setNetworkName(String networkName) { this.networkName = networkName; }
    public Long getNetworkId() { return networkId; }
    public void setNetworkId(Long networkId) { this.networkId = networkId; }
    public String getVrfName() { return vrfName; }
    public void setVrfName(String vrfName) { this.vrfName = vrfName; }
    public Integer getVlanId() { return vlanId; }
    public void setVlanId(Integer vlanId) { this.vlanId = vlanId; }
    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }
    public String getNetworkTemplate() { return networkTemplate; }
    public void setNetworkTemplate(String networkTemplate) { this.networkTemplate = networkTemplate; }
    public String getNetworkExtensionTemplate() { return networkExtensionTemplate; }
    public void setNetworkExtensionTemplate(String networkExtensionTemplate) { this.networkExtensionTemplate = networkExtensionTemplate; }
    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }
    public Long getSegmentId() { return segmentId; }
    public void setSegmentId(Long segmentId) { this.segmentId = segmentId; }
    public String getGatewayIpAddress() { return gatewayIpAddress; }
    public void setGatewayIpAddress(String gatewayIpAddress) { this.gatewayIpAddress = gatewayIpAddress; }
    public String getGatewayIpv6Address() { return gatewayIpv6Address; }
    public void setGatewayIpv6Address(String gatewayIpv6Address) { this.gatewayIpv6Address = gatewayIpv6Address; }
    public String getIntfDescription() { return intfDescription; }
    public void setIntfDescription(String intfDescription) { this.intfDescription = intfDescription; }
    public Boolean getLayer2Only() { return layer2Only; }
    public void setLayer2Only(Boolean layer2Only) { this.layer2Only = layer2Only; }
    public Integer getLoopbackId() { return loopbackId; }
    public void setLoopbackId(Integer loopbackId) { this.loopbackId = loopbackId; }
    public String getMcastGroup() { return mcastGroup; }
    public void setMcastGroup(String mcastGroup) { this.mcastGroup = mcastGroup; }
    public Integer getMtu() { return mtu; }
    public void setMtu(Integer mtu) { this.mtu = mtu; }
    public Boolean getSuppressArp() { return suppressArp; }
    public void setSuppressArp(Boolean suppressArp) { this.suppressArp = suppressArp; }
    public Long getTag() { return tag; }
    public void setTag(Long tag) { this.tag = tag; }
    public Boolean getTrmEnabled() { return trmEnabled; }
    public void setTrmEnabled(Boolean trmEnabled) { this.trmEnabled = trmEnabled; }
    public String getVlanName() { return vlanName; }
    public void setVlanName(String vlanName) { this.vlanName = vlanName; }
    public String getDhcpServerAddr1() { return dhcpServerAddr1; }
    public void setDhcpServerAddr1(String dhcpServerAddr1) { this.dhcpServerAddr1 = dhcpServerAddr1; }
    public String getVrfDhcp() { return vrfDhcp; }
    public void setVrfDhcp(String vrfDhcp) { this.vrfDhcp = vrfDhcp; }

    @Override
    public String toString() {
        return "NetworkCreateRequest{fabricName='" + fabricName + "', networkName='" + networkName
                + "', networkId=" + networkId + ", vrfName='" + vrfName + "', vlanId=" + vlanId + '}';
    }
}
