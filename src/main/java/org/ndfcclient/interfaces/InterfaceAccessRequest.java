package org.ndfcclient.interfaces;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * An access-mode Ethernet interface on one switch. The optional settings default to
 * the values of the int_access_host policy.
 */
public class InterfaceAccessRequest {

    @NotBlank
    @JsonProperty("serial_number")
    private String serialNumber;

    @NotBlank
    @JsonProperty("interface_name")
    private String interfaceName;

    @NotBlank
    @JsonProperty("policy")
    private String policy = "int_access_host";

    @Min(1)
    @Max(4094)
    @JsonProperty("access_vlan")
    private Integer accessVlan;

    @JsonProperty("admin_state")
    private boolean adminState = true;

    @JsonProperty("bpduguard_enabled")
    private boolean bpduguardEnabled = true;

    @JsonProperty("porttype_fast_enabled")
    private boolean porttypeFastEnabled = true;

    @JsonProperty("enable_netflow")
    private boolean enableNetflow;

    @JsonProperty("ptp")
    private boolean ptp;

    /** jumbo, default, or a number of bytes */
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("mtu")
    private String mtu = "jumbo";

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("speed")
    private String speed = "Auto";

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("desc")
    private String desc = "";

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("freeform_config")
    private String freeformConfig = "";

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("netflow_monitor")
    private String netflowMonitor = "";

    public String getSerialNumber() { return serialNumber; }
    public void setSerialNumber(String serialNumber) { this.serialNumber = serialNumber; }
    public String getInterfaceName() { return interfaceName; }
    public void setInterfaceName(String interfaceName) { this.interfaceName = interfaceName; }
    public String getPolicy() { return policy; }
    public void setPolicy(String policy) { this.policy = policy; }
    public Integer getAccessVlan() { return accessVlan; }
    public void setAccessVlan(Integer accessVlan) { this.accessVlan = accessVlan; }
    public boolean isAdminState() { return adminState; }
    public void setAdminState(boolean adminState) { this.adminState = adminState; }
    public boolean isBpduguardEnabled() { return bpduguardEnabled; }
    public void setBpduguardEnabled(boolean bpduguardEnabled) { this.bpduguardEnabled = bpduguardEnabled; }
    public boolean isPorttypeFastEnabled() { return porttypeFastEnabled; }
    public void setPorttypeFastEnabled(boolean porttypeFastEnabled) { this.porttypeFastEnabled = porttypeFastEnabled; }
    public boolean isEnableNetflow() { return enableNetflow; }
    public void setEnableNetflow(boolean enableNetflow) { this.enableNetflow = enableNetflow; }
    public boolean isPtp() { return ptp; }
    public void setPtp(boolean ptp) { this.ptp = ptp; }
    public String getMtu() { return mtu; }
    public void setMtu(String mtu) { this.mtu = mtu; }
    public String getSpeed() { return speed; }
    public void setSpeed(String speed) { this.speed = speed; }
    public String getDesc() { return desc; }
    public void setDesc(String desc) { this.desc = desc; }
    public String getFreeformConfig() { return freeformConfig; }
    public void setFreeformConfig(String freeformConfig) { this.freeformConfig = freeformConfig; }
    public String getNetflowMonitor() { return netflowMonitor; }
    public void setNetflowMonitor(String netflowMonitor) { this.netflowMonitor = netflowMonitor; }

    @Override
    public String toString() {
        return "InterfaceAccessRequest{serialNumber='" + serialNumber + "', interfaceName='" + interfaceName
                + "', policy='" + policy + "', accessVlan=" + accessVlan + '}';
    }
}
