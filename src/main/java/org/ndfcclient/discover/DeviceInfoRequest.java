package org.ndfcclient.discover;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Selects a switch by fabric and IPv4 address.
 */
public class DeviceInfoRequest {

    @NotBlank
    @JsonProperty("fabric_name")
    private String fabricName;

    @NotBlank
    @JsonProperty("switch_ip4")
    private String switchIp4;

    public String getFabricName() { return fabricName; }

    public void setFabricName(String fabricName) { this.fabricName = fabricName; }

    public String getSwitchIp4() { return switchIp4; }

    public void setSwitchIp4(String switchIp4) { this.switchIp4 = switchIp4; }

    @Override
    public String toString() {
        return "DeviceInfoRequest{fabricName='" + fabricName + "', switchIp4='" + switchIp4 + "'}";
    }
}
