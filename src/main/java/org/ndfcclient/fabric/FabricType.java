package org.ndfcclient.fabric;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Fabric types and the controller template each one is created from.
 */
public enum FabricType {
    VXLAN_EVPN("Easy_Fabric"),
    VXLAN_EVPN_MSD("MSD_Fabric"),
    LAN_CLASSIC("LAN_Classic"),
    IPFM("Easy_Fabric_IPFM"),
    ISN("External_Fabric");

    private final String templateName;

    FabricType(String templateName) {
        this.templateName = templateName;
    }

    public String getTemplateName() {
        return templateName;
    }

    /**
     * Parses a FABRIC_TYPE value.
     *
     * @throws IllegalArgumentException if the value is not a known fabric type
     */
    public static FabricType fromValue(String value) {
        for (FabricType type : values()) {
            if (type.name().equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Invalid FABRIC_TYPE: " + value + ". Expected one of "
                + Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(", ")));
    }
}
