package org.ndfcclient.resource;

/**
 * Resource manager pools a usage query can be narrowed to. ALL keeps every entry.
 */
public enum ResourcePool {
    ALL,
    DISCOVERED_VLAN,
    SERVICE_NETWORK_VLAN,
    TOP_DOWN_VRF_VLAN,
    TOP_DOWN_NETWORK_VLAN,
    VPC_PEER_LINK_VLAN
}
