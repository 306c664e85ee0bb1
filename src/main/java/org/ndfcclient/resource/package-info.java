/**
 * Resource manager queries: VLAN and ID pools in use on a switch.
 */
package org.ndfcclient.resource;
