/**
 * VRFs: creation, bulk deletion, and attachment to switches and vPC pairs.
 */
package org.ndfcclient.vrf;
