package org.ndfcclient.validation;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shape checks for controller parameters.
 *
 * Each verify method returns normally when the value is acceptable and throws
 * {@link IllegalArgumentException} otherwise. Range failures read
 * "&lt;name&gt; &lt;value&gt; not within range &lt;min&gt;-&lt;max&gt;".
 */
public final class Validations {

    private static final Pattern FABRIC_NAME = Pattern.compile("[a-zA-Z0-9_-]+");
    private static final Pattern ALL_DIGITS = Pattern.compile("\\d+");
    private static final Pattern ASDOT = Pattern.compile("(\\d+)\\.(\\d+)");
    private static final Pattern HEXTET = Pattern.compile("[0-9a-fA-F]{1,4}");
    private static final Pattern IPV4 = Pattern.compile(
        "((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)");

    private static final int FABRIC_NAME_MAX_LENGTH = 64;

    private Validations() {
    }

    public static void verifyIntegerRange(String name, long value, long min, long max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(name + " " + value + " not within range " + min + "-" + max);
        }
    }

    public static void verifyVlan(int vlanId) {
        verifyIntegerRange("vlan_id", vlanId, 1, 4094);
    }

    /**
     * VRF VLANs exclude VLAN 1 and the range the controller reserves internally.
     */
    public static void verifyVrfVlanId(int vlanId) {
        verifyIntegerRange("vrf_vlan_id", vlanId, 2, 3967);
    }

    public static void verifyLoopbackId(int loopbackId) {
        verifyIntegerRange("loopback_id", loopbackId, 1, 1023);
    }

    public static void verifyMaxBgpPaths(int paths) {
        verifyIntegerRange("max_bgp_paths", paths, 1, 64);
    }

    public static void verifyMtu(int mtu) {
        verifyIntegerRange("mtu", mtu, 1500, 9216);
    }

    public static void verifyNveId(int nveId) {
        verifyIntegerRange("nve_id", nveId, 1, 1);
    }

    public static void verifyRoutingTag(long tag) {
        verifyIntegerRange("routing_tag", tag, 0, 4294967295L);
    }

    public static void verifyVni(long vni) {
        verifyIntegerRange("vni", vni, 1, 16777214);
    }

    public static void verifyIgmpVersion(int version) {
        if (!Set.of(1, 2, 3).contains(version)) {
            throw new IllegalArgumentException("igmp_version " + version + " must be one of 1, 2, 3");
        }
    }

    public static void verifyBgpPasswordKeyType(int keyType) {
        if (keyType != 3 && keyType != 7) {
            throw new IllegalArgumentException("bgp_password_key_type " + keyType + " must be one of 3, 7");
        }
    }

    /**
     * Accepts Boolean values only; strings such as "true" are rejected.
     */
    public static boolean verifyBoolean(Object value) {
        if (!(value instanceof Boolean)) {
            throw new IllegalArgumentException("expected boolean, got " + value);
        }
        return (Boolean) value;
    }

    /**
     * Fabric names are at most 64 characters of letters, digits, "_" and "-", and are
     * not purely numeric.
     */
    public static void verifyFabricName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("fabric_name must not be empty");
        }
        if (name.length() > FABRIC_NAME_MAX_LENGTH) {
            throw new IllegalArgumentException("fabric_name " + name + " is longer than "
                    + FABRIC_NAME_MAX_LENGTH + " characters");
        }
        if (!FABRIC_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("fabric_name " + name
                    + " must contain only letters, digits, underscore and hyphen");
        }
        if (ALL_DIGITS.matcher(name).matches()) {
            throw new IllegalArgumentException("fabric_name " + name + " must not be purely numeric");
        }
    }

    /**
     * Accepts asplain (1-4294967295) or asdot (x.y, x in 1-65535, y in 0-65535).
     */
    public static void verifyBgpAsn(String asn) {
        String invalid = "bgp_asn " + asn + " must be asplain 1-4294967295 or asdot 1-65535.0-65535";
        if (asn == null) {
            throw new IllegalArgumentException(invalid);
        }
        if (ALL_DIGITS.matcher(asn).matches()) {
            if (asn.length() > 10 || Long.parseLong(asn) < 1 || Long.parseLong(asn) > 4294967295L) {
                throw new IllegalArgumentException(invalid);
            }
            return;
        }
        Matcher asdot = ASDOT.matcher(asn);
        if (!asdot.matches() || asdot.group(1).length() > 5 || asdot.group(2).length() > 5) {
            throw new IllegalArgumentException(invalid);
        }
        int high = Integer.parseInt(asdot.group(1));
        int low = Integer.parseInt(asdot.group(2));
        if (high < 1 || high > 65535 || low > 65535) {
            throw new IllegalArgumentException(invalid);
        }
    }

    public static boolean isIpv4Address(String value) {
        return value != null && IPV4.matcher(value).matches();
    }

    public static void verifyIpv4Address(String value) {
        if (!isIpv4Address(value)) {
            throw new IllegalArgumentException("Invalid IPv4 address: " + value);
        }
    }

    /**
     * Accepts an IPv4 address with a prefix length, for example 10.1.1.1/24.
     */
    public static void verifyIpv4AddressWithPrefix(String value) {
        String[] parts = value == null ? new String[0] : value.split("/", -1);
        if (parts.length != 2 || !isIpv4Address(parts[0]) || !isPrefixLength(parts[1], 32)) {
            throw new IllegalArgumentException("Invalid IPv4 address with prefix: " + value);
        }
    }

    /**
     * Accepts an IPv6 address with a prefix length, for example 2001:db8::1/64.
     */
    public static void verifyIpv6AddressWithPrefix(String value) {
        String[] parts = value == null ? new String[0] : value.split("/", -1);
        if (parts.length != 2 || !isIpv6Address(parts[0]) || !isPrefixLength(parts[1], 128)) {
            throw new IllegalArgumentException("Invalid IPv6 address with prefix: " + value);
        }
    }

    /**
     * Accepts an IPv4 address in 224.0.0.0/4.
     */
    public static void verifyIpv4MulticastAddress(String value) {
        if (!isIpv4Address(value)) {
            throw new IllegalArgumentException("Invalid IPv4 multicast address: " + value);
        }
        int firstOctet = Integer.parseInt(value.substring(0, value.indexOf('.')));
        if (firstOctet < 224 || firstOctet > 239) {
            throw new IllegalArgumentException("Invalid IPv4 multicast address: " + value);
        }
    }

    /**
     * Accepts full, "::" compressed and IPv4-suffixed IPv6 literals.
     */
    public static boolean isIpv6Address(String value) {
        if (value == null || !value.contains(":")) {
            return false;
        }
        int compressed = value.indexOf("::");
        if (compressed >= 0 && value.indexOf("::", compressed + 1) >= 0) {
            return false;
        }
        String[] groups = value.split(":", -1);
        int hextets = 0;
        for (int i = 0; i < groups.length; i++) {
            String group = groups[i];
            if (group.isEmpty()) {
                continue;
            }
            if (i == groups.length - 1 && group.contains(".")) {
                if (!isIpv4Address(group)) {
                    return false;
                }
                hextets += 2;
            } else if (HEXTET.matcher(group).matches()) {
                hextets++;
            } else {
                return false;
            }
        }
        if (compressed < 0) {
            return hextets == 8 && !value.startsWith(":") && !value.endsWith(":");
        }
        boolean leadingColon = value.startsWith(":") && !value.startsWith("::");
        boolean trailingColon = value.endsWith(":") && !value.endsWith("::");
        return hextets < 8 && !leadingColon && !trailingColon;
    }

    private static boolean isPrefixLength(String value, int max) {
        if (!ALL_DIGITS.matcher(value).matches() || value.length() > 3) {
            return false;
        }
        int prefix = Integer.parseInt(value);
        return prefix <= max;
    }
}
