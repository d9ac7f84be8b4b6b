package com.shlokmestry.gatekeeper.net;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

public final class IpAddresses {

    private static final Pattern IPV4 = Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");
    private static final Pattern IPV6 = Pattern.compile("[0-9a-fA-F:][0-9a-fA-F:.]*");

    private IpAddresses() {}

    public static InetAddress parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("address is blank");
        }
        String s = value.trim();
        if (s.startsWith("[") && s.endsWith("]")) {
            s = s.substring(1, s.length() - 1);
        }

        if (s.indexOf(':') >= 0) {
            if (!IPV6.matcher(s).matches()) {
                throw new IllegalArgumentException("not an IPv6 literal: " + value);
            }
        } else if (!IPV4.matcher(s).matches() || !octetsInRange(s)) {
            throw new IllegalArgumentException("not an IPv4 literal: " + value);
        }

        try {
            // literal-only input, so this never resolves a hostname
            return InetAddress.getByName(s);
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("not an IP address: " + value, e);
        }
    }

    public static int bitLength(InetAddress address) {
        return address instanceof Inet4Address ? 32 : 128;
    }

    public static String canonical(InetAddress address) {
        return address.getHostAddress();
    }

    private static boolean octetsInRange(String s) {
        for (String part : s.split("\\.")) {
            if (Integer.parseInt(part) > 255) {
                return false;
            }
        }
        return true;
    }
}
