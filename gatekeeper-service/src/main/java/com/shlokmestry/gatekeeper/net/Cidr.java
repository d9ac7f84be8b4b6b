package com.shlokmestry.gatekeeper.net;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;

public final class Cidr {

    private static final int MAPPED_PREFIX_BITS = 96;

    private final byte[] network;
    private final int prefixLength;

    private Cidr(byte[] network, int prefixLength) {
        this.network = network;
        this.prefixLength = prefixLength;
    }

    public static Cidr parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidRangeException(String.valueOf(value), "blank");
        }
        String s = value.trim();
        int slash = s.indexOf('/');
        String addressPart = slash < 0 ? s : s.substring(0, slash);

        InetAddress address;
        try {
            address = IpAddresses.parse(addressPart);
        } catch (IllegalArgumentException e) {
            throw new InvalidRangeException(value, "bad address");
        }

        // ::ffff:a.b.c.d parses to an Inet4Address, but its prefix still counts 128 bits
        boolean mapped = addressPart.indexOf(':') >= 0 && address instanceof Inet4Address;
        int maxBits = mapped ? 128 : IpAddresses.bitLength(address);
        int prefix = maxBits;
        if (slash >= 0) {
            String prefixPart = s.substring(slash + 1);
            if (prefixPart.isEmpty() || prefixPart.length() > 3 || !prefixPart.chars().allMatch(Character::isDigit)) {
                throw new InvalidRangeException(value, "bad prefix length");
            }
            prefix = Integer.parseInt(prefixPart);
            if (prefix > maxBits) {
                throw new InvalidRangeException(value, "prefix length exceeds " + maxBits);
            }
        }

        if (mapped) {
            if (prefix >= MAPPED_PREFIX_BITS) {
                // wholly inside ::ffff:0:0/96, which is where every mapped address is looked up
                prefix -= MAPPED_PREFIX_BITS;
            } else {
                return new Cidr(mask(toMappedV6(address.getAddress()), prefix), prefix);
            }
        }
        return new Cidr(mask(address.getAddress(), prefix), prefix);
    }

    private static byte[] toMappedV6(byte[] v4) {
        byte[] v6 = new byte[16];
        v6[10] = (byte) 0xFF;
        v6[11] = (byte) 0xFF;
        System.arraycopy(v4, 0, v6, 12, 4);
        return v6;
    }

    public int prefixLength() {
        return prefixLength;
    }

    public int bitLength() {
        return network.length * 8;
    }

    public byte[] networkBytes() {
        return network.clone();
    }

    public boolean contains(InetAddress address) {
        byte[] a = address.getAddress();
        if (a.length != network.length) {
            return false;
        }
        return Arrays.equals(mask(a, prefixLength), network);
    }

    private static byte[] mask(byte[] bytes, int prefix) {
        byte[] out = bytes.clone();
        for (int i = 0; i < out.length; i++) {
            int bitsInByte = Math.max(0, Math.min(8, prefix - i * 8));
            out[i] = (byte) (out[i] & (0xFF << (8 - bitsInByte)));
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Cidr other)) return false;
        return prefixLength == other.prefixLength && Arrays.equals(network, other.network);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(network) + prefixLength;
    }

    @Override
    public String toString() {
        try {
            return InetAddress.getByAddress(network).getHostAddress() + "/" + prefixLength;
        } catch (UnknownHostException e) {
            // 4 or 16 bytes always
            throw new IllegalStateException(e);
        }
    }
}
