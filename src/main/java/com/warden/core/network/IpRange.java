package com.warden.core.network;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A CIDR block such as {@code 10.0.0.0/8} or {@code fe80::/10}.
 */
public final class IpRange {

    private static final Pattern IPV4 = Pattern.compile("^(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})$");
    private static final Pattern IPV6 = Pattern.compile("^[0-9a-fA-F:.]+$");

    private final String cidr;
    private final byte[] network;
    private final int prefixLength;

    private IpRange(String cidr, byte[] network, int prefixLength) {
        this.cidr = cidr;
        this.network = network;
        this.prefixLength = prefixLength;
    }

    /**
     * Parses a CIDR block; a bare address is treated as a single-host range.
     *
     * @throws IllegalArgumentException if the text is not a valid range
     */
    public static IpRange parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("IP range must not be blank");
        }
        String trimmed = text.trim();
        int slash = trimmed.indexOf('/');
        String addressPart = slash < 0 ? trimmed : trimmed.substring(0, slash);
        InetAddress address = parseLiteral(addressPart)
                .orElseThrow(() -> new IllegalArgumentException("Invalid IP range: " + text));
        byte[] bytes = address.getAddress();
        int maxBits = bytes.length * 8;
        int prefix = maxBits;
        if (slash >= 0) {
            try {
                prefix = Integer.parseInt(trimmed.substring(slash + 1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid IP range: " + text, e);
            }
        }
        if (prefix < 0 || prefix > maxBits) {
            throw new IllegalArgumentException("Invalid prefix length in " + text);
        }
        return new IpRange(address.getHostAddress() + "/" + prefix, mask(bytes, prefix), prefix);
    }

    /**
     * Parses an IPv4 or IPv6 literal without ever consulting DNS.
     */
    public static Optional<InetAddress> parseLiteral(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String host = text.trim();
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        var v4 = IPV4.matcher(host);
        if (v4.matches()) {
            byte[] bytes = new byte[4];
            for (int i = 0; i < 4; i++) {
                int octet = Integer.parseInt(v4.group(i + 1));
                if (octet > 255) {
                    return Optional.empty();
                }
                bytes[i] = (byte) octet;
            }
            return byAddress(bytes);
        }
        if (host.contains(":") && IPV6.matcher(host).matches()) {
            try {
                // A literal containing ':' is never resolved through DNS.
                return Optional.of(InetAddress.getByName(host));
            } catch (UnknownHostException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public boolean contains(InetAddress address) {
        byte[] candidate = address.getAddress();
        if (candidate.length != network.length) {
            return false;
        }
        byte[] masked = mask(candidate, prefixLength);
        for (int i = 0; i < masked.length; i++) {
            if (masked[i] != network[i]) {
                return false;
            }
        }
        return true;
    }

    public String cidr() {
        return cidr;
    }

    @Override
    public String toString() {
        return cidr;
    }

    private static byte[] mask(byte[] bytes, int prefix) {
        byte[] out = bytes.clone();
        for (int i = 0; i < out.length; i++) {
            int bitsInByte = Math.max(0, Math.min(8, prefix - i * 8));
            int byteMask = bitsInByte == 0 ? 0 : (0xFF << (8 - bitsInByte)) & 0xFF;
            out[i] = (byte) (out[i] & byteMask);
        }
        return out;
    }

    private static Optional<InetAddress> byAddress(byte[] bytes) {
        try {
            return Optional.of(InetAddress.getByAddress(bytes));
        } catch (UnknownHostException e) {
            return Optional.empty();
        }
    }
}
