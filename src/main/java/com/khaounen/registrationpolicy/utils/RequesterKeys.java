package com.khaounen.registrationpolicy.utils;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Builds the keys requester counters are stored under.
 */
public final class RequesterKeys {

    public static final String UNKNOWN = "unknown";

    private static final Pattern IPV4_PREFIX = Pattern.compile("^(\\d+\\.\\d+\\.\\d+)\\.\\d+$");

    private RequesterKeys() {
    }

    /**
     * Key for one address. Every spelling of an address maps to the same key:
     * IPv6 is expanded to its full form and IPv4-mapped IPv6 becomes plain IPv4.
     */
    public static String ip(String ip) {
        if (ip == null || ip.isBlank()) {
            return UNKNOWN;
        }
        return canonical(ip.trim());
    }

    static String canonical(String ip) {
        if (!IpUtils.isIpLiteral(ip)) {
            return ip.toLowerCase(Locale.ROOT);
        }
        try {
            // a validated literal is parsed, never resolved
            return InetAddress.getByName(ip).getHostAddress().toLowerCase(Locale.ROOT);
        } catch (UnknownHostException ex) {
            return ip.toLowerCase(Locale.ROOT);
        }
    }

    /**
     * SHA-256 over the /24 (IPv4) or first hextet (IPv6) of the address and the
     * user agent with version numbers stripped.
     */
    public static String fingerprint(String ip, String userAgent) {
        return sha256(String.join("|", normalizeIp(ip), normalizeUa(userAgent)));
    }

    private static String normalizeIp(String ip) {
        if (ip == null || ip.isBlank()) return "0";

        ip = canonical(ip.trim());
        if (ip.contains(":")) {
            return ip.split(":")[0].toLowerCase(Locale.ROOT) + "::";
        }

        var m = IPV4_PREFIX.matcher(ip);
        if (m.matches()) return m.group(1) + ".0";
        return ip;
    }

    private static String normalizeUa(String ua) {
        if (ua == null) return "ua-null";
        return ua.toLowerCase(Locale.ROOT)
                .replaceAll("\\d+(\\.\\d+)*", "")
                .replaceAll("\\s+", " ");
    }

    private static String sha256(String raw) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(raw.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (Exception e) {
            throw new IllegalStateException("Fingerprint error", e);
        }
    }
}
