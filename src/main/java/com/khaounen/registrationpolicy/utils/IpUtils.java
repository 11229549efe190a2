package com.khaounen.registrationpolicy.utils;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.util.StringUtils;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

public class IpUtils {

    private static final Pattern IPV4 = Pattern.compile(
            "^(?:(?:25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(?:25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$");

    private static final Pattern IPV6_CHARS = Pattern.compile("^[0-9A-Fa-f:.]+$");

    private IpUtils() {
    }

    public static String resolveIp(HttpServletRequest request) {
        String[] headers = {
                "X-Forwarded-For",
                "X-Real-IP",
                "CF-Connecting-IP",
                "True-Client-IP"
        };

        for (String header : headers) {
            String value = request.getHeader(header);
            if (StringUtils.hasText(value)) {
                return value.split(",")[0].trim();
            }
        }

        return request.getRemoteAddr();
    }

    public static boolean isIpLiteral(String value) {
        return isIpv4(value) || isIpv6(value);
    }

    public static boolean isIpv4(String value) {
        return value != null && IPV4.matcher(value).matches();
    }

    /**
     * Text forms of RFC 4291, including an embedded IPv4 tail. Zone ids and
     * brackets are not accepted.
     */
    public static boolean isIpv6(String value) {
        if (value == null || value.indexOf(':') < 0 || !IPV6_CHARS.matcher(value).matches()) {
            return false;
        }
        if (value.charAt(0) == '.') {
            return false;
        }
        String tail = value.substring(value.lastIndexOf(':') + 1);
        if (tail.indexOf('.') >= 0 && !isIpv4(tail)) {
            return false;
        }
        try {
            // starts with a hex digit or ':' and contains ':', so it is parsed as a literal and never resolved
            InetAddress.getByName(value);
            return true;
        } catch (UnknownHostException ex) {
            return false;
        }
    }

    public static boolean isLoopbackHost(String host) {
        if (host == null) {
            return false;
        }
        String bare = host.startsWith("[") && host.endsWith("]") ? host.substring(1, host.length() - 1) : host;
        return "localhost".equalsIgnoreCase(bare)
                || bare.startsWith("127.") && isIpv4(bare)
                || "::1".equals(bare)
                || "0:0:0:0:0:0:0:1".equals(bare);
    }
}
