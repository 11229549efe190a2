package com.khaounen.registrationpolicy.security.policy.rules;

import com.khaounen.registrationpolicy.utils.IpUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;

final class UriSupport {

    private UriSupport() {
    }

    static Optional<URI> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            URI uri = new URI(value);
            return uri.getScheme() == null ? Optional.empty() : Optional.of(uri);
        } catch (URISyntaxException ex) {
            return Optional.empty();
        }
    }

    static String scheme(URI uri) {
        return uri.getScheme().toLowerCase(Locale.ROOT);
    }

    /**
     * https with a public host: loopback names and addresses do not count.
     */
    static boolean isSecureWebUri(URI uri) {
        return "https".equals(scheme(uri))
                && uri.getHost() != null
                && !uri.getHost().isBlank()
                && !IpUtils.isLoopbackHost(uri.getHost())
                && uri.getRawFragment() == null;
    }

    static boolean sameHostOrSubdomain(String parentHost, String host) {
        if (parentHost == null || host == null) {
            return false;
        }
        String parent = parentHost.toLowerCase(Locale.ROOT);
        String child = host.toLowerCase(Locale.ROOT);
        return child.equals(parent) || child.endsWith("." + parent);
    }
}
