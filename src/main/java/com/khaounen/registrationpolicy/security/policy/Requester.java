package com.khaounen.registrationpolicy.security.policy;

import java.util.Optional;

/**
 * Ambient request data. Either field may be null, meaning unknown.
 */
public record Requester(String ipAddress, String userAgent) {

    private static final Requester UNKNOWN = new Requester(null, null);

    public static Requester unknown() {
        return UNKNOWN;
    }

    public Optional<String> ip() {
        return Optional.ofNullable(ipAddress);
    }

    public Optional<String> agent() {
        return Optional.ofNullable(userAgent);
    }
}
