package com.khaounen.registrationpolicy.security.policy;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Verdict {
    ALLOW,
    DENY,
    FLAG;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
