package com.khaounen.registrationpolicy.security.policy;

public enum FailureMode {
    /** Unavailable dependency yields a fatal reject with reason {@code evaluation_unavailable}. */
    FAIL_CLOSED,
    /** Unavailable dependency makes the dependent rule pass. */
    FAIL_OPEN
}
