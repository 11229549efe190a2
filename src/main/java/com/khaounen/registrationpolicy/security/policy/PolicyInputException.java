package com.khaounen.registrationpolicy.security.policy;

/**
 * The request does not satisfy the input contract. Raised before any rule runs
 * and never represented as a {@link Decision}.
 */
public class PolicyInputException extends RuntimeException {

    public PolicyInputException(String message) {
        super(message);
    }

    public PolicyInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
