package com.khaounen.registrationpolicy.security.policy;

/**
 * A rule could not reach a dependency it needs. Resolved by the engine through
 * the configured {@link FailureMode}.
 */
public class RuleEvaluationException extends RuntimeException {

    public RuleEvaluationException(String message) {
        super(message);
    }

    public RuleEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
