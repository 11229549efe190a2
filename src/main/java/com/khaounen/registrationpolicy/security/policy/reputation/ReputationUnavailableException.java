package com.khaounen.registrationpolicy.security.policy.reputation;

import com.khaounen.registrationpolicy.security.policy.RuleEvaluationException;

public class ReputationUnavailableException extends RuleEvaluationException {

    public ReputationUnavailableException(String message) {
        super(message);
    }

    public ReputationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
