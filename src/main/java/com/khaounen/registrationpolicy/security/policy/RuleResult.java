package com.khaounen.registrationpolicy.security.policy;

/**
 * Outcome of a single {@link Rule}. A fatal reject guarantees a {@link Verdict#DENY}.
 */
public record RuleResult(Outcome outcome, String reason, boolean fatal) {

    private static final RuleResult PASS = new RuleResult(Outcome.PASS, null, false);

    public enum Outcome {
        PASS,
        WARN,
        REJECT
    }

    public static RuleResult pass() {
        return PASS;
    }

    public static RuleResult warn(String reason) {
        return new RuleResult(Outcome.WARN, reason, false);
    }

    public static RuleResult reject(String reason) {
        return new RuleResult(Outcome.REJECT, reason, false);
    }

    public static RuleResult fatal(String reason) {
        return new RuleResult(Outcome.REJECT, reason, true);
    }

    public static RuleResult reject(String reason, boolean fatal) {
        return new RuleResult(Outcome.REJECT, reason, fatal);
    }

    public boolean passed() {
        return outcome == Outcome.PASS;
    }

    public boolean isFatalReject() {
        return outcome == Outcome.REJECT && fatal;
    }
}
