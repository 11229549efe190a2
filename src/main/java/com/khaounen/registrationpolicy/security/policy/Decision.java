package com.khaounen.registrationpolicy.security.policy;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"verdict", "violations", "warnings"})
public record Decision(
        Verdict verdict,
        List<Diagnostic> violations,
        List<Diagnostic> warnings
) {

    public Decision {
        violations = violations == null ? List.of() : List.copyOf(violations);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static Decision allow() {
        return new Decision(Verdict.ALLOW, List.of(), List.of());
    }

    public boolean admitted() {
        return verdict != Verdict.DENY;
    }

    public boolean hasViolation(String ruleId) {
        return violations.stream().anyMatch(d -> d.rule().equals(ruleId));
    }
}
