package com.khaounen.registrationpolicy.security.policy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reduces rule outcomes to one {@link Decision}. Diagnostics keep the order
 * the outcomes are given in.
 */
public class DecisionAggregator {

    public Decision aggregate(List<RuleOutcome> outcomes) {
        boolean fatal = false;
        boolean flagged = false;
        List<Diagnostic> rejects = new ArrayList<>();
        List<Diagnostic> warns = new ArrayList<>();
        List<Diagnostic> flags = new ArrayList<>();

        for (RuleOutcome outcome : outcomes) {
            RuleResult result = outcome.result();
            if (result.outcome() == RuleResult.Outcome.WARN) {
                flagged = true;
                Diagnostic diagnostic = outcome.diagnostic();
                warns.add(diagnostic);
                flags.add(diagnostic);
            } else if (result.outcome() == RuleResult.Outcome.REJECT) {
                Diagnostic diagnostic = outcome.diagnostic();
                rejects.add(diagnostic);
                if (result.fatal()) {
                    fatal = true;
                } else {
                    flagged = true;
                    flags.add(diagnostic);
                }
            }
        }

        if (fatal) {
            return new Decision(Verdict.DENY, rejects, warns);
        }
        if (flagged) {
            return new Decision(Verdict.FLAG, List.of(), flags);
        }
        return Decision.allow();
    }

    public record RuleOutcome(String ruleId, RuleResult result) {

        public Diagnostic diagnostic() {
            String message = result.reason() == null ? result.outcome().name().toLowerCase(Locale.ROOT) : result.reason();
            return new Diagnostic(ruleId, message);
        }
    }
}
