package com.khaounen.registrationpolicy.security.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.khaounen.registrationpolicy.security.policy.DecisionAggregator.RuleOutcome;
import com.khaounen.registrationpolicy.security.policy.reputation.ReputationTracker;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether a dynamic client registration attempt is admitted.
 * <p>
 * Every registered rule runs on every call, in registration order, against
 * the same input and the same evaluation instant, so diagnostics are complete
 * even when an early rule already guarantees a denial. A call ends either in a
 * {@link Decision} or in a {@link PolicyInputException}; faults inside rules
 * are resolved through the configured {@link FailureMode}.
 */
@Slf4j
public class RegistrationPolicyEngine {

    public static final String EVALUATION_UNAVAILABLE = "evaluation_unavailable";

    private final List<Rule> rules;
    private final ReputationTracker reputation;
    private final FailureMode failureMode;
    private final Clock clock;
    private final PolicyInputNormalizer normalizer;
    private final DecisionAggregator aggregator = new DecisionAggregator();
    private final PolicyDecisionListener listener;

    public RegistrationPolicyEngine(
            List<Rule> rules,
            ReputationTracker reputation,
            FailureMode failureMode,
            Clock clock,
            PolicyInputNormalizer normalizer,
            PolicyDecisionListener listener
    ) {
        this.rules = rules == null ? List.of() : List.copyOf(rules);
        this.reputation = reputation;
        this.failureMode = failureMode == null ? FailureMode.FAIL_CLOSED : failureMode;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.normalizer = normalizer;
        this.listener = listener;
    }

    public Decision evaluate(JsonNode request) {
        return evaluate(normalizer.normalize(request));
    }

    public Decision evaluate(String request) {
        return evaluate(normalizer.normalize(request));
    }

    public Decision evaluate(PolicyInput input) {
        EvaluationContext context = new EvaluationContext(clock.instant(), reputation);
        List<RuleOutcome> outcomes = new ArrayList<>(rules.size());
        for (Rule rule : rules) {
            outcomes.add(new RuleOutcome(rule.id(), run(rule, input, context)));
        }
        Decision decision = aggregator.aggregate(outcomes);
        log.debug("registration policy verdict={} violations={} warnings={} ip={}",
                decision.verdict().value(),
                decision.violations().size(),
                decision.warnings().size(),
                input.requester().ipAddress());
        notifyListener(input, decision);
        return decision;
    }

    public List<Rule> rules() {
        return rules;
    }

    public FailureMode failureMode() {
        return failureMode;
    }

    private RuleResult run(Rule rule, PolicyInput input, EvaluationContext context) {
        try {
            RuleResult result = rule.evaluate(input, context);
            if (result == null) {
                log.error("rule {} returned no result, applying {}", rule.id(), failureMode);
                return unavailable();
            }
            return result;
        } catch (RuleEvaluationException ex) {
            log.warn("rule {} could not be evaluated, applying {}: {}", rule.id(), failureMode, ex.getMessage());
            return unavailable();
        } catch (RuntimeException ex) {
            log.error("rule {} failed unexpectedly, applying {}", rule.id(), failureMode, ex);
            return unavailable();
        }
    }

    private RuleResult unavailable() {
        return failureMode == FailureMode.FAIL_OPEN ? RuleResult.pass() : RuleResult.fatal(EVALUATION_UNAVAILABLE);
    }

    private void notifyListener(PolicyInput input, Decision decision) {
        if (listener == null) {
            return;
        }
        try {
            listener.onDecision(input, decision);
        } catch (RuntimeException ex) {
            log.warn("registration policy listener failed: {}", ex.getMessage());
        }
    }
}
