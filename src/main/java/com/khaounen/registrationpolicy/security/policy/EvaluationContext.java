package com.khaounen.registrationpolicy.security.policy;

import com.khaounen.registrationpolicy.security.policy.reputation.ReputationTracker;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Per-call view of shared state handed to every rule. The instant is fixed
 * for the whole evaluation.
 */
public final class EvaluationContext {

    private final Instant now;
    private final ReputationTracker reputation;

    public EvaluationContext(Instant now, ReputationTracker reputation) {
        this.now = Objects.requireNonNull(now, "now");
        this.reputation = reputation;
    }

    public Instant now() {
        return now;
    }

    /**
     * @throws RuleEvaluationException when no tracker is configured or the tracker is unreachable
     */
    public long incrementAndCheck(String key, Duration window) {
        if (reputation == null) {
            throw new RuleEvaluationException("no reputation tracker configured");
        }
        return reputation.incrementAndCheck(key, window, now);
    }
}
