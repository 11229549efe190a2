package com.khaounen.registrationpolicy.security.policy.reputation;

import java.time.Duration;
import java.time.Instant;

/**
 * Short-lived per-key attempt counters. This is the only shared mutable state
 * of the policy engine and it is reachable only through this operation.
 */
public interface ReputationTracker {

    /**
     * Records one attempt for {@code key} and returns the number of attempts
     * seen in the window that is current at {@code now}, this one included.
     * A window opens with the first attempt and lasts {@code window}.
     *
     * @throws ReputationUnavailableException when the backing store cannot be reached
     */
    long incrementAndCheck(String key, Duration window, Instant now);
}
