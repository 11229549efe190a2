package com.khaounen.registrationpolicy.security.policy.rules;

import com.khaounen.registrationpolicy.security.policy.ClientMetadata;
import com.khaounen.registrationpolicy.security.policy.EvaluationContext;
import com.khaounen.registrationpolicy.security.policy.PolicyInput;
import com.khaounen.registrationpolicy.security.policy.RegistrationPolicyProperties;
import com.khaounen.registrationpolicy.security.policy.Requester;
import com.khaounen.registrationpolicy.security.policy.RuleEvaluationException;
import com.khaounen.registrationpolicy.security.policy.RuleResult;
import com.khaounen.registrationpolicy.security.policy.reputation.LocalReputationTracker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RequesterRateLimitRuleTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final LocalReputationTracker tracker = new LocalReputationTracker();

    @AfterEach
    void close() {
        tracker.close();
    }

    @Test
    void rejectsOnceLimitIsExceeded() {
        RequesterRateLimitRule rule = new RequesterRateLimitRule(2, Duration.ofSeconds(60), RegistrationPolicyProperties.KeyType.IP, true);
        Requester requester = new Requester("203.0.113.9", "curl/8.4.0");

        assertTrue(evaluate(rule, requester, NOW).passed());
        assertTrue(evaluate(rule, requester, NOW).passed());
        RuleResult third = evaluate(rule, requester, NOW.plusSeconds(1));

        assertTrue(third.isFatalReject());
        assertEquals("more than 2 registration attempts within 60s", third.reason());
    }

    @Test
    void requestersAreCountedSeparately() {
        RequesterRateLimitRule rule = new RequesterRateLimitRule(1, Duration.ofSeconds(60), RegistrationPolicyProperties.KeyType.IP, true);

        assertTrue(evaluate(rule, new Requester("203.0.113.9", null), NOW).passed());
        assertTrue(evaluate(rule, new Requester("203.0.113.10", null), NOW).passed());
        assertEquals(RuleResult.Outcome.REJECT, evaluate(rule, new Requester("203.0.113.9", null), NOW).outcome());
    }

    @Test
    void rewritingAnAddressDoesNotOpenANewBucket() {
        RequesterRateLimitRule rule = new RequesterRateLimitRule(1, Duration.ofSeconds(60), RegistrationPolicyProperties.KeyType.IP, true);

        assertTrue(evaluate(rule, new Requester("2001:db8::1", null), NOW).passed());
        assertEquals(RuleResult.Outcome.REJECT, evaluate(rule, new Requester("2001:0db8:0:0:0:0:0:1", null), NOW).outcome());
        assertEquals(RuleResult.Outcome.REJECT, evaluate(rule, new Requester("2001:db8:0::1", null), NOW).outcome());

        assertTrue(evaluate(rule, new Requester("203.0.113.5", null), NOW).passed());
        assertEquals(RuleResult.Outcome.REJECT, evaluate(rule, new Requester("::ffff:203.0.113.5", null), NOW).outcome());
    }

    @Test
    void requestersWithoutAddressShareOneBucket() {
        RequesterRateLimitRule rule = new RequesterRateLimitRule(1, Duration.ofSeconds(60), RegistrationPolicyProperties.KeyType.IP, true);

        assertTrue(evaluate(rule, Requester.unknown(), NOW).passed());
        assertEquals(RuleResult.Outcome.REJECT, evaluate(rule, new Requester(null, "curl/8.4.0"), NOW).outcome());
    }

    @Test
    void fingerprintKeysSeparateUserAgentsOnOneAddress() {
        RequesterRateLimitRule rule = new RequesterRateLimitRule(1, Duration.ofSeconds(60), RegistrationPolicyProperties.KeyType.FINGERPRINT, false);

        assertTrue(evaluate(rule, new Requester("203.0.113.9", "curl/8.4.0"), NOW).passed());
        assertTrue(evaluate(rule, new Requester("203.0.113.9", "Mozilla/5.0 Firefox/126.0"), NOW).passed());

        RuleResult repeat = evaluate(rule, new Requester("203.0.113.9", "curl/8.5.0"), NOW);
        assertEquals(RuleResult.Outcome.REJECT, repeat.outcome());
        assertFalse(repeat.isFatalReject());
    }

    @Test
    void windowElapsingResetsTheCount() {
        RequesterRateLimitRule rule = new RequesterRateLimitRule(1, Duration.ofSeconds(60), RegistrationPolicyProperties.KeyType.IP, true);
        Requester requester = new Requester("198.51.100.4", null);

        assertTrue(evaluate(rule, requester, NOW).passed());
        assertEquals(RuleResult.Outcome.REJECT, evaluate(rule, requester, NOW.plusSeconds(30)).outcome());
        assertTrue(evaluate(rule, requester, NOW.plusSeconds(61)).passed());
    }

    @Test
    void missingTrackerSurfacesAsEvaluationFailure() {
        RequesterRateLimitRule rule = new RequesterRateLimitRule(1, Duration.ofSeconds(60), RegistrationPolicyProperties.KeyType.IP, true);
        PolicyInput input = new PolicyInput(ClientMetadata.empty(), Requester.unknown());

        assertThrows(RuleEvaluationException.class, () -> rule.evaluate(input, new EvaluationContext(NOW, null)));
    }

    private RuleResult evaluate(RequesterRateLimitRule rule, Requester requester, Instant now) {
        PolicyInput input = new PolicyInput(ClientMetadata.empty(), requester);
        return rule.evaluate(input, new EvaluationContext(now, tracker));
    }
}
