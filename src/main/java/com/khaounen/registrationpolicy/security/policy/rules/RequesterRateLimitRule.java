package com.khaounen.registrationpolicy.security.policy.rules;

import com.khaounen.registrationpolicy.security.policy.EvaluationContext;
import com.khaounen.registrationpolicy.security.policy.PolicyInput;
import com.khaounen.registrationpolicy.security.policy.RegistrationPolicyProperties;
import com.khaounen.registrationpolicy.security.policy.Requester;
import com.khaounen.registrationpolicy.security.policy.Rule;
import com.khaounen.registrationpolicy.security.policy.RuleResult;
import com.khaounen.registrationpolicy.utils.RequesterKeys;

import java.time.Duration;

/**
 * Counts registration attempts per requester and rejects once more than
 * {@code maxRequests} arrive within one window. Requests without an IP share
 * the {@value RequesterKeys#UNKNOWN} bucket.
 */
public class RequesterRateLimitRule implements Rule {

    public static final String ID = "requester_rate_limit";

    private final int maxRequests;
    private final Duration window;
    private final RegistrationPolicyProperties.KeyType keyType;
    private final boolean fatal;

    public RequesterRateLimitRule(int maxRequests, Duration window, RegistrationPolicyProperties.KeyType keyType, boolean fatal) {
        this.maxRequests = Math.max(1, maxRequests);
        this.window = window == null || window.isNegative() || window.isZero() ? Duration.ofSeconds(60) : window;
        this.keyType = keyType == null ? RegistrationPolicyProperties.KeyType.IP : keyType;
        this.fatal = fatal;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RuleResult evaluate(PolicyInput input, EvaluationContext context) {
        long count = context.incrementAndCheck(key(input.requester()), window);
        if (count > maxRequests) {
            return RuleResult.reject(
                    "more than " + maxRequests + " registration attempts within " + window.toSeconds() + "s",
                    fatal
            );
        }
        return RuleResult.pass();
    }

    private String key(Requester requester) {
        if (keyType == RegistrationPolicyProperties.KeyType.FINGERPRINT) {
            return "rate:" + ID + ":fp:" + RequesterKeys.fingerprint(requester.ipAddress(), requester.userAgent());
        }
        return "rate:" + ID + ":ip:" + RequesterKeys.ip(requester.ipAddress());
    }
}
