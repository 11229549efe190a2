package com.khaounen.registrationpolicy.security.policy.rules;

import com.khaounen.registrationpolicy.security.policy.EvaluationContext;
import com.khaounen.registrationpolicy.security.policy.PolicyInput;
import com.khaounen.registrationpolicy.security.policy.RegistrationPolicyProperties;
import com.khaounen.registrationpolicy.security.policy.Rule;
import com.khaounen.registrationpolicy.security.policy.RuleResult;
import org.springframework.util.PatternMatchUtils;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Matches the requester's user agent against simple {@code *} patterns of
 * known scripted clients, ignoring case.
 */
public class UserAgentPatternRule implements Rule {

    public static final String ID = "blocked_user_agent_pattern";

    private final List<String> patterns;
    private final RegistrationPolicyProperties.Action action;
    private final boolean fatal;
    private final boolean flagMissing;

    public UserAgentPatternRule(
            Collection<String> patterns,
            RegistrationPolicyProperties.Action action,
            boolean fatal,
            boolean flagMissing
    ) {
        this.patterns = patterns == null
                ? List.of()
                : patterns.stream()
                        .filter(p -> p != null && !p.isBlank())
                        .map(p -> p.trim().toLowerCase(Locale.ROOT))
                        .toList();
        this.action = action == null ? RegistrationPolicyProperties.Action.WARN : action;
        this.fatal = fatal;
        this.flagMissing = flagMissing;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RuleResult evaluate(PolicyInput input, EvaluationContext context) {
        String userAgent = input.requester().userAgent();
        if (userAgent == null || userAgent.isBlank()) {
            return flagMissing ? result("user agent is missing") : RuleResult.pass();
        }
        String candidate = userAgent.trim().toLowerCase(Locale.ROOT);
        for (String pattern : patterns) {
            if (PatternMatchUtils.simpleMatch(pattern, candidate)) {
                return result("user agent matches scripted client pattern '" + pattern + "'");
            }
        }
        return RuleResult.pass();
    }

    private RuleResult result(String reason) {
        if (action == RegistrationPolicyProperties.Action.REJECT) {
            return RuleResult.reject(reason, fatal);
        }
        return RuleResult.warn(reason);
    }
}
