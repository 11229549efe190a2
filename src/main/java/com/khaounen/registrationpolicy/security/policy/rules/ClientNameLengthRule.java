package com.khaounen.registrationpolicy.security.policy.rules;

import com.khaounen.registrationpolicy.security.policy.EvaluationContext;
import com.khaounen.registrationpolicy.security.policy.PolicyInput;
import com.khaounen.registrationpolicy.security.policy.Rule;
import com.khaounen.registrationpolicy.security.policy.RuleResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Bounds {@code client_name} and its localized {@code client_name#tag} variants.
 */
public class ClientNameLengthRule implements Rule {

    public static final String ID = "client_name_length";

    private static final String FIELD = "client_name";

    private final int maxLength;
    private final boolean fatal;

    public ClientNameLengthRule(int maxLength, boolean fatal) {
        this.maxLength = Math.max(1, maxLength);
        this.fatal = fatal;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RuleResult evaluate(PolicyInput input, EvaluationContext context) {
        List<String> problems = new ArrayList<>();
        for (Map.Entry<String, Object> entry : input.clientMetadata().asMap().entrySet()) {
            String key = entry.getKey();
            if (!key.equals(FIELD) && !key.startsWith(FIELD + "#")) {
                continue;
            }
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            if (!(value instanceof String name)) {
                problems.add(key + " must be a string");
                continue;
            }
            int length = name.codePointCount(0, name.length());
            if (name.isBlank() || length > maxLength) {
                problems.add(key + " must be between 1 and " + maxLength + " characters");
            }
        }
        return problems.isEmpty() ? RuleResult.pass() : RuleResult.reject(String.join("; ", problems), fatal);
    }
}
