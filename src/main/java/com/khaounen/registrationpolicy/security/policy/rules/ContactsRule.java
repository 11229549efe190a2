package com.khaounen.registrationpolicy.security.policy.rules;

import com.khaounen.registrationpolicy.security.policy.EvaluationContext;
import com.khaounen.registrationpolicy.security.policy.PolicyInput;
import com.khaounen.registrationpolicy.security.policy.Rule;
import com.khaounen.registrationpolicy.security.policy.RuleResult;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

public class ContactsRule implements Rule {

    public static final String ID = "contacts";

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private final boolean fatal;

    public ContactsRule(boolean fatal) {
        this.fatal = fatal;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RuleResult evaluate(PolicyInput input, EvaluationContext context) {
        if (input.clientMetadata().get(ID) == null) {
            return RuleResult.pass();
        }
        Optional<List<String>> contacts = input.clientMetadata().getStringList(ID);
        if (contacts.isEmpty()) {
            return RuleResult.reject("contacts must be an array of strings", fatal);
        }
        List<String> invalid = contacts.get().stream()
                .filter(contact -> !EMAIL.matcher(contact).matches())
                .toList();
        if (invalid.isEmpty()) {
            return RuleResult.pass();
        }
        return RuleResult.reject("invalid contacts: " + String.join(", ", invalid), fatal);
    }
}
