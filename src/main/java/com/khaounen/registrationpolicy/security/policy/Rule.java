package com.khaounen.registrationpolicy.security.policy;

/**
 * A named predicate over a registration attempt. Implementations must be
 * stateless; shared counters are reached only through the context.
 */
public interface Rule {

    String id();

    RuleResult evaluate(PolicyInput input, EvaluationContext context);
}
