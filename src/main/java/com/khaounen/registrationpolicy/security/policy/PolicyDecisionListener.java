package com.khaounen.registrationpolicy.security.policy;

public interface PolicyDecisionListener {
    void onDecision(PolicyInput input, Decision decision);
}
