package com.khaounen.registrationpolicy.security.policy;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"rule", "message"})
public record Diagnostic(String rule, String message) {
}
