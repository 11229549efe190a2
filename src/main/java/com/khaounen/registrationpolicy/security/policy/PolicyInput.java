package com.khaounen.registrationpolicy.security.policy;

import java.util.Objects;

public record PolicyInput(ClientMetadata clientMetadata, Requester requester) {

    public PolicyInput {
        Objects.requireNonNull(clientMetadata, "clientMetadata");
        Objects.requireNonNull(requester, "requester");
    }
}
