package com.khaounen.registrationpolicy.security.policy.rules;

import com.khaounen.registrationpolicy.security.policy.ClientMetadata;
import com.khaounen.registrationpolicy.security.policy.EvaluationContext;
import com.khaounen.registrationpolicy.security.policy.PolicyInput;
import com.khaounen.registrationpolicy.security.policy.Rule;
import com.khaounen.registrationpolicy.security.policy.RuleResult;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code client_uri} must be a public https URL. Terms of service, policy and
 * logo URLs must be https too and live on the client's host or a subdomain of it.
 */
public class ClientUriRule implements Rule {

    public static final String ID = "client_uri";

    private static final List<String> RELATED_URIS = List.of("tos_uri", "policy_uri", "logo_uri");

    private final boolean allowMissing;
    private final boolean fatal;

    public ClientUriRule(boolean allowMissing, boolean fatal) {
        this.allowMissing = allowMissing;
        this.fatal = fatal;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RuleResult evaluate(PolicyInput input, EvaluationContext context) {
        ClientMetadata metadata = input.clientMetadata();
        List<String> problems = new ArrayList<>();

        String clientHost = null;
        if (metadata.get(ID) == null) {
            if (!allowMissing) {
                problems.add("missing client_uri");
            }
        } else {
            Optional<URI> clientUri = secureUri(metadata, ID);
            if (clientUri.isPresent()) {
                clientHost = clientUri.get().getHost();
            } else {
                problems.add("invalid client_uri");
            }
        }

        String host = clientHost;
        for (String field : RELATED_URIS) {
            if (metadata.get(field) == null) {
                continue;
            }
            Optional<URI> related = secureUri(metadata, field);
            boolean hostMatches = host == null
                    || related.map(uri -> UriSupport.sameHostOrSubdomain(host, uri.getHost())).orElse(false);
            if (related.isEmpty() || !hostMatches) {
                problems.add("invalid " + field);
            }
        }

        return problems.isEmpty() ? RuleResult.pass() : RuleResult.reject(String.join("; ", problems), fatal);
    }

    private static Optional<URI> secureUri(ClientMetadata metadata, String field) {
        return metadata.getString(field)
                .flatMap(UriSupport::parse)
                .filter(UriSupport::isSecureWebUri);
    }
}
