package com.khaounen.registrationpolicy.security.policy.rules;

import com.khaounen.registrationpolicy.security.policy.ClientMetadata;
import com.khaounen.registrationpolicy.security.policy.EvaluationContext;
import com.khaounen.registrationpolicy.security.policy.PolicyInput;
import com.khaounen.registrationpolicy.security.policy.Rule;
import com.khaounen.registrationpolicy.security.policy.RuleResult;
import com.khaounen.registrationpolicy.utils.IpUtils;

import java.net.URI;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Redirect URIs must be absolute, fragment-free and use https, one of the
 * allowed custom schemes, or plain http on a loopback host when that is
 * enabled. Grants that redirect ({@code authorization_code}, {@code implicit})
 * require at least one redirect URI; a missing {@code grant_types} means
 * {@code authorization_code}.
 */
public class RedirectUriRule implements Rule {

    public static final String ID = "redirect_uris";

    private static final List<String> DEFAULT_GRANT_TYPES = List.of("authorization_code");
    private static final Set<String> REDIRECTING_GRANTS = Set.of("authorization_code", "implicit");

    private final Set<String> customSchemes;
    private final boolean allowLoopbackHttp;
    private final boolean fatal;

    public RedirectUriRule(Collection<String> customSchemes, boolean allowLoopbackHttp, boolean fatal) {
        this.customSchemes = customSchemes == null
                ? Set.of()
                : customSchemes.stream()
                        .filter(s -> s != null && !s.isBlank())
                        .map(s -> s.trim().toLowerCase(Locale.ROOT))
                        .collect(Collectors.toUnmodifiableSet());
        this.allowLoopbackHttp = allowLoopbackHttp;
        this.fatal = fatal;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RuleResult evaluate(PolicyInput input, EvaluationContext context) {
        ClientMetadata metadata = input.clientMetadata();
        if (metadata.get(ID) == null) {
            return requiresRedirectUris(metadata) ? RuleResult.reject("missing redirect_uris", fatal) : RuleResult.pass();
        }
        Optional<List<String>> uris = metadata.getStringList(ID);
        if (uris.isEmpty()) {
            return RuleResult.reject("redirect_uris must be an array of strings", fatal);
        }
        if (uris.get().isEmpty()) {
            return requiresRedirectUris(metadata) ? RuleResult.reject("missing redirect_uris", fatal) : RuleResult.pass();
        }
        List<String> invalid = uris.get().stream()
                .filter(uri -> !isAllowed(uri))
                .toList();
        if (invalid.isEmpty()) {
            return RuleResult.pass();
        }
        return RuleResult.reject("invalid redirect_uri: " + String.join(", ", invalid), fatal);
    }

    private boolean isAllowed(String value) {
        Optional<URI> parsed = UriSupport.parse(value);
        if (parsed.isEmpty()) {
            return false;
        }
        URI uri = parsed.get();
        if (uri.getRawFragment() != null) {
            return false;
        }
        String scheme = UriSupport.scheme(uri);
        if ("https".equals(scheme)) {
            return uri.getHost() != null && !uri.getHost().isBlank();
        }
        if ("http".equals(scheme)) {
            return allowLoopbackHttp && IpUtils.isLoopbackHost(uri.getHost());
        }
        return customSchemes.contains(scheme);
    }

    private static boolean requiresRedirectUris(ClientMetadata metadata) {
        List<String> grantTypes = metadata.get("grant_types") == null
                ? DEFAULT_GRANT_TYPES
                : metadata.getStringList("grant_types").orElse(DEFAULT_GRANT_TYPES);
        return grantTypes.stream().anyMatch(REDIRECTING_GRANTS::contains);
    }
}
