package com.khaounen.registrationpolicy.security.policy;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "registration-policy")
public class RegistrationPolicyProperties {

    private boolean enabled = true;
    private FailureMode failureMode = FailureMode.FAIL_CLOSED;
    private Filter filter = new Filter();
    private Reputation reputation = new Reputation();
    private Rules rules = new Rules();

    @Data
    public static class Filter {
        private boolean enabled = false;
        private String path = "/oauth2/registration";
        private int maxBodyBytes = 64 * 1024;
    }

    @Data
    public static class Reputation {
        private StoreType store = StoreType.LOCAL;
        private String keyPrefix = "registration-policy:";
        private int timeoutMs = 250;
        private int maxConcurrentCalls = 16;
        private int sweepIntervalSeconds = 300;
    }

    public enum StoreType {
        LOCAL,
        REDIS
    }

    @Data
    public static class Rules {
        private RedirectUris redirectUris = new RedirectUris();
        private ClientUri clientUri = new ClientUri();
        private ClientName clientName = new ClientName();
        private Contacts contacts = new Contacts();
        private UserAgent userAgent = new UserAgent();
        private RateLimit rateLimit = new RateLimit();
    }

    @Data
    public static class RedirectUris {
        private boolean enabled = true;
        private boolean fatal = true;
        private List<String> allowedCustomSchemes = new ArrayList<>();
        private boolean allowLoopbackHttp = true;
    }

    @Data
    public static class ClientUri {
        private boolean enabled = true;
        private boolean fatal = false;
        private boolean allowMissing = true;
    }

    @Data
    public static class ClientName {
        private boolean enabled = true;
        private boolean fatal = false;
        private int maxLength = 255;
    }

    @Data
    public static class Contacts {
        private boolean enabled = true;
        private boolean fatal = false;
    }

    @Data
    public static class UserAgent {
        private boolean enabled = true;
        private Action action = Action.WARN;
        private boolean fatal = false;
        private boolean flagMissing = false;
        private List<String> patterns = new ArrayList<>(List.of(
                "curl/*",
                "wget/*",
                "python-requests/*",
                "python-urllib/*",
                "go-http-client/*",
                "java/*",
                "okhttp/*",
                "libwww-perl/*"
        ));
    }

    public enum Action {
        WARN,
        REJECT
    }

    @Data
    public static class RateLimit {
        private boolean enabled = true;
        private boolean fatal = true;
        private int maxRequests = 10;
        private int windowSeconds = 60;
        private KeyType keyType = KeyType.IP;
    }

    public enum KeyType {
        IP,
        FINGERPRINT
    }
}
