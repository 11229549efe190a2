package com.khaounen.registrationpolicy.security.policy;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Where audited registration decisions are reported. Only verdicts listed in
 * {@code verdicts} are sent; both channels are off until enabled.
 */
@Data
@ConfigurationProperties(prefix = "registration-policy.audit")
public class PolicyAuditProperties {

    private List<Verdict> verdicts = new ArrayList<>(List.of(Verdict.FLAG, Verdict.DENY));
    private Webhook webhook = new Webhook();
    private Mail smtp = new Mail();

    @Data
    public static class Webhook {
        private boolean enabled = false;
        private String url;
        /** Extra request headers, e.g. a shared secret for the receiving endpoint. */
        private Map<String, String> headers = new LinkedHashMap<>();
        private int connectTimeoutMs = 1000;
        private int timeoutMs = 2000;
        private boolean includeContext = true;
    }

    @Data
    public static class Mail {
        private boolean enabled = false;
        private String from;
        private List<String> to = new ArrayList<>();
        /** Followed by the verdict, e.g. {@code "[registration-policy] deny"}. */
        private String subjectPrefix = "[registration-policy]";
        private boolean includeContext = true;
    }
}
