package com.khaounen.registrationpolicy.security.policy;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports audited verdicts to a webhook and/or by mail. Delivery failures are
 * logged and never affect the decision.
 */
@Slf4j
public class PolicyAuditDispatcher implements PolicyDecisionListener {

    private final PolicyAuditProperties properties;
    private final ObjectMapper objectMapper;
    private final ObjectProvider<JavaMailSender> mailSenderProvider;
    private final HttpClient httpClient;

    public PolicyAuditDispatcher(
            PolicyAuditProperties properties,
            ObjectMapper objectMapper,
            ObjectProvider<JavaMailSender> mailSenderProvider
    ) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.mailSenderProvider = mailSenderProvider;
        this.httpClient = webhookClient(properties);
    }

    private static HttpClient webhookClient(PolicyAuditProperties properties) {
        if (properties == null || properties.getWebhook() == null || !properties.getWebhook().isEnabled()) {
            return null;
        }
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(properties.getWebhook().getConnectTimeoutMs()))
                .build();
    }

    @Override
    public void onDecision(PolicyInput input, Decision decision) {
        if (properties == null || !properties.getVerdicts().contains(decision.verdict())) {
            return;
        }
        sendWebhook(input, decision);
        sendSmtp(input, decision);
    }

    private void sendWebhook(PolicyInput input, Decision decision) {
        PolicyAuditProperties.Webhook webhook = properties.getWebhook();
        if (httpClient == null || !webhook.isEnabled() || webhook.getUrl() == null || webhook.getUrl().isBlank()) {
            return;
        }
        try {
            String payload = objectMapper.writeValueAsString(buildPayload(input, decision, webhook.isIncludeContext()));
            HttpRequest.Builder request = HttpRequest.newBuilder()
                    .uri(URI.create(webhook.getUrl()))
                    .timeout(Duration.ofMillis(webhook.getTimeoutMs()))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(payload));
            webhook.getHeaders().forEach(request::header);
            httpClient.sendAsync(request.build(), HttpResponse.BodyHandlers.discarding())
                    .whenComplete((response, error) -> {
                        if (error != null) {
                            log.warn("registration audit webhook failed: {}", error.getMessage());
                        } else if (response.statusCode() >= 400) {
                            log.warn("registration audit webhook returned {}", response.statusCode());
                        }
                    });
        } catch (Exception ex) {
            log.warn("registration audit webhook failed: {}", ex.getMessage());
        }
    }

    private void sendSmtp(PolicyInput input, Decision decision) {
        PolicyAuditProperties.Mail smtp = properties.getSmtp();
        if (smtp == null || !smtp.isEnabled() || mailSenderProvider == null) {
            return;
        }
        JavaMailSender sender = mailSenderProvider.getIfAvailable();
        if (sender == null || smtp.getFrom() == null || smtp.getFrom().isBlank() || smtp.getTo().isEmpty()) {
            return;
        }
        try {
            SimpleMailMessage message = new SimpleMailMessage();
            message.setFrom(smtp.getFrom());
            message.setTo(smtp.getTo().toArray(new String[0]));
            message.setSubject(subject(smtp, decision));
            message.setText(buildMailBody(input, decision, smtp.isIncludeContext()));
            sender.send(message);
        } catch (Exception ex) {
            log.warn("registration audit mail failed: {}", ex.getMessage());
        }
    }

    HttpClient webhookClient() {
        return httpClient;
    }

    static String subject(PolicyAuditProperties.Mail smtp, Decision decision) {
        String prefix = smtp.getSubjectPrefix();
        String verdict = decision.verdict().value();
        return prefix == null || prefix.isBlank() ? verdict : prefix.trim() + " " + verdict;
    }

    Map<String, Object> buildPayload(PolicyInput input, Decision decision, boolean includeContext) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("timestamp", Instant.now().toString());
        payload.put("verdict", decision.verdict().value());
        payload.put("violations", decision.violations());
        payload.put("warnings", decision.warnings());
        if (includeContext) {
            Map<String, Object> ctx = new LinkedHashMap<>();
            ctx.put("ip_address", input.requester().ipAddress());
            ctx.put("user_agent", input.requester().userAgent());
            ctx.put("client_name", input.clientMetadata().getString("client_name").orElse(null));
            ctx.put("redirect_uris", input.clientMetadata().getStringList("redirect_uris").orElse(List.of()));
            payload.put("context", ctx);
        }
        return payload;
    }

    private String buildMailBody(PolicyInput input, Decision decision, boolean includeContext) {
        StringBuilder sb = new StringBuilder();
        sb.append("Client registration audit\n");
        sb.append("timestamp: ").append(Instant.now()).append('\n');
        sb.append("verdict: ").append(decision.verdict().value()).append('\n');
        for (Diagnostic violation : decision.violations()) {
            sb.append("violation: ").append(violation.rule()).append(" - ").append(violation.message()).append('\n');
        }
        for (Diagnostic warning : decision.warnings()) {
            sb.append("warning: ").append(warning.rule()).append(" - ").append(warning.message()).append('\n');
        }
        if (includeContext) {
            sb.append("ip_address: ").append(input.requester().ipAddress()).append('\n');
            sb.append("user_agent: ").append(input.requester().userAgent()).append('\n');
            sb.append("client_name: ").append(input.clientMetadata().getString("client_name").orElse(null)).append('\n');
        }
        return sb.toString();
    }
}
