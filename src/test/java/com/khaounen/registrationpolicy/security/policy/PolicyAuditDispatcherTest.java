package com.khaounen.registrationpolicy.security.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class PolicyAuditDispatcherTest {

    private static final PolicyInput INPUT = new PolicyInput(
            ClientMetadata.of(Map.of("client_name", "Example", "redirect_uris", List.of("https://example.com/cb"))),
            new Requester("203.0.113.5", "curl/8.0"));

    private static final Decision FLAGGED = new Decision(
            Verdict.FLAG,
            List.of(),
            List.of(new Diagnostic("blocked_user_agent_pattern", "user agent matches scripted client pattern 'curl/*'")));

    private static final Decision DENIED = new Decision(
            Verdict.DENY,
            List.of(new Diagnostic("redirect_uris", "invalid redirect_uri: http://example.com/cb")),
            List.of());

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void mailsAuditedVerdictsOnly() {
        JavaMailSender mailSender = mock(JavaMailSender.class);
        PolicyAuditDispatcher dispatcher = new PolicyAuditDispatcher(smtpProperties(), objectMapper,
                new SimpleObjectProvider<>(mailSender));

        dispatcher.onDecision(INPUT, Decision.allow());
        verify(mailSender, never()).send(any(SimpleMailMessage.class));

        dispatcher.onDecision(INPUT, FLAGGED);
        ArgumentCaptor<SimpleMailMessage> sent = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mailSender).send(sent.capture());
        SimpleMailMessage message = sent.getValue();
        assertEquals("audit@example.com", message.getFrom());
        assertEquals("[registration-policy] flag", message.getSubject());
        assertTrue(message.getText().contains("verdict: flag"));
        assertTrue(message.getText().contains("warning: blocked_user_agent_pattern"));
        assertTrue(message.getText().contains("ip_address: 203.0.113.5"));
    }

    @Test
    void mailSubjectNamesTheVerdict() {
        PolicyAuditProperties.Mail mail = new PolicyAuditProperties.Mail();

        assertEquals("[registration-policy] deny", PolicyAuditDispatcher.subject(mail, DENIED));
        mail.setSubjectPrefix(" ");
        assertEquals("flag", PolicyAuditDispatcher.subject(mail, FLAGGED));
    }

    @Test
    void mailFailureIsNotPropagated() {
        JavaMailSender mailSender = mock(JavaMailSender.class);
        doThrow(new MailSendException("smtp down")).when(mailSender).send(any(SimpleMailMessage.class));
        PolicyAuditDispatcher dispatcher = new PolicyAuditDispatcher(smtpProperties(), objectMapper,
                new SimpleObjectProvider<>(mailSender));

        assertDoesNotThrow(() -> dispatcher.onDecision(INPUT, FLAGGED));
    }

    @Test
    void webhookReusesOneClientAndSendsConfiguredHeaders() throws Exception {
        Queue<String> bodies = new ConcurrentLinkedQueue<>();
        Queue<String> secrets = new ConcurrentLinkedQueue<>();
        CountDownLatch delivered = new CountDownLatch(2);
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/audit", exchange -> {
            bodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            secrets.add(String.valueOf(exchange.getRequestHeaders().getFirst("X-Audit-Secret")));
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            delivered.countDown();
        });
        server.start();
        try {
            PolicyAuditProperties properties = new PolicyAuditProperties();
            properties.getWebhook().setEnabled(true);
            properties.getWebhook().setUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/audit");
            properties.getWebhook().getHeaders().put("X-Audit-Secret", "s3cret");
            PolicyAuditDispatcher dispatcher = new PolicyAuditDispatcher(properties, objectMapper, new SimpleObjectProvider<>(null));
            var client = dispatcher.webhookClient();

            dispatcher.onDecision(INPUT, FLAGGED);
            dispatcher.onDecision(INPUT, DENIED);

            assertTrue(delivered.await(5, TimeUnit.SECONDS));
            assertSame(client, dispatcher.webhookClient());
            assertEquals(List.of("s3cret", "s3cret"), List.copyOf(secrets));
            List<String> verdicts = bodies.stream()
                    .map(this::readTree)
                    .map(body -> body.get("verdict").asText())
                    .sorted()
                    .toList();
            assertEquals(List.of("deny", "flag"), verdicts);
        } finally {
            server.stop(0);
        }
    }

    @Test
    void disabledWebhookBuildsNoClient() {
        PolicyAuditDispatcher dispatcher = new PolicyAuditDispatcher(new PolicyAuditProperties(), objectMapper,
                new SimpleObjectProvider<>(null));

        assertNull(dispatcher.webhookClient());
        assertDoesNotThrow(() -> dispatcher.onDecision(INPUT, FLAGGED));
    }

    @Test
    void payloadCarriesDiagnosticsAndContext() {
        PolicyAuditDispatcher dispatcher = new PolicyAuditDispatcher(new PolicyAuditProperties(), objectMapper,
                new SimpleObjectProvider<>(null));

        Map<String, Object> payload = dispatcher.buildPayload(INPUT, FLAGGED, true);

        assertEquals("flag", payload.get("verdict"));
        assertEquals(FLAGGED.warnings(), payload.get("warnings"));
        Object context = payload.get("context");
        assertNotNull(context);
        assertEquals("curl/8.0", ((Map<?, ?>) context).get("user_agent"));
        assertEquals(List.of("https://example.com/cb"), ((Map<?, ?>) context).get("redirect_uris"));

        assertFalse(dispatcher.buildPayload(INPUT, FLAGGED, false).containsKey("context"));
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (Exception ex) {
            throw new IllegalStateException(ex);
        }
    }

    private static PolicyAuditProperties smtpProperties() {
        PolicyAuditProperties properties = new PolicyAuditProperties();
        properties.getSmtp().setEnabled(true);
        properties.getSmtp().setFrom("audit@example.com");
        properties.getSmtp().setTo(List.of("security@example.com"));
        return properties;
    }
}
