package com.khaounen.registrationpolicy.security.filters;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.khaounen.registrationpolicy.security.policy.Decision;
import com.khaounen.registrationpolicy.security.policy.PolicyInputException;
import com.khaounen.registrationpolicy.security.policy.PolicyInputNormalizer;
import com.khaounen.registrationpolicy.security.policy.RegistrationPolicyEngine;
import com.khaounen.registrationpolicy.security.policy.RegistrationPolicyProperties;
import com.khaounen.registrationpolicy.security.policy.Verdict;
import com.khaounen.registrationpolicy.security.policy.rules.RedirectUriRule;
import com.khaounen.registrationpolicy.utils.IpUtils;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs the registration policy in front of an existing dynamic client
 * registration endpoint. Denied and malformed requests are answered with an
 * RFC 7591 error; flagged ones carry {@value #DECISION_HEADER} and continue.
 */
@Slf4j
public class RegistrationPolicyFilter extends OncePerRequestFilter {

    public static final String DECISION_HEADER = "X-Registration-Policy";

    private final RegistrationPolicyProperties properties;
    private final RegistrationPolicyEngine engine;
    private final ObjectMapper objectMapper;
    private final AntPathMatcher matcher = new AntPathMatcher();

    public RegistrationPolicyFilter(
            RegistrationPolicyProperties properties,
            RegistrationPolicyEngine engine,
            ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.engine = engine;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        RegistrationPolicyProperties.Filter filter = properties.getFilter();
        return !properties.isEnabled()
                || !filter.isEnabled()
                || !"POST".equalsIgnoreCase(request.getMethod())
                || !matcher.match(filter.getPath(), request.getRequestURI());
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        int maxBodyBytes = Math.min(Math.max(0, properties.getFilter().getMaxBodyBytes()), Integer.MAX_VALUE - 1);
        if (request.getContentLengthLong() > maxBodyBytes) {
            writeError(response, "invalid_request", "request body too large");
            return;
        }
        // never buffer more than one byte past the limit, whatever the declared length
        byte[] body = request.getInputStream().readNBytes(maxBodyBytes + 1);
        if (body.length > maxBodyBytes) {
            writeError(response, "invalid_request", "request body too large");
            return;
        }
        HttpServletRequest effectiveRequest = new CachedBodyRequest(request, body);

        Decision decision;
        try {
            decision = engine.evaluate(envelope(body, IpUtils.resolveIp(request), request.getHeader(HttpHeaders.USER_AGENT)));
        } catch (PolicyInputException ex) {
            log.debug("registration request rejected as malformed: {}", ex.getMessage());
            writeError(response, "invalid_request", ex.getMessage());
            return;
        }

        if (decision.verdict() == Verdict.DENY) {
            String error = decision.hasViolation(RedirectUriRule.ID) ? "invalid_redirect_uri" : "invalid_client_metadata";
            String description = decision.violations().isEmpty() ? "registration denied" : decision.violations().get(0).message();
            writeError(response, error, description);
            return;
        }
        if (decision.verdict() == Verdict.FLAG) {
            response.setHeader(DECISION_HEADER, Verdict.FLAG.value());
        }

        filterChain.doFilter(effectiveRequest, response);
    }

    private JsonNode envelope(byte[] body, String ip, String userAgent) {
        ObjectNode envelope = objectMapper.createObjectNode();
        JsonNode metadata;
        try {
            metadata = body.length == 0 ? null : objectMapper.readTree(body);
        } catch (IOException ex) {
            throw new PolicyInputException("request body is not valid JSON", ex);
        }
        if (metadata != null && !metadata.isMissingNode()) {
            envelope.set(PolicyInputNormalizer.CLIENT_METADATA, metadata);
        }
        ObjectNode requester = envelope.putObject(PolicyInputNormalizer.REQUESTER);
        if (ip != null && !ip.isBlank()) {
            requester.put(PolicyInputNormalizer.IP_ADDRESS, ip);
        }
        if (userAgent != null) {
            requester.put(PolicyInputNormalizer.USER_AGENT, userAgent);
        }
        return envelope;
    }

    private void writeError(HttpServletResponse response, String error, String description) throws IOException {
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("error", error);
        payload.put("error_description", description);
        response.setStatus(HttpServletResponse.SC_BAD_REQUEST);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write(objectMapper.writeValueAsString(payload));
    }

    private static class CachedBodyRequest extends HttpServletRequestWrapper {
        private final byte[] body;

        private CachedBodyRequest(HttpServletRequest request, byte[] body) {
            super(request);
            this.body = body != null ? body : new byte[0];
        }

        @Override
        public ServletInputStream getInputStream() {
            return new ServletInputStream() {
                private int index = 0;

                @Override
                public boolean isFinished() {
                    return index >= body.length;
                }

                @Override
                public boolean isReady() {
                    return true;
                }

                @Override
                public void setReadListener(ReadListener readListener) {
                    throw new UnsupportedOperationException("async reads are not supported");
                }

                @Override
                public int read() {
                    if (isFinished()) {
                        return -1;
                    }
                    return body[index++] & 0xff;
                }
            };
        }

        @Override
        public BufferedReader getReader() {
            return new BufferedReader(new InputStreamReader(getInputStream(), StandardCharsets.UTF_8));
        }
    }
}
