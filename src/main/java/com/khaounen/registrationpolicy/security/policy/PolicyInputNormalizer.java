package com.khaounen.registrationpolicy.security.policy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.khaounen.registrationpolicy.utils.IpUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Checks a raw request against the input contract and turns it into a
 * {@link PolicyInput}. Client metadata is carried over key for key.
 */
public class PolicyInputNormalizer {

    public static final String CLIENT_METADATA = "client_metadata";
    public static final String REQUESTER = "requester";
    public static final String IP_ADDRESS = "ip_address";
    public static final String USER_AGENT = "user_agent";

    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public PolicyInputNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public PolicyInput normalize(String json) {
        if (json == null || json.isBlank()) {
            throw new PolicyInputException("request body is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new PolicyInputException("request is not valid JSON", ex);
        }
        return normalize(root);
    }

    public PolicyInput normalize(Map<String, ?> request) {
        if (request == null) {
            throw new PolicyInputException("request must be a JSON object");
        }
        return normalize((JsonNode) objectMapper.valueToTree(request));
    }

    public PolicyInput normalize(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new PolicyInputException("request must be a JSON object");
        }
        JsonNode metadataNode = root.get(CLIENT_METADATA);
        if (metadataNode == null) {
            throw new PolicyInputException("missing required field '" + CLIENT_METADATA + "'");
        }
        if (!metadataNode.isObject()) {
            throw new PolicyInputException("'" + CLIENT_METADATA + "' must be an object");
        }
        JsonNode requesterNode = root.get(REQUESTER);
        if (requesterNode == null) {
            throw new PolicyInputException("missing required field '" + REQUESTER + "'");
        }
        if (!requesterNode.isObject()) {
            throw new PolicyInputException("'" + REQUESTER + "' must be an object");
        }

        Map<String, Object> metadata = objectMapper.convertValue(metadataNode, METADATA_TYPE);
        return new PolicyInput(ClientMetadata.of(metadata), requester(requesterNode));
    }

    private static Requester requester(JsonNode node) {
        String ip = optionalText(node, IP_ADDRESS);
        if (ip != null && !IpUtils.isIpLiteral(ip)) {
            throw new PolicyInputException("'" + IP_ADDRESS + "' is not a valid IPv4 or IPv6 address");
        }
        String userAgent = optionalText(node, USER_AGENT);
        if (ip == null && userAgent == null) {
            return Requester.unknown();
        }
        return new Requester(ip, userAgent);
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new PolicyInputException("'" + field + "' must be a string");
        }
        return value.textValue();
    }
}
