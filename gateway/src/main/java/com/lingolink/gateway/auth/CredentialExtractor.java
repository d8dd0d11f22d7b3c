package com.lingolink.gateway.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.lingolink.core.util.JsonUtils;

import java.util.List;
import java.util.Map;

/**
 * Pulls a bearer credential out of an {@code authenticate} payload or a handshake
 * request.
 */
public final class CredentialExtractor {
    private CredentialExtractor() {
    }

    private static final List<String> PAYLOAD_FIELDS = List.of("token", "idToken", "accessToken");
    private static final List<String> QUERY_PARAMS = List.of("token", "access_token");

    /**
     * @param data payload of an {@code authenticate} frame: a string, or an object with
     *             {@code token}, {@code idToken} or {@code accessToken}
     * @return the credential, or {@code null} when none is present
     */
    public static String fromPayload(JsonNode data) {
        if (data == null || data.isNull()) {
            return null;
        }
        if (data.isTextual()) {
            return blankToNull(data.asText());
        }
        for (String field : PAYLOAD_FIELDS) {
            String value = JsonUtils.textField(data, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * @param authorization value of the {@code Authorization} header, may be {@code null}
     * @param query         decoded query parameters of the upgrade request
     * @return the credential, or {@code null} when the handshake carried none
     */
    public static String fromHandshake(String authorization, Map<String, List<String>> query) {
        String fromHeader = fromAuthorizationHeader(authorization);
        if (fromHeader != null) {
            return fromHeader;
        }
        if (query == null) {
            return null;
        }
        for (String param : QUERY_PARAMS) {
            List<String> values = query.get(param);
            if (values != null && !values.isEmpty()) {
                String value = blankToNull(values.get(0));
                if (value != null) {
                    return value;
                }
            }
        }
        return null;
    }

    static String fromAuthorizationHeader(String authorization) {
        String header = blankToNull(authorization);
        if (header == null) {
            return null;
        }
        String[] parts = header.split("\\s+");
        if (parts.length == 2 && "bearer".equalsIgnoreCase(parts[0])) {
            return parts[1];
        }
        return parts.length == 1 ? parts[0] : null;
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
