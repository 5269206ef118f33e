package com.testplatform.request;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Decodes request payloads received from clients as JSON.
 * Property names follow the PascalCase wire format, e.g.
 * <pre>
 * {"Sources": ["a.dll"], "RunSettings": "&lt;RunSettings/&gt;", "TestPlatformOptions": {"TestCaseFilter": "Priority=1"}}
 * </pre>
 */
public class PayloadReader {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private PayloadReader() {
    }

    public static DiscoveryRequestPayload readDiscoveryPayload(String json) {
        return read(json, DiscoveryRequestPayload.class);
    }

    public static TestRunRequestPayload readRunPayload(String json) {
        return read(json, TestRunRequestPayload.class);
    }

    public static ProtocolConfig readProtocolConfig(String json) {
        return read(json, ProtocolConfig.class);
    }

    private static <T> T read(String json, Class<T> type) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Empty " + type.getSimpleName() + " payload");
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON payload: " + e.getOriginalMessage(), e);
        }
    }
}
