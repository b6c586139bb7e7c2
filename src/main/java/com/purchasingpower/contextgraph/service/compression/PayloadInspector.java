package com.purchasingpower.contextgraph.service.compression;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.contextgraph.exception.ContextValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Size measurement and deep copy of payloads through their JSON form.
 *
 * <p>A payload's size is the UTF-8 byte length of its compact JSON
 * serialization; tokens are estimated as {@code ceil(bytes / 4)}.
 */
@Component
@RequiredArgsConstructor
public class PayloadInspector {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public long sizeOf(Object value) {
        return toBytes(value).length;
    }

    public static long estimateTokens(long bytes) {
        return (bytes + 3) / 4;
    }

    public long tokensOf(Object value) {
        return estimateTokens(sizeOf(value));
    }

    /**
     * A structurally independent, mutable copy.
     */
    public Map<String, Object> deepCopy(Map<String, Object> payload) {
        try {
            return objectMapper.readValue(toBytes(payload), PAYLOAD_TYPE);
        } catch (IOException e) {
            throw new ContextValidationException("payload", "Payload cannot be copied: " + e.getMessage());
        }
    }

    public String toJson(Object value) {
        return new String(toBytes(value), StandardCharsets.UTF_8);
    }

    private byte[] toBytes(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new ContextValidationException("payload", "Payload is not serializable: " + e.getOriginalMessage());
        }
    }
}
