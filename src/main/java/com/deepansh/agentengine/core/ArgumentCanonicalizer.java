package com.deepansh.agentengine.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.Map;

/**
 * Serializes tool arguments with object keys sorted at every level, so two calls whose
 * arguments differ only in key order or whitespace produce the same string.
 * Array order is significant; 1 and 1.0 are different values.
 */
public final class ArgumentCanonicalizer {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private ArgumentCanonicalizer() {
    }

    public static String canonicalize(Map<String, Object> arguments) {
        try {
            return CANONICAL.writeValueAsString(arguments == null ? Map.of() : arguments);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Tool arguments are not serializable", e);
        }
    }

    public static ToolCallKey keyOf(String toolName, Map<String, Object> arguments) {
        return new ToolCallKey(toolName, canonicalize(arguments));
    }
}
