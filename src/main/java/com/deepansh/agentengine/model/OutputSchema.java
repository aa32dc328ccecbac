package com.deepansh.agentengine.model;

import java.util.Map;
import java.util.Objects;

/**
 * Target shape of a run's final answer: a JSON Schema (as a Map, the same form tools use
 * for their input schemas) plus the Java type the conforming document is bound to.
 */
public record OutputSchema<T>(String name, Map<String, Object> jsonSchema, Class<T> type) {

    public OutputSchema {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(jsonSchema, "jsonSchema");
        Objects.requireNonNull(type, "type");
        jsonSchema = Map.copyOf(jsonSchema);
    }

    public static <T> OutputSchema<T> of(String name, Map<String, Object> jsonSchema, Class<T> type) {
        return new OutputSchema<>(name, jsonSchema, type);
    }

    /** Schema whose conforming documents are handed back as plain maps. */
    @SuppressWarnings("unchecked")
    public static OutputSchema<Map<String, Object>> untyped(String name, Map<String, Object> jsonSchema) {
        return new OutputSchema<>(name, jsonSchema, (Class<Map<String, Object>>) (Class<?>) Map.class);
    }
}
