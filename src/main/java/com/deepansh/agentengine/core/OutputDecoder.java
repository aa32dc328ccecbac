package com.deepansh.agentengine.core;

import com.deepansh.agentengine.model.OutputSchema;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks model text against an {@link OutputSchema} and binds conforming documents to the target type.
 *
 * Supported keywords: type (including arrays of types), properties, required, items, enum.
 * Anything else in the schema is ignored.
 */
public class OutputDecoder {

    private static final Pattern FENCE = Pattern.compile("^```[a-zA-Z]*\\s*(.*?)\\s*```$", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public OutputDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /** Removes a surrounding Markdown code fence such as ```json ... ```. */
    public static String stripFence(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        Matcher m = FENCE.matcher(trimmed);
        return m.matches() ? m.group(1) : trimmed;
    }

    /**
     * @return the parsed document when {@code text} is JSON that conforms to the schema
     */
    public Optional<JsonNode> parseConforming(String text, OutputSchema<?> schema) {
        String candidate = stripFence(text);
        if (candidate.isEmpty()) {
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(candidate);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (node == null || node.isMissingNode()) {
            return Optional.empty();
        }
        return violations(node, schema.jsonSchema()).isEmpty() ? Optional.of(node) : Optional.empty();
    }

    public <T> T decode(JsonNode document, OutputSchema<T> schema) throws JsonProcessingException {
        return objectMapper.treeToValue(document, schema.type());
    }

    public String toJson(JsonNode document) {
        return document.toString();
    }

    /** Every way {@code node} fails {@code schema}; empty when it conforms. */
    public List<String> violations(JsonNode node, Map<String, Object> schema) {
        List<String> errors = new ArrayList<>();
        check(node, schema, "$", errors);
        return errors;
    }

    /** Instruction block appended to the system prompt so the model knows the answer format. */
    public String instructionsFor(OutputSchema<?> schema) {
        String json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(schema.jsonSchema());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Output schema '" + schema.name() + "' is not serializable", e);
        }
        return "When you have the final answer, reply with only a JSON document (no prose, no code fence) "
                + "that conforms to this JSON Schema named \"" + schema.name() + "\":\n" + json;
    }

    @SuppressWarnings("unchecked")
    private void check(JsonNode node, Map<String, Object> schema, String path, List<String> errors) {
        Object type = schema.get("type");
        if (type != null && !matchesType(node, type)) {
            errors.add(path + ": expected " + type + " but was " + node.getNodeType().name().toLowerCase());
            return;
        }

        Object allowed = schema.get("enum");
        if (allowed instanceof Collection<?> values && values.stream().noneMatch(v -> sameValue(node, v))) {
            errors.add(path + ": " + node + " is not one of " + values);
        }

        if (node.isObject()) {
            Object required = schema.get("required");
            if (required instanceof Collection<?> names) {
                for (Object name : names) {
                    if (!node.has(String.valueOf(name))) {
                        errors.add(path + ": missing required property '" + name + "'");
                    }
                }
            }
            Object properties = schema.get("properties");
            if (properties instanceof Map<?, ?> props) {
                Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    Object propSchema = props.get(field.getKey());
                    if (propSchema instanceof Map<?, ?> sub) {
                        check(field.getValue(), (Map<String, Object>) sub, path + "." + field.getKey(), errors);
                    }
                }
            }
        }

        if (node.isArray() && schema.get("items") instanceof Map<?, ?> items) {
            for (int i = 0; i < node.size(); i++) {
                check(node.get(i), (Map<String, Object>) items, path + "[" + i + "]", errors);
            }
        }
    }

    private boolean matchesType(JsonNode node, Object type) {
        if (type instanceof Collection<?> types) {
            return types.stream().anyMatch(t -> matchesType(node, t));
        }
        switch (String.valueOf(type)) {
            case "object":
                return node.isObject();
            case "array":
                return node.isArray();
            case "string":
                return node.isTextual();
            case "number":
                return node.isNumber();
            case "integer":
                return node.isIntegralNumber()
                        || (node.isNumber() && node.decimalValue().stripTrailingZeros().scale() <= 0);
            case "boolean":
                return node.isBoolean();
            case "null":
                return node.isNull();
            default:
                return true;
        }
    }

    private boolean sameValue(JsonNode node, Object expected) {
        JsonNode expectedNode = expected == null ? objectMapper.nullNode() : objectMapper.valueToTree(expected);
        if (node.isNumber() && expectedNode.isNumber()) {
            BigDecimal a = node.decimalValue();
            BigDecimal b = expectedNode.decimalValue();
            return a.compareTo(b) == 0;
        }
        return node.equals(expectedNode);
    }
}
