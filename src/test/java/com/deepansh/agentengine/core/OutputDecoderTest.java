package com.deepansh.agentengine.core;

import com.deepansh.agentengine.model.OutputSchema;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutputDecoderTest {

    public record Weather(String city, int temperature, List<String> tags) {
    }

    private static final Map<String, Object> WEATHER_SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of(
                    "city", Map.of("type", "string"),
                    "temperature", Map.of("type", "integer"),
                    "tags", Map.of("type", "array", "items", Map.of("type", "string")),
                    "unit", Map.of("type", "string", "enum", List.of("C", "F"))
            ),
            "required", List.of("city", "temperature")
    );

    private final OutputDecoder decoder = new OutputDecoder(new ObjectMapper());
    private final OutputSchema<Weather> schema = OutputSchema.of("weather", WEATHER_SCHEMA, Weather.class);

    @Test
    void conformingJson_decodesToRecord() throws JsonProcessingException {
        JsonNode doc = decoder.parseConforming("{\"city\":\"Tokyo\",\"temperature\":21,\"tags\":[\"sunny\"]}", schema)
                .orElseThrow();

        assertThat(decoder.decode(doc, schema)).isEqualTo(new Weather("Tokyo", 21, List.of("sunny")));
    }

    @Test
    void fencedJson_isAccepted() {
        String text = "```json\n{\"city\":\"Oslo\",\"temperature\":-3}\n```";
        assertThat(decoder.parseConforming(text, schema)).isPresent();
    }

    @Test
    void unknownProperties_areIgnoredWhenDecoding() throws JsonProcessingException {
        JsonNode doc = decoder.parseConforming("{\"city\":\"Oslo\",\"temperature\":1,\"unit\":\"C\"}", schema)
                .orElseThrow();
        assertThat(decoder.decode(doc, schema).city()).isEqualTo("Oslo");
    }

    @Test
    void prose_doesNotConform() {
        assertThat(decoder.parseConforming("The weather in Tokyo is sunny.", schema)).isEmpty();
        assertThat(decoder.parseConforming("", schema)).isEmpty();
    }

    @Test
    void violations_reportTypeRequiredItemsAndEnum() {
        ObjectMapper mapper = new ObjectMapper();
        JsonNode bad = mapper.valueToTree(Map.of(
                "temperature", "hot",
                "tags", List.of(1),
                "unit", "K"));

        assertThat(decoder.violations(bad, WEATHER_SCHEMA))
                .anySatisfy(v -> assertThat(v).contains("missing required property 'city'"))
                .anySatisfy(v -> assertThat(v).contains("$.temperature"))
                .anySatisfy(v -> assertThat(v).contains("$.tags[0]"))
                .anySatisfy(v -> assertThat(v).contains("$.unit"));
    }

    @Test
    void integerType_acceptsWholeDecimalsOnly() {
        ObjectMapper mapper = new ObjectMapper();
        Map<String, Object> intSchema = Map.of("type", "integer");

        assertThat(decoder.violations(mapper.valueToTree(3.0), intSchema)).isEmpty();
        assertThat(decoder.violations(mapper.valueToTree(3.5), intSchema)).isNotEmpty();
    }

    @Test
    void typeArray_acceptsAnyListedType() {
        ObjectMapper mapper = new ObjectMapper();
        Map<String, Object> nullable = Map.of("type", List.of("string", "null"));

        assertThat(decoder.violations(mapper.nullNode(), nullable)).isEmpty();
        assertThat(decoder.violations(mapper.valueToTree("x"), nullable)).isEmpty();
        assertThat(decoder.violations(mapper.valueToTree(1), nullable)).isNotEmpty();
    }

    @Test
    void conformingButUnbindable_throwsOnDecode() {
        Map<String, Object> loose = Map.of("type", "object");
        OutputSchema<Weather> looseSchema = OutputSchema.of("weather", loose, Weather.class);
        JsonNode doc = decoder.parseConforming("{\"temperature\":\"very hot\"}", looseSchema).orElseThrow();

        assertThatThrownBy(() -> decoder.decode(doc, looseSchema)).isInstanceOf(JsonProcessingException.class);
    }

    @Test
    void instructions_includeSchemaName() {
        assertThat(decoder.instructionsFor(schema)).contains("\"weather\"").contains("temperature");
    }
}
