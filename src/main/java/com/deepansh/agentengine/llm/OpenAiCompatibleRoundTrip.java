package com.deepansh.agentengine.llm;

import com.deepansh.agentengine.model.Message;
import com.deepansh.agentengine.model.OutputSchema;
import com.deepansh.agentengine.model.ProviderRequest;
import com.deepansh.agentengine.model.ProviderResponse;
import com.deepansh.agentengine.model.StopReason;
import com.deepansh.agentengine.model.TokenUsage;
import com.deepansh.agentengine.model.ToolCall;
import com.deepansh.agentengine.tool.ToolDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Round trip against an OpenAI-compatible chat completions endpoint: Groq, OpenAI and Gemini.
 *
 * Failures are classified for the retry layer:
 *
 * | Error                    | Kind                                           |
 * |--------------------------|------------------------------------------------|
 * | 429                      | RATE_LIMITED, response headers attached        |
 * | 408, 5xx, network error  | SERVER_ERROR                                   |
 * | 401/403                  | FATAL, invalid key                             |
 * | 400 model_decommissioned | FATAL with loud guidance in the log            |
 * | other 4xx, bad payload   | FATAL                                          |
 */
@Slf4j
public class OpenAiCompatibleRoundTrip implements ProviderRoundTrip {

    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {};

    private final LlmProviderProperties props;
    private final ObjectMapper objectMapper;
    private final String providerName;
    private final RestClient restClient;

    public OpenAiCompatibleRoundTrip(LlmProviderProperties props,
                                     ObjectMapper objectMapper,
                                     String providerName,
                                     RestClient.Builder restClientBuilder) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.providerName = providerName;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public ProviderResponse execute(ProviderRequest request) {
        Map<String, Object> requestBody = buildRequestBody(request);

        log.debug("Sending {} messages to {} [model={}, tools={}]",
                request.getMessages().size(), providerName, props.getModel(), request.getTools().size());

        Map<String, Object> response;
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        handle4xxError(body, res.getStatusCode().value(), res.getHeaders());
                    })
                    .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 5xx [{}]: {}", providerName, res.getStatusCode(), body);
                        throw new ProviderException(FailureKind.SERVER_ERROR, res.getStatusCode().value(),
                                providerName + " server error [" + res.getStatusCode().value() + "]: " + body,
                                res.getHeaders(), null, null);
                    })
                    .body(new ParameterizedTypeReference<>() {});
        } catch (ResourceAccessException e) {
            throw ProviderException.serverError(0, providerName + " unreachable: " + e.getMessage(), e);
        }

        if (response == null) {
            throw ProviderException.fatal(200, providerName + " returned an empty body", null);
        }
        return parseResponse(response);
    }

    /**
     * Maps 4xx codes to failure kinds. Only 429 and 408 are worth another attempt.
     */
    private void handle4xxError(String body, int statusCode, HttpHeaders headers) {
        if (statusCode == 429) {
            log.warn("{} rate limited [429]: {}", providerName, body);
            throw ProviderException.rateLimited(providerName + " rate limit exceeded", copyOf(headers));
        }
        if (statusCode == 408) {
            log.warn("{} request timeout [408]", providerName);
            throw new ProviderException(FailureKind.SERVER_ERROR, 408,
                    providerName + " request timeout", copyOf(headers), null, null);
        }

        log.error("{} 4xx [{}]: {}", providerName, statusCode, body);

        // Configuration error, so make it impossible to miss in the log.
        if (body.contains("model_decommissioned")) {
            log.error("================================================================");
            log.error("  MODEL DECOMMISSIONED: {} is no longer supported.", props.getModel());
            log.error("  Update llm.providers.{}.model in application.yml", providerName);
            log.error("================================================================");
            throw ProviderException.fatal(statusCode,
                    "Model '" + props.getModel() + "' is decommissioned on " + providerName, null);
        }

        if (statusCode == 401 || statusCode == 403) {
            throw ProviderException.fatal(statusCode,
                    providerName + " API key is invalid. Check your "
                            + providerName.toUpperCase() + "_API_KEY environment variable.", null);
        }

        throw ProviderException.fatal(statusCode,
                providerName + " client error [" + statusCode + "]: " + body, null);
    }

    private static HttpHeaders copyOf(HttpHeaders headers) {
        HttpHeaders copy = new HttpHeaders();
        copy.putAll(headers);
        return HttpHeaders.readOnlyHttpHeaders(copy);
    }

    Map<String, Object> buildRequestBody(ProviderRequest request) {
        List<Map<String, Object>> formattedMessages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            formattedMessages.add(Map.of("role", "system", "content", request.getSystemPrompt()));
        }
        request.getMessages().stream().map(this::formatMessage).forEach(formattedMessages::add);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", props.getMaxTokens());
        body.put("temperature", props.getTemperature());
        body.put("messages", formattedMessages);

        List<ToolDefinition> tools = request.getTools();
        if (!tools.isEmpty()) {
            body.put("tools", tools.stream().map(ToolDefinition::toOpenAiSchema).toList());
            if (request.getToolChoice() != null) {
                body.put("tool_choice", request.getToolChoice().wireValue());
            }
        } else if (request.getResponseSchema() != null && props.isNativeStructuredOutput()) {
            body.put("response_format", responseFormat(request.getResponseSchema()));
        }

        return body;
    }

    private static Map<String, Object> responseFormat(OutputSchema<?> schema) {
        return Map.of(
                "type", "json_schema",
                "json_schema", Map.of(
                        "name", schema.name(),
                        "schema", schema.jsonSchema()
                )
        );
    }

    private Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new HashMap<>();
        m.put("role", msg.getRole().name());

        if (msg.getRole() == Message.Role.tool) {
            m.put("tool_call_id", msg.getToolCallId());
            m.put("content", msg.getContent() != null ? msg.getContent() : "");
        } else if (msg.getRole() == Message.Role.assistant) {
            // An assistant turn that made tool calls must carry them, or the provider
            // cannot correlate the tool results that follow.
            m.put("content", msg.getContent());
            if (msg.hasToolCalls()) {
                m.put("tool_calls", msg.getToolCalls().stream().map(this::formatToolCall).toList());
            }
        } else {
            m.put("content", msg.getContent() != null ? msg.getContent() : "");
        }
        return m;
    }

    private Map<String, Object> formatToolCall(ToolCall tc) {
        Map<String, Object> fn = new HashMap<>();
        fn.put("name", tc.getToolName());
        try {
            fn.put("arguments", objectMapper.writeValueAsString(
                    tc.getArguments() == null ? Map.of() : tc.getArguments()));
        } catch (JsonProcessingException e) {
            throw ProviderException.fatal(0, "Could not serialize arguments of tool call " + tc.getId(), e);
        }

        Map<String, Object> tcMap = new HashMap<>();
        tcMap.put("id", tc.getId());
        tcMap.put("type", "function");
        tcMap.put("function", fn);
        return tcMap;
    }

    @SuppressWarnings("unchecked")
    ProviderResponse parseResponse(Map<String, Object> response) {
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw ProviderException.fatal(200, providerName + " returned no choices in response", null);
        }

        TokenUsage usage = TokenUsage.ZERO;
        Map<String, Object> usageMap = (Map<String, Object>) response.get("usage");
        if (usageMap != null) {
            usage = new TokenUsage(
                    ((Number) usageMap.getOrDefault("prompt_tokens", 0)).intValue(),
                    ((Number) usageMap.getOrDefault("completion_tokens", 0)).intValue());
            log.debug("Token usage: prompt={} completion={}", usage.inputTokens(), usage.outputTokens());
        }

        Map<String, Object> choice = choices.get(0);
        Map<String, Object> message = (Map<String, Object>) choice.get("message");
        String finishReason = (String) choice.get("finish_reason");
        log.debug("{} finish_reason: {}", providerName, finishReason);

        ProviderResponse.ProviderResponseBuilder builder = ProviderResponse.builder()
                .usage(usage)
                .model((String) response.get("model"));

        if (message != null) {
            Object content = message.get("content");
            if (content instanceof String text && !text.isEmpty()) {
                builder.textBlock(text);
            }
            List<Map<String, Object>> toolCalls = (List<Map<String, Object>>) message.get("tool_calls");
            if (toolCalls != null) {
                toolCalls.forEach(tc -> builder.toolCall(parseToolCall(tc)));
            }
        }

        ProviderResponse parsed = builder.build();
        return parsed.toBuilder().stopReason(stopReason(finishReason, parsed.hasToolCalls())).build();
    }

    @SuppressWarnings("unchecked")
    private ToolCall parseToolCall(Map<String, Object> tc) {
        Map<String, Object> function = (Map<String, Object>) tc.get("function");
        if (function == null) {
            throw ProviderException.fatal(200, providerName + " returned a tool call without a function", null);
        }
        Object rawArgs = function.get("arguments");
        Map<String, Object> args;
        if (rawArgs instanceof Map<?, ?> map) {
            args = (Map<String, Object>) map;
        } else if (rawArgs == null || rawArgs.toString().isBlank()) {
            args = Map.of();
        } else {
            try {
                args = objectMapper.readValue(rawArgs.toString(), ARGS_TYPE);
            } catch (JsonProcessingException e) {
                throw ProviderException.fatal(200,
                        "Failed to parse arguments of tool '" + function.get("name") + "'", e);
            }
        }
        return ToolCall.builder()
                .id((String) tc.get("id"))
                .toolName((String) function.get("name"))
                .arguments(args == null ? Map.of() : args)
                .build();
    }

    private static StopReason stopReason(String finishReason, boolean hasToolCalls) {
        if (finishReason == null) {
            return hasToolCalls ? StopReason.TOOL_USE : StopReason.END_TURN;
        }
        return switch (finishReason) {
            case "tool_calls", "function_call" -> StopReason.TOOL_USE;
            case "length" -> StopReason.MAX_TOKENS;
            case "stop" -> hasToolCalls ? StopReason.TOOL_USE : StopReason.END_TURN;
            default -> StopReason.STOP_SEQUENCE;
        };
    }
}
