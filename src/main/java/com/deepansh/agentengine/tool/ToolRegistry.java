package com.deepansh.agentengine.tool;

import com.deepansh.agentengine.exception.AgentException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of the tools a run may call, indexed by name.
 *
 * Spring auto-discovers every @Component that implements AgentTool and injects them
 * as a List&lt;AgentTool&gt;. {@link #select(Collection)} narrows the set for a single run.
 * Read-only once built, so one registry can be shared across concurrent runs.
 */
@Component
@Slf4j
public class ToolRegistry {

    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {};

    private final Map<String, AgentTool> tools;
    private final ObjectMapper objectMapper;

    @Autowired
    public ToolRegistry(List<AgentTool> toolBeans, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        Map<String, AgentTool> indexed = new LinkedHashMap<>();
        toolBeans.forEach(tool -> {
            if (indexed.putIfAbsent(tool.getName(), tool) != null) {
                throw new AgentException("Duplicate tool name: " + tool.getName());
            }
            log.info("Registered tool: [{}]", tool.getName());
        });
        this.tools = Map.copyOf(indexed);
        log.info("Total tools registered: {}", tools.size());
    }

    private ToolRegistry(Map<String, AgentTool> tools, ObjectMapper objectMapper) {
        this.tools = tools;
        this.objectMapper = objectMapper;
    }

    public Optional<ToolExecutor> lookup(String name) {
        AgentTool tool = name == null ? null : tools.get(name);
        if (tool == null) {
            return Optional.empty();
        }
        return Optional.of(argumentsJson -> {
            Map<String, Object> args = argumentsJson == null || argumentsJson.isBlank()
                    ? Map.of()
                    : objectMapper.readValue(argumentsJson, ARGS_TYPE);
            log.debug("Tool [{}] invoked with args: {}", name, args);
            return tool.execute(args == null ? Map.of() : args);
        });
    }

    public List<ToolDefinition> getAllDefinitions() {
        return tools.values().stream()
                .sorted((a, b) -> a.getName().compareTo(b.getName()))
                .map(ToolDefinition::from)
                .toList();
    }

    /**
     * A registry holding only the named tools. Null or empty means all of them.
     *
     * @throws IllegalArgumentException for a name that is not registered
     */
    public ToolRegistry select(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return this;
        }
        Map<String, AgentTool> subset = new LinkedHashMap<>();
        for (String n : names) {
            AgentTool tool = tools.get(n);
            if (tool == null) {
                throw new IllegalArgumentException("Unknown tool '" + n + "'. Available tools: " + tools.keySet());
            }
            subset.put(n, tool);
        }
        return new ToolRegistry(Map.copyOf(subset), objectMapper);
    }

    public boolean hasTool(String name) {
        return tools.containsKey(name);
    }

    public int toolCount() {
        return tools.size();
    }
}
