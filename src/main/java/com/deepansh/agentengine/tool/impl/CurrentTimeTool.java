package com.deepansh.agentengine.tool.impl;

import com.deepansh.agentengine.tool.AgentTool;
import com.deepansh.agentengine.tool.ToolOutput;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Returns the current date and time, optionally in a given IANA timezone and format.
 */
@Component
public class CurrentTimeTool implements AgentTool {

    private final Clock clock;

    public CurrentTimeTool(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "current_time";
    }

    @Override
    public String getDescription() {
        return "Get the current date and time. Optionally pass an IANA timezone such as "
                + "'Asia/Tokyo' and a format: 'iso8601' (default), 'date', 'time' or a Java date pattern.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "timezone", Map.of(
                                "type", "string",
                                "description", "IANA timezone id, e.g. 'UTC', 'Europe/Berlin'. Defaults to UTC."
                        ),
                        "format", Map.of(
                                "type", "string",
                                "description", "'iso8601', 'date', 'time', or a pattern like 'yyyy-MM-dd HH:mm'"
                        )
                ),
                "required", List.of()
        );
    }

    @Override
    public ToolOutput execute(Map<String, Object> arguments) {
        Object tz = arguments.get("timezone");
        Object format = arguments.get("format");

        ZoneId zone;
        try {
            zone = tz == null || tz.toString().isBlank() ? ZoneId.of("UTC") : ZoneId.of(tz.toString());
        } catch (DateTimeException e) {
            return ToolOutput.error("Error: Unknown timezone '" + tz + "'. Use an IANA id such as 'UTC' or 'Asia/Tokyo'.");
        }

        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
        try {
            return ToolOutput.success(formatter(format == null ? null : format.toString()).format(now));
        } catch (IllegalArgumentException | DateTimeException e) {
            return ToolOutput.error("Error: Invalid format '" + format + "': " + e.getMessage());
        }
    }

    private static DateTimeFormatter formatter(String format) {
        if (format == null || format.isBlank() || "iso8601".equalsIgnoreCase(format)) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME;
        }
        switch (format.toLowerCase()) {
            case "date":
                return DateTimeFormatter.ISO_LOCAL_DATE;
            case "time":
                return DateTimeFormatter.ofPattern("HH:mm:ss");
            default:
                return DateTimeFormatter.ofPattern(format);
        }
    }
}
