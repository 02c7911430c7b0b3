package me.golemcore.flow.domain.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Audit entry for one tool invocation made during an agent run.
 */
public record ToolCallRecord(String tool, Map<String, Object> input, Object output, boolean success,
        Instant timestamp) {

    public Map<String, Object> toOutputMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("tool", tool);
        map.put("input", input != null ? input : Map.of());
        map.put("output", output);
        map.put("success", success);
        map.put("timestamp", timestamp != null ? timestamp.toEpochMilli() : null);
        return map;
    }
}
