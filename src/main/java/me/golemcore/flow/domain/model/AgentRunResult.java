package me.golemcore.flow.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final summary of an agent run. Always structurally complete, whatever the
 * terminal status.
 */
@Data
@Builder
public class AgentRunResult {

    private String answer;
    private AgentRunStatus status;
    private int iterations;
    private String error;

    @Builder.Default
    private List<ToolCallRecord> toolCalls = List.of();

    @Builder.Default
    private List<Message> messages = List.of();

    /**
     * Node output consumed by downstream workflow steps. {@code output} mirrors
     * {@code answer}.
     */
    public Map<String, Object> toOutput() {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("answer", answer);
        output.put("output", answer);
        output.put("toolCalls", toolCalls.stream().map(ToolCallRecord::toOutputMap).toList());
        output.put("iterations", iterations);
        output.put("status", status.getWireName());
        output.put("messages", messages.stream().map(Message::toOutputMap).toList());
        if (error != null) {
            output.put("error", error);
        }
        return output;
    }
}
