package me.golemcore.flow.domain.model;

/**
 * Kinds of progress events streamed to workflow observers. The wire name is the
 * {@code type} field of the emitted JSON frame.
 */
public enum FlowEventType {

    CONNECTED("connected"),
    AGENT_START("agent_start"),
    AGENT_THINKING("agent_thinking"),
    AGENT_TOOL_START("agent_tool_start"),
    AGENT_TOOL_END("agent_tool_end"),
    AGENT_COMPLETE("agent_complete"),
    AGENT_ERROR("agent_error"),
    NODE_OUTPUT("node_output"),
    WEBHOOK_RECEIVED("webhook_received"),
    EXECUTION_STARTED("execution_started"),
    EXECUTION_COMPLETED("execution_completed");

    private final String wireName;

    FlowEventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
