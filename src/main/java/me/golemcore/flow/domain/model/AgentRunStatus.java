package me.golemcore.flow.domain.model;

public enum AgentRunStatus {

    COMPLETED("completed"),
    MAX_ITERATIONS("max_iterations"),
    ERROR("error");

    private final String wireName;

    AgentRunStatus(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
