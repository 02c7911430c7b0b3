package me.golemcore.flow.domain.model;

/**
 * Position of a run in the reason, act, observe cycle.
 */
public enum AgentStep {
    REASON, ACT, OBSERVE, COMPLETE
}
