package me.golemcore.flow.domain.model;

import lombok.Builder;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Transient progress event for one workflow. Never stored; only forwarded to
 * the subscriptions open at publish time.
 */
@Builder
public record FlowEvent(FlowEventType type, String nodeId, Instant timestamp, Map<String, Object> payload) {

    public static FlowEvent of(FlowEventType type, String nodeId, Instant timestamp, Map<String, Object> payload) {
        return new FlowEvent(type, nodeId, timestamp, payload != null ? payload : Map.of());
    }

    /**
     * Flat JSON shape of the frame: {@code type}, {@code nodeId},
     * {@code timestamp} followed by the type-specific fields.
     */
    public Map<String, Object> toWireMap() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("type", type.getWireName());
        if (nodeId != null) {
            wire.put("nodeId", nodeId);
        }
        if (timestamp != null) {
            wire.put("timestamp", timestamp.toString());
        }
        if (payload != null) {
            payload.forEach((key, value) -> {
                if (value != null) {
                    wire.put(key, value);
                }
            });
        }
        return wire;
    }
}
