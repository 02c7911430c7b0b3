package me.golemcore.flow.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw webhook payload as captured by the inbound endpoint. Sensitive headers
 * ({@code cookie}, {@code authorization}) are already stripped.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundEvent {

    private Object body;
    private Map<String, Object> query;
    private Map<String, String> headers;
    private String method;
    private String path;
    private Instant timestamp;

    /**
     * JSON shape handed to listeners and to the {@code webhook_received} event.
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("body", body != null ? body : Map.of());
        payload.put("query", query != null ? query : Map.of());
        payload.put("headers", headers != null ? headers : Map.of());
        payload.put("method", method);
        payload.put("path", path);
        payload.put("timestamp", timestamp != null ? timestamp.toString() : null);
        return payload;
    }
}
