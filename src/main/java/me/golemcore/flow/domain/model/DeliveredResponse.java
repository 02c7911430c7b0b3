package me.golemcore.flow.domain.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * HTTP response artifact produced by a workflow for a waiting webhook caller.
 * Consumed exactly once.
 */
@Data
@Builder
public class DeliveredResponse {

    public static final String DEFAULT_CONTENT_TYPE = "application/json";

    private String pathKey;

    @Builder.Default
    private int statusCode = 200;

    @Builder.Default
    private Map<String, String> headers = Map.of();

    private Object body;
    private Instant deliveredAt;

    /**
     * Case-insensitive header lookup.
     */
    public String header(String name) {
        if (headers == null || name == null) {
            return null;
        }
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (name.equalsIgnoreCase(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    public String contentType() {
        String contentType = header("Content-Type");
        return contentType != null && !contentType.isBlank() ? contentType : DEFAULT_CONTENT_TYPE;
    }
}
