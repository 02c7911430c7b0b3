package me.golemcore.flow.adapter.inbound.webhook.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Response handed over by an out-of-process executor for a waiting webhook
 * caller.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookResponseRequest {

    /** Defaults to 200. */
    private Integer statusCode;

    private Map<String, String> headers;

    /** Written raw when a string, as JSON otherwise. */
    private Object body;
}
