package me.golemcore.flow.adapter.inbound.webhook.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Acknowledgment returned to a webhook caller when the workflow produced no
 * response in time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebhookAck {

    @Builder.Default
    private boolean success = true;

    private String message;
    private String path;
    private String method;
    private String timestamp;
}
