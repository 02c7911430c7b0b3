package me.golemcore.flow.adapter.inbound.webhook.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Reply of the listen endpoints. {@code received} and {@code data} are only
 * present on poll replies.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebhookListenResponse {

    private boolean success;
    private Boolean received;
    private Map<String, Object> data;
    private String message;

    public static WebhookListenResponse received(Map<String, Object> data) {
        return WebhookListenResponse.builder().success(true).received(true).data(data).build();
    }

    public static WebhookListenResponse notReceived(String message) {
        return WebhookListenResponse.builder().success(true).received(false).message(message).build();
    }

    public static WebhookListenResponse action(boolean success, String message) {
        return WebhookListenResponse.builder().success(success).message(message).build();
    }
}
