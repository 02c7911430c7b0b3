package me.golemcore.flow.adapter.inbound.webhook.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookResponseResult {
    private boolean success;
    private boolean delivered;
}
