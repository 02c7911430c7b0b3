package me.golemcore.flow.adapter.inbound.webhook.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /webhook-listen/{key}}: {@code clear} or {@code reset}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ListenActionRequest {
    private String action;
}
