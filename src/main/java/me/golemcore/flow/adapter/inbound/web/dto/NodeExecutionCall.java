package me.golemcore.flow.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.Map;

/**
 * Body of {@code POST /api/workflows/{workflowId}/nodes/{nodeId}/executions}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeExecutionCall {

    private String operation;
    private String executionId;
    private Map<String, Object> input;

    @ToString.Exclude
    private Map<String, String> credentials;
}
