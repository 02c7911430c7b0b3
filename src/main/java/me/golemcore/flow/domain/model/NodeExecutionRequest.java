package me.golemcore.flow.domain.model;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.util.Map;
import java.util.Optional;

/**
 * Call made by the workflow executor to run one node with its resolved input.
 */
@Data
@Builder
public class NodeExecutionRequest {

    private String workflowId;
    private String nodeId;
    private String executionId;
    private String operation;

    @Builder.Default
    private Map<String, Object> input = Map.of();

    /**
     * Connected account secrets keyed by provider ({@code openai},
     * {@code anthropic}, {@code slack}, {@code google}).
     */
    @Builder.Default
    @ToString.Exclude
    private Map<String, String> credentials = Map.of();

    public Optional<String> credential(String provider) {
        if (credentials == null || provider == null) {
            return Optional.empty();
        }
        String value = credentials.get(provider);
        return value != null && !value.isBlank() ? Optional.of(value) : Optional.empty();
    }
}
