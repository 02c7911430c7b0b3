package me.golemcore.flow.adapter.inbound.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.flow.adapter.inbound.web.dto.NodeExecutionCall;
import me.golemcore.flow.domain.model.NodeErrorCode;
import me.golemcore.flow.domain.model.NodeExecutionException;
import me.golemcore.flow.domain.model.NodeExecutionRequest;
import me.golemcore.flow.domain.node.NodeExecutorRegistry;
import me.golemcore.flow.domain.service.EventBroadcastService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletionException;

/**
 * Runs a single node for a workflow executor living outside this process.
 */
@RestController
@RequestMapping("/api/workflows/{workflowId}/nodes/{nodeId}/executions")
@RequiredArgsConstructor
@Slf4j
public class NodeExecutionController {

    private final NodeExecutorRegistry nodeExecutorRegistry;
    private final EventBroadcastService eventBroadcastService;

    @PostMapping
    public Mono<ResponseEntity<Map<String, Object>>> execute(@PathVariable String workflowId,
            @PathVariable String nodeId, @RequestBody NodeExecutionCall call) {
        String executionId = call.getExecutionId() != null && !call.getExecutionId().isBlank()
                ? call.getExecutionId()
                : UUID.randomUUID().toString();
        NodeExecutionRequest request = NodeExecutionRequest.builder()
                .workflowId(workflowId)
                .nodeId(nodeId)
                .executionId(executionId)
                .operation(call.getOperation())
                .input(call.getInput() != null ? call.getInput() : Map.of())
                .credentials(call.getCredentials() != null ? call.getCredentials() : Map.of())
                .build();

        log.info("[API] Executing node {} ({}) of workflow {}, execution {}", nodeId, call.getOperation(),
                workflowId, executionId);
        eventBroadcastService.publishExecutionStarted(workflowId, executionId);

        return Mono.defer(() -> Mono.fromFuture(nodeExecutorRegistry.execute(request)))
                .doOnNext(output -> eventBroadcastService.publishExecutionCompleted(workflowId, executionId,
                        results(nodeId, output)))
                .onErrorMap(NodeExecutionController::unwrap)
                .doOnError(error -> eventBroadcastService.publishExecutionCompleted(workflowId, executionId,
                        results(nodeId, Map.of("error", String.valueOf(error.getMessage())))))
                .map(ResponseEntity::ok);
    }

    private static Map<String, Object> results(String nodeId, Object output) {
        Map<String, Object> results = new LinkedHashMap<>();
        results.put(nodeId, output);
        return results;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        if (cause instanceof NodeExecutionException) {
            return cause;
        }
        return new NodeExecutionException(NodeErrorCode.EXECUTION_FAILED, cause.getMessage(), cause);
    }
}
