package me.golemcore.flow.domain.node;

import me.golemcore.flow.domain.model.NodeErrorCode;
import me.golemcore.flow.domain.model.NodeExecutionException;
import me.golemcore.flow.domain.model.NodeExecutionRequest;
import me.golemcore.flow.domain.service.EventBroadcastService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NodeExecutorRegistryTest {

    private NodeExecutor first;
    private NodeExecutor second;
    private EventBroadcastService events;
    private NodeExecutorRegistry registry;

    @BeforeEach
    void setUp() {
        first = mock(NodeExecutor.class);
        second = mock(NodeExecutor.class);
        when(first.supportedOperations()).thenReturn(Set.of("agent.tools", "shared"));
        when(second.supportedOperations()).thenReturn(Set.of("webhook.respond", "shared"));
        events = mock(EventBroadcastService.class);
        registry = new NodeExecutorRegistry(List.of(first, second), events);
    }

    @Test
    void shouldDispatchByOperationAndPublishOutput() throws Exception {
        Map<String, Object> output = Map.of("sent", true);
        when(second.execute(any())).thenReturn(CompletableFuture.completedFuture(output));

        Map<String, Object> result = registry.execute(request("webhook.respond")).get(1, TimeUnit.SECONDS);

        assertEquals(output, result);
        verify(events).publishNodeOutput("wf-1", "node-1", output);
    }

    @Test
    void shouldKeepFirstExecutorForSharedOperation() {
        when(first.execute(any())).thenReturn(CompletableFuture.completedFuture(Map.of()));

        registry.execute(request("shared"));

        verify(first).execute(any());
        verify(second, never()).execute(any());
    }

    @Test
    void shouldRejectUnknownOperation() {
        ExecutionException error = assertThrows(ExecutionException.class,
                () -> registry.execute(request("nope")).get(1, TimeUnit.SECONDS));

        NodeExecutionException cause = assertInstanceOf(NodeExecutionException.class, error.getCause());
        assertEquals(NodeErrorCode.UNSUPPORTED_OPERATION, cause.getCode());
        assertFalse(registry.supports("nope"));
        assertTrue(registry.supports("agent.tools"));
    }

    @Test
    void shouldNotPublishOutputOfFailedNode() {
        when(first.execute(any())).thenReturn(CompletableFuture.failedFuture(
                new NodeExecutionException(NodeErrorCode.EXECUTION_FAILED, "boom")));

        assertThrows(ExecutionException.class,
                () -> registry.execute(request("agent.tools")).get(1, TimeUnit.SECONDS));

        verify(events, never()).publishNodeOutput(anyString(), anyString(), any());
    }

    @Test
    void shouldTurnSynchronousNodeExceptionIntoFailedFuture() {
        when(first.execute(any())).thenThrow(new NodeExecutionException(NodeErrorCode.VALIDATION_ERROR, "bad"));

        CompletableFuture<Map<String, Object>> future = registry.execute(request("agent.tools"));

        assertTrue(future.isCompletedExceptionally());
    }

    private static NodeExecutionRequest request(String operation) {
        return NodeExecutionRequest.builder()
                .workflowId("wf-1")
                .nodeId("node-1")
                .operation(operation)
                .build();
    }
}
