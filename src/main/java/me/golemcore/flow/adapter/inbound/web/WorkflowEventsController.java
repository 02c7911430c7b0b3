package me.golemcore.flow.adapter.inbound.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.flow.domain.service.EventBroadcastService;
import me.golemcore.flow.domain.service.EventSubscription;
import me.golemcore.flow.infrastructure.config.FlowProperties;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.time.Duration;

/**
 * Server-sent event stream of one workflow's execution progress.
 *
 * <p>
 * Each frame is a JSON object with {@code type}, {@code nodeId} and
 * {@code timestamp}. A comment frame keeps idle connections open.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class WorkflowEventsController {

    private static final String HEARTBEAT = "heartbeat";

    private final EventBroadcastService eventBroadcastService;
    private final FlowProperties properties;

    @GetMapping(path = "/workflow/{workflowId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<Object>> events(@PathVariable String workflowId, ServerHttpResponse response) {
        response.getHeaders().setCacheControl(CacheControl.noCache());
        Duration heartbeat = Duration.ofMillis(Math.max(1, properties.getEvents().getHeartbeatIntervalMs()));

        return Flux.defer(() -> {
            EventSubscription subscription = eventBroadcastService.subscribe(workflowId);
            Flux<ServerSentEvent<Object>> frames = subscription.events()
                    .map(event -> ServerSentEvent.<Object>builder(event.toWireMap()).build());
            return frames
                    .publish(shared -> Flux.merge(shared, heartbeats(heartbeat).takeUntilOther(shared.then())))
                    .doFinally(signal -> {
                        log.debug("[Hub] Stream for workflow {} ended ({})", workflowId, signal);
                        eventBroadcastService.unsubscribe(subscription);
                    });
        });
    }

    private static Flux<ServerSentEvent<Object>> heartbeats(Duration interval) {
        return Flux.interval(interval, interval)
                .map(tick -> ServerSentEvent.<Object>builder().comment(HEARTBEAT).build());
    }
}
