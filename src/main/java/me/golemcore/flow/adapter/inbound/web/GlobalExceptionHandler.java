package me.golemcore.flow.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.flow.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.flow.domain.model.NodeExecutionException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Maps controller exceptions to {@link ApiErrorResponse} bodies for every
 * inbound adapter.
 */
@ControllerAdvice(basePackages = "me.golemcore.flow.adapter.inbound")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, ex.getReason());
    }

    @ExceptionHandler(NodeExecutionException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleNodeExecution(NodeExecutionException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getCode().getHttpStatus());
        if (status.is5xxServerError()) {
            log.warn("[API] Node execution failed ({}): {}", ex.getCode(), ex.getMessage());
        } else {
            log.info("[API] Node execution rejected ({}): {}", ex.getCode(), ex.getMessage());
        }
        return respond(status, ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
