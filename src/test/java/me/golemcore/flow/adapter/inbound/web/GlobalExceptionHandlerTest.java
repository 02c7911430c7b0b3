package me.golemcore.flow.adapter.inbound.web;

import me.golemcore.flow.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.flow.domain.model.NodeErrorCode;
import me.golemcore.flow.domain.model.NodeExecutionException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void shouldUseNodeErrorCodeStatus() {
        StepVerifier.create(handler.handleNodeExecution(
                new NodeExecutionException(NodeErrorCode.UNSUPPORTED_OPERATION, "Unknown operation: x")))
                .assertNext(response -> assertError(response, 422, "Unknown operation: x"))
                .verifyComplete();
    }

    @Test
    void shouldKeepResponseStatusReason() {
        StepVerifier.create(handler.handleResponseStatus(
                new ResponseStatusException(HttpStatus.BAD_REQUEST, "Webhook path is required")))
                .assertNext(response -> assertError(response, 400, "Webhook path is required"))
                .verifyComplete();
    }

    @Test
    void shouldMapIllegalArgumentToBadRequest() {
        StepVerifier.create(handler.handleIllegalArgument(new IllegalArgumentException("bad key")))
                .assertNext(response -> assertError(response, 400, "bad key"))
                .verifyComplete();
    }

    @Test
    void shouldHideDetailsOfUnexpectedErrors() {
        StepVerifier.create(handler.handleGeneric(new IllegalStateException("secret detail")))
                .assertNext(response -> assertError(response, 500, "Internal server error"))
                .verifyComplete();
    }

    private static void assertError(ResponseEntity<ApiErrorResponse> response, int status, String message) {
        assertEquals(status, response.getStatusCode().value());
        assertEquals(status, response.getBody().getStatus());
        assertEquals(message, response.getBody().getMessage());
    }
}
