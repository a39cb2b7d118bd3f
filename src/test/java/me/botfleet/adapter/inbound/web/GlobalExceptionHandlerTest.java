package me.botfleet.adapter.inbound.web;

import me.botfleet.adapter.inbound.web.dto.ApiErrorResponse;
import me.botfleet.domain.model.InstanceNotFoundException;
import me.botfleet.domain.model.InvalidReferenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldHandleResponseStatusException() {
        ResponseStatusException ex = new ResponseStatusException(HttpStatus.NOT_FOUND, "Template 'x' not found");

        expect(handler.handleResponseStatus(ex), HttpStatus.NOT_FOUND, "not_found", "Template 'x' not found");
    }

    @Test
    void shouldMapInvalidReferenceToConfigError() {
        InvalidReferenceException ex = InvalidReferenceException.unknown("credential", "cred-9");

        expect(handler.handleInvalidReference(ex), HttpStatus.BAD_REQUEST, "config_error", ex.getMessage());
    }

    @Test
    void shouldMapUnknownInstanceToNotFound() {
        InstanceNotFoundException ex = new InstanceNotFoundException("grug-1");

        expect(handler.handleNotFound(ex), HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
    }

    @Test
    void shouldHandleIllegalArgumentException() {
        IllegalArgumentException ex = new IllegalArgumentException("Template id must match [a-z0-9][a-z0-9_-]{0,63}");

        expect(handler.handleIllegalArgument(ex), HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    @Test
    void shouldHandleIllegalStateException() {
        IllegalStateException ex = new IllegalStateException("Instance 'grug-1' already exists");

        expect(handler.handleIllegalState(ex), HttpStatus.CONFLICT, "conflict", ex.getMessage());
    }

    @Test
    void shouldUnwrapCompletionExceptionFromOrchestratorFutures() {
        CompletionException wrappedConflict = new CompletionException(new IllegalStateException("in use"));
        CompletionException wrappedConfig = new CompletionException(
                InvalidReferenceException.unknown("template", "nope"));
        CompletionException wrappedMissing = new CompletionException(new InstanceNotFoundException("x"));

        expect(handler.handleCompletion(wrappedConflict), HttpStatus.CONFLICT, "conflict", "in use");
        expect(handler.handleCompletion(wrappedConfig), HttpStatus.BAD_REQUEST, "config_error",
                wrappedConfig.getCause().getMessage());
        expect(handler.handleCompletion(wrappedMissing), HttpStatus.NOT_FOUND, "not_found",
                wrappedMissing.getCause().getMessage());
    }

    @Test
    void shouldHideDetailsOfUnexpectedFailures() {
        expect(handler.handleGeneric(new RuntimeException("NPE somewhere")), HttpStatus.INTERNAL_SERVER_ERROR,
                "internal_error", "Internal server error");
        expect(handler.handleCompletion(new CompletionException(new RuntimeException("boom"))),
                HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Internal server error");
    }

    private static void expect(Mono<ResponseEntity<ApiErrorResponse>> result, HttpStatus status, String error,
            String message) {
        StepVerifier.create(result)
                .assertNext(response -> {
                    assertEquals(status, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(status.value(), body.getStatus());
                    assertEquals(error, body.getError());
                    assertEquals(message, body.getMessage());
                })
                .verifyComplete();
    }
}
