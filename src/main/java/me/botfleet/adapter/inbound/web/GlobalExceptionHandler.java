package me.botfleet.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.botfleet.adapter.inbound.web.dto.ApiErrorResponse;
import me.botfleet.domain.model.InvalidReferenceException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletionException;

/**
 * Maps domain exceptions raised by the management controllers to
 * {@link ApiErrorResponse} bodies.
 */
@ControllerAdvice(basePackages = "me.botfleet.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, status.name().toLowerCase(Locale.ROOT), ex.getReason());
    }

    @ExceptionHandler(InvalidReferenceException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleInvalidReference(InvalidReferenceException ex) {
        log.warn("[API] Config error ({} '{}'): {}", ex.getReferenceType(), ex.getReference(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "config_error", ex.getMessage());
    }

    @ExceptionHandler(NoSuchElementException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleNotFound(NoSuchElementException ex) {
        log.warn("[API] Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalState(IllegalStateException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "conflict", ex.getMessage());
    }

    @ExceptionHandler(CompletionException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleCompletion(CompletionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof InvalidReferenceException invalid) {
            return handleInvalidReference(invalid);
        }
        if (cause instanceof NoSuchElementException missing) {
            return handleNotFound(missing);
        }
        if (cause instanceof IllegalArgumentException badRequest) {
            return handleIllegalArgument(badRequest);
        }
        if (cause instanceof IllegalStateException conflict) {
            return handleIllegalState(conflict);
        }
        return handleGeneric(ex);
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Internal server error");
    }

    private static Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String error, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .error(error)
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
