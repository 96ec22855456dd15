package me.golemcore.humanloop.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.humanloop.adapter.inbound.web.dto.ApiErrorResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * Maps controller failures to {@link ApiErrorResponse} bodies. Scoped to the
 * REST controllers; the event stream reports nothing through it.
 */
@ControllerAdvice(basePackages = "me.golemcore.humanloop.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    static final String INVALID_REQUEST = "invalid_request";
    static final String CONFLICT = "conflict";
    static final String INTERNAL_ERROR = "internal_error";

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        String error = status == HttpStatus.BAD_REQUEST ? INVALID_REQUEST : status.name().toLowerCase(Locale.ROOT);
        return Mono.just(ResponseEntity.status(status).body(body(status, error, ex.getReason())));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(body(HttpStatus.BAD_REQUEST, INVALID_REQUEST, ex.getMessage())));
    }

    @ExceptionHandler(IllegalStateException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalState(IllegalStateException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return Mono.just(ResponseEntity.status(HttpStatus.CONFLICT)
                .body(body(HttpStatus.CONFLICT, CONFLICT, ex.getMessage())));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, "Internal server error")));
    }

    private static ApiErrorResponse body(HttpStatus status, String error, String message) {
        return ApiErrorResponse.builder()
                .status(status.value())
                .error(error)
                .message(message)
                .build();
    }
}
