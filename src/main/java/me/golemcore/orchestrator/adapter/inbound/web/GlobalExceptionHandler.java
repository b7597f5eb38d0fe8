package me.golemcore.orchestrator.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.orchestrator.domain.exception.ErrorCode;
import me.golemcore.orchestrator.domain.exception.OrchestrationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Centralized exception handler for the REST controllers.
 */
@ControllerAdvice(basePackages = "me.golemcore.orchestrator.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    public static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
        case NOT_FOUND -> HttpStatus.NOT_FOUND;
        case STALE_REFERENCE -> HttpStatus.GONE;
        case DUPLICATE_CHANNEL -> HttpStatus.CONFLICT;
        case INVALID_TRANSITION -> HttpStatus.UNPROCESSABLE_ENTITY;
        case BAD_REQUEST -> HttpStatus.BAD_REQUEST;
        case CAPACITY_EXHAUSTED, PERSISTENCE_FAILURE -> HttpStatus.SERVICE_UNAVAILABLE;
        case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    @ExceptionHandler(OrchestrationException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleOrchestration(OrchestrationException ex) {
        HttpStatus status = statusFor(ex.getCode());
        if (status.is5xxServerError()) {
            log.error("[API] {}: {}", ex.getCode(), ex.getMessage());
        } else {
            log.warn("[API] {}: {}", ex.getCode(), ex.getMessage());
        }
        return Mono.just(ResponseEntity.status(status).body(body(status, ex.getCode(), ex.getMessage())));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return Mono.just(ResponseEntity.status(status).body(body(status, null, ex.getReason())));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(body(HttpStatus.BAD_REQUEST, ErrorCode.BAD_REQUEST, ex.getMessage())));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL, "Internal server error")));
    }

    private ApiErrorResponse body(HttpStatus status, ErrorCode code, String message) {
        return ApiErrorResponse.builder()
                .status(status.value())
                .code(code != null ? code.name() : null)
                .message(message)
                .build();
    }
}
