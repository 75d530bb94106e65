package com.cladgateway.config;

import com.cladgateway.exception.GatewayException;
import com.cladgateway.model.ChatModels;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

/**
 * Maps failures to {@code {"error": {"message", "type"}}} bodies.
 * Internal details are logged; callers only see the sanitized message.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(GatewayException.class)
    public Mono<ResponseEntity<ChatModels.ErrorResponse>> handleGatewayException(GatewayException ex) {
        log.error("{}: {}", ex.getClass().getSimpleName(), ex.getMessage());
        return Mono.just(toResponse(ex));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ChatModels.ErrorResponse>> handleValidationException(WebExchangeBindException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .reduce((a, b) -> a + ", " + b)
                .orElse("Validation failed");

        log.warn("Validation error: {}", message);

        return Mono.just(ResponseEntity.badRequest()
                .body(ChatModels.ErrorResponse.of("invalid_request_error", message)));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ChatModels.ErrorResponse>> handleInputException(ServerWebInputException ex) {
        log.warn("Malformed request: {}", ex.getMessage());

        return Mono.just(ResponseEntity.badRequest()
                .body(ChatModels.ErrorResponse.of("invalid_request_error", "Malformed request body")));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ChatModels.ErrorResponse>> handleResponseStatusException(ResponseStatusException ex) {
        log.warn("HTTP status exception: {} {}", ex.getStatusCode().value(), ex.getReason());

        return Mono.just(ResponseEntity.status(ex.getStatusCode())
                .body(ChatModels.ErrorResponse.of("invalid_request_error",
                        ex.getReason() != null ? ex.getReason() : "Request failed")));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ChatModels.ErrorResponse>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);

        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ChatModels.ErrorResponse.of("internal_error", "An unexpected error occurred")));
    }

    private ResponseEntity<ChatModels.ErrorResponse> toResponse(GatewayException ex) {
        return ResponseEntity.status(ex.getStatus())
                .body(ChatModels.ErrorResponse.of(ex.getErrorType(), ex.getClientMessage()));
    }
}
