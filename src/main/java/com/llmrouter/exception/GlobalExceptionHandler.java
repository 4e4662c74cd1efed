package com.llmrouter.exception;

import com.llmrouter.model.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler for all REST controllers.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResourceNotFound(ResourceNotFoundException ex) {
        log.warn("Resource not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ErrorKind.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(ForbiddenOperationException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleForbidden(ForbiddenOperationException ex) {
        log.warn("Forbidden: {}", ex.getMessage());
        return respond(HttpStatus.FORBIDDEN, ErrorKind.FORBIDDEN, ex.getMessage());
    }

    @ExceptionHandler(KeyRevokedException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleKeyRevoked(KeyRevokedException ex) {
        log.warn("Revoked key used: {}", ex.getMessage());
        return respond(HttpStatus.UNAUTHORIZED, ErrorKind.KEY_REVOKED, ex.getMessage());
    }

    @ExceptionHandler(InvalidCredentialsException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInvalidCredentials(InvalidCredentialsException ex) {
        log.warn("Invalid credentials: {}", ex.getMessage());
        return respond(HttpStatus.UNAUTHORIZED, ErrorKind.UNAUTHORIZED, ex.getMessage());
    }

    @ExceptionHandler(ModelResolutionException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleModelResolution(ModelResolutionException ex) {
        log.warn("Model resolution failed: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorKind.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(UpstreamFailureException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleUpstreamFailure(UpstreamFailureException ex) {
        log.error("Upstream provider {} failed: {}", ex.getProvider(), ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ErrorKind.UPSTREAM_FAILURE, ex.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationException(WebExchangeBindException ex) {
        String errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        log.warn("Validation error: {}", errors);
        return respond(HttpStatus.BAD_REQUEST, ErrorKind.BAD_REQUEST, "Validation failed: " + errors);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInputException(ServerWebInputException ex) {
        log.warn("Unreadable request: {}", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, ErrorKind.BAD_REQUEST,
                ex.getReason() != null ? ex.getReason() : "Invalid request");
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorKind.INTERNAL_ERROR, "Internal server error");
    }

    private Mono<ResponseEntity<ErrorResponse>> respond(HttpStatus status, ErrorKind kind, String detail) {
        ErrorResponse error = ErrorResponse.builder()
                .kind(kind)
                .detail(detail)
                .traceId(UUID.randomUUID().toString())
                .build();
        return Mono.just(ResponseEntity.status(status).body(error));
    }
}
