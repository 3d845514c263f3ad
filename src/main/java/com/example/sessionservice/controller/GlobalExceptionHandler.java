package com.example.sessionservice.controller;

import com.example.sessionservice.kv.StoreUnavailableException;
import com.example.sessionservice.model.dto.ApiError;
import com.example.sessionservice.service.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;

import java.time.Instant;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Maps failures to {@link ApiError} bodies. Server-side errors get a fixed message; the cause is
 * only logged, under the errorId returned to the client.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MissingUserIdException.class)
    public ResponseEntity<ApiError> handleMissingUser(MissingUserIdException ex, ServerWebExchange exchange) {
        return build(HttpStatus.UNAUTHORIZED, ex.getMessage(), exchange, ex, false);
    }

    @ExceptionHandler(SessionAccessDeniedException.class)
    public ResponseEntity<ApiError> handleAccessDenied(SessionAccessDeniedException ex, ServerWebExchange exchange) {
        return build(HttpStatus.FORBIDDEN, ex.getMessage(), exchange, ex, false);
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(SessionNotFoundException ex, ServerWebExchange exchange) {
        return build(HttpStatus.NOT_FOUND, ex.getMessage(), exchange, ex, false);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleBadRequest(IllegalArgumentException ex, ServerWebExchange exchange) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), exchange, ex, false);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ApiError> handleValidation(WebExchangeBindException ex, ServerWebExchange exchange) {
        String details = ex.getFieldErrors().stream()
                .map(err -> err.getField() + ": " + err.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return build(HttpStatus.BAD_REQUEST, "Request is not valid: " + details, exchange, ex, false);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> handleResponseStatus(ResponseStatusException ex, ServerWebExchange exchange) {
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        HttpStatus resolved = status == null ? HttpStatus.INTERNAL_SERVER_ERROR : status;
        String message = resolved.is5xxServerError() ? "Internal error processing the request" : ex.getReason();
        return build(resolved, message, exchange, ex, resolved.is5xxServerError());
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ApiError> handleStoreUnavailable(StoreUnavailableException ex, ServerWebExchange exchange) {
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Session store unavailable", exchange, ex, true);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, ServerWebExchange exchange) {
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error processing the request", exchange, ex, true);
    }

    private ResponseEntity<ApiError> build(HttpStatus status,
                                           String message,
                                           ServerWebExchange exchange,
                                           Exception ex,
                                           boolean logStack) {
        String errorId = UUID.randomUUID().toString();
        String path = exchange != null ? exchange.getRequest().getPath().value() : "";
        String method = exchange != null ? String.valueOf(exchange.getRequest().getMethod()) : "";

        if (logStack) {
            log.error("errorId={} status={} method={} path={} msg={}", errorId, status.value(), method, path, message, ex);
        } else {
            log.warn("errorId={} status={} method={} path={} msg={}", errorId, status.value(), method, path, message);
        }

        ApiError body = new ApiError(errorId, status.value(), status.getReasonPhrase(), message, path, Instant.now());
        return ResponseEntity.status(status).body(body);
    }
}
