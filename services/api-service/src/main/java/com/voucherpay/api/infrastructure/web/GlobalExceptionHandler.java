package com.voucherpay.api.infrastructure.web;

import com.voucherpay.observability.CorrelationContextHolder;
import com.voucherpay.security.UnauthenticatedException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

/**
 * Maps exceptions to the error envelope
 * {@code {"error": {"code": 401, "message": "...", "type": "...", "correlation_id": "..."}}}.
 *
 * <p>The response enrichment stage later adds screen-reader and user-friendly variants of
 * {@code error.message}. Every token failure produces the same 401 body whatever its cause;
 * the cause is only logged.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(UnauthenticatedException.class)
    public ResponseEntity<Map<String, Object>> handleUnauthenticated(UnauthenticatedException ex) {
        log.debug("Unauthenticated request: {}", ex.reason());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                .body(envelope(HttpStatus.UNAUTHORIZED, UnauthenticatedException.MESSAGE, "authentication_error"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("invalid request");
        log.warn("Validation failed: {}", detail);
        return validationError(detail);
    }

    @ExceptionHandler({
        IllegalArgumentException.class,
        MissingServletRequestParameterException.class,
        HttpMessageNotReadableException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadInput(Exception ex) {
        String detail = ex instanceof HttpMessageNotReadableException ? "malformed request body" : ex.getMessage();
        log.warn("Bad request: {}", detail);
        return validationError(detail);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatusCode status = ex.getStatusCode();
        String message = ex.getReason() != null ? ex.getReason() : reasonPhrase(status);
        log.debug("Request rejected with {}: {}", status.value(), message);
        return ResponseEntity.status(status).body(envelope(status, message, "http_error"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            log.debug("Framework error {}: {}", status.value(), ex.getMessage());
            return ResponseEntity.status(status)
                    .headers(errorResponse.getHeaders())
                    .body(envelope(status, reasonPhrase(status), "http_error"));
        }
        log.error("Internal server error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(envelope(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", "server_error"));
    }

    private static ResponseEntity<Map<String, Object>> validationError(String detail) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(envelope(HttpStatus.UNPROCESSABLE_ENTITY, "Validation error: " + detail, "validation_error"));
    }

    private static Map<String, Object> envelope(HttpStatusCode status, String message, String type) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("code", status.value());
        error.put("message", message);
        error.put("type", type);
        CorrelationContextHolder.get().ifPresent(ctx -> error.put("correlation_id", ctx.correlationId()));
        return Map.of("error", error);
    }

    private static String reasonPhrase(HttpStatusCode status) {
        HttpStatus resolved = HttpStatus.resolve(status.value());
        return resolved != null ? resolved.getReasonPhrase() : "HTTP " + status.value();
    }
}
