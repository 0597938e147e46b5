package com.agentbench.dispatch.api;

import com.agentbench.core.error.AgentBenchException;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps scheduler failures to JSON error bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(AgentBenchException.class)
    public ResponseEntity<Map<String, Object>> agentBench(AgentBenchException ex) {
        HttpStatus status = switch (ex.kind()) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case USAGE_LIMIT_EXCEEDED -> HttpStatus.PAYMENT_REQUIRED;
            case NO_AWS_ACCOUNT_CONNECTED, CROSS_ACCOUNT_TRUST -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ILLEGAL_STATE, CLAIM_CONFLICT, CANCELLED -> HttpStatus.CONFLICT;
            case BUILD, INFRA, TIMEOUT -> HttpStatus.BAD_GATEWAY;
        };
        if (status.is5xxServerError()) {
            log.warn("Request failed with {}: {}", ex.kind(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(Map.of(
                "status", "error",
                "reason", ex.kind().name().toLowerCase(),
                "message", ex.getMessage() == null ? "request_failed" : ex.getMessage(),
                "ts", Instant.now().toString()
        ));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
                "status", "error",
                "reason", "bad_request",
                "message", ex.getMessage() == null ? "invalid_request" : ex.getMessage(),
                "ts", Instant.now().toString()
        ));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException ex) {
        Map<String, String> fields = new HashMap<>();
        for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
            fields.put(fe.getField(), fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
                "status", "error",
                "reason", "validation_error",
                "message", "invalid_request",
                "fields", fields,
                "ts", Instant.now().toString()
        ));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Map<String, Object>> validation(ConstraintViolationException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
                "status", "error",
                "reason", "validation_error",
                "message", ex.getMessage() == null ? "invalid_request" : ex.getMessage(),
                "ts", Instant.now().toString()
        ));
    }
}
