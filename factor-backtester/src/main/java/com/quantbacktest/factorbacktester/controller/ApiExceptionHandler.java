package com.quantbacktest.factorbacktester.controller;

import com.quantbacktest.factorbacktester.exception.BacktestException;
import com.quantbacktest.factorbacktester.exception.InvalidTransitionException;
import com.quantbacktest.factorbacktester.exception.ResourceNotFoundException;
import com.quantbacktest.factorbacktester.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
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
 * Maps domain exceptions to JSON error bodies: validation 400, not found 404, illegal transition 409.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> badRequest(ValidationException ex) {
        return error(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException ex) {
        Map<String, String> fields = new HashMap<>();
        for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
            fields.put(fe.getField(), fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
                "status", "error",
                "reason", ValidationException.CODE,
                "message", "invalid_request",
                "fields", fields,
                "ts", Instant.now().toString()));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(ResourceNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<Map<String, Object>> conflict(InvalidTransitionException ex) {
        log.warn("Rejected transition {} -> {}", ex.getFrom(), ex.getTo());
        return error(HttpStatus.CONFLICT, ex);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, BacktestException ex) {
        return ResponseEntity.status(status).body(Map.of(
                "status", "error",
                "reason", ex.getErrorCode(),
                "message", ex.getMessage() == null ? "invalid_request" : ex.getMessage(),
                "ts", Instant.now().toString()));
    }
}
