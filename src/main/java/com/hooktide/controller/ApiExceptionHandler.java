package com.hooktide.controller;

import com.hooktide.exception.InvalidConditionException;
import com.hooktide.exception.UnknownProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Error bodies for the routing admin API. Webhook failures are mapped by
 * {@link WebhookController} itself, since they carry stage and error kind.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidConditionException.class)
    public ResponseEntity<Map<String, String>> invalidCondition(InvalidConditionException e) {
        log.warn("Rejected filter update: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", "INVALID_CONDITION", "message", e.getMessage()));
    }

    @ExceptionHandler(UnknownProviderException.class)
    public ResponseEntity<Map<String, String>> unknownProvider(UnknownProviderException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", "UNKNOWN_PROVIDER", "message", e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> invalidRequest(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .findFirst()
                .orElse("Invalid request");
        return ResponseEntity.badRequest().body(Map.of("error", "INVALID_REQUEST", "message", message));
    }
}
