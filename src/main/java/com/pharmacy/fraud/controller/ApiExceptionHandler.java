package com.pharmacy.fraud.controller;

import com.pharmacy.fraud.exception.ConfigurationException;
import com.pharmacy.fraud.exception.RunCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handleConfiguration(ConfigurationException ex) {
        log.warn("Rejected run configuration: {} ({})", ex.getMessage(), ex.getField());
        Map<String, Object> body = body("Invalid configuration", ex.getMessage());
        body.put("field", ex.getField());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(RunCancelledException.class)
    public ResponseEntity<Map<String, Object>> handleCancelled(RunCancelledException ex) {
        log.warn("Ranking run cancelled: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body("Run cancelled", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(body("Bad request", ex.getMessage()));
    }

    private static Map<String, Object> body(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("error", error);
        body.put("message", message);
        return body;
    }
}
