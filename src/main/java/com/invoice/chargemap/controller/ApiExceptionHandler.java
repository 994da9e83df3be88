package com.invoice.chargemap.controller;

import com.invoice.chargemap.exception.RuleTableException;
import com.invoice.chargemap.exception.RuleTablesNotLoadedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(RuleTableException.class)
    public ResponseEntity<Map<String, Object>> handleRuleTable(RuleTableException ex) {
        log.warn("Rejected rule table: {}", ex.getMessage());
        Map<String, Object> body = body(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
        body.put("table", ex.getTable());
        body.put("rowId", ex.getRowId());
        return ResponseEntity.unprocessableEntity().body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, ex.getMessage()));
    }

    @ExceptionHandler(RuleTablesNotLoadedException.class)
    public ResponseEntity<Map<String, Object>> handleNotReady(RuleTablesNotLoadedException ex) {
        log.warn("Service not ready: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(body(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage()));
    }

    private static Map<String, Object> body(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        return body;
    }
}
