package com.evfinder.infrastructure.rest;

import com.evfinder.domain.ports.LedgerPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps engine exceptions to HTTP responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> invalidRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("message", e.getMessage()));
    }

    @ExceptionHandler(LedgerPersistenceException.class)
    public ResponseEntity<Map<String, String>> persistenceFailure(LedgerPersistenceException e) {
        logger.error("Ledger persistence failed", e);
        return ResponseEntity.internalServerError().body(Map.of("message", "Ledger could not be stored"));
    }
}
