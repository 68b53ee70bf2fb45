package com.delta.adfeed.monitor.api;

import com.delta.adfeed.monitor.persistence.ConfigPersistenceException;
import com.delta.adfeed.monitor.service.ConfigValidationException;
import com.delta.adfeed.monitor.service.CycleInProgressException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class MonitorExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(MonitorExceptionHandler.class);

    @ExceptionHandler(CycleInProgressException.class)
    public ResponseEntity<Map<String, String>> handleCycleInProgress(CycleInProgressException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(Map.of("error", "cycle_in_progress", "message", ex.getMessage()));
    }

    @ExceptionHandler(ConfigValidationException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidConfig(ConfigValidationException ex) {
        return ResponseEntity.badRequest()
            .body(Map.of("error", "invalid_config", "detail", ex.getViolations()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest()
            .body(Map.of("error", "malformed_request", "message", "Request body is not valid JSON"));
    }

    @ExceptionHandler(ConfigPersistenceException.class)
    public ResponseEntity<Map<String, String>> handleConfigPersistence(ConfigPersistenceException ex) {
        log.warn("Config document I/O failed", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(Map.of("error", "config_io_error", "message", ex.getMessage()));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, String>> handleDatabase(DataAccessException ex) {
        log.warn("Database error while serving request", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(Map.of("error", "database_error", "message", "Database error"));
    }
}
