package com.example.dynatrace.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the application.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(DynatraceApiException.class)
    public ResponseEntity<Map<String, Object>> handleDynatraceApiException(DynatraceApiException ex) {
        log.error("Dynatrace API error: {}", ex.getMessage(), ex);

        Map<String, Object> errorResponse = errorBody(HttpStatus.BAD_GATEWAY, "Dynatrace API Error", ex.getMessage());
        errorResponse.put("upstreamStatus", ex.getStatusCode());
        errorResponse.put("errorCode", ex.getErrorCode());

        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(errorResponse);
    }

    @ExceptionHandler(ConfigNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleConfigNotFoundException(ConfigNotFoundException ex) {
        log.warn("Config not found: {}", ex.getMessage());

        Map<String, Object> errorResponse = errorBody(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage());
        errorResponse.put("api", ex.getApiId());
        errorResponse.put("name", ex.getName());

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorResponse);
    }

    @ExceptionHandler(UnknownApiException.class)
    public ResponseEntity<Map<String, Object>> handleUnknownApiException(UnknownApiException ex) {
        log.warn("Unknown api requested: {}", ex.getApiId());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred"));
    }

    private Map<String, Object> errorBody(HttpStatus status, String error, String message) {
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("timestamp", LocalDateTime.now().toString());
        errorResponse.put("status", status.value());
        errorResponse.put("error", error);
        errorResponse.put("message", message);
        return errorResponse;
    }
}
