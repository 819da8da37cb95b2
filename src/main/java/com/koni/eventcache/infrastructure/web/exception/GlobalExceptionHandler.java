package com.koni.eventcache.infrastructure.web.exception;

import com.koni.eventcache.domain.exception.DeviceRegistryUnavailableException;
import com.koni.eventcache.domain.exception.ValidationException;
import com.koni.eventcache.infrastructure.web.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Global exception handler for REST API endpoints.
 * Provides consistent error responses and appropriate HTTP status codes.
 * 
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    
    /**
     * Handle validation exceptions.
     * Returns 400 Bad Request when input validation fails.
     * 
     */
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(ValidationException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }
    
    /**
     * Handle request parameters that cannot be converted, e.g. a non-numeric max.
     * Returns 400 Bad Request.
     * 
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Invalid request parameter {}: {}", ex.getName(), ex.getValue());
        return respond(HttpStatus.BAD_REQUEST, "Invalid value for parameter " + ex.getName());
    }
    
    /**
     * Handle device registry unavailable exceptions.
     * Returns 503 Service Unavailable when the registry is down, unreachable or returns garbage.
     * 
     */
    @ExceptionHandler(DeviceRegistryUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleDeviceRegistryUnavailableException(DeviceRegistryUnavailableException ex) {
        log.error("Device registry unavailable: {}", ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Device registry temporarily unavailable");
    }
    
    /**
     * Handle all other unexpected exceptions.
     * Returns 500 Internal Server Error for unhandled exceptions.
     * 
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error occurred: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.of(status, message));
    }
}
