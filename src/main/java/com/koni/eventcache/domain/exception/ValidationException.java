package com.koni.eventcache.domain.exception;

/**
 * Exception thrown when a query or request parameter is invalid.
 * This is reported as a bad request rather than as an empty result.
 */
public class ValidationException extends RuntimeException {
    
    public ValidationException(String message) {
        super(message);
    }
    
    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
