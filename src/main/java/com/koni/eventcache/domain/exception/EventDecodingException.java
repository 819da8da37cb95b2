package com.koni.eventcache.domain.exception;

/**
 * Exception thrown when a broker message body cannot be decoded into an Event.
 * Decoding failures are local to a single message and never stop ingestion.
 */
public class EventDecodingException extends RuntimeException {
    
    public EventDecodingException(String message) {
        super(message);
    }
    
    public EventDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
