package com.koni.eventcache.domain.exception;

/**
 * Exception thrown by a broker subscription once it has been closed, either by
 * the broker or by a local cancellation. This is a clean end of the stream,
 * not a failure.
 */
public class SubscriptionClosedException extends RuntimeException {
    
    public SubscriptionClosedException(String message) {
        super(message);
    }
    
    public SubscriptionClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
