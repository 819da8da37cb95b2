package com.koni.eventcache.domain.exception;

/**
 * Exception thrown when the message broker cannot be reached or a subscription
 * link fails. This is a transport-level failure and is fatal to the ingestion loop.
 */
public class BrokerUnavailableException extends RuntimeException {
    
    public BrokerUnavailableException(String message) {
        super(message);
    }
    
    public BrokerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
