package com.koni.eventcache.domain.exception;

/**
 * Exception thrown when the external device registry cannot be queried or
 * returns a response that cannot be parsed.
 */
public class DeviceRegistryUnavailableException extends RuntimeException {
    
    public DeviceRegistryUnavailableException(String message) {
        super(message);
    }
    
    public DeviceRegistryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
