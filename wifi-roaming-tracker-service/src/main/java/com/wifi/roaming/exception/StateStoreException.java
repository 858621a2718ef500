package com.wifi.roaming.exception;

/**
 * Exception thrown when the roaming state cannot be read from or written to its backing store.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message) {
        super(message);
    }

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
