package com.wifi.roaming.exception;

/**
 * Exception thrown when a snapshot entry lacks the fields needed to track the device.
 */
public class InvalidDeviceDescriptorException extends RuntimeException {

    public InvalidDeviceDescriptorException(String message) {
        super(message);
    }
}
