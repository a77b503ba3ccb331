package com.slotsync.booking.settings.exception;

public class AvailabilityExceptionNotFoundException extends RuntimeException {
    public AvailabilityExceptionNotFoundException(String message) {
        super(message);
    }

    public AvailabilityExceptionNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
