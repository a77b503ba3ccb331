package com.slotsync.booking.settings.exception;

public class CalendarSettingsNotFoundException extends RuntimeException {
    public CalendarSettingsNotFoundException(String message) {
        super(message);
    }

    public CalendarSettingsNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
