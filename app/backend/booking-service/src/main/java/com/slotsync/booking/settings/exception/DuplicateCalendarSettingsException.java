package com.slotsync.booking.settings.exception;

public class DuplicateCalendarSettingsException extends RuntimeException {
    public DuplicateCalendarSettingsException(String message) {
        super(message);
    }

    public DuplicateCalendarSettingsException(String message, Throwable cause) {
        super(message, cause);
    }
}
