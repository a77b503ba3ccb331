package com.slotsync.booking.common.exception;

/**
 * 타임존 데이터베이스 로드 실패 (기동 시 치명적 오류)
 */
public class TimezoneDataException extends RuntimeException {
    public TimezoneDataException(String message) {
        super(message);
    }

    public TimezoneDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
