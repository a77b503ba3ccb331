package com.slotsync.booking.common.exception;

/**
 * 저장된 가용 시간 데이터가 손상된 경우 (시작 >= 종료, 타임존 불일치 등)
 */
public class AvailabilityDataException extends RuntimeException {
    public AvailabilityDataException(String message) {
        super(message);
    }

    public AvailabilityDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
