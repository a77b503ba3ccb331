package com.slotsync.booking.common.exception;

/**
 * 형식이 잘못된 입력 (기간, 시간, 타임존 등). 가용 시간 계산 전에 거부된다.
 */
public class InvalidRequestException extends RuntimeException {
    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
