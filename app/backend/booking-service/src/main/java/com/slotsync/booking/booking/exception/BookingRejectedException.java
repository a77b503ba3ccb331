package com.slotsync.booking.booking.exception;

import com.slotsync.booking.booking.algorithm.RejectionReason;
import lombok.Getter;

/**
 * HTTP 경계에서 예약 거부 결과를 오류 응답으로 변환하기 위한 예외
 */
@Getter
public class BookingRejectedException extends RuntimeException {

    private final RejectionReason reason;

    public BookingRejectedException(RejectionReason reason) {
        super(reason.getMessage());
        this.reason = reason;
    }
}
