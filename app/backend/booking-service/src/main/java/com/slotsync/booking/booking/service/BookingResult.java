package com.slotsync.booking.booking.service;

import com.slotsync.booking.booking.algorithm.RejectionReason;
import com.slotsync.booking.common.entity.Booking;
import lombok.Getter;
import lombok.ToString;

/**
 * 예약 생성 결과: 저장된 예약 또는 거부 사유 중 하나
 */
@Getter
@ToString
public final class BookingResult {

    private final Booking booking;
    private final RejectionReason reason;

    private BookingResult(Booking booking, RejectionReason reason) {
        this.booking = booking;
        this.reason = reason;
    }

    public static BookingResult accepted(Booking booking) {
        return new BookingResult(booking, null);
    }

    public static BookingResult rejected(RejectionReason reason) {
        return new BookingResult(null, reason);
    }

    public boolean isAccepted() {
        return booking != null;
    }
}
