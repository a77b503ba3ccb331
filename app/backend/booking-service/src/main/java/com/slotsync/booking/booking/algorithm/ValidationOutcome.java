package com.slotsync.booking.booking.algorithm;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 예약 검증 결과: Accept 또는 Reject(reason)
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ValidationOutcome {

    private static final ValidationOutcome ACCEPTED = new ValidationOutcome(null);

    private final RejectionReason reason;

    private ValidationOutcome(RejectionReason reason) {
        this.reason = reason;
    }

    public static ValidationOutcome accept() {
        return ACCEPTED;
    }

    public static ValidationOutcome reject(RejectionReason reason) {
        return new ValidationOutcome(reason);
    }

    public boolean isAccepted() {
        return reason == null;
    }
}
