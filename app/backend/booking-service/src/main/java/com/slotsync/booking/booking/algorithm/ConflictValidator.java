package com.slotsync.booking.booking.algorithm;

import com.slotsync.booking.availability.algorithm.AvailabilitySnapshot;
import com.slotsync.booking.availability.algorithm.BufferPolicyApplier;
import com.slotsync.booking.availability.algorithm.EffectiveBufferPolicy;
import com.slotsync.booking.availability.algorithm.TimeInterval;
import com.slotsync.booking.availability.algorithm.TimeIntervals;
import com.slotsync.booking.common.entity.EventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * 예약 충돌 검증
 *
 * 검증 순서 (앞 단계 실패 시 즉시 거부):
 * 1. 길이 일치
 * 2. 규칙/예외 가용 구간에 포함
 * 3. 확정 예약과 겹치지 않음 ([a,b)와 [b,c)는 충돌 아님)
 * 4. 버퍼 적용 후 빈 구간에 포함
 * 5. 최소 사전 예약 시간
 * 6. 최대 예약 가능 기간
 *
 * 스냅샷은 검증 시점에 새로 계산한 값이어야 한다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConflictValidator {

    private final BufferPolicyApplier bufferPolicyApplier;

    public ValidationOutcome validate(
            EventType eventType,
            TimeInterval proposed,
            AvailabilitySnapshot snapshot,
            Instant now
    ) {
        if (!proposed.getDuration().equals(eventType.getDuration())) {
            return reject(RejectionReason.DURATION_MISMATCH, proposed, snapshot);
        }

        if (!TimeIntervals.anyContains(snapshot.getResolvedAvailability(), proposed)) {
            return reject(RejectionReason.OUTSIDE_AVAILABILITY, proposed, snapshot);
        }

        for (TimeInterval booked : snapshot.getConfirmedBookings()) {
            if (TimeIntervals.intersect(booked, proposed).isPresent()) {
                return reject(RejectionReason.DOUBLE_BOOKING, proposed, snapshot);
            }
        }

        EffectiveBufferPolicy policy = snapshot.getPolicy();
        List<TimeInterval> buffered = bufferPolicyApplier.shrink(snapshot.freeIntervals(), policy);
        if (!TimeIntervals.anyContains(buffered, proposed)) {
            return reject(RejectionReason.BUFFER_VIOLATION, proposed, snapshot);
        }

        TimeInterval bookingWindow = bufferPolicyApplier.bookingWindow(policy, now);
        if (proposed.getStart().isBefore(bookingWindow.getStart())) {
            return reject(RejectionReason.NOTICE_VIOLATION, proposed, snapshot);
        }
        if (proposed.getEnd().isAfter(bookingWindow.getEnd())) {
            return reject(RejectionReason.ADVANCE_WINDOW_VIOLATION, proposed, snapshot);
        }

        log.debug("예약 검증 통과 - ownerId: {}, 구간: {} ~ {}",
                snapshot.getOwnerId(), proposed.getStart(), proposed.getEnd());
        return ValidationOutcome.accept();
    }

    private ValidationOutcome reject(RejectionReason reason, TimeInterval proposed, AvailabilitySnapshot snapshot) {
        log.debug("예약 검증 실패 - ownerId: {}, 구간: {} ~ {}, 사유: {}",
                snapshot.getOwnerId(), proposed.getStart(), proposed.getEnd(), reason);
        return ValidationOutcome.reject(reason);
    }
}
