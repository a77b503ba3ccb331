package com.slotsync.booking.availability.algorithm;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.ZoneId;
import java.util.List;

/**
 * 특정 시점에 계산한 소유자 가용 상태
 *
 * 슬롯 조회와 예약 검증이 같은 계산 결과를 사용하도록 묶어 둔 값 객체.
 */
@Getter
@Builder
@ToString
public class AvailabilitySnapshot {

    private final String ownerId;

    private final ZoneId zone;

    /**
     * 계산 범위 (조회/검증 대상에 여유 구간을 더한 범위)
     */
    private final TimeInterval window;

    /**
     * 규칙/예외로 전개한 가용 구간 (예약 미반영)
     */
    private final List<TimeInterval> resolvedAvailability;

    /**
     * window와 겹치는 확정 예약 구간
     */
    private final List<TimeInterval> confirmedBookings;

    private final EffectiveBufferPolicy policy;

    /**
     * 가용 구간 - 확정 예약
     */
    public List<TimeInterval> freeIntervals() {
        return TimeIntervals.subtractAll(resolvedAvailability, confirmedBookings);
    }
}
