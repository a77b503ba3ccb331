package com.slotsync.booking.booking.store;

import com.slotsync.booking.availability.algorithm.TimeInterval;
import com.slotsync.booking.common.entity.Booking;
import com.slotsync.booking.common.entity.CalendarSettings;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 예약 저장소 계약
 *
 * 구현체는 다음을 보장해야 한다.
 * - lockOwner: 현재 트랜잭션이 끝날 때까지 같은 소유자의 다른 lockOwner 호출을 막는다 (프로세스 간에도 유효).
 * - lockBooking: 현재 트랜잭션이 끝날 때까지 같은 예약 행에 대한 쓰기를 막는다.
 * - insertIfNoOverlap: 같은 소유자의 확정 예약과 겹치면 저장하지 않는다.
 * - markCancelled: 확정 → 취소 상태 전이만 수행하며, 이미 취소된 예약에는 아무 것도 하지 않는다.
 */
public interface BookingStore {

    /**
     * 소유자 단위 배타 락 획득
     *
     * @return 락을 잡은 소유자의 캘린더 설정
     * @throws com.slotsync.booking.settings.exception.CalendarSettingsNotFoundException 설정이 없는 경우
     */
    CalendarSettings lockOwner(String ownerId);

    /**
     * 설정이 있으면 소유자 락 획득, 없으면 Optional.empty()
     */
    Optional<CalendarSettings> tryLockOwner(String ownerId);

    /**
     * 예약 행 단위 배타 락 (소유자 설정이 삭제된 뒤의 취소용)
     */
    Optional<Booking> lockBooking(Long bookingId);

    /**
     * 구간과 겹치는 확정 예약 조회
     */
    List<Booking> findConfirmedOverlapping(String ownerId, TimeInterval interval);

    /**
     * 겹치는 확정 예약이 없을 때만 저장
     *
     * @return 저장된 예약, 충돌 시 Optional.empty()
     */
    Optional<Booking> insertIfNoOverlap(Booking booking);

    Optional<Booking> findById(Long bookingId);

    List<Booking> findByOwnerInRange(String ownerId, TimeInterval interval);

    /**
     * @return 상태가 실제로 바뀌었으면 true
     */
    boolean markCancelled(Long bookingId, Instant cancelledAt);
}
