package com.slotsync.booking.booking.store;

import com.slotsync.booking.availability.algorithm.TimeInterval;
import com.slotsync.booking.common.entity.Booking;
import com.slotsync.booking.common.entity.Booking.BookingStatus;
import com.slotsync.booking.common.entity.CalendarSettings;
import com.slotsync.booking.common.repository.BookingRepository;
import com.slotsync.booking.common.repository.CalendarSettingsRepository;
import com.slotsync.booking.settings.exception.CalendarSettingsNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JPA 기반 예약 저장소
 *
 * 소유자의 calendar_settings 행에 SELECT ... FOR UPDATE 를 걸어 직렬화 지점으로 사용한다.
 * 락은 DB가 보유하므로 서비스 인스턴스가 여러 개여도 유효하다.
 * 쓰기 메서드는 호출자가 연 트랜잭션 안에서만 실행된다 (MANDATORY).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaBookingStore implements BookingStore {

    private final BookingRepository bookingRepository;
    private final CalendarSettingsRepository calendarSettingsRepository;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public CalendarSettings lockOwner(String ownerId) {
        return tryLockOwner(ownerId)
                .orElseThrow(() -> new CalendarSettingsNotFoundException("캘린더 설정을 찾을 수 없습니다. ownerId: " + ownerId));
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<CalendarSettings> tryLockOwner(String ownerId) {
        Optional<CalendarSettings> settings = calendarSettingsRepository.findByOwnerIdForUpdate(ownerId);
        if (settings.isPresent()) {
            log.debug("소유자 락 획득 - ownerId: {}", ownerId);
        }
        return settings;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Booking> lockBooking(Long bookingId) {
        Optional<Booking> booking = bookingRepository.findByIdForUpdate(bookingId);
        log.debug("예약 행 락 획득 - bookingId: {}, 존재: {}", bookingId, booking.isPresent());
        return booking;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Booking> findConfirmedOverlapping(String ownerId, TimeInterval interval) {
        return bookingRepository.findOverlappingByStatus(
                ownerId, BookingStatus.CONFIRMED, interval.getStart(), interval.getEnd());
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Booking> insertIfNoOverlap(Booking booking) {
        List<Booking> overlapping = bookingRepository.findOverlappingByStatus(
                booking.getOwnerId(), BookingStatus.CONFIRMED, booking.getStartTime(), booking.getEndTime());

        if (!overlapping.isEmpty()) {
            log.warn("예약 저장 중 충돌 감지 - ownerId: {}, 구간: {} ~ {}, 충돌 예약: {}",
                    booking.getOwnerId(), booking.getStartTime(), booking.getEndTime(),
                    overlapping.get(0).getBookingId());
            return Optional.empty();
        }

        return Optional.of(bookingRepository.save(booking));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Booking> findById(Long bookingId) {
        return bookingRepository.findById(bookingId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Booking> findByOwnerInRange(String ownerId, TimeInterval interval) {
        return bookingRepository.findByOwnerIdAndDateRange(ownerId, interval.getStart(), interval.getEnd());
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean markCancelled(Long bookingId, Instant cancelledAt) {
        int updated = bookingRepository.cancelIfConfirmed(
                bookingId, cancelledAt, BookingStatus.CONFIRMED, BookingStatus.CANCELLED);
        return updated > 0;
    }
}
