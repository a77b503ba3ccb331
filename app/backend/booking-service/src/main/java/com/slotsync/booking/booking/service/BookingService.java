package com.slotsync.booking.booking.service;

import com.slotsync.booking.availability.algorithm.AvailabilitySnapshot;
import com.slotsync.booking.availability.algorithm.TimeInterval;
import com.slotsync.booking.availability.service.AvailabilityService;
import com.slotsync.booking.booking.algorithm.ConflictValidator;
import com.slotsync.booking.booking.algorithm.RejectionReason;
import com.slotsync.booking.booking.algorithm.ValidationOutcome;
import com.slotsync.booking.booking.dto.BookingRequest;
import com.slotsync.booking.booking.dto.BookingResponse;
import com.slotsync.booking.booking.exception.BookingNotFoundException;
import com.slotsync.booking.booking.publisher.BookingEventPublisher;
import com.slotsync.booking.booking.store.BookingStore;
import com.slotsync.booking.common.entity.Booking;
import com.slotsync.booking.common.entity.CalendarSettings;
import com.slotsync.booking.common.entity.EventType;
import com.slotsync.booking.common.exception.InvalidRequestException;
import com.slotsync.booking.common.exception.UnauthorizedAccessException;
import com.slotsync.booking.common.repository.EventTypeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 예약 생성/취소 서비스
 *
 * 생성과 취소는 소유자 락을 잡은 하나의 트랜잭션 안에서
 * 가용 상태 재계산 → 검증 → 조건부 저장 순으로 처리한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BookingService {

    private final BookingStore bookingStore;
    private final AvailabilityService availabilityService;
    private final ConflictValidator conflictValidator;
    private final EventTypeRepository eventTypeRepository;
    private final BookingEventPublisher bookingEventPublisher;
    private final Clock clock;

    /**
     * 예약 생성
     *
     * 이전에 조회한 슬롯은 신뢰하지 않고 락 획득 후 가용 상태를 다시 계산한다.
     *
     * 락 대기 후의 조회가 먼저 커밋된 예약을 볼 수 있도록 READ COMMITTED로 실행한다.
     *
     * @return 저장된 예약 또는 거부 사유
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public BookingResult createBooking(String ownerId, Long eventTypeId, BookingRequest request) {
        log.info("예약 생성 요청 - ownerId: {}, eventTypeId: {}, startTime: {}", ownerId, eventTypeId, request.getStartTime());

        EventType eventType = availabilityService.loadBookableEventType(ownerId, eventTypeId);

        Instant start = request.getStartTime().toInstant();
        Instant end = request.getEndTime() != null
                ? request.getEndTime().toInstant()
                : start.plus(eventType.getDuration());
        if (!end.isAfter(start)) {
            log.warn("예약 거부 - ownerId: {}, 사유: {}", ownerId, RejectionReason.DURATION_MISMATCH);
            return BookingResult.rejected(RejectionReason.DURATION_MISMATCH);
        }
        TimeInterval proposed = TimeInterval.of(start, end);

        CalendarSettings settings = bookingStore.lockOwner(ownerId);
        AvailabilitySnapshot snapshot = availabilityService.buildSnapshot(settings, eventType, proposed);

        ValidationOutcome outcome = conflictValidator.validate(eventType, proposed, snapshot, clock.instant());
        if (!outcome.isAccepted()) {
            log.warn("예약 거부 - ownerId: {}, 구간: {} ~ {}, 사유: {}", ownerId, start, end, outcome.getReason());
            return BookingResult.rejected(outcome.getReason());
        }

        Booking booking = Booking.builder()
                .ownerId(ownerId)
                .eventTypeId(eventType.getEventTypeId())
                .startTime(start)
                .endTime(end)
                .inviteeName(request.getInviteeName())
                .inviteeEmail(request.getInviteeEmail())
                .build();

        Optional<Booking> saved = bookingStore.insertIfNoOverlap(booking);
        if (saved.isEmpty()) {
            log.warn("예약 거부 - ownerId: {}, 구간: {} ~ {}, 사유: {}", ownerId, start, end, RejectionReason.DOUBLE_BOOKING);
            return BookingResult.rejected(RejectionReason.DOUBLE_BOOKING);
        }

        Booking created = saved.get();
        log.info("예약 생성 완료 - bookingId: {}, ownerId: {}, 구간: {} ~ {}", created.getBookingId(), ownerId, start, end);

        bookingEventPublisher.publishBookingConfirmed(created, eventType.getName(), settings.getTimezone());
        return BookingResult.accepted(created);
    }

    /**
     * 예약 취소 (소유자 전용)
     *
     * 이미 취소된 예약을 다시 취소해도 상태는 그대로이며 이벤트도 발행하지 않는다.
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public BookingResponse cancelBooking(Long bookingId, String cognitoSub) {
        log.info("예약 취소 요청 - bookingId: {}, cognitoSub: {}", bookingId, cognitoSub);

        Booking booking = findOwnedBooking(bookingId, cognitoSub);
        // 설정이 삭제된 소유자는 예약 행 락으로 대체
        Optional<CalendarSettings> settings = bookingStore.tryLockOwner(booking.getOwnerId());
        if (settings.isEmpty()) {
            bookingStore.lockBooking(bookingId);
        }

        boolean changed = bookingStore.markCancelled(bookingId, clock.instant());
        Booking current = bookingStore.findById(bookingId)
                .orElseThrow(() -> new BookingNotFoundException("예약을 찾을 수 없습니다. ID: " + bookingId));

        if (changed) {
            log.info("예약 취소 완료 - bookingId: {}", bookingId);
            String eventTypeName = eventTypeRepository.findById(current.getEventTypeId())
                    .map(EventType::getName)
                    .orElse(null);
            String ownerTimezone = settings.map(CalendarSettings::getTimezone).orElse(null);
            bookingEventPublisher.publishBookingCancelled(current, eventTypeName, ownerTimezone);
        } else {
            log.info("이미 취소된 예약 - bookingId: {}", bookingId);
        }

        return BookingResponse.from(current);
    }

    @Transactional(readOnly = true)
    public BookingResponse getBooking(Long bookingId, String cognitoSub) {
        return BookingResponse.from(findOwnedBooking(bookingId, cognitoSub));
    }

    /**
     * 기간과 겹치는 소유자의 예약 목록 (취소 포함)
     */
    @Transactional(readOnly = true)
    public List<BookingResponse> getBookings(String cognitoSub, Instant from, Instant to) {
        if (from == null || to == null || !from.isBefore(to)) {
            throw new InvalidRequestException("조회 시작 시각은 종료 시각보다 이전이어야 합니다.");
        }

        return bookingStore.findByOwnerInRange(cognitoSub, TimeInterval.of(from, to)).stream()
                .map(BookingResponse::from)
                .collect(Collectors.toList());
    }

    private Booking findOwnedBooking(Long bookingId, String cognitoSub) {
        Booking booking = bookingStore.findById(bookingId)
                .orElseThrow(() -> new BookingNotFoundException("예약을 찾을 수 없습니다. ID: " + bookingId));

        if (!booking.getOwnerId().equals(cognitoSub)) {
            throw new UnauthorizedAccessException("해당 예약에 접근할 권한이 없습니다.");
        }
        return booking;
    }
}
