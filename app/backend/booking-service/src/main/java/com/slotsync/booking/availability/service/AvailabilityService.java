package com.slotsync.booking.availability.service;

import com.slotsync.booking.availability.algorithm.AvailabilityRuleResolver;
import com.slotsync.booking.availability.algorithm.AvailabilitySnapshot;
import com.slotsync.booking.availability.algorithm.BufferPolicyApplier;
import com.slotsync.booking.availability.algorithm.EffectiveBufferPolicy;
import com.slotsync.booking.availability.algorithm.SlotGenerator;
import com.slotsync.booking.availability.algorithm.TimeInterval;
import com.slotsync.booking.availability.dto.SlotDto;
import com.slotsync.booking.availability.dto.SlotListResponse;
import com.slotsync.booking.booking.store.BookingStore;
import com.slotsync.booking.common.entity.AvailabilityException;
import com.slotsync.booking.common.entity.Booking;
import com.slotsync.booking.common.entity.BufferPolicy;
import com.slotsync.booking.common.entity.CalendarSettings;
import com.slotsync.booking.common.entity.EventType;
import com.slotsync.booking.common.entity.WorkingHourRule;
import com.slotsync.booking.common.exception.AvailabilityDataException;
import com.slotsync.booking.common.exception.InvalidRequestException;
import com.slotsync.booking.common.repository.AvailabilityExceptionRepository;
import com.slotsync.booking.common.repository.BufferPolicyRepository;
import com.slotsync.booking.common.repository.CalendarSettingsRepository;
import com.slotsync.booking.common.repository.EventTypeRepository;
import com.slotsync.booking.common.repository.WorkingHourRuleRepository;
import com.slotsync.booking.common.timezone.TimezoneRegistry;
import com.slotsync.booking.eventtypes.exception.EventTypeNotFoundException;
import com.slotsync.booking.settings.exception.CalendarSettingsNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 가용 시간 조회 서비스
 *
 * 규칙 전개 → 확정 예약 차감 → 버퍼/예약 기간 적용 → 슬롯 생성 순으로 계산한다.
 * 조회는 락 없이 읽기 전용 트랜잭션에서 수행한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AvailabilityService {

    private final CalendarSettingsRepository calendarSettingsRepository;
    private final WorkingHourRuleRepository workingHourRuleRepository;
    private final AvailabilityExceptionRepository availabilityExceptionRepository;
    private final BufferPolicyRepository bufferPolicyRepository;
    private final EventTypeRepository eventTypeRepository;
    private final BookingStore bookingStore;
    private final TimezoneRegistry timezoneRegistry;
    private final AvailabilityRuleResolver availabilityRuleResolver;
    private final BufferPolicyApplier bufferPolicyApplier;
    private final SlotGenerator slotGenerator;
    private final Clock clock;

    @Value("${booking.slots.max-range-days:62}")
    private long maxRangeDays;

    /**
     * 예약 가능한 슬롯 조회
     *
     * @param ownerId     캘린더 소유자
     * @param eventTypeId 이벤트 타입 ID
     * @param from        조회 시작 (포함)
     * @param to          조회 끝 (제외)
     * @return 시작 시각이 [from, to) 안에 있는 슬롯 목록
     */
    @Transactional(readOnly = true)
    public SlotListResponse listSlots(String ownerId, Long eventTypeId, Instant from, Instant to) {
        log.info("슬롯 조회 요청 - ownerId: {}, eventTypeId: {}, 기간: {} ~ {}", ownerId, eventTypeId, from, to);

        TimeInterval range = validateRange(from, to);
        EventType eventType = loadBookableEventType(ownerId, eventTypeId);
        AvailabilitySnapshot snapshot = loadSnapshot(ownerId, eventType, range);
        Instant now = clock.instant();

        List<TimeInterval> bookable = bufferPolicyApplier.apply(
                snapshot.freeIntervals(), snapshot.getPolicy(), now, eventType.getDuration());

        List<SlotDto> slots = new ArrayList<>();
        for (Instant start : slotGenerator.generate(bookable, eventType.getDuration(), eventType.getSlotStep())) {
            if (start.isBefore(from)) {
                continue;
            }
            if (!start.isBefore(to)) {
                break;
            }
            slots.add(SlotDto.of(start, eventType.getDuration(), snapshot.getZone()));
        }

        log.info("슬롯 조회 완료 - ownerId: {}, eventTypeId: {}, 슬롯 수: {}", ownerId, eventTypeId, slots.size());

        return SlotListResponse.builder()
                .ownerId(ownerId)
                .eventTypeId(eventType.getEventTypeId())
                .eventTypeName(eventType.getName())
                .durationMinutes(eventType.getDurationMinutes())
                .timezone(snapshot.getZone().getId())
                .from(from)
                .to(to)
                .slots(slots)
                .build();
    }

    /**
     * 예약 가능한(활성) 이벤트 타입 조회
     *
     * 비활성 이벤트 타입은 존재하지 않는 것으로 취급한다.
     */
    public EventType loadBookableEventType(String ownerId, Long eventTypeId) {
        return eventTypeRepository.findByEventTypeIdAndOwnerId(eventTypeId, ownerId)
                .filter(EventType::isBookable)
                .orElseThrow(() -> new EventTypeNotFoundException("이벤트 타입을 찾을 수 없습니다. ID: " + eventTypeId));
    }

    /**
     * 락 없이 스냅샷 계산 (조회 경로)
     */
    public AvailabilitySnapshot loadSnapshot(String ownerId, EventType eventType, TimeInterval target) {
        CalendarSettings settings = calendarSettingsRepository.findByOwnerId(ownerId)
                .orElseThrow(() -> new CalendarSettingsNotFoundException("캘린더 설정을 찾을 수 없습니다. ownerId: " + ownerId));
        return buildSnapshot(settings, eventType, target);
    }

    /**
     * 대상 구간 주변의 가용 상태 스냅샷 계산
     *
     * 대상 구간 밖의 가용 구간/예약도 버퍼 계산에 영향을 주므로
     * 하루 + 버퍼 + 이벤트 길이만큼 양쪽으로 넓혀서 계산한다.
     * 호출자의 트랜잭션(예약 경로에서는 소유자 락을 잡은 트랜잭션)에 참여한다.
     */
    public AvailabilitySnapshot buildSnapshot(CalendarSettings settings, EventType eventType, TimeInterval target) {
        String ownerId = settings.getOwnerId();
        ZoneId zone = timezoneRegistry.find(settings.getTimezone())
                .orElseThrow(() -> new AvailabilityDataException(
                        "지원하지 않는 타임존이 저장되어 있습니다. ownerId: " + ownerId + ", timezone: " + settings.getTimezone()));

        BufferPolicy bufferPolicy = bufferPolicyRepository.findByOwnerId(ownerId)
                .orElseGet(() -> BufferPolicy.none(ownerId));
        EffectiveBufferPolicy policy = EffectiveBufferPolicy.of(bufferPolicy, eventType);

        Duration padding = Duration.ofDays(1)
                .plus(policy.getPreBuffer())
                .plus(policy.getPostBuffer())
                .plus(eventType.getDuration());
        TimeInterval window = TimeInterval.of(target.getStart().minus(padding), target.getEnd().plus(padding));

        List<WorkingHourRule> rules = workingHourRuleRepository.findByOwnerId(ownerId);
        LocalDate firstDate = window.getStart().atZone(zone).toLocalDate().minusDays(1);
        LocalDate lastDate = window.getEnd().atZone(zone).toLocalDate().plusDays(1);
        List<AvailabilityException> exceptions =
                availabilityExceptionRepository.findByOwnerIdAndExceptionDateBetween(ownerId, firstDate, lastDate);

        List<TimeInterval> resolved = availabilityRuleResolver.resolve(ownerId, window, zone, rules, exceptions);
        List<TimeInterval> bookings = bookingStore.findConfirmedOverlapping(ownerId, window).stream()
                .map(this::toInterval)
                .collect(Collectors.toList());

        log.debug("스냅샷 계산 - ownerId: {}, 범위: {} ~ {}, 가용 구간: {}, 확정 예약: {}",
                ownerId, window.getStart(), window.getEnd(), resolved.size(), bookings.size());

        return AvailabilitySnapshot.builder()
                .ownerId(ownerId)
                .zone(zone)
                .window(window)
                .resolvedAvailability(resolved)
                .confirmedBookings(bookings)
                .policy(policy)
                .build();
    }

    private TimeInterval validateRange(Instant from, Instant to) {
        if (from == null || to == null) {
            throw new InvalidRequestException("조회 기간(from, to)은 필수입니다.");
        }
        if (!from.isBefore(to)) {
            throw new InvalidRequestException("조회 시작 시각은 종료 시각보다 이전이어야 합니다.");
        }
        if (Duration.between(from, to).compareTo(Duration.ofDays(maxRangeDays)) > 0) {
            throw new InvalidRequestException("조회 기간은 최대 " + maxRangeDays + "일까지 가능합니다.");
        }
        return TimeInterval.of(from, to);
    }

    private TimeInterval toInterval(Booking booking) {
        return TimeInterval.of(booking.getStartTime(), booking.getEndTime());
    }
}
