package com.slotsync.booking.settings.service;

import com.slotsync.booking.availability.algorithm.AvailabilityRuleResolver;
import com.slotsync.booking.common.entity.BufferPolicy;
import com.slotsync.booking.common.entity.CalendarSettings;
import com.slotsync.booking.common.entity.WorkingHourRule;
import com.slotsync.booking.common.exception.InvalidRequestException;
import com.slotsync.booking.common.repository.AvailabilityExceptionRepository;
import com.slotsync.booking.common.repository.BufferPolicyRepository;
import com.slotsync.booking.common.repository.CalendarSettingsRepository;
import com.slotsync.booking.common.repository.WorkingHourRuleRepository;
import com.slotsync.booking.common.timezone.TimezoneRegistry;
import com.slotsync.booking.settings.dto.BufferTimeDto;
import com.slotsync.booking.settings.dto.CalendarSettingsRequest;
import com.slotsync.booking.settings.dto.CalendarSettingsResponse;
import com.slotsync.booking.settings.dto.TimeSlotDto;
import com.slotsync.booking.settings.exception.CalendarSettingsNotFoundException;
import com.slotsync.booking.settings.exception.DuplicateCalendarSettingsException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 캘린더 설정 관리
 *
 * 근무 시간은 WorkingHourRule 행으로, 버퍼 시간은 BufferPolicy 행으로 저장한다.
 * 수정/삭제는 예약 생성과 같은 소유자 락을 잡고 수행한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CalendarSettingsService {

    private static final int SECONDS_PER_DAY = 24 * 60 * 60;

    private final CalendarSettingsRepository calendarSettingsRepository;
    private final WorkingHourRuleRepository workingHourRuleRepository;
    private final BufferPolicyRepository bufferPolicyRepository;
    private final AvailabilityExceptionRepository availabilityExceptionRepository;
    private final TimezoneRegistry timezoneRegistry;

    @Transactional(readOnly = true)
    public CalendarSettingsResponse getCalendarSettings(String cognitoSub) {
        log.info("캘린더 설정 조회 - cognitoSub: {}", cognitoSub);

        CalendarSettings settings = calendarSettingsRepository.findByOwnerId(cognitoSub)
                .orElseThrow(() -> notFound(cognitoSub));

        return toResponse(settings);
    }

    @Transactional
    public CalendarSettingsResponse createCalendarSettings(CalendarSettingsRequest request, String cognitoSub) {
        log.info("캘린더 설정 생성 요청 - cognitoSub: {}, timezone: {}", cognitoSub, request.getTimezone());

        if (calendarSettingsRepository.existsByOwnerId(cognitoSub)) {
            throw new DuplicateCalendarSettingsException("이미 캘린더 설정이 존재합니다. cognitoSub: " + cognitoSub);
        }

        validateTimezone(request.getTimezone());
        List<WorkingHourRule> rules = toRules(request.getWorkingHours(), cognitoSub, request.getTimezone());

        CalendarSettings settings = CalendarSettings.builder()
                .ownerId(cognitoSub)
                .timezone(request.getTimezone())
                .calendarName(request.getCalendarName())
                .defaultMeetingDuration(request.getDefaultMeetingDuration())
                .build();
        CalendarSettings saved = calendarSettingsRepository.save(settings);

        workingHourRuleRepository.saveAll(rules);
        BufferPolicy policy = BufferPolicy.none(cognitoSub);
        applyBufferTime(policy, request.getBufferTime());
        bufferPolicyRepository.save(policy);

        log.info("캘린더 설정 생성 완료 - calendarSettingsId: {}, 근무 시간 규칙: {}", saved.getCalendarSettingsId(), rules.size());

        return CalendarSettingsResponse.from(saved, rules, policy);
    }

    /**
     * 캘린더 설정 전체 교체
     *
     * 근무 시간 규칙은 모두 삭제 후 다시 저장한다.
     */
    @Transactional
    public CalendarSettingsResponse updateCalendarSettings(CalendarSettingsRequest request, String cognitoSub) {
        log.info("캘린더 설정 수정 요청 - cognitoSub: {}, timezone: {}", cognitoSub, request.getTimezone());

        CalendarSettings settings = calendarSettingsRepository.findByOwnerIdForUpdate(cognitoSub)
                .orElseThrow(() -> notFound(cognitoSub));

        validateTimezone(request.getTimezone());
        List<WorkingHourRule> rules = toRules(request.getWorkingHours(), cognitoSub, request.getTimezone());

        settings.setTimezone(request.getTimezone());
        settings.setCalendarName(request.getCalendarName());
        settings.setDefaultMeetingDuration(request.getDefaultMeetingDuration());
        CalendarSettings saved = calendarSettingsRepository.save(settings);

        workingHourRuleRepository.deleteAllByOwnerId(cognitoSub);
        workingHourRuleRepository.saveAll(rules);

        BufferPolicy policy = bufferPolicyRepository.findByOwnerId(cognitoSub)
                .orElseGet(() -> BufferPolicy.none(cognitoSub));
        applyBufferTime(policy, request.getBufferTime());
        bufferPolicyRepository.save(policy);

        log.info("캘린더 설정 수정 완료 - calendarSettingsId: {}", saved.getCalendarSettingsId());

        return CalendarSettingsResponse.from(saved, rules, policy);
    }

    /**
     * 캘린더 설정 삭제
     *
     * 근무 시간, 예외, 버퍼 정책도 함께 삭제한다. 예약은 보존한다.
     */
    @Transactional
    public void deleteCalendarSettings(String cognitoSub) {
        log.info("캘린더 설정 삭제 요청 - cognitoSub: {}", cognitoSub);

        CalendarSettings settings = calendarSettingsRepository.findByOwnerIdForUpdate(cognitoSub)
                .orElseThrow(() -> notFound(cognitoSub));

        workingHourRuleRepository.deleteAllByOwnerId(cognitoSub);
        availabilityExceptionRepository.deleteAllByOwnerId(cognitoSub);
        bufferPolicyRepository.deleteAllByOwnerId(cognitoSub);
        calendarSettingsRepository.delete(settings);

        log.info("캘린더 설정 삭제 완료 - calendarSettingsId: {}", settings.getCalendarSettingsId());
    }

    private CalendarSettingsResponse toResponse(CalendarSettings settings) {
        String ownerId = settings.getOwnerId();
        List<WorkingHourRule> rules = workingHourRuleRepository.findByOwnerId(ownerId);
        BufferPolicy policy = bufferPolicyRepository.findByOwnerId(ownerId)
                .orElseGet(() -> BufferPolicy.none(ownerId));
        return CalendarSettingsResponse.from(settings, rules, policy);
    }

    private void validateTimezone(String timezone) {
        if (!timezoneRegistry.isSupported(timezone)) {
            throw new InvalidRequestException("지원하지 않는 타임존입니다: " + timezone);
        }
    }

    /**
     * 요일별 근무 시간을 규칙 행으로 변환
     *
     * 각 구간은 start < end (end 00:00은 자정)이어야 하고 같은 요일의 구간끼리 겹칠 수 없다.
     */
    private List<WorkingHourRule> toRules(Map<String, List<TimeSlotDto>> workingHours, String ownerId, String timezone) {
        List<WorkingHourRule> rules = new ArrayList<>();

        for (Map.Entry<String, List<TimeSlotDto>> entry : workingHours.entrySet()) {
            DayOfWeek day = parseDay(entry.getKey());
            List<TimeSlotDto> slots = entry.getValue() != null ? new ArrayList<>(entry.getValue()) : new ArrayList<>();
            slots.sort(Comparator.comparing(TimeSlotDto::getStart));

            int previousEnd = -1;
            for (TimeSlotDto slot : slots) {
                if (!AvailabilityRuleResolver.isOrdered(slot.getStart(), slot.getEnd())) {
                    throw new InvalidRequestException(
                            "근무 시간의 시작은 종료보다 이전이어야 합니다: " + entry.getKey() + " " + slot.getStart() + "-" + slot.getEnd());
                }
                if (slot.getStart().toSecondOfDay() < previousEnd) {
                    throw new InvalidRequestException("같은 요일의 근무 시간이 겹칩니다: " + entry.getKey());
                }
                previousEnd = endSecondOfDay(slot.getEnd());

                rules.add(WorkingHourRule.builder()
                        .ownerId(ownerId)
                        .dayOfWeek(day)
                        .startTime(slot.getStart())
                        .endTime(slot.getEnd())
                        .timezone(timezone)
                        .build());
            }
        }
        return rules;
    }

    private DayOfWeek parseDay(String key) {
        try {
            return DayOfWeek.valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("알 수 없는 요일입니다: " + key, e);
        }
    }

    private static int endSecondOfDay(LocalTime end) {
        return LocalTime.MIDNIGHT.equals(end) ? SECONDS_PER_DAY : end.toSecondOfDay();
    }

    private void applyBufferTime(BufferPolicy policy, BufferTimeDto bufferTime) {
        if (bufferTime == null) {
            policy.setPreBufferMinutes(0);
            policy.setPostBufferMinutes(0);
            policy.setMinimumNoticeMinutes(0);
            policy.setMaximumAdvanceDays(null);
            return;
        }
        policy.setPreBufferMinutes(bufferTime.getBefore() != null ? bufferTime.getBefore() : 0);
        policy.setPostBufferMinutes(bufferTime.getAfter() != null ? bufferTime.getAfter() : 0);
        policy.setMinimumNoticeMinutes(bufferTime.getMinimumNoticeMinutes() != null ? bufferTime.getMinimumNoticeMinutes() : 0);
        policy.setMaximumAdvanceDays(bufferTime.getMaximumAdvanceDays());
    }

    private CalendarSettingsNotFoundException notFound(String cognitoSub) {
        return new CalendarSettingsNotFoundException("캘린더 설정을 찾을 수 없습니다. cognitoSub: " + cognitoSub);
    }
}
