package com.slotsync.booking.availability.algorithm;

import com.slotsync.booking.common.entity.AvailabilityException;
import com.slotsync.booking.common.entity.WorkingHourRule;
import com.slotsync.booking.common.exception.AvailabilityDataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 가용 시간 규칙 전개
 *
 * 주요 기능:
 * 1. 날짜별 우선순위 조회: 예외(날짜 키) → 요일 규칙
 * 2. 현지 시각 구간을 소유자 타임존 기준으로 UTC 변환 (DST 전환일은 실제 UTC 길이로 생성)
 * 3. 날짜 경계를 넘어 인접/중첩된 구간 병합 후 조회 범위로 자르기
 */
@Component
@Slf4j
public class AvailabilityRuleResolver {

    /**
     * 가용 시간 전개 메인 메서드
     *
     * @param ownerId    소유자 ID (로그용)
     * @param range      조회 범위 [from, to) (UTC)
     * @param zone       소유자 타임존
     * @param rules      요일별 근무 시간 규칙
     * @param exceptions 날짜별 예외
     * @return 정렬되고 서로 겹치지 않는 UTC 구간 목록
     * @throws AvailabilityDataException 규칙 데이터가 손상된 경우
     */
    public List<TimeInterval> resolve(
            String ownerId,
            TimeInterval range,
            ZoneId zone,
            List<WorkingHourRule> rules,
            List<AvailabilityException> exceptions
    ) {
        if (range.isEmpty()) {
            return new ArrayList<>();
        }

        Map<DayOfWeek, List<WorkingHourRule>> rulesByDay = indexRules(rules, zone);
        Map<LocalDate, List<AvailabilityException>> exceptionsByDate = indexExceptions(exceptions);

        LocalDate firstDate = range.getStart().atZone(zone).toLocalDate();
        LocalDate lastDate = range.getEnd().atZone(zone).toLocalDate();

        List<TimeInterval> expanded = new ArrayList<>();
        for (LocalDate date = firstDate; !date.isAfter(lastDate); date = date.plusDays(1)) {
            List<AvailabilityException> dateExceptions = exceptionsByDate.get(date);
            if (dateExceptions != null) {
                expanded.addAll(expandExceptions(date, dateExceptions, zone));
            } else {
                expanded.addAll(expandRules(date, rulesByDay.getOrDefault(date.getDayOfWeek(), Collections.emptyList()), zone));
            }
        }

        List<TimeInterval> resolved = TimeIntervals.clip(TimeIntervals.merge(expanded), range);
        log.debug("가용 시간 전개 완료 - ownerId: {}, 기간: {} ~ {}, 날짜 수: {}, 구간 수: {}",
                ownerId, firstDate, lastDate, ChronoUnit.DAYS.between(firstDate, lastDate) + 1, resolved.size());
        return resolved;
    }

    private Map<DayOfWeek, List<WorkingHourRule>> indexRules(List<WorkingHourRule> rules, ZoneId zone) {
        Map<DayOfWeek, List<WorkingHourRule>> byDay = new EnumMap<>(DayOfWeek.class);
        for (WorkingHourRule rule : rules) {
            validateRule(rule, zone);
            byDay.computeIfAbsent(rule.getDayOfWeek(), day -> new ArrayList<>()).add(rule);
        }
        return byDay;
    }

    private Map<LocalDate, List<AvailabilityException>> indexExceptions(List<AvailabilityException> exceptions) {
        Map<LocalDate, List<AvailabilityException>> byDate = new HashMap<>();
        for (AvailabilityException exception : exceptions) {
            byDate.computeIfAbsent(exception.getExceptionDate(), date -> new ArrayList<>()).add(exception);
        }
        return byDate;
    }

    /**
     * 예외 전개: 종일 차단이 하나라도 있으면 그 날짜는 비어 있고, 아니면 대체 구간들의 합집합
     */
    private List<TimeInterval> expandExceptions(LocalDate date, List<AvailabilityException> exceptions, ZoneId zone) {
        List<TimeInterval> intervals = new ArrayList<>();
        for (AvailabilityException exception : exceptions) {
            if (exception.isBlockOut()) {
                return Collections.emptyList();
            }
            if (exception.getStartTime() == null || exception.getEndTime() == null) {
                throw new AvailabilityDataException("대체 예외에 시간 구간이 없습니다. exceptionId: " + exception.getExceptionId());
            }
            if (!isOrdered(exception.getStartTime(), exception.getEndTime())) {
                throw new AvailabilityDataException("대체 예외의 시작 시간이 종료 시간보다 늦습니다. exceptionId: " + exception.getExceptionId());
            }
            toUtc(date, exception.getStartTime(), exception.getEndTime(), zone).ifPresent(intervals::add);
        }
        return intervals;
    }

    private List<TimeInterval> expandRules(LocalDate date, List<WorkingHourRule> rules, ZoneId zone) {
        List<TimeInterval> intervals = new ArrayList<>(rules.size());
        for (WorkingHourRule rule : rules) {
            toUtc(date, rule.getStartTime(), rule.getEndTime(), zone).ifPresent(intervals::add);
        }
        return intervals;
    }

    /**
     * 현지 시각 구간 → UTC 구간
     *
     * DST gap 안의 현지 시각은 gap 길이만큼 뒤로 밀리고, overlap에서는 이른 오프셋을 사용한다.
     * 변환 결과가 비면 (gap 안에 완전히 들어간 구간) 제외한다.
     */
    Optional<TimeInterval> toUtc(LocalDate date, LocalTime start, LocalTime end, ZoneId zone) {
        Instant startInstant = ZonedDateTime.of(date, start, zone).toInstant();
        Instant endInstant = LocalTime.MIDNIGHT.equals(end)
                ? date.plusDays(1).atStartOfDay(zone).toInstant()
                : ZonedDateTime.of(date, end, zone).toInstant();

        if (!startInstant.isBefore(endInstant)) {
            return Optional.empty();
        }
        return Optional.of(new TimeInterval(startInstant, endInstant));
    }

    private void validateRule(WorkingHourRule rule, ZoneId zone) {
        if (rule.getDayOfWeek() == null || rule.getStartTime() == null || rule.getEndTime() == null) {
            throw new AvailabilityDataException("근무 시간 규칙에 필수 값이 없습니다. ruleId: " + rule.getRuleId());
        }
        if (!isOrdered(rule.getStartTime(), rule.getEndTime())) {
            throw new AvailabilityDataException("근무 시간 규칙의 시작 시간이 종료 시간보다 늦습니다. ruleId: " + rule.getRuleId());
        }
        if (rule.getTimezone() != null && !rule.getTimezone().equals(zone.getId())) {
            throw new AvailabilityDataException("근무 시간 규칙의 타임존이 캘린더 설정과 다릅니다. ruleId: "
                    + rule.getRuleId() + ", rule: " + rule.getTimezone() + ", settings: " + zone.getId());
        }
    }

    /**
     * 같은 날 안에서 start < end (end 00:00은 하루 끝)
     */
    public static boolean isOrdered(LocalTime start, LocalTime end) {
        return LocalTime.MIDNIGHT.equals(end) || start.isBefore(end);
    }
}
