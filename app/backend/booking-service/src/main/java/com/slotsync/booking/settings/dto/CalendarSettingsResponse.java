package com.slotsync.booking.settings.dto;

import com.slotsync.booking.common.entity.BufferPolicy;
import com.slotsync.booking.common.entity.CalendarSettings;
import com.slotsync.booking.common.entity.WorkingHourRule;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "캘린더 설정 응답")
public class CalendarSettingsResponse {

    @Schema(description = "캘린더 설정 ID", example = "1")
    private Long calendarSettingsId;

    @Schema(description = "소유자 Cognito Sub", example = "a1b2c3d4-e5f6-7890-abcd-ef1234567890")
    private String ownerId;

    @Schema(description = "IANA 타임존", example = "Asia/Seoul")
    private String timezone;

    @Schema(description = "캘린더 이름", example = "상담 예약")
    private String calendarName;

    @Schema(description = "기본 미팅 길이 (분)", example = "30")
    private Integer defaultMeetingDuration;

    @Schema(description = "요일별 근무 시간 (월요일부터)")
    private Map<String, List<TimeSlotDto>> workingHours;

    private BufferTimeDto bufferTime;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public static CalendarSettingsResponse from(CalendarSettings settings, List<WorkingHourRule> rules, BufferPolicy policy) {
        return CalendarSettingsResponse.builder()
                .calendarSettingsId(settings.getCalendarSettingsId())
                .ownerId(settings.getOwnerId())
                .timezone(settings.getTimezone())
                .calendarName(settings.getCalendarName())
                .defaultMeetingDuration(settings.getDefaultMeetingDuration())
                .workingHours(toWorkingHours(rules))
                .bufferTime(BufferTimeDto.from(policy))
                .createdAt(settings.getCreatedAt())
                .updatedAt(settings.getUpdatedAt())
                .build();
    }

    private static Map<String, List<TimeSlotDto>> toWorkingHours(List<WorkingHourRule> rules) {
        Map<String, List<TimeSlotDto>> workingHours = new LinkedHashMap<>();
        for (DayOfWeek day : DayOfWeek.values()) {
            List<TimeSlotDto> slots = new ArrayList<>();
            rules.stream()
                    .filter(rule -> rule.getDayOfWeek() == day)
                    .sorted(Comparator.comparing(WorkingHourRule::getStartTime))
                    .forEach(rule -> slots.add(new TimeSlotDto(rule.getStartTime(), rule.getEndTime())));
            if (!slots.isEmpty()) {
                workingHours.put(day.name().toLowerCase(Locale.ROOT), slots);
            }
        }
        return workingHours;
    }
}
