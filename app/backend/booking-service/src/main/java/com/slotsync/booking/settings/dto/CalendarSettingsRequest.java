package com.slotsync.booking.settings.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "캘린더 설정 생성/수정 요청")
public class CalendarSettingsRequest {

    @NotBlank(message = "Timezone is required")
    @Schema(description = "IANA 타임존", example = "Asia/Seoul", requiredMode = Schema.RequiredMode.REQUIRED)
    private String timezone;

    @NotBlank(message = "Calendar name is required")
    @Size(max = 100, message = "Calendar name must be at most 100 characters")
    @Schema(description = "캘린더 이름", example = "상담 예약", requiredMode = Schema.RequiredMode.REQUIRED)
    private String calendarName;

    @NotNull(message = "Default meeting duration is required")
    @Min(value = 15, message = "Meeting duration must be between 15 and 120 minutes")
    @Max(value = 120, message = "Meeting duration must be between 15 and 120 minutes")
    @Schema(description = "기본 미팅 길이 (분)", example = "30", requiredMode = Schema.RequiredMode.REQUIRED)
    private Integer defaultMeetingDuration;

    /**
     * 요일(monday ~ sunday) → 근무 시간 목록. 빠진 요일은 근무하지 않는 날.
     */
    @NotNull(message = "Working hours are required")
    @Schema(description = "요일별 근무 시간", example = "{\"monday\": [{\"start\": \"09:00\", \"end\": \"17:00\"}]}")
    private Map<String, List<@Valid TimeSlotDto>> workingHours;

    @Valid
    @Schema(description = "버퍼 시간 (생략 시 0)")
    private BufferTimeDto bufferTime;
}
