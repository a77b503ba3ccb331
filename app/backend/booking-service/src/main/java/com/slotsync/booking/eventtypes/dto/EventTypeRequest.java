package com.slotsync.booking.eventtypes.dto;

import com.slotsync.booking.common.entity.EventType.LocationType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "이벤트 타입 생성/수정 요청")
public class EventTypeRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 100, message = "Name must be at most 100 characters")
    @Schema(description = "이벤트 이름", example = "30분 상담", requiredMode = Schema.RequiredMode.REQUIRED)
    private String name;

    @Schema(description = "설명", example = "진로 상담")
    private String description;

    @NotNull(message = "Duration is required")
    @Min(value = 5, message = "Duration must be between 5 and 480 minutes")
    @Max(value = 480, message = "Duration must be between 5 and 480 minutes")
    @Schema(description = "미팅 길이 (분)", example = "30", requiredMode = Schema.RequiredMode.REQUIRED)
    private Integer durationMinutes;

    @Min(value = 5, message = "Slot step must be between 5 and 480 minutes")
    @Max(value = 480, message = "Slot step must be between 5 and 480 minutes")
    @Schema(description = "슬롯 시작 간격 (분, 생략 시 미팅 길이)", example = "15")
    private Integer slotStepMinutes;

    @Pattern(regexp = "^#[0-9A-Fa-f]{6}$", message = "Color must be a HEX code (#RRGGBB)")
    @Schema(description = "색상 (HEX)", example = "#3B82F6")
    private String color;

    @Schema(description = "진행 방식", example = "VIDEO", allowableValues = {"IN_PERSON", "PHONE", "VIDEO"})
    private LocationType locationType;

    @Size(max = 500, message = "Meeting link must be at most 500 characters")
    @Schema(description = "미팅 링크", example = "https://meet.example.com/abc")
    private String meetingLink;

    @Min(value = 0, message = "Buffer before must not be negative")
    @Schema(description = "앞 버퍼 재정의 (분, null = 캘린더 설정 사용)", example = "10")
    private Integer bufferBeforeMinutes;

    @Min(value = 0, message = "Buffer after must not be negative")
    @Schema(description = "뒤 버퍼 재정의 (분)", example = "10")
    private Integer bufferAfterMinutes;

    @Min(value = 0, message = "Minimum notice must not be negative")
    @Schema(description = "최소 사전 예약 시간 재정의 (분)", example = "60")
    private Integer minBookingNoticeMinutes;

    @Min(value = 1, message = "Maximum advance must be at least 1 day")
    @Schema(description = "최대 예약 가능 기간 재정의 (일)", example = "30")
    private Integer maxBookingAdvanceDays;

    @Schema(description = "활성 여부", example = "true")
    private Boolean isActive;
}
