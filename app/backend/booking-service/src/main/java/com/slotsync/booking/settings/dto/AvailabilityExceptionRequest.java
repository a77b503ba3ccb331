package com.slotsync.booking.settings.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.slotsync.booking.common.entity.AvailabilityException.ExceptionType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "가용 시간 예외 생성 요청")
public class AvailabilityExceptionRequest {

    @NotNull(message = "Date is required")
    @Schema(description = "예외 날짜 (소유자 타임존 기준)", example = "2025-12-25", requiredMode = Schema.RequiredMode.REQUIRED)
    private LocalDate date;

    @NotNull(message = "Type is required")
    @Schema(description = "예외 유형", example = "BLOCK_OUT", allowableValues = {"BLOCK_OUT", "OVERRIDE"},
            requiredMode = Schema.RequiredMode.REQUIRED)
    private ExceptionType type;

    @JsonFormat(pattern = "HH:mm")
    @Schema(description = "시작 시각 (OVERRIDE만)", example = "10:00", type = "string")
    private LocalTime startTime;

    @JsonFormat(pattern = "HH:mm")
    @Schema(description = "종료 시각 (OVERRIDE만, 00:00 = 자정)", example = "14:00", type = "string")
    private LocalTime endTime;
}
