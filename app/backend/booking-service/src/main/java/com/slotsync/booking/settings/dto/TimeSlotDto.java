package com.slotsync.booking.settings.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalTime;

/**
 * 하루 안의 시간 구간 (HH:mm). end가 00:00이면 자정까지를 의미한다.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "시간 구간")
public class TimeSlotDto {

    @NotNull(message = "Start is required")
    @JsonFormat(pattern = "HH:mm")
    @Schema(description = "시작 시각", example = "09:00", type = "string")
    private LocalTime start;

    @NotNull(message = "End is required")
    @JsonFormat(pattern = "HH:mm")
    @Schema(description = "종료 시각 (00:00 = 자정)", example = "17:00", type = "string")
    private LocalTime end;
}
