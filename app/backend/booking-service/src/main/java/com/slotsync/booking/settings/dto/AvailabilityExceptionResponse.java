package com.slotsync.booking.settings.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.slotsync.booking.common.entity.AvailabilityException;
import io.swagger.v3.oas.annotations.media.Schema;
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
@Schema(description = "가용 시간 예외 응답")
public class AvailabilityExceptionResponse {

    private Long exceptionId;

    private String ownerId;

    private LocalDate date;

    @Schema(description = "예외 유형", example = "OVERRIDE")
    private String type;

    @JsonFormat(pattern = "HH:mm")
    @Schema(type = "string", example = "10:00")
    private LocalTime startTime;

    @JsonFormat(pattern = "HH:mm")
    @Schema(type = "string", example = "14:00")
    private LocalTime endTime;

    public static AvailabilityExceptionResponse from(AvailabilityException exception) {
        return AvailabilityExceptionResponse.builder()
                .exceptionId(exception.getExceptionId())
                .ownerId(exception.getOwnerId())
                .date(exception.getExceptionDate())
                .type(exception.getType().name())
                .startTime(exception.getStartTime())
                .endTime(exception.getEndTime())
                .build();
    }
}
