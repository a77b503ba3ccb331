package com.slotsync.booking.availability.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;

/**
 * 예약 가능 슬롯 DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "예약 가능 슬롯")
public class SlotDto {

    @Schema(description = "시작 시각 (UTC)", example = "2025-11-24T00:00:00Z")
    private Instant startTime;

    @Schema(description = "종료 시각 (UTC)", example = "2025-11-24T00:30:00Z")
    private Instant endTime;

    @Schema(description = "소유자 타임존 기준 시작 시각", example = "2025-11-24T09:00:00+09:00")
    private OffsetDateTime localStartTime;

    public static SlotDto of(Instant start, Duration duration, ZoneId zone) {
        return SlotDto.builder()
                .startTime(start)
                .endTime(start.plus(duration))
                .localStartTime(start.atZone(zone).toOffsetDateTime())
                .build();
    }
}
