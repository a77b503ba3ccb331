package com.slotsync.booking.settings.dto;

import com.slotsync.booking.common.entity.BufferPolicy;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "버퍼 시간 및 예약 가능 기간")
public class BufferTimeDto {

    @Min(value = 0, message = "Buffer before must not be negative")
    @Max(value = 240, message = "Buffer before must be at most 240 minutes")
    @Schema(description = "앞 버퍼 (분)", example = "10")
    private Integer before;

    @Min(value = 0, message = "Buffer after must not be negative")
    @Max(value = 240, message = "Buffer after must be at most 240 minutes")
    @Schema(description = "뒤 버퍼 (분)", example = "10")
    private Integer after;

    @Min(value = 0, message = "Minimum notice must not be negative")
    @Schema(description = "최소 사전 예약 시간 (분)", example = "120")
    private Integer minimumNoticeMinutes;

    @Min(value = 1, message = "Maximum advance must be at least 1 day")
    @Schema(description = "최대 예약 가능 기간 (일, null = 제한 없음)", example = "60")
    private Integer maximumAdvanceDays;

    public static BufferTimeDto from(BufferPolicy policy) {
        return BufferTimeDto.builder()
                .before(policy.getPreBufferMinutes())
                .after(policy.getPostBufferMinutes())
                .minimumNoticeMinutes(policy.getMinimumNoticeMinutes())
                .maximumAdvanceDays(policy.getMaximumAdvanceDays())
                .build();
    }
}
