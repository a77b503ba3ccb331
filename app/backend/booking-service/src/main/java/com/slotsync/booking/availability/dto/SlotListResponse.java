package com.slotsync.booking.availability.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * 슬롯 조회 응답 DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "슬롯 조회 응답")
public class SlotListResponse {

    private String ownerId;

    private Long eventTypeId;

    private String eventTypeName;

    private Integer durationMinutes;

    @Schema(description = "소유자 타임존", example = "Asia/Seoul")
    private String timezone;

    private Instant from;

    private Instant to;

    private List<SlotDto> slots;

    private Integer totalSlots;

    /**
     * slots 설정 시 totalSlots도 함께 계산
     */
    public static class SlotListResponseBuilder {
        public SlotListResponseBuilder slots(List<SlotDto> slots) {
            this.slots = slots;
            this.totalSlots = slots != null ? slots.size() : 0;
            return this;
        }
    }
}
