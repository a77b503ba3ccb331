package com.slotsync.booking.eventtypes.dto;

import com.slotsync.booking.common.entity.EventType;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "이벤트 타입 응답")
public class EventTypeResponse {

    private Long eventTypeId;

    private String ownerId;

    private String name;

    private String description;

    private Integer durationMinutes;

    private Integer slotStepMinutes;

    private String color;

    @Schema(description = "진행 방식", example = "VIDEO")
    private String locationType;

    private String meetingLink;

    private Integer bufferBeforeMinutes;

    private Integer bufferAfterMinutes;

    private Integer minBookingNoticeMinutes;

    private Integer maxBookingAdvanceDays;

    private Boolean isActive;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public static EventTypeResponse from(EventType eventType) {
        return EventTypeResponse.builder()
                .eventTypeId(eventType.getEventTypeId())
                .ownerId(eventType.getOwnerId())
                .name(eventType.getName())
                .description(eventType.getDescription())
                .durationMinutes(eventType.getDurationMinutes())
                .slotStepMinutes(eventType.getSlotStepMinutes())
                .color(eventType.getColor())
                .locationType(eventType.getLocationType() != null ? eventType.getLocationType().name() : null)
                .meetingLink(eventType.getMeetingLink())
                .bufferBeforeMinutes(eventType.getBufferBeforeMinutes())
                .bufferAfterMinutes(eventType.getBufferAfterMinutes())
                .minBookingNoticeMinutes(eventType.getMinBookingNoticeMinutes())
                .maxBookingAdvanceDays(eventType.getMaxBookingAdvanceDays())
                .isActive(eventType.getIsActive())
                .createdAt(eventType.getCreatedAt())
                .updatedAt(eventType.getUpdatedAt())
                .build();
    }
}
