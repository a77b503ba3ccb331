package com.slotsync.booking.common.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 예약 가능한 미팅 템플릿
 *
 * 버퍼/예약 기간 필드가 null이 아니면 소유자의 BufferPolicy 값을 대체한다.
 */
@Entity
@Table(name = "event_types", indexes = {
    @Index(name = "idx_event_type_owner", columnList = "owner_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EventType {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "event_type_id")
    private Long eventTypeId;

    @Column(name = "owner_id", nullable = false, length = 255)
    private String ownerId;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "duration_minutes", nullable = false)
    private Integer durationMinutes;

    @Column(name = "slot_step_minutes", nullable = false)
    private Integer slotStepMinutes;

    @Column(length = 7)
    private String color; // HEX color code (#RRGGBB)

    @Enumerated(EnumType.STRING)
    @Column(name = "location_type", length = 20)
    private LocationType locationType;

    @Column(name = "meeting_link", length = 500)
    private String meetingLink;

    @Column(name = "buffer_before_minutes")
    private Integer bufferBeforeMinutes;

    @Column(name = "buffer_after_minutes")
    private Integer bufferAfterMinutes;

    @Column(name = "min_booking_notice_minutes")
    private Integer minBookingNoticeMinutes;

    @Column(name = "max_booking_advance_days")
    private Integer maxBookingAdvanceDays;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean isActive = true;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public Duration getDuration() {
        return Duration.ofMinutes(durationMinutes);
    }

    public Duration getSlotStep() {
        return Duration.ofMinutes(slotStepMinutes);
    }

    public boolean isBookable() {
        return Boolean.TRUE.equals(isActive);
    }

    public enum LocationType {
        IN_PERSON, PHONE, VIDEO
    }
}
