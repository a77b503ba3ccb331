package com.slotsync.booking.common.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * 사용자별 캘린더 설정
 *
 * 예약 생성/취소 시 이 행에 PESSIMISTIC_WRITE 락을 걸어 소유자 단위로 직렬화한다.
 */
@Entity
@Table(name = "calendar_settings", uniqueConstraints = {
    @UniqueConstraint(name = "uk_calendar_settings_owner", columnNames = {"owner_id"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CalendarSettings {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "calendar_settings_id")
    private Long calendarSettingsId;

    @Column(name = "owner_id", nullable = false, length = 255)
    private String ownerId;

    /**
     * IANA 타임존 ID (예: "Asia/Seoul")
     */
    @Column(nullable = false, length = 64)
    private String timezone;

    @Column(name = "calendar_name", nullable = false, length = 100)
    private String calendarName;

    @Column(name = "default_meeting_duration", nullable = false)
    private Integer defaultMeetingDuration;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
