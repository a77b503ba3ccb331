package com.slotsync.booking.common.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * 예약
 *
 * 시작/종료 시각은 항상 UTC Instant로 저장한다 (현지 시각 저장 금지).
 * 취소된 예약은 충돌 검사에서 제외되지만 감사 목적으로 보존한다.
 */
@Entity
@Table(name = "bookings", indexes = {
    @Index(name = "idx_owner_status_start", columnList = "owner_id, status, start_time"),
    @Index(name = "idx_owner_end", columnList = "owner_id, end_time"),
    @Index(name = "idx_event_type_id", columnList = "event_type_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Booking {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "booking_id")
    private Long bookingId;

    @Column(name = "owner_id", nullable = false, length = 255)
    private String ownerId;

    /**
     * 이벤트 타입 삭제 후에도 예약은 유지되므로 FK를 두지 않는다
     */
    @Column(name = "event_type_id", nullable = false)
    private Long eventTypeId;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private BookingStatus status = BookingStatus.CONFIRMED;

    @Column(name = "invitee_name", length = 100)
    private String inviteeName;

    @Column(name = "invitee_email", length = 255)
    private String inviteeEmail;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public enum BookingStatus {
        CONFIRMED, CANCELLED
    }
}
