package com.slotsync.shared.dto.sqs;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Booking-Service가 발행하는 예약 이벤트 메시지
 * SQS Queue: booking-notification-queue
 *
 * 공유 DTO: booking-service, Notification-Lambda(확인 메일 발송)가 사용
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BookingEventMessage {

    public static final String BOOKING_CONFIRMED = "BOOKING_CONFIRMED";
    public static final String BOOKING_CANCELLED = "BOOKING_CANCELLED";

    /**
     * 이벤트 타입: BOOKING_CONFIRMED, BOOKING_CANCELLED
     */
    private String eventType;

    private Long bookingId;

    /**
     * 캘린더 소유자 (Cognito Sub)
     */
    private String ownerId;

    private Long eventTypeId;

    /**
     * 이벤트 타입 이름 (메일 제목용)
     */
    private String eventTypeName;

    /**
     * 시작 시각 (UTC, 예: 2025-11-24T09:00:00Z)
     */
    @JsonFormat(shape = JsonFormat.Shape.STRING, timezone = "UTC")
    private Instant startTime;

    /**
     * 종료 시각 (UTC)
     */
    @JsonFormat(shape = JsonFormat.Shape.STRING, timezone = "UTC")
    private Instant endTime;

    /**
     * 소유자 타임존 (메일 본문 현지 시각 표기용)
     */
    private String ownerTimezone;

    private String inviteeName;

    private String inviteeEmail;
}
