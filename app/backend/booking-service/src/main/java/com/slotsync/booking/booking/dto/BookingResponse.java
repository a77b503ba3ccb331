package com.slotsync.booking.booking.dto;

import com.slotsync.booking.common.entity.Booking;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "예약 정보 응답")
public class BookingResponse {

    @Schema(description = "예약 ID", example = "1")
    private Long bookingId;

    @Schema(description = "캘린더 소유자 Cognito Sub", example = "a1b2c3d4-e5f6-7890-abcd-ef1234567890")
    private String ownerId;

    @Schema(description = "이벤트 타입 ID", example = "1")
    private Long eventTypeId;

    @Schema(description = "시작 시각 (UTC)", example = "2025-11-24T00:00:00Z")
    private Instant startTime;

    @Schema(description = "종료 시각 (UTC)", example = "2025-11-24T00:30:00Z")
    private Instant endTime;

    @Schema(description = "예약 상태", example = "CONFIRMED", allowableValues = {"CONFIRMED", "CANCELLED"})
    private String status;

    @Schema(description = "예약자 이름", example = "홍길동")
    private String inviteeName;

    @Schema(description = "예약자 이메일", example = "invitee@example.com")
    private String inviteeEmail;

    @Schema(description = "취소 시각 (UTC)")
    private Instant cancelledAt;

    @Schema(description = "생성 시각 (UTC)")
    private Instant createdAt;

    public static BookingResponse from(Booking booking) {
        return BookingResponse.builder()
                .bookingId(booking.getBookingId())
                .ownerId(booking.getOwnerId())
                .eventTypeId(booking.getEventTypeId())
                .startTime(booking.getStartTime())
                .endTime(booking.getEndTime())
                .status(booking.getStatus().name())
                .inviteeName(booking.getInviteeName())
                .inviteeEmail(booking.getInviteeEmail())
                .cancelledAt(booking.getCancelledAt())
                .createdAt(booking.getCreatedAt())
                .build();
    }
}
