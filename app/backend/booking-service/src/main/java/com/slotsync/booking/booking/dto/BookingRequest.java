package com.slotsync.booking.booking.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "예약 생성 요청")
public class BookingRequest {

    @NotNull(message = "Start time is required")
    @Schema(description = "시작 시각 (오프셋 포함)", example = "2025-11-24T09:00:00+09:00", requiredMode = Schema.RequiredMode.REQUIRED)
    private OffsetDateTime startTime;

    @Schema(description = "종료 시각 (생략 시 이벤트 길이로 계산)", example = "2025-11-24T09:30:00+09:00")
    private OffsetDateTime endTime;

    @NotBlank(message = "Invitee name is required")
    @Size(max = 100, message = "Invitee name must be at most 100 characters")
    @Schema(description = "예약자 이름", example = "홍길동", requiredMode = Schema.RequiredMode.REQUIRED)
    private String inviteeName;

    @NotBlank(message = "Invitee email is required")
    @Email(message = "Invitee email is invalid")
    @Schema(description = "예약자 이메일", example = "invitee@example.com", requiredMode = Schema.RequiredMode.REQUIRED)
    private String inviteeEmail;
}
