package com.slotsync.booking.common.exception;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

/**
 * 오류 응답 본문
 *
 * 예약 거부는 errorCode에 거부 사유(DOUBLE_BOOKING 등)를 그대로 담는다.
 */
@Getter
@AllArgsConstructor
@Schema(description = "오류 응답")
public class ErrorResponse {

    @Schema(description = "오류 코드", example = "DOUBLE_BOOKING")
    private final String errorCode;

    @Schema(description = "사용자 메시지", example = "이미 다른 예약이 있는 시간입니다. 가능한 시간을 다시 조회해 주세요.")
    private final String message;

    @Schema(description = "발생 시각 (UTC)", example = "2025-11-24T00:00:00Z")
    private final Instant timestamp;

    public ErrorResponse(String errorCode, String message) {
        this(errorCode, message, Instant.now());
    }
}
