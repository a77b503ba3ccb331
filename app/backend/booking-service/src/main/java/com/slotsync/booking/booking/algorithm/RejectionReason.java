package com.slotsync.booking.booking.algorithm;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 예약 거부 사유
 *
 * 각 사유는 오류 분류와 사용자 메시지에 1:1로 대응한다.
 */
@Getter
@RequiredArgsConstructor
public enum RejectionReason {

    DURATION_MISMATCH(ErrorCategory.VALIDATION, "예약 길이가 이벤트 타입의 길이와 다릅니다."),
    OUTSIDE_AVAILABILITY(ErrorCategory.AVAILABILITY, "요청한 시간은 예약 가능한 시간이 아닙니다."),
    BUFFER_VIOLATION(ErrorCategory.AVAILABILITY, "앞뒤 일정과의 버퍼 시간이 부족합니다."),
    NOTICE_VIOLATION(ErrorCategory.AVAILABILITY, "최소 사전 예약 시간보다 가까운 시간은 예약할 수 없습니다."),
    ADVANCE_WINDOW_VIOLATION(ErrorCategory.AVAILABILITY, "예약 가능한 기간을 벗어났습니다."),
    DOUBLE_BOOKING(ErrorCategory.CONFLICT, "이미 다른 예약이 있는 시간입니다. 가능한 시간을 다시 조회해 주세요.");

    private final ErrorCategory category;
    private final String message;

    public String getErrorCode() {
        return name();
    }

    public enum ErrorCategory {
        /** 입력 형식 오류 */
        VALIDATION,
        /** 다른 시간으로 재시도 가능 */
        AVAILABILITY,
        /** 다른 예약과 충돌 (슬롯 재조회 후 재시도) */
        CONFLICT
    }
}
