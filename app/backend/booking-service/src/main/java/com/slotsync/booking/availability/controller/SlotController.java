package com.slotsync.booking.availability.controller;

import com.slotsync.booking.availability.dto.SlotListResponse;
import com.slotsync.booking.availability.service.AvailabilityService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.OffsetDateTime;

/**
 * 예약 가능 슬롯 조회 API (초대받은 사람용, 인증 불필요)
 */
@Tag(name = "Slots", description = "예약 가능 슬롯 조회 API")
@RestController
@RequestMapping("/v1/users/{ownerId}/event-types/{eventTypeId}/slots")
@RequiredArgsConstructor
@Slf4j
public class SlotController {

    private final AvailabilityService availabilityService;

    @Operation(
            summary = "예약 가능 슬롯 조회",
            description = "근무 시간, 예외, 확정 예약, 버퍼 정책을 반영한 예약 가능 시작 시각 목록을 반환합니다."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "400", description = "잘못된 조회 기간"),
            @ApiResponse(responseCode = "404", description = "이벤트 타입 또는 캘린더 설정 없음")
    })
    @GetMapping
    public ResponseEntity<SlotListResponse> listSlots(
            @PathVariable String ownerId,
            @PathVariable Long eventTypeId,
            @Parameter(description = "조회 시작 (ISO-8601, 오프셋 포함)", example = "2025-11-24T00:00:00Z")
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime from,
            @Parameter(description = "조회 끝 (제외)", example = "2025-11-25T00:00:00Z")
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime to
    ) {
        log.info("GET /v1/users/{}/event-types/{}/slots - from: {}, to: {}", ownerId, eventTypeId, from, to);
        SlotListResponse response = availabilityService.listSlots(
                ownerId, eventTypeId, from.toInstant(), to.toInstant());
        return ResponseEntity.ok(response);
    }
}
