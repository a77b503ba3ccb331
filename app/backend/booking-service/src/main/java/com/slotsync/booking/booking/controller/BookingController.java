package com.slotsync.booking.booking.controller;

import com.slotsync.booking.booking.dto.BookingRequest;
import com.slotsync.booking.booking.dto.BookingResponse;
import com.slotsync.booking.booking.exception.BookingRejectedException;
import com.slotsync.booking.booking.service.BookingResult;
import com.slotsync.booking.booking.service.BookingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.OffsetDateTime;
import java.util.List;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Booking", description = "예약 API")
public class BookingController {

    private final BookingService bookingService;

    @PostMapping("/users/{ownerId}/event-types/{eventTypeId}/bookings")
    @Operation(summary = "예약 생성", description = "요청 시점의 가용 상태를 다시 계산해 검증한 뒤 예약을 확정합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "예약 확정"),
            @ApiResponse(responseCode = "400", description = "입력값 오류 또는 길이 불일치 (DURATION_MISMATCH)"),
            @ApiResponse(responseCode = "404", description = "이벤트 타입 또는 캘린더 설정 없음"),
            @ApiResponse(responseCode = "409", description = "다른 예약과 겹침 (DOUBLE_BOOKING)"),
            @ApiResponse(responseCode = "422", description = "가용 시간/버퍼/예약 기간 위반")
    })
    public ResponseEntity<BookingResponse> createBooking(
            @PathVariable String ownerId,
            @PathVariable Long eventTypeId,
            @Valid @RequestBody BookingRequest request
    ) {
        log.info("POST /v1/users/{}/event-types/{}/bookings - startTime: {}", ownerId, eventTypeId, request.getStartTime());

        BookingResult result = bookingService.createBooking(ownerId, eventTypeId, request);
        if (!result.isAccepted()) {
            throw new BookingRejectedException(result.getReason());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(BookingResponse.from(result.getBooking()));
    }

    @PatchMapping("/bookings/{bookingId}/cancel")
    @SecurityRequirement(name = "ownerHeader")
    @Operation(summary = "예약 취소", description = "이미 취소된 예약이면 현재 상태를 그대로 반환합니다.")
    public ResponseEntity<BookingResponse> cancelBooking(
            @PathVariable Long bookingId,
            @Parameter(hidden = true) @RequestHeader("X-Cognito-Sub") String cognitoSub
    ) {
        return ResponseEntity.ok(bookingService.cancelBooking(bookingId, cognitoSub));
    }

    @GetMapping("/bookings")
    @SecurityRequirement(name = "ownerHeader")
    @Operation(summary = "예약 목록 조회", description = "기간과 겹치는 예약을 취소 건 포함하여 조회합니다.")
    public ResponseEntity<List<BookingResponse>> getBookings(
            @Parameter(hidden = true) @RequestHeader("X-Cognito-Sub") String cognitoSub,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime to
    ) {
        return ResponseEntity.ok(bookingService.getBookings(cognitoSub, from.toInstant(), to.toInstant()));
    }

    @GetMapping("/bookings/{bookingId}")
    @SecurityRequirement(name = "ownerHeader")
    @Operation(summary = "예약 상세 조회")
    public ResponseEntity<BookingResponse> getBooking(
            @PathVariable Long bookingId,
            @Parameter(hidden = true) @RequestHeader("X-Cognito-Sub") String cognitoSub
    ) {
        return ResponseEntity.ok(bookingService.getBooking(bookingId, cognitoSub));
    }
}
