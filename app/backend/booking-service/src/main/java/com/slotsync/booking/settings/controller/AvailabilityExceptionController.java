package com.slotsync.booking.settings.controller;

import com.slotsync.booking.settings.dto.AvailabilityExceptionRequest;
import com.slotsync.booking.settings.dto.AvailabilityExceptionResponse;
import com.slotsync.booking.settings.service.AvailabilityExceptionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/v1/availability-exceptions")
@RequiredArgsConstructor
@Tag(name = "Availability Exception", description = "날짜별 가용 시간 예외 API")
@SecurityRequirement(name = "ownerHeader")
public class AvailabilityExceptionController {

    private final AvailabilityExceptionService availabilityExceptionService;

    @GetMapping
    @Operation(summary = "예외 목록 조회")
    public ResponseEntity<List<AvailabilityExceptionResponse>> getExceptions(
            @Parameter(hidden = true) @RequestHeader("X-Cognito-Sub") String cognitoSub,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return ResponseEntity.ok(availabilityExceptionService.getExceptions(cognitoSub, from, to));
    }

    @PostMapping
    @Operation(summary = "예외 추가", description = "BLOCK_OUT은 종일 차단, OVERRIDE는 해당 날짜의 근무 시간을 대체합니다.")
    public ResponseEntity<AvailabilityExceptionResponse> createException(
            @Parameter(hidden = true) @RequestHeader("X-Cognito-Sub") String cognitoSub,
            @Valid @RequestBody AvailabilityExceptionRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(availabilityExceptionService.createException(request, cognitoSub));
    }

    @DeleteMapping("/{exceptionId}")
    @Operation(summary = "예외 삭제")
    public ResponseEntity<Void> deleteException(
            @PathVariable Long exceptionId,
            @Parameter(hidden = true) @RequestHeader("X-Cognito-Sub") String cognitoSub
    ) {
        availabilityExceptionService.deleteException(exceptionId, cognitoSub);
        return ResponseEntity.noContent().build();
    }
}
