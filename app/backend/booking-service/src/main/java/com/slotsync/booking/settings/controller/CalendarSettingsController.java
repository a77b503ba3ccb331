package com.slotsync.booking.settings.controller;

import com.slotsync.booking.settings.dto.CalendarSettingsRequest;
import com.slotsync.booking.settings.dto.CalendarSettingsResponse;
import com.slotsync.booking.settings.service.CalendarSettingsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/v1/calendar-settings")
@RequiredArgsConstructor
@Tag(name = "Calendar Settings", description = "캘린더 설정 API")
@SecurityRequirement(name = "ownerHeader")
public class CalendarSettingsController {

    private final CalendarSettingsService calendarSettingsService;

    @GetMapping
    @Operation(summary = "캘린더 설정 조회")
    public ResponseEntity<CalendarSettingsResponse> getCalendarSettings(
            @Parameter(hidden = true) @RequestHeader("X-Cognito-Sub") String cognitoSub
    ) {
        return ResponseEntity.ok(calendarSettingsService.getCalendarSettings(cognitoSub));
    }

    @PostMapping
    @Operation(summary = "캘린더 설정 생성", description = "사용자당 하나만 생성할 수 있습니다.")
    public ResponseEntity<CalendarSettingsResponse> createCalendarSettings(
            @Parameter(hidden = true) @RequestHeader("X-Cognito-Sub") String cognitoSub,
            @Valid @RequestBody CalendarSettingsRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(calendarSettingsService.createCalendarSettings(request, cognitoSub));
    }

    @PutMapping
    @Operation(summary = "캘린더 설정 수정", description = "근무 시간과 버퍼 시간을 포함해 전체를 교체합니다.")
    public ResponseEntity<CalendarSettingsResponse> updateCalendarSettings(
            @Parameter(hidden = true) @RequestHeader("X-Cognito-Sub") String cognitoSub,
            @Valid @RequestBody CalendarSettingsRequest request
    ) {
        return ResponseEntity.ok(calendarSettingsService.updateCalendarSettings(request, cognitoSub));
    }

    @DeleteMapping
    @Operation(summary = "캘린더 설정 삭제", description = "기존 예약은 유지됩니다.")
    public ResponseEntity<Void> deleteCalendarSettings(
            @Parameter(hidden = true) @RequestHeader("X-Cognito-Sub") String cognitoSub
    ) {
        calendarSettingsService.deleteCalendarSettings(cognitoSub);
        return ResponseEntity.noContent().build();
    }
}
