package com.slotsync.booking.eventtypes.controller;

import com.slotsync.booking.eventtypes.dto.EventTypeRequest;
import com.slotsync.booking.eventtypes.dto.EventTypeResponse;
import com.slotsync.booking.eventtypes.service.EventTypeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1/event-types")
@RequiredArgsConstructor
@Tag(name = "Event Type", description = "이벤트 타입 관리 API")
@SecurityRequirement(name = "ownerHeader")
public class EventTypeController {

    private final EventTypeService eventTypeService;

    @GetMapping
    @Operation(summary = "이벤트 타입 목록 조회")
    public ResponseEntity<List<EventTypeResponse>> getEventTypes(
            @Parameter(hidden = true) @RequestHeader("X-Cognito-Sub") String cognitoSub,
            @Parameter(description = "활성 이벤트 타입만 조회") @RequestParam(required = false, defaultValue = "false") boolean activeOnly
    ) {
        return ResponseEntity.ok(eventTypeService.getEventTypes(cognitoSub, activeOnly));
    }

    @GetMapping("/{eventTypeId}")
    @Operation(summary = "이벤트 타입 상세 조회")
    public ResponseEntity<EventTypeResponse> getEventType(
            @PathVariable Long eventTypeId,
            @Parameter(hidden = true) @RequestHeader("X-Cognito-Sub") String cognitoSub
    ) {
        return ResponseEntity.ok(eventTypeService.getEventType(eventTypeId, cognitoSub));
    }

    @PostMapping
    @Operation(summary = "이벤트 타입 생성")
    public ResponseEntity<EventTypeResponse> createEventType(
            @Parameter(hidden = true) @RequestHeader("X-Cognito-Sub") String cognitoSub,
            @Valid @RequestBody EventTypeRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(eventTypeService.createEventType(request, cognitoSub));
    }

    @PutMapping("/{eventTypeId}")
    @Operation(summary = "이벤트 타입 수정")
    public ResponseEntity<EventTypeResponse> updateEventType(
            @PathVariable Long eventTypeId,
            @Parameter(hidden = true) @RequestHeader("X-Cognito-Sub") String cognitoSub,
            @Valid @RequestBody EventTypeRequest request
    ) {
        return ResponseEntity.ok(eventTypeService.updateEventType(eventTypeId, request, cognitoSub));
    }

    @DeleteMapping("/{eventTypeId}")
    @Operation(summary = "이벤트 타입 삭제", description = "기존 예약은 취소되지 않습니다.")
    public ResponseEntity<Void> deleteEventType(
            @PathVariable Long eventTypeId,
            @Parameter(hidden = true) @RequestHeader("X-Cognito-Sub") String cognitoSub
    ) {
        eventTypeService.deleteEventType(eventTypeId, cognitoSub);
        return ResponseEntity.noContent().build();
    }
}
