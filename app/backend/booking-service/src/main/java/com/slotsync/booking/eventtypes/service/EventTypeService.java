package com.slotsync.booking.eventtypes.service;

import com.slotsync.booking.common.entity.Booking.BookingStatus;
import com.slotsync.booking.common.entity.EventType;
import com.slotsync.booking.common.exception.UnauthorizedAccessException;
import com.slotsync.booking.common.repository.BookingRepository;
import com.slotsync.booking.common.repository.EventTypeRepository;
import com.slotsync.booking.eventtypes.dto.EventTypeRequest;
import com.slotsync.booking.eventtypes.dto.EventTypeResponse;
import com.slotsync.booking.eventtypes.exception.EventTypeNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class EventTypeService {

    private final EventTypeRepository eventTypeRepository;
    private final BookingRepository bookingRepository;

    @Transactional
    public EventTypeResponse createEventType(EventTypeRequest request, String cognitoSub) {
        log.info("이벤트 타입 생성 요청 - cognitoSub: {}, name: {}", cognitoSub, request.getName());

        EventType eventType = EventType.builder()
                .ownerId(cognitoSub)
                .build();
        apply(eventType, request);

        EventType saved = eventTypeRepository.save(eventType);
        log.info("이벤트 타입 생성 완료 - eventTypeId: {}", saved.getEventTypeId());

        return EventTypeResponse.from(saved);
    }

    /**
     * 사용자의 이벤트 타입 목록 (activeOnly면 활성만)
     */
    @Transactional(readOnly = true)
    public List<EventTypeResponse> getEventTypes(String cognitoSub, boolean activeOnly) {
        log.info("이벤트 타입 목록 조회 - cognitoSub: {}, activeOnly: {}", cognitoSub, activeOnly);

        List<EventType> eventTypes = activeOnly
                ? eventTypeRepository.findByOwnerIdAndIsActive(cognitoSub, true)
                : eventTypeRepository.findByOwnerIdOrderByCreatedAtAsc(cognitoSub);

        return eventTypes.stream()
                .map(EventTypeResponse::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public EventTypeResponse getEventType(Long eventTypeId, String cognitoSub) {
        return EventTypeResponse.from(findOwned(eventTypeId, cognitoSub));
    }

    @Transactional
    public EventTypeResponse updateEventType(Long eventTypeId, EventTypeRequest request, String cognitoSub) {
        log.info("이벤트 타입 수정 요청 - eventTypeId: {}, cognitoSub: {}", eventTypeId, cognitoSub);

        EventType eventType = findOwned(eventTypeId, cognitoSub);
        apply(eventType, request);

        EventType updated = eventTypeRepository.save(eventType);
        log.info("이벤트 타입 수정 완료 - eventTypeId: {}", eventTypeId);

        return EventTypeResponse.from(updated);
    }

    /**
     * 이벤트 타입 삭제. 이미 확정된 예약은 취소하지 않는다.
     */
    @Transactional
    public void deleteEventType(Long eventTypeId, String cognitoSub) {
        log.info("이벤트 타입 삭제 요청 - eventTypeId: {}, cognitoSub: {}", eventTypeId, cognitoSub);

        EventType eventType = findOwned(eventTypeId, cognitoSub);
        long confirmed = bookingRepository.countByEventTypeIdAndStatus(eventTypeId, BookingStatus.CONFIRMED);

        eventTypeRepository.delete(eventType);
        log.info("이벤트 타입 삭제 완료 - eventTypeId: {}, 유지되는 확정 예약: {}", eventTypeId, confirmed);
    }

    private EventType findOwned(Long eventTypeId, String cognitoSub) {
        EventType eventType = eventTypeRepository.findById(eventTypeId)
                .orElseThrow(() -> new EventTypeNotFoundException("이벤트 타입을 찾을 수 없습니다. ID: " + eventTypeId));

        if (!eventType.getOwnerId().equals(cognitoSub)) {
            throw new UnauthorizedAccessException("해당 이벤트 타입에 접근할 권한이 없습니다.");
        }
        return eventType;
    }

    private void apply(EventType eventType, EventTypeRequest request) {
        eventType.setName(request.getName());
        eventType.setDescription(request.getDescription());
        eventType.setDurationMinutes(request.getDurationMinutes());
        eventType.setSlotStepMinutes(request.getSlotStepMinutes() != null
                ? request.getSlotStepMinutes()
                : request.getDurationMinutes());
        eventType.setColor(request.getColor());
        eventType.setLocationType(request.getLocationType());
        eventType.setMeetingLink(request.getMeetingLink());
        eventType.setBufferBeforeMinutes(request.getBufferBeforeMinutes());
        eventType.setBufferAfterMinutes(request.getBufferAfterMinutes());
        eventType.setMinBookingNoticeMinutes(request.getMinBookingNoticeMinutes());
        eventType.setMaxBookingAdvanceDays(request.getMaxBookingAdvanceDays());
        if (request.getIsActive() != null) {
            eventType.setIsActive(request.getIsActive());
        }
    }
}
