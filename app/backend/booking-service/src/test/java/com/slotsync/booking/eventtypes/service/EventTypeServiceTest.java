package com.slotsync.booking.eventtypes.service;

import com.slotsync.booking.common.entity.Booking.BookingStatus;
import com.slotsync.booking.common.entity.EventType;
import com.slotsync.booking.common.entity.EventType.LocationType;
import com.slotsync.booking.common.exception.UnauthorizedAccessException;
import com.slotsync.booking.common.repository.BookingRepository;
import com.slotsync.booking.common.repository.EventTypeRepository;
import com.slotsync.booking.eventtypes.dto.EventTypeRequest;
import com.slotsync.booking.eventtypes.dto.EventTypeResponse;
import com.slotsync.booking.eventtypes.exception.EventTypeNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

@ExtendWith(MockitoExtension.class)
@DisplayName("EventTypeService 테스트")
class EventTypeServiceTest {

    private static final String OWNER = "owner-sub";

    @Mock
    private EventTypeRepository eventTypeRepository;
    @Mock
    private BookingRepository bookingRepository;

    @InjectMocks
    private EventTypeService eventTypeService;

    private EventType existing() {
        return EventType.builder()
                .eventTypeId(1L)
                .ownerId(OWNER)
                .name("30분 상담")
                .durationMinutes(30)
                .slotStepMinutes(30)
                .build();
    }

    @Test
    @DisplayName("생성 - 슬롯 간격을 생략하면 미팅 길이를 사용")
    void create_defaultsStepToDuration() {
        // given
        EventTypeRequest request = EventTypeRequest.builder()
                .name("45분 면담")
                .durationMinutes(45)
                .locationType(LocationType.VIDEO)
                .bufferBeforeMinutes(10)
                .build();
        given(eventTypeRepository.save(any(EventType.class))).willAnswer(invocation -> {
            EventType eventType = invocation.getArgument(0);
            eventType.setEventTypeId(3L);
            return eventType;
        });

        // when
        EventTypeResponse response = eventTypeService.createEventType(request, OWNER);

        // then
        assertThat(response.getEventTypeId()).isEqualTo(3L);
        assertThat(response.getOwnerId()).isEqualTo(OWNER);
        assertThat(response.getSlotStepMinutes()).isEqualTo(45);
        assertThat(response.getBufferBeforeMinutes()).isEqualTo(10);
        assertThat(response.getBufferAfterMinutes()).isNull();
        assertThat(response.getIsActive()).isTrue();
    }

    @Test
    @DisplayName("목록 - activeOnly면 활성 이벤트 타입만 조회")
    void getEventTypes_activeOnly() {
        given(eventTypeRepository.findByOwnerIdAndIsActive(OWNER, true)).willReturn(List.of(existing()));

        List<EventTypeResponse> responses = eventTypeService.getEventTypes(OWNER, true);

        assertThat(responses).hasSize(1);
        then(eventTypeRepository).should(never()).findByOwnerIdOrderByCreatedAtAsc(any());
    }

    @Test
    @DisplayName("수정 - 비활성화 가능, 명시한 슬롯 간격 유지")
    void update_deactivate() {
        // given
        EventType eventType = existing();
        given(eventTypeRepository.findById(1L)).willReturn(Optional.of(eventType));
        given(eventTypeRepository.save(eventType)).willReturn(eventType);
        EventTypeRequest request = EventTypeRequest.builder()
                .name("30분 상담")
                .durationMinutes(30)
                .slotStepMinutes(15)
                .isActive(false)
                .build();

        // when
        EventTypeResponse response = eventTypeService.updateEventType(1L, request, OWNER);

        // then
        assertThat(response.getIsActive()).isFalse();
        assertThat(response.getSlotStepMinutes()).isEqualTo(15);
        assertThat(eventType.isBookable()).isFalse();
    }

    @Test
    @DisplayName("조회 - 다른 소유자의 이벤트 타입은 UnauthorizedAccessException")
    void get_otherOwner() {
        given(eventTypeRepository.findById(1L)).willReturn(Optional.of(existing()));

        assertThatThrownBy(() -> eventTypeService.getEventType(1L, "someone-else"))
                .isInstanceOf(UnauthorizedAccessException.class);
    }

    @Test
    @DisplayName("조회 - 없는 이벤트 타입은 EventTypeNotFoundException")
    void get_notFound() {
        given(eventTypeRepository.findById(9L)).willReturn(Optional.empty());

        assertThatThrownBy(() -> eventTypeService.getEventType(9L, OWNER))
                .isInstanceOf(EventTypeNotFoundException.class);
    }

    @Test
    @DisplayName("삭제 - 확정 예약은 그대로 두고 이벤트 타입만 삭제")
    void delete_keepsBookings() {
        // given
        EventType eventType = existing();
        given(eventTypeRepository.findById(1L)).willReturn(Optional.of(eventType));
        given(bookingRepository.countByEventTypeIdAndStatus(1L, BookingStatus.CONFIRMED)).willReturn(2L);

        // when
        eventTypeService.deleteEventType(1L, OWNER);

        // then
        then(eventTypeRepository).should().delete(eventType);
        then(bookingRepository).should(never()).cancelIfConfirmed(any(), any(), any(), any());
    }
}
