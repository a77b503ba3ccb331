package com.slotsync.booking.settings.service;

import com.slotsync.booking.common.entity.BufferPolicy;
import com.slotsync.booking.common.entity.CalendarSettings;
import com.slotsync.booking.common.entity.WorkingHourRule;
import com.slotsync.booking.common.exception.InvalidRequestException;
import com.slotsync.booking.common.repository.AvailabilityExceptionRepository;
import com.slotsync.booking.common.repository.BufferPolicyRepository;
import com.slotsync.booking.common.repository.CalendarSettingsRepository;
import com.slotsync.booking.common.repository.WorkingHourRuleRepository;
import com.slotsync.booking.common.timezone.TimezoneRegistry;
import com.slotsync.booking.settings.dto.BufferTimeDto;
import com.slotsync.booking.settings.dto.CalendarSettingsRequest;
import com.slotsync.booking.settings.dto.CalendarSettingsResponse;
import com.slotsync.booking.settings.dto.TimeSlotDto;
import com.slotsync.booking.settings.exception.CalendarSettingsNotFoundException;
import com.slotsync.booking.settings.exception.DuplicateCalendarSettingsException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

@ExtendWith(MockitoExtension.class)
@DisplayName("CalendarSettingsService 테스트")
class CalendarSettingsServiceTest {

    private static final String OWNER = "owner-sub";

    private static TimezoneRegistry timezoneRegistry;

    @Mock
    private CalendarSettingsRepository calendarSettingsRepository;
    @Mock
    private WorkingHourRuleRepository workingHourRuleRepository;
    @Mock
    private BufferPolicyRepository bufferPolicyRepository;
    @Mock
    private AvailabilityExceptionRepository availabilityExceptionRepository;

    private CalendarSettingsService calendarSettingsService;

    @BeforeAll
    static void loadTimezones() {
        timezoneRegistry = new TimezoneRegistry();
    }

    @BeforeEach
    void setUp() {
        calendarSettingsService = new CalendarSettingsService(
                calendarSettingsRepository, workingHourRuleRepository, bufferPolicyRepository,
                availabilityExceptionRepository, timezoneRegistry);
    }

    private static TimeSlotDto slot(String start, String end) {
        return new TimeSlotDto(LocalTime.parse(start), LocalTime.parse(end));
    }

    private CalendarSettingsRequest request(String timezone, Map<String, List<TimeSlotDto>> workingHours) {
        return CalendarSettingsRequest.builder()
                .timezone(timezone)
                .calendarName("상담 예약")
                .defaultMeetingDuration(30)
                .workingHours(workingHours)
                .bufferTime(BufferTimeDto.builder().before(10).after(5).minimumNoticeMinutes(120).build())
                .build();
    }

    private CalendarSettings existingSettings() {
        return CalendarSettings.builder()
                .calendarSettingsId(1L)
                .ownerId(OWNER)
                .timezone("UTC")
                .calendarName("기존 캘린더")
                .defaultMeetingDuration(30)
                .build();
    }

    @Test
    @DisplayName("생성 - 요일별 근무 시간을 규칙으로 저장하고 월요일부터 정렬해 응답")
    void create_success() {
        // given
        Map<String, List<TimeSlotDto>> workingHours = new LinkedHashMap<>();
        workingHours.put("friday", List.of(slot("13:00", "18:00")));
        workingHours.put("Monday", List.of(slot("13:00", "17:00"), slot("09:00", "12:00")));
        given(calendarSettingsRepository.existsByOwnerId(OWNER)).willReturn(false);
        given(calendarSettingsRepository.save(any(CalendarSettings.class))).willAnswer(invocation -> {
            CalendarSettings settings = invocation.getArgument(0);
            settings.setCalendarSettingsId(1L);
            return settings;
        });

        // when
        CalendarSettingsResponse response = calendarSettingsService.createCalendarSettings(
                request("Asia/Seoul", workingHours), OWNER);

        // then
        assertThat(response.getCalendarSettingsId()).isEqualTo(1L);
        assertThat(response.getTimezone()).isEqualTo("Asia/Seoul");
        assertThat(response.getWorkingHours().keySet()).containsExactly("monday", "friday");
        assertThat(response.getWorkingHours().get("monday"))
                .extracting(TimeSlotDto::getStart)
                .containsExactly(LocalTime.of(9, 0), LocalTime.of(13, 0));
        assertThat(response.getBufferTime().getBefore()).isEqualTo(10);
        assertThat(response.getBufferTime().getMinimumNoticeMinutes()).isEqualTo(120);

        ArgumentCaptor<BufferPolicy> policyCaptor = ArgumentCaptor.forClass(BufferPolicy.class);
        then(bufferPolicyRepository).should().save(policyCaptor.capture());
        assertThat(policyCaptor.getValue().getOwnerId()).isEqualTo(OWNER);
        assertThat(policyCaptor.getValue().getPostBufferMinutes()).isEqualTo(5);
        assertThat(policyCaptor.getValue().getMaximumAdvanceDays()).isNull();
    }

    @Test
    @DisplayName("생성 - 종료 00:00은 자정으로 허용")
    void create_midnightEnd() {
        // given
        given(calendarSettingsRepository.existsByOwnerId(OWNER)).willReturn(false);
        given(calendarSettingsRepository.save(any(CalendarSettings.class))).willAnswer(invocation -> invocation.getArgument(0));

        // when
        CalendarSettingsResponse response = calendarSettingsService.createCalendarSettings(
                request("UTC", Map.of("sunday", List.of(slot("22:00", "00:00")))), OWNER);

        // then
        assertThat(response.getWorkingHours().get("sunday")).containsExactly(slot("22:00", "00:00"));
    }

    @Test
    @DisplayName("생성 - 이미 설정이 있으면 DuplicateCalendarSettingsException")
    void create_duplicate() {
        given(calendarSettingsRepository.existsByOwnerId(OWNER)).willReturn(true);

        assertThatThrownBy(() -> calendarSettingsService.createCalendarSettings(request("UTC", Map.of()), OWNER))
                .isInstanceOf(DuplicateCalendarSettingsException.class);
        then(calendarSettingsRepository).should(never()).save(any());
    }

    @Test
    @DisplayName("생성 - 알 수 없는 타임존은 InvalidRequestException")
    void create_unknownTimezone() {
        given(calendarSettingsRepository.existsByOwnerId(OWNER)).willReturn(false);

        assertThatThrownBy(() -> calendarSettingsService.createCalendarSettings(request("Mars/Olympus", Map.of()), OWNER))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("Mars/Olympus");
    }

    @Test
    @DisplayName("생성 - 시작이 종료 이후인 근무 시간은 거부")
    void create_reversedSlot() {
        given(calendarSettingsRepository.existsByOwnerId(OWNER)).willReturn(false);

        assertThatThrownBy(() -> calendarSettingsService.createCalendarSettings(
                request("UTC", Map.of("monday", List.of(slot("17:00", "09:00")))), OWNER))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    @DisplayName("생성 - 같은 요일의 근무 시간이 겹치면 거부")
    void create_overlappingSlots() {
        given(calendarSettingsRepository.existsByOwnerId(OWNER)).willReturn(false);

        assertThatThrownBy(() -> calendarSettingsService.createCalendarSettings(
                request("UTC", Map.of("monday", List.of(slot("09:00", "12:00"), slot("11:00", "14:00")))), OWNER))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("겹칩니다");
    }

    @Test
    @DisplayName("생성 - 붙어 있는 구간은 겹침이 아님")
    void create_abuttingSlots() {
        given(calendarSettingsRepository.existsByOwnerId(OWNER)).willReturn(false);
        given(calendarSettingsRepository.save(any(CalendarSettings.class))).willAnswer(invocation -> invocation.getArgument(0));

        CalendarSettingsResponse response = calendarSettingsService.createCalendarSettings(
                request("UTC", Map.of("monday", List.of(slot("09:00", "12:00"), slot("12:00", "14:00")))), OWNER);

        assertThat(response.getWorkingHours().get("monday")).hasSize(2);
    }

    @Test
    @DisplayName("생성 - 알 수 없는 요일 키는 거부")
    void create_unknownDay() {
        given(calendarSettingsRepository.existsByOwnerId(OWNER)).willReturn(false);

        assertThatThrownBy(() -> calendarSettingsService.createCalendarSettings(
                request("UTC", Map.of("funday", List.of(slot("09:00", "12:00")))), OWNER))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("funday");
    }

    @Test
    @DisplayName("수정 - 규칙 전체 교체 후 기존 버퍼 정책 갱신")
    void update_replacesRules() {
        // given
        BufferPolicy existingPolicy = BufferPolicy.none(OWNER);
        existingPolicy.setMaximumAdvanceDays(30);
        given(calendarSettingsRepository.findByOwnerIdForUpdate(OWNER)).willReturn(Optional.of(existingSettings()));
        given(calendarSettingsRepository.save(any(CalendarSettings.class))).willAnswer(invocation -> invocation.getArgument(0));
        given(bufferPolicyRepository.findByOwnerId(OWNER)).willReturn(Optional.of(existingPolicy));

        // when
        CalendarSettingsResponse response = calendarSettingsService.updateCalendarSettings(
                request("America/New_York", Map.of("tuesday", List.of(slot("10:00", "16:00")))), OWNER);

        // then
        assertThat(response.getTimezone()).isEqualTo("America/New_York");
        assertThat(response.getCalendarName()).isEqualTo("상담 예약");
        assertThat(response.getWorkingHours()).containsOnlyKeys("tuesday");
        assertThat(existingPolicy.getPreBufferMinutes()).isEqualTo(10);
        assertThat(existingPolicy.getMaximumAdvanceDays()).isNull();
        then(workingHourRuleRepository).should().deleteAllByOwnerId(OWNER);
        then(bufferPolicyRepository).should().save(existingPolicy);
    }

    @Test
    @DisplayName("수정 - 버퍼 설정을 생략하면 기존 정책을 0으로 초기화")
    void update_withoutBufferTime_resetsPolicy() {
        // given
        BufferPolicy existingPolicy = BufferPolicy.builder()
                .ownerId(OWNER)
                .preBufferMinutes(10)
                .postBufferMinutes(5)
                .minimumNoticeMinutes(120)
                .maximumAdvanceDays(30)
                .build();
        given(calendarSettingsRepository.findByOwnerIdForUpdate(OWNER)).willReturn(Optional.of(existingSettings()));
        given(calendarSettingsRepository.save(any(CalendarSettings.class))).willAnswer(invocation -> invocation.getArgument(0));
        given(bufferPolicyRepository.findByOwnerId(OWNER)).willReturn(Optional.of(existingPolicy));
        CalendarSettingsRequest withoutBuffer = CalendarSettingsRequest.builder()
                .timezone("UTC")
                .calendarName("상담 예약")
                .defaultMeetingDuration(30)
                .workingHours(Map.of("monday", List.of(slot("09:00", "17:00"))))
                .build();

        // when
        calendarSettingsService.updateCalendarSettings(withoutBuffer, OWNER);

        // then
        assertThat(existingPolicy.getPreBufferMinutes()).isZero();
        assertThat(existingPolicy.getPostBufferMinutes()).isZero();
        assertThat(existingPolicy.getMinimumNoticeMinutes()).isZero();
        assertThat(existingPolicy.getMaximumAdvanceDays()).isNull();
        then(bufferPolicyRepository).should().save(existingPolicy);
    }

    @Test
    @DisplayName("수정 - 설정이 없으면 CalendarSettingsNotFoundException")
    void update_notFound() {
        given(calendarSettingsRepository.findByOwnerIdForUpdate(OWNER)).willReturn(Optional.empty());

        assertThatThrownBy(() -> calendarSettingsService.updateCalendarSettings(request("UTC", Map.of()), OWNER))
                .isInstanceOf(CalendarSettingsNotFoundException.class);
    }

    @Test
    @DisplayName("조회 - 규칙과 버퍼 정책을 함께 응답 (정책 없으면 0)")
    void get_withoutPolicy() {
        // given
        WorkingHourRule rule = WorkingHourRule.builder()
                .ownerId(OWNER)
                .dayOfWeek(DayOfWeek.WEDNESDAY)
                .startTime(LocalTime.of(9, 0))
                .endTime(LocalTime.of(17, 0))
                .timezone("UTC")
                .build();
        given(calendarSettingsRepository.findByOwnerId(OWNER)).willReturn(Optional.of(existingSettings()));
        given(workingHourRuleRepository.findByOwnerId(OWNER)).willReturn(List.of(rule));
        given(bufferPolicyRepository.findByOwnerId(OWNER)).willReturn(Optional.empty());

        // when
        CalendarSettingsResponse response = calendarSettingsService.getCalendarSettings(OWNER);

        // then
        assertThat(response.getWorkingHours().get("wednesday")).containsExactly(slot("09:00", "17:00"));
        assertThat(response.getBufferTime().getBefore()).isZero();
        assertThat(response.getBufferTime().getMaximumAdvanceDays()).isNull();
    }

    @Test
    @DisplayName("삭제 - 근무 시간, 예외, 버퍼 정책을 함께 삭제")
    void delete_cascades() {
        // given
        CalendarSettings settings = existingSettings();
        given(calendarSettingsRepository.findByOwnerIdForUpdate(OWNER)).willReturn(Optional.of(settings));

        // when
        calendarSettingsService.deleteCalendarSettings(OWNER);

        // then
        then(workingHourRuleRepository).should().deleteAllByOwnerId(OWNER);
        then(availabilityExceptionRepository).should().deleteAllByOwnerId(OWNER);
        then(bufferPolicyRepository).should().deleteAllByOwnerId(OWNER);
        then(calendarSettingsRepository).should().delete(settings);
    }
}
