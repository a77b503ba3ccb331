package com.slotsync.booking.integration;

import com.slotsync.booking.booking.algorithm.RejectionReason;
import com.slotsync.booking.booking.dto.BookingRequest;
import com.slotsync.booking.booking.dto.BookingResponse;
import com.slotsync.booking.booking.service.BookingResult;
import com.slotsync.booking.booking.service.BookingService;
import com.slotsync.booking.common.entity.Booking.BookingStatus;
import com.slotsync.booking.common.entity.CalendarSettings;
import com.slotsync.booking.common.entity.EventType;
import com.slotsync.booking.common.entity.WorkingHourRule;
import com.slotsync.booking.common.repository.AvailabilityExceptionRepository;
import com.slotsync.booking.common.repository.BookingRepository;
import com.slotsync.booking.common.repository.BufferPolicyRepository;
import com.slotsync.booking.common.repository.CalendarSettingsRepository;
import com.slotsync.booking.common.repository.EventTypeRepository;
import com.slotsync.booking.common.repository.WorkingHourRuleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageResponse;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;

/**
 * 예약 동시성 통합 테스트
 * 실제 MySQL에서 소유자 행 락으로 같은 시간대 예약이 하나만 확정되는지 확인한다.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class BookingConcurrencyIntegrationTest {

    private static final String OWNER = "integration-owner";
    private static final int CONCURRENT_REQUESTS = 8;

    @Container
    static MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
        .withDatabaseName("booking_service_test")
        .withUsername("test")
        .withPassword("test");

    @DynamicPropertySource
    static void properties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", mysql::getJdbcUrl);
        registry.add("spring.datasource.username", mysql::getUsername);
        registry.add("spring.datasource.password", mysql::getPassword);
    }

    @MockBean
    private SqsAsyncClient sqsAsyncClient;

    @Autowired
    private BookingService bookingService;
    @Autowired
    private BookingRepository bookingRepository;
    @Autowired
    private CalendarSettingsRepository calendarSettingsRepository;
    @Autowired
    private WorkingHourRuleRepository workingHourRuleRepository;
    @Autowired
    private BufferPolicyRepository bufferPolicyRepository;
    @Autowired
    private AvailabilityExceptionRepository availabilityExceptionRepository;
    @Autowired
    private EventTypeRepository eventTypeRepository;

    private Long eventTypeId;
    private OffsetDateTime slotStart;

    @BeforeEach
    void setUp() {
        bookingRepository.deleteAll();
        availabilityExceptionRepository.deleteAll();
        bufferPolicyRepository.deleteAll();
        workingHourRuleRepository.deleteAll();
        eventTypeRepository.deleteAll();
        calendarSettingsRepository.deleteAll();

        given(sqsAsyncClient.sendMessage(any(SendMessageRequest.class)))
            .willReturn(CompletableFuture.completedFuture(SendMessageResponse.builder().build()));

        calendarSettingsRepository.save(CalendarSettings.builder()
            .ownerId(OWNER)
            .timezone("UTC")
            .calendarName("통합 테스트 캘린더")
            .defaultMeetingDuration(30)
            .build());

        // 매일 09:00 ~ 17:00 UTC
        List<WorkingHourRule> rules = new ArrayList<>();
        for (DayOfWeek day : DayOfWeek.values()) {
            rules.add(WorkingHourRule.builder()
                .ownerId(OWNER)
                .dayOfWeek(day)
                .startTime(LocalTime.of(9, 0))
                .endTime(LocalTime.of(17, 0))
                .timezone("UTC")
                .build());
        }
        workingHourRuleRepository.saveAll(rules);

        eventTypeId = eventTypeRepository.save(EventType.builder()
            .ownerId(OWNER)
            .name("30분 상담")
            .durationMinutes(30)
            .slotStepMinutes(30)
            .build()).getEventTypeId();

        slotStart = LocalDate.now(ZoneOffset.UTC).plusDays(7).atTime(10, 0).atOffset(ZoneOffset.UTC);
    }

    private BookingRequest request(OffsetDateTime start, String inviteeName) {
        return BookingRequest.builder()
            .startTime(start)
            .inviteeName(inviteeName)
            .inviteeEmail(inviteeName + "@example.com")
            .build();
    }

    private List<BookingResult> runConcurrently(List<BookingRequest> requests) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(requests.size());
        CountDownLatch ready = new CountDownLatch(1);
        try {
            List<Future<BookingResult>> futures = new ArrayList<>();
            for (BookingRequest request : requests) {
                Callable<BookingResult> task = () -> {
                    ready.await();
                    return bookingService.createBooking(OWNER, eventTypeId, request);
                };
                futures.add(executor.submit(task));
            }
            ready.countDown();

            List<BookingResult> results = new ArrayList<>();
            for (Future<BookingResult> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("같은 시간대 동시 예약은 하나만 확정되고 나머지는 DOUBLE_BOOKING")
    void concurrentSameSlot_onlyOneConfirmed() throws Exception {
        // given
        List<BookingRequest> requests = new ArrayList<>();
        for (int i = 0; i < CONCURRENT_REQUESTS; i++) {
            requests.add(request(slotStart, "invitee" + i));
        }

        // when
        List<BookingResult> results = runConcurrently(requests);

        // then
        assertThat(results).filteredOn(BookingResult::isAccepted).hasSize(1);
        assertThat(results).filteredOn(result -> !result.isAccepted())
            .extracting(BookingResult::getReason)
            .containsOnly(RejectionReason.DOUBLE_BOOKING);
        assertThat(bookingRepository.countByEventTypeIdAndStatus(eventTypeId, BookingStatus.CONFIRMED)).isEqualTo(1L);
    }

    @Test
    @DisplayName("붙어 있는 시간대 동시 예약은 모두 확정")
    void concurrentAdjacentSlots_allConfirmed() throws Exception {
        // when
        List<BookingResult> results = runConcurrently(List.of(
            request(slotStart, "first"),
            request(slotStart.plusMinutes(30), "second")));

        // then
        assertThat(results).allMatch(BookingResult::isAccepted);
        assertThat(bookingRepository.countByEventTypeIdAndStatus(eventTypeId, BookingStatus.CONFIRMED)).isEqualTo(2L);
    }

    @Test
    @DisplayName("취소한 시간대는 다시 예약 가능하고, 재취소는 상태를 바꾸지 않음")
    void cancelThenRebook() {
        // given
        BookingResult first = bookingService.createBooking(OWNER, eventTypeId, request(slotStart, "first"));
        assertThat(first.isAccepted()).isTrue();
        Long firstId = first.getBooking().getBookingId();

        // when
        BookingResponse cancelled = bookingService.cancelBooking(firstId, OWNER);
        BookingResponse cancelledAgain = bookingService.cancelBooking(firstId, OWNER);
        BookingResult rebooked = bookingService.createBooking(OWNER, eventTypeId, request(slotStart, "second"));

        // then
        assertThat(cancelled.getStatus()).isEqualTo("CANCELLED");
        assertThat(cancelledAgain.getStatus()).isEqualTo("CANCELLED");
        assertThat(cancelledAgain.getCancelledAt()).isEqualTo(cancelled.getCancelledAt());
        assertThat(rebooked.isAccepted()).isTrue();
        assertThat(bookingRepository.count()).isEqualTo(2L);
    }
}
