package com.slotsync.booking.availability.algorithm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("BufferPolicyApplier 테스트")
class BufferPolicyApplierTest {

    private static final Instant NOW = Instant.parse("2025-11-20T00:00:00Z");
    private static final Duration THIRTY_MINUTES = Duration.ofMinutes(30);

    private BufferPolicyApplier applier;

    @BeforeEach
    void setUp() {
        applier = new BufferPolicyApplier();
    }

    private static TimeInterval interval(String start, String end) {
        return TimeInterval.of(Instant.parse("2025-11-24T" + start + ":00Z"), Instant.parse("2025-11-24T" + end + ":00Z"));
    }

    @Test
    @DisplayName("정책이 없으면 구간 그대로")
    void apply_noPolicy_keepsIntervals() {
        List<TimeInterval> free = List.of(interval("09:00", "10:00"), interval("10:30", "17:00"));

        assertThat(applier.apply(free, EffectiveBufferPolicy.none(), NOW, THIRTY_MINUTES)).isEqualTo(free);
    }

    @Test
    @DisplayName("앞/뒤 버퍼만큼 각 구간 양 끝이 줄어듦")
    void apply_buffers_shrinkBothEnds() {
        // given
        EffectiveBufferPolicy policy = EffectiveBufferPolicy.builder()
                .preBuffer(Duration.ofMinutes(10))
                .postBuffer(Duration.ofMinutes(15))
                .build();

        // when
        List<TimeInterval> result = applier.apply(List.of(interval("10:30", "17:00")), policy, NOW, THIRTY_MINUTES);

        // then
        assertThat(result).containsExactly(interval("10:40", "16:45"));
    }

    @Test
    @DisplayName("버퍼 적용 후 이벤트 길이보다 짧은 구간은 버려짐")
    void apply_dropsShortIntervals() {
        // given: 09:00~10:00 (60분) - 앞 15 - 뒤 20 = 25분 < 30분
        EffectiveBufferPolicy policy = EffectiveBufferPolicy.builder()
                .preBuffer(Duration.ofMinutes(15))
                .postBuffer(Duration.ofMinutes(20))
                .build();

        // when
        List<TimeInterval> result = applier.apply(
                List.of(interval("09:00", "10:00"), interval("13:00", "15:00")), policy, NOW, THIRTY_MINUTES);

        // then
        assertThat(result).containsExactly(interval("13:15", "14:40"));
        assertThat(result).allSatisfy(i -> assertThat(i.getDuration()).isGreaterThanOrEqualTo(THIRTY_MINUTES));
    }

    @Test
    @DisplayName("최소 사전 예약 시간 이전 부분은 잘림")
    void apply_minimumNotice_clipsStart() {
        // given
        Instant now = Instant.parse("2025-11-24T09:00:00Z");
        EffectiveBufferPolicy policy = EffectiveBufferPolicy.builder()
                .minimumNotice(Duration.ofHours(2))
                .build();

        // when
        List<TimeInterval> result = applier.apply(List.of(interval("09:00", "17:00")), policy, now, THIRTY_MINUTES);

        // then
        assertThat(result).containsExactly(interval("11:00", "17:00"));
    }

    @Test
    @DisplayName("최대 예약 가능 기간 이후 부분은 잘림")
    void apply_maximumAdvance_clipsEnd() {
        // given: now + 4일 12시간 = 2025-11-24T12:00Z
        EffectiveBufferPolicy policy = EffectiveBufferPolicy.builder()
                .maximumAdvance(Duration.ofDays(4).plusHours(12))
                .build();

        // when
        List<TimeInterval> result = applier.apply(List.of(interval("09:00", "17:00")), policy, NOW, THIRTY_MINUTES);

        // then
        assertThat(result).containsExactly(interval("09:00", "12:00"));
    }

    @Test
    @DisplayName("예약 가능 기간 - 최대값이 없으면 끝은 Instant.MAX")
    void bookingWindow_unbounded() {
        EffectiveBufferPolicy policy = EffectiveBufferPolicy.builder()
                .minimumNotice(Duration.ofMinutes(30))
                .build();

        TimeInterval window = applier.bookingWindow(policy, NOW);

        assertThat(window.getStart()).isEqualTo(NOW.plus(Duration.ofMinutes(30)));
        assertThat(window.getEnd()).isEqualTo(Instant.MAX);
    }
}
