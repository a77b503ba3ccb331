package com.slotsync.booking.availability.algorithm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SlotGenerator 테스트")
class SlotGeneratorTest {

    private static final Duration THIRTY_MINUTES = Duration.ofMinutes(30);

    private SlotGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new SlotGenerator();
    }

    private static Instant at(String hhmm) {
        return Instant.parse("2025-11-24T" + hhmm + ":00Z");
    }

    private static List<Instant> toList(Iterable<Instant> slots) {
        List<Instant> result = new ArrayList<>();
        slots.forEach(result::add);
        return result;
    }

    @Test
    @DisplayName("구간 안에서 step 간격으로 시작 시각 생성 (끝을 넘는 슬롯 제외)")
    void generate_stepsWithinInterval() {
        Iterable<Instant> slots = generator.generate(
                List.of(TimeInterval.of(at("09:00"), at("11:00"))), THIRTY_MINUTES, Duration.ofMinutes(30));

        assertThat(toList(slots)).containsExactly(at("09:00"), at("09:30"), at("10:00"), at("10:30"));
    }

    @Test
    @DisplayName("step이 길이보다 짧으면 슬롯이 겹쳐서 생성됨")
    void generate_stepShorterThanDuration() {
        Iterable<Instant> slots = generator.generate(
                List.of(TimeInterval.of(at("09:00"), at("10:00"))), THIRTY_MINUTES, Duration.ofMinutes(15));

        assertThat(toList(slots)).containsExactly(at("09:00"), at("09:15"), at("09:30"));
    }

    @Test
    @DisplayName("구간 시작이 step 배수가 아니면 올림한 시각부터 시작")
    void generate_alignsToStep() {
        Iterable<Instant> slots = generator.generate(
                List.of(TimeInterval.of(at("09:10"), at("10:30"))), THIRTY_MINUTES, Duration.ofMinutes(15));

        List<Instant> result = toList(slots);
        assertThat(result).containsExactly(at("09:15"), at("09:30"), at("09:45"), at("10:00"));
        assertThat(result).allSatisfy(slot -> assertThat(slot.getEpochSecond() % (15 * 60)).isZero());
    }

    @Test
    @DisplayName("길이보다 짧은 구간에서는 슬롯 없음, 다음 구간으로 넘어감")
    void generate_skipsShortIntervals() {
        Iterable<Instant> slots = generator.generate(
                List.of(TimeInterval.of(at("09:00"), at("09:20")), TimeInterval.of(at("13:00"), at("13:30"))),
                THIRTY_MINUTES, Duration.ofMinutes(30));

        assertThat(toList(slots)).containsExactly(at("13:00"));
    }

    @Test
    @DisplayName("시퀀스는 여러 번 순회해도 같은 결과")
    void generate_isRestartable() {
        Iterable<Instant> slots = generator.generate(
                List.of(TimeInterval.of(at("09:00"), at("10:00"))), THIRTY_MINUTES, Duration.ofMinutes(30));

        assertThat(toList(slots)).isEqualTo(toList(slots));
    }

    @Test
    @DisplayName("모두 소비한 뒤 next()는 NoSuchElementException")
    void iterator_exhausted_throws() {
        Iterator<Instant> iterator = generator.generate(
                List.of(TimeInterval.of(at("09:00"), at("09:30"))), THIRTY_MINUTES, Duration.ofMinutes(30)).iterator();

        assertThat(iterator.next()).isEqualTo(at("09:00"));
        assertThat(iterator.hasNext()).isFalse();
        assertThatThrownBy(iterator::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    @DisplayName("길이/간격이 0 이하이거나 초 단위가 아니면 예외")
    void generate_invalidArguments_throw() {
        List<TimeInterval> intervals = List.of(TimeInterval.of(at("09:00"), at("10:00")));

        assertThatThrownBy(() -> generator.generate(intervals, Duration.ZERO, Duration.ofMinutes(15)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> generator.generate(intervals, THIRTY_MINUTES, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> generator.generate(intervals, THIRTY_MINUTES, Duration.ofMillis(1500)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
