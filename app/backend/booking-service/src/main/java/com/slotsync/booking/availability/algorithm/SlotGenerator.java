package com.slotsync.booking.availability.algorithm;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * 예약 후보 시작 시각 생성
 *
 * 각 구간의 시작을 epoch 기준 step 배수로 올림한 뒤 step 간격으로 전진하며
 * candidate + duration <= interval.end 인 동안 시작 시각을 낸다.
 * 결과는 화면 표시용이며, 예약 확정 시에는 ConflictValidator가 다시 검증한다.
 */
@Component
public class SlotGenerator {

    /**
     * @param intervals 버퍼 적용이 끝난 구간 (정렬됨)
     * @param duration  이벤트 길이
     * @param step      시작 시각 간격 (초 단위 이상)
     * @return 지연 평가되는, 반복 순회 가능한 시작 시각 시퀀스
     */
    public Iterable<Instant> generate(List<TimeInterval> intervals, Duration duration, Duration step) {
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("이벤트 길이는 0보다 커야 합니다: " + duration);
        }
        if (step.isNegative() || step.isZero() || step.getNano() != 0) {
            throw new IllegalArgumentException("슬롯 간격은 1초 이상의 초 단위여야 합니다: " + step);
        }
        List<TimeInterval> snapshot = List.copyOf(intervals);
        return () -> new SlotIterator(snapshot, duration, step);
    }

    /**
     * epoch 기준 step 배수로 올림
     */
    public static Instant alignUp(Instant instant, Duration step) {
        long stepSeconds = step.getSeconds();
        long epochSecond = instant.getEpochSecond();
        Instant floor = Instant.ofEpochSecond(epochSecond - Math.floorMod(epochSecond, stepSeconds));
        return floor.equals(instant) ? instant : floor.plus(step);
    }

    private static final class SlotIterator implements Iterator<Instant> {

        private final List<TimeInterval> intervals;
        private final Duration duration;
        private final Duration step;

        private int index;
        private Instant candidate;

        private SlotIterator(List<TimeInterval> intervals, Duration duration, Duration step) {
            this.intervals = intervals;
            this.duration = duration;
            this.step = step;
        }

        @Override
        public boolean hasNext() {
            while (index < intervals.size()) {
                TimeInterval interval = intervals.get(index);
                if (candidate == null) {
                    candidate = alignUp(interval.getStart(), step);
                }
                if (!candidate.plus(duration).isAfter(interval.getEnd())) {
                    return true;
                }
                index++;
                candidate = null;
            }
            return false;
        }

        @Override
        public Instant next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Instant slot = candidate;
            candidate = candidate.plus(step);
            return slot;
        }
    }
}
