package com.slotsync.booking.availability.algorithm;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 절대 시각(UTC Instant) 기반 반개구간 [start, end)
 *
 * 현지 시각은 규칙 전개 단계에서만 다루고, 이 클래스는 항상 절대 시각만 다룬다.
 * 길이가 0인 구간은 빈 구간으로 취급하며 연산 결과에서 제외된다.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class TimeInterval implements Comparable<TimeInterval> {

    private final Instant start;
    private final Instant end;

    public TimeInterval(Instant start, Instant end) {
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("종료 시각이 시작 시각보다 빠릅니다: " + start + " ~ " + end);
        }
    }

    public static TimeInterval of(Instant start, Instant end) {
        return new TimeInterval(start, end);
    }

    public static TimeInterval of(Instant start, Duration duration) {
        return new TimeInterval(start, start.plus(duration));
    }

    @Override
    public int compareTo(TimeInterval other) {
        int byStart = this.start.compareTo(other.start);
        return byStart != 0 ? byStart : this.end.compareTo(other.end);
    }

    public boolean isEmpty() {
        return !start.isBefore(end);
    }

    public Duration getDuration() {
        return Duration.between(start, end);
    }

    /**
     * 두 구간이 겹치는지 확인 ([a,b)와 [b,c)는 겹치지 않음)
     */
    public boolean overlaps(TimeInterval other) {
        return this.start.isBefore(other.end) && other.start.isBefore(this.end)
                && !this.isEmpty() && !other.isEmpty();
    }

    /**
     * 시각 포함 여부 (start 포함, end 제외)
     */
    public boolean contains(Instant point) {
        return !point.isBefore(start) && point.isBefore(end);
    }

    /**
     * 다른 구간 전체를 포함하는지 확인
     */
    public boolean contains(TimeInterval other) {
        return !other.isEmpty() && !other.start.isBefore(this.start) && !other.end.isAfter(this.end);
    }

    /**
     * 교집합 (비어 있으면 Optional.empty())
     */
    public Optional<TimeInterval> intersect(TimeInterval other) {
        Instant s = this.start.isAfter(other.start) ? this.start : other.start;
        Instant e = this.end.isBefore(other.end) ? this.end : other.end;
        if (!s.isBefore(e)) {
            return Optional.empty();
        }
        return Optional.of(new TimeInterval(s, e));
    }

    /**
     * 차집합 this - other (0, 1 또는 2 조각)
     */
    public List<TimeInterval> subtract(TimeInterval other) {
        List<TimeInterval> pieces = new ArrayList<>(2);
        if (this.isEmpty()) {
            return pieces;
        }
        if (!overlaps(other)) {
            pieces.add(this);
            return pieces;
        }
        if (this.start.isBefore(other.start)) {
            pieces.add(new TimeInterval(this.start, other.start));
        }
        if (other.end.isBefore(this.end)) {
            pieces.add(new TimeInterval(other.end, this.end));
        }
        return pieces;
    }

    /**
     * 두 구간을 병합 (겹치거나 인접한 경우에만 의미 있음)
     */
    public TimeInterval mergeWith(TimeInterval other) {
        Instant mergedStart = this.start.isBefore(other.start) ? this.start : other.start;
        Instant mergedEnd = this.end.isAfter(other.end) ? this.end : other.end;
        return new TimeInterval(mergedStart, mergedEnd);
    }

    /**
     * 양 끝을 안쪽으로 줄인 구간 (뒤집히면 빈 Optional)
     */
    public Optional<TimeInterval> shrink(Duration fromStart, Duration fromEnd) {
        Instant s = start.plus(fromStart);
        Instant e = end.minus(fromEnd);
        if (!s.isBefore(e)) {
            return Optional.empty();
        }
        return Optional.of(new TimeInterval(s, e));
    }
}
