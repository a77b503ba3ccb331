package com.slotsync.booking.availability.algorithm;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * TimeInterval 목록 연산 유틸리티
 *
 * 모든 연산은 순수 함수이며 입력 목록을 변경하지 않는다.
 */
public final class TimeIntervals {

    private TimeIntervals() {
    }

    public static Optional<TimeInterval> intersect(TimeInterval a, TimeInterval b) {
        return a.intersect(b);
    }

    public static List<TimeInterval> subtract(TimeInterval a, TimeInterval b) {
        return a.subtract(b);
    }

    public static boolean contains(TimeInterval a, Instant point) {
        return a.contains(point);
    }

    /**
     * 겹치거나 인접한 구간 병합 (Interval Merging)
     *
     * @param intervals 병합할 구간 목록 (순서 무관)
     * @return 시작 시각 순으로 정렬된, 서로 겹치지 않는 구간 목록
     */
    public static List<TimeInterval> merge(List<TimeInterval> intervals) {
        if (intervals == null || intervals.isEmpty()) {
            return new ArrayList<>();
        }

        List<TimeInterval> sorted = new ArrayList<>();
        for (TimeInterval interval : intervals) {
            if (!interval.isEmpty()) {
                sorted.add(interval);
            }
        }
        if (sorted.isEmpty()) {
            return sorted;
        }
        Collections.sort(sorted);

        List<TimeInterval> merged = new ArrayList<>();
        TimeInterval last = sorted.get(0);

        for (int i = 1; i < sorted.size(); i++) {
            TimeInterval current = sorted.get(i);

            // 겹치거나 인접하면 병합
            if (!current.getStart().isAfter(last.getEnd())) {
                last = last.mergeWith(current);
            } else {
                merged.add(last);
                last = current;
            }
        }
        merged.add(last);

        return merged;
    }

    /**
     * base 구간들에서 removals 구간들을 모두 뺀 결과
     *
     * @return 정렬되고 병합된 결과 구간 목록
     */
    public static List<TimeInterval> subtractAll(List<TimeInterval> base, List<TimeInterval> removals) {
        List<TimeInterval> remaining = merge(base);
        List<TimeInterval> mergedRemovals = merge(removals);

        for (TimeInterval removal : mergedRemovals) {
            List<TimeInterval> next = new ArrayList<>(remaining.size() + 1);
            for (TimeInterval interval : remaining) {
                next.addAll(interval.subtract(removal));
            }
            remaining = next;
        }

        return remaining;
    }

    /**
     * 각 구간을 window로 잘라낸 결과 (비는 구간은 제외)
     */
    public static List<TimeInterval> clip(List<TimeInterval> intervals, TimeInterval window) {
        List<TimeInterval> clipped = new ArrayList<>();
        for (TimeInterval interval : intervals) {
            interval.intersect(window).ifPresent(clipped::add);
        }
        return clipped;
    }

    /**
     * 구간 목록 중 하나가 target 전체를 포함하는지 확인
     */
    public static boolean anyContains(List<TimeInterval> intervals, TimeInterval target) {
        for (TimeInterval interval : intervals) {
            if (interval.contains(target)) {
                return true;
            }
        }
        return false;
    }
}
