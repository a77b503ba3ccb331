package com.slotsync.booking.availability.algorithm;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 버퍼 정책 적용
 *
 * 1. 빈 구간 양 끝을 pre/post 버퍼만큼 줄임
 * 2. [now + 최소 사전 예약 시간, now + 최대 예약 가능 기간] 으로 자름
 * 3. 이벤트 길이보다 짧아진 구간은 버림
 */
@Component
@Slf4j
public class BufferPolicyApplier {

    /**
     * 버퍼 정책 적용 메인 메서드
     *
     * @param freeIntervals 예약되지 않은 가용 구간 (정렬됨)
     * @param policy        최종 버퍼 정책
     * @param now           조회 시각
     * @param eventDuration 이벤트 길이
     * @return 이벤트 길이 이상인 구간만 포함한 목록
     */
    public List<TimeInterval> apply(
            List<TimeInterval> freeIntervals,
            EffectiveBufferPolicy policy,
            Instant now,
            Duration eventDuration
    ) {
        List<TimeInterval> shrunk = shrink(freeIntervals, policy);
        List<TimeInterval> windowed = TimeIntervals.clip(shrunk, bookingWindow(policy, now));

        List<TimeInterval> result = new ArrayList<>(windowed.size());
        for (TimeInterval interval : windowed) {
            if (interval.getDuration().compareTo(eventDuration) >= 0) {
                result.add(interval);
            }
        }

        log.debug("버퍼 정책 적용 완료 - 입력: {}, 버퍼 적용 후: {}, 예약 기간 적용 후: {}, 최종: {}",
                freeIntervals.size(), shrunk.size(), windowed.size(), result.size());
        return result;
    }

    /**
     * 각 구간의 시작을 pre 버퍼만큼, 끝을 post 버퍼만큼 줄임
     */
    public List<TimeInterval> shrink(List<TimeInterval> intervals, EffectiveBufferPolicy policy) {
        List<TimeInterval> shrunk = new ArrayList<>(intervals.size());
        for (TimeInterval interval : intervals) {
            interval.shrink(policy.getPreBuffer(), policy.getPostBuffer()).ifPresent(shrunk::add);
        }
        return shrunk;
    }

    /**
     * 예약 가능 기간 [now + minimumNotice, now + maximumAdvance]
     *
     * 최대 예약 기간이 없으면 끝은 Instant.MAX
     */
    public TimeInterval bookingWindow(EffectiveBufferPolicy policy, Instant now) {
        Instant earliest = now.plus(policy.getMinimumNotice());
        Instant latest = policy.hasMaximumAdvance() ? now.plus(policy.getMaximumAdvance()) : Instant.MAX;
        if (latest.isBefore(earliest)) {
            latest = earliest;
        }
        return new TimeInterval(earliest, latest);
    }
}
