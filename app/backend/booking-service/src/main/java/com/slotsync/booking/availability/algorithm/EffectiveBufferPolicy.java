package com.slotsync.booking.availability.algorithm;

import com.slotsync.booking.common.entity.BufferPolicy;
import com.slotsync.booking.common.entity.EventType;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 소유자 BufferPolicy에 이벤트 타입별 재정의를 반영한 최종 정책
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class EffectiveBufferPolicy {

    @Builder.Default
    private final Duration preBuffer = Duration.ZERO;

    @Builder.Default
    private final Duration postBuffer = Duration.ZERO;

    @Builder.Default
    private final Duration minimumNotice = Duration.ZERO;

    /**
     * null이면 제한 없음
     */
    private final Duration maximumAdvance;

    public static EffectiveBufferPolicy none() {
        return EffectiveBufferPolicy.builder().build();
    }

    public static EffectiveBufferPolicy of(BufferPolicy policy, EventType eventType) {
        Integer pre = firstNonNull(eventType.getBufferBeforeMinutes(), policy.getPreBufferMinutes());
        Integer post = firstNonNull(eventType.getBufferAfterMinutes(), policy.getPostBufferMinutes());
        Integer notice = firstNonNull(eventType.getMinBookingNoticeMinutes(), policy.getMinimumNoticeMinutes());
        Integer advanceDays = firstNonNull(eventType.getMaxBookingAdvanceDays(), policy.getMaximumAdvanceDays());

        return EffectiveBufferPolicy.builder()
                .preBuffer(minutes(pre))
                .postBuffer(minutes(post))
                .minimumNotice(minutes(notice))
                .maximumAdvance(advanceDays != null ? Duration.ofDays(advanceDays) : null)
                .build();
    }

    public boolean hasMaximumAdvance() {
        return maximumAdvance != null;
    }

    private static Duration minutes(Integer value) {
        return value != null ? Duration.ofMinutes(value) : Duration.ZERO;
    }

    private static Integer firstNonNull(Integer override, Integer fallback) {
        return override != null ? override : fallback;
    }
}
