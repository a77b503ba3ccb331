package com.slotsync.booking.common.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * 버퍼 시간 및 예약 가능 기간 정책
 */
@Entity
@Table(name = "buffer_policies", uniqueConstraints = {
    @UniqueConstraint(name = "uk_buffer_policy_owner", columnNames = {"owner_id"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BufferPolicy {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "buffer_policy_id")
    private Long bufferPolicyId;

    @Column(name = "owner_id", nullable = false, length = 255)
    private String ownerId;

    @Column(name = "pre_buffer_minutes", nullable = false)
    @Builder.Default
    private Integer preBufferMinutes = 0;

    @Column(name = "post_buffer_minutes", nullable = false)
    @Builder.Default
    private Integer postBufferMinutes = 0;

    @Column(name = "minimum_notice_minutes", nullable = false)
    @Builder.Default
    private Integer minimumNoticeMinutes = 0;

    /**
     * null이면 제한 없음
     */
    @Column(name = "maximum_advance_days")
    private Integer maximumAdvanceDays;

    public static BufferPolicy none(String ownerId) {
        return BufferPolicy.builder().ownerId(ownerId).build();
    }
}
