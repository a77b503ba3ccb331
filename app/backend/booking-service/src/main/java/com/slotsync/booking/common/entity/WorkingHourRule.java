package com.slotsync.booking.common.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.DayOfWeek;
import java.time.LocalTime;

/**
 * 요일별 반복 근무 시간 규칙
 *
 * endTime이 00:00이면 해당 날짜의 자정(하루 끝)을 의미한다.
 */
@Entity
@Table(name = "working_hour_rules", indexes = {
    @Index(name = "idx_rule_owner_day", columnList = "owner_id, day_of_week")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WorkingHourRule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "rule_id")
    private Long ruleId;

    @Column(name = "owner_id", nullable = false, length = 255)
    private String ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week", nullable = false, length = 10)
    private DayOfWeek dayOfWeek;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(nullable = false, length = 64)
    private String timezone;
}
