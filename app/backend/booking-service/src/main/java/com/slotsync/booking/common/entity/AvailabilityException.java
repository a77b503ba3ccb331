package com.slotsync.booking.common.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 특정 날짜의 가용 시간 예외 (종일 차단 또는 시간 대체)
 *
 * 같은 날짜의 요일 규칙보다 항상 우선한다.
 */
@Entity
@Table(name = "availability_exceptions", indexes = {
    @Index(name = "idx_exception_owner_date", columnList = "owner_id, exception_date")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AvailabilityException {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "exception_id")
    private Long exceptionId;

    @Column(name = "owner_id", nullable = false, length = 255)
    private String ownerId;

    @Column(name = "exception_date", nullable = false)
    private LocalDate exceptionDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ExceptionType type;

    /**
     * OVERRIDE인 경우에만 사용
     */
    @Column(name = "start_time")
    private LocalTime startTime;

    @Column(name = "end_time")
    private LocalTime endTime;

    public boolean isBlockOut() {
        return type == ExceptionType.BLOCK_OUT;
    }

    public enum ExceptionType {
        BLOCK_OUT, OVERRIDE
    }
}
