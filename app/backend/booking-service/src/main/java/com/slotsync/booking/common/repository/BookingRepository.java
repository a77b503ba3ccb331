package com.slotsync.booking.common.repository;

import com.slotsync.booking.common.entity.Booking;
import com.slotsync.booking.common.entity.Booking.BookingStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface BookingRepository extends JpaRepository<Booking, Long> {

    // 기간과 겹치는 특정 상태의 예약 조회 (반개구간 [start, end) 기준)
    @Query("SELECT b FROM Booking b WHERE b.ownerId = :ownerId " +
           "AND b.status = :status " +
           "AND b.startTime < :endTime AND b.endTime > :startTime " +
           "ORDER BY b.startTime")
    List<Booking> findOverlappingByStatus(
        @Param("ownerId") String ownerId,
        @Param("status") BookingStatus status,
        @Param("startTime") Instant startTime,
        @Param("endTime") Instant endTime
    );

    // 기간과 겹치는 예약 전체 조회 (취소 포함, 소유자 목록 화면용)
    @Query("SELECT b FROM Booking b WHERE b.ownerId = :ownerId " +
           "AND b.startTime < :endTime AND b.endTime > :startTime " +
           "ORDER BY b.startTime")
    List<Booking> findByOwnerIdAndDateRange(
        @Param("ownerId") String ownerId,
        @Param("startTime") Instant startTime,
        @Param("endTime") Instant endTime
    );

    // 확정 상태인 경우에만 취소 (이미 취소된 예약이면 0 반환)
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Booking b SET b.status = :cancelled, b.cancelledAt = :cancelledAt, b.updatedAt = :cancelledAt " +
           "WHERE b.bookingId = :bookingId AND b.status = :confirmed")
    int cancelIfConfirmed(
        @Param("bookingId") Long bookingId,
        @Param("cancelledAt") Instant cancelledAt,
        @Param("confirmed") BookingStatus confirmed,
        @Param("cancelled") BookingStatus cancelled
    );

    // 예약 행 락 (SELECT ... FOR UPDATE)
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Booking b WHERE b.bookingId = :bookingId")
    Optional<Booking> findByIdForUpdate(@Param("bookingId") Long bookingId);

    // 이벤트 타입별 예약 수 (삭제 시 로그용)
    long countByEventTypeIdAndStatus(Long eventTypeId, BookingStatus status);
}
