package com.slotsync.booking.common.repository;

import com.slotsync.booking.common.entity.AvailabilityException;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface AvailabilityExceptionRepository extends JpaRepository<AvailabilityException, Long> {

    List<AvailabilityException> findByOwnerIdOrderByExceptionDate(String ownerId);

    // 날짜 범위 조회 (양 끝 포함)
    List<AvailabilityException> findByOwnerIdAndExceptionDateBetween(String ownerId, LocalDate from, LocalDate to);

    void deleteAllByOwnerId(String ownerId);
}
