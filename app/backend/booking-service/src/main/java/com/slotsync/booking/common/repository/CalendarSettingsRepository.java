package com.slotsync.booking.common.repository;

import com.slotsync.booking.common.entity.CalendarSettings;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CalendarSettingsRepository extends JpaRepository<CalendarSettings, Long> {

    Optional<CalendarSettings> findByOwnerId(String ownerId);

    boolean existsByOwnerId(String ownerId);

    // 소유자 단위 예약 직렬화 (SELECT ... FOR UPDATE)
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CalendarSettings c WHERE c.ownerId = :ownerId")
    Optional<CalendarSettings> findByOwnerIdForUpdate(@Param("ownerId") String ownerId);
}
