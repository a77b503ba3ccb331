package com.slotsync.booking.common.repository;

import com.slotsync.booking.common.entity.EventType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface EventTypeRepository extends JpaRepository<EventType, Long> {

    List<EventType> findByOwnerIdOrderByCreatedAtAsc(String ownerId);

    List<EventType> findByOwnerIdAndIsActive(String ownerId, Boolean isActive);

    Optional<EventType> findByEventTypeIdAndOwnerId(Long eventTypeId, String ownerId);
}
