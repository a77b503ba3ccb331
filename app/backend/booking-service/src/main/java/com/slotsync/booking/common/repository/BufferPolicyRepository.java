package com.slotsync.booking.common.repository;

import com.slotsync.booking.common.entity.BufferPolicy;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface BufferPolicyRepository extends JpaRepository<BufferPolicy, Long> {

    Optional<BufferPolicy> findByOwnerId(String ownerId);

    void deleteAllByOwnerId(String ownerId);
}
