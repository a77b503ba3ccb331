package com.slotsync.booking.common.repository;

import com.slotsync.booking.common.entity.WorkingHourRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WorkingHourRuleRepository extends JpaRepository<WorkingHourRule, Long> {

    List<WorkingHourRule> findByOwnerId(String ownerId);

    // 설정 전체 교체 시 사용
    void deleteAllByOwnerId(String ownerId);
}
