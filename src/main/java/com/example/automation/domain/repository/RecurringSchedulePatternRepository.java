package com.example.automation.domain.repository;

import com.example.automation.domain.entity.RecurringSchedulePattern;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface RecurringSchedulePatternRepository extends JpaRepository<RecurringSchedulePattern, UUID> {

    List<RecurringSchedulePattern> findByTaskIdAndActiveTrue(UUID taskId);

    List<RecurringSchedulePattern> findByTaskId(UUID taskId);
}
