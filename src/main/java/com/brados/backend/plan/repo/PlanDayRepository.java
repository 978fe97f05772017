package com.brados.backend.plan.repo;

import com.brados.backend.plan.entity.PlanDay;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PlanDayRepository extends JpaRepository<PlanDay, Long> {
    List<PlanDay> findByPlanIdOrderBySortOrderAscIdAsc(Long planId);
}
