package com.brados.backend.plan.repo;

import com.brados.backend.plan.entity.PlanDayExercise;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface PlanDayExerciseRepository extends JpaRepository<PlanDayExercise, Long> {
    List<PlanDayExercise> findByPlanDayIdOrderBySortOrderAscIdAsc(Long planDayId);

    List<PlanDayExercise> findByPlanDayIdInOrderBySortOrderAscIdAsc(Collection<Long> planDayIds);
}
