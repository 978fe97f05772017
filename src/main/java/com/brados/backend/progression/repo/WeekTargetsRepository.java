package com.brados.backend.progression.repo;

import com.brados.backend.progression.entity.WeekTargetsEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface WeekTargetsRepository extends JpaRepository<WeekTargetsEntity, Long> {

    List<WeekTargetsEntity> findByMesocycleIdAndWeekNumber(Long mesocycleId, Integer weekNumber);

    Optional<WeekTargetsEntity> findByMesocycleIdAndPlanExerciseIdAndWeekNumber(
            Long mesocycleId, Long planExerciseId, Integer weekNumber);

    List<WeekTargetsEntity> findByMesocycleIdAndPlanDayIdAndExerciseIdAndWeekNumber(
            Long mesocycleId, Long planDayId, Long exerciseId, Integer weekNumber);

    boolean existsByMesocycleIdAndWeekNumber(Long mesocycleId, Integer weekNumber);
}
