package com.brados.backend.plan.dto;

import com.brados.backend.plan.entity.PlanDayExercise;

public record PlanExerciseDto(
        Long id,
        Long planDayId,
        Long exerciseId,
        int sets,
        int reps,
        double weight,
        int minReps,
        int maxReps,
        int restSeconds,
        int sortOrder
) {
    public static PlanExerciseDto from(PlanDayExercise e) {
        return new PlanExerciseDto(e.getId(), e.getPlanDayId(), e.getExerciseId(), e.getSets(), e.getReps(),
                e.getWeight(), e.getMinReps(), e.getMaxReps(), e.getRestSeconds(), e.getSortOrder());
    }
}
