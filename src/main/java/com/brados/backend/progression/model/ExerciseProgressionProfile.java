package com.brados.backend.progression.model;

import com.brados.backend.plan.entity.Exercise;
import com.brados.backend.plan.entity.PlanDayExercise;

/**
 * Baseline prescription of one exercise on one plan day. Read-only input of the engine.
 */
public record ExerciseProgressionProfile(
        Long exerciseId,
        Long planExerciseId,
        double baseWeight,
        int baseReps,
        int baseSets,
        double weightIncrement,
        int minReps,
        int maxReps
) {

    public static ExerciseProgressionProfile of(PlanDayExercise pde, Exercise exercise) {
        return new ExerciseProgressionProfile(
                pde.getExerciseId(),
                pde.getId(),
                pde.getWeight() == null ? 0.0 : pde.getWeight(),
                pde.getReps(),
                pde.getSets(),
                exercise.getWeightIncrement() == null ? 0.0 : exercise.getWeightIncrement(),
                pde.getMinReps(),
                pde.getMaxReps()
        );
    }

    public int clampReps(int reps) {
        return Math.max(minReps, Math.min(maxReps, reps));
    }

    public double floorWeight(double weight) {
        return Math.max(baseWeight, weight);
    }
}
