package com.brados.backend.progression.model;

/**
 * Prescription for one exercise in one week.
 *
 * @param consecutiveFailures running failure counter to carry when this week gets summarised
 */
public record WeekTargets(
        Long exerciseId,
        Long planExerciseId,
        double targetWeight,
        int targetReps,
        int targetSets,
        int weekNumber,
        boolean deload,
        ProgressionReason reason,
        int consecutiveFailures
) {}
