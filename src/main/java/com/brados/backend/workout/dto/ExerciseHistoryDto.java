package com.brados.backend.workout.dto;

import java.time.LocalDate;
import java.util.List;

/**
 * Every session an exercise was trained in, oldest first.
 *
 * @param personalRecord heaviest session best, null when nothing was ever completed
 */
public record ExerciseHistoryDto(
        Long exerciseId,
        String exerciseName,
        List<Entry> entries,
        PersonalRecord personalRecord
) {

    /** One workout: its completed sets and the heaviest of them. */
    public record Entry(
            Long workoutId,
            Long mesocycleId,
            int weekNumber,
            LocalDate date,
            List<HistorySet> sets,
            double bestWeight,
            int bestSetReps
    ) {}

    public record HistorySet(int setNumber, double weight, int reps) {}

    public record PersonalRecord(double weight, int reps, LocalDate date, Long workoutId) {}
}
