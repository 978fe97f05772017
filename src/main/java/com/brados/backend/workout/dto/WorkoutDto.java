package com.brados.backend.workout.dto;

import com.brados.backend.workout.entity.Workout;

import java.time.Instant;
import java.time.LocalDate;

public record WorkoutDto(
        Long id,
        Long mesocycleId,
        Long planDayId,
        int weekNumber,
        LocalDate scheduledDate,
        Workout.Status status,
        Instant startedAt,
        Instant completedAt
) {
    public static WorkoutDto from(Workout w) {
        return new WorkoutDto(w.getId(), w.getMesocycleId(), w.getPlanDayId(), w.getWeekNumber(),
                w.getScheduledDate(), w.getStatus(), w.getStartedAt(), w.getCompletedAt());
    }
}
