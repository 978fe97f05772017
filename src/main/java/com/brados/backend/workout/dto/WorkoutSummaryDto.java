package com.brados.backend.workout.dto;

import com.brados.backend.workout.entity.Workout;

import java.time.LocalDate;

public record WorkoutSummaryDto(
        Long id,
        Long planDayId,
        String planDayName,
        int weekNumber,
        LocalDate scheduledDate,
        Workout.Status status,
        int setCount,
        int completedSetCount
) {}
