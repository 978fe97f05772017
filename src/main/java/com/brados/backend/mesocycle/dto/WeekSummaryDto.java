package com.brados.backend.mesocycle.dto;

import com.brados.backend.workout.dto.WorkoutSummaryDto;

import java.util.List;

public record WeekSummaryDto(
        int weekNumber,
        boolean deload,
        List<WorkoutSummaryDto> workouts,
        int totalWorkouts,
        int completedWorkouts,
        int skippedWorkouts
) {}
