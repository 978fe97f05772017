package com.brados.backend.workout.dto;

import java.util.List;

public record WorkoutExerciseDto(
        Long exerciseId,
        String exerciseName,
        List<WorkoutSetDto> sets,
        int totalSets,
        int completedSets
) {}
