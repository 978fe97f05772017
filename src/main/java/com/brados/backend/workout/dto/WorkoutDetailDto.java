package com.brados.backend.workout.dto;

import java.util.List;

public record WorkoutDetailDto(
        WorkoutDto workout,
        String planDayName,
        List<WorkoutExerciseDto> exercises
) {}
