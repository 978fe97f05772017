package com.brados.backend.plan.dto;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

// null fields are left as they are
public record UpdatePlanExerciseRequest(
        @Positive Integer sets,
        @Positive Integer reps,
        @PositiveOrZero Double weight,
        @Positive Integer minReps,
        @Positive Integer maxReps,
        @PositiveOrZero Integer restSeconds
) {}
