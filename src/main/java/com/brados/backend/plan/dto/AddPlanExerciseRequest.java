package com.brados.backend.plan.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

/** Omitted numbers take the plan defaults (3 x 10 at 0, range 8-12, 90 s rest). */
public record AddPlanExerciseRequest(
        @NotNull @Positive Long exerciseId,
        @Positive Integer sets,
        @Positive Integer reps,
        @PositiveOrZero Double weight,
        @Positive Integer minReps,
        @Positive Integer maxReps,
        @PositiveOrZero Integer restSeconds
) {}
