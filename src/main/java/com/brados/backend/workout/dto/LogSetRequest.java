package com.brados.backend.workout.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record LogSetRequest(
        @NotNull @PositiveOrZero Integer actualReps,
        @NotNull @PositiveOrZero Double actualWeight
) {}
