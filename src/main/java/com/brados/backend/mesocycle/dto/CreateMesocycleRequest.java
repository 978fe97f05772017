package com.brados.backend.mesocycle.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.LocalDate;

public record CreateMesocycleRequest(
        @NotNull @Positive Long planId,
        // yyyy-MM-dd; week 1 starts here
        @NotNull LocalDate startDate
) {}
