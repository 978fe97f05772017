package com.brados.backend.mesocycle.dto;

import com.brados.backend.mesocycle.entity.Mesocycle;

import java.time.LocalDate;
import java.util.List;

public record MesocycleDetailDto(
        Long id,
        Long planId,
        String planName,
        LocalDate startDate,
        int currentWeek,
        int durationWeeks,
        Mesocycle.Status status,
        List<WeekSummaryDto> weeks,
        int totalWorkouts,
        int completedWorkouts
) {}
