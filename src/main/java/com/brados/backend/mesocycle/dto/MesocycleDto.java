package com.brados.backend.mesocycle.dto;

import com.brados.backend.mesocycle.entity.Mesocycle;

import java.time.LocalDate;

public record MesocycleDto(
        Long id,
        Long planId,
        LocalDate startDate,
        int currentWeek,
        int durationWeeks,
        Mesocycle.Status status
) {
    public static MesocycleDto from(Mesocycle m) {
        return new MesocycleDto(m.getId(), m.getPlanId(), m.getStartDate(),
                m.getCurrentWeek(), m.getDurationWeeks(), m.getStatus());
    }
}
