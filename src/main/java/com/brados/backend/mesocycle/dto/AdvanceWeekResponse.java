package com.brados.backend.mesocycle.dto;

import com.brados.backend.mesocycle.service.PlanModificationService;
import com.brados.backend.progression.model.WeekTargets;

import java.util.List;

public record AdvanceWeekResponse(
        Long mesocycleId,
        int weekNumber,
        boolean deload,
        boolean mesocycleCompleted,
        List<WeekTargets> targets
) {
    public static AdvanceWeekResponse from(PlanModificationService.AdvanceResult r) {
        return new AdvanceWeekResponse(r.mesocycleId(), r.weekNumber(), r.deload(),
                r.mesocycleCompleted(), r.targets());
    }
}
