package com.brados.backend.plan.dto;

import com.brados.backend.mesocycle.service.PlanSyncResult;

/**
 * @param exercise the plan exercise after the change, null when it was removed
 * @param sync     what changed in the plan's active mesocycle, null when none is running
 */
public record PlanExerciseChangeResponse(
        PlanExerciseDto exercise,
        PlanSyncResult sync
) {}
