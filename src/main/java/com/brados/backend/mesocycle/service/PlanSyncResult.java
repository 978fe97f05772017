package com.brados.backend.mesocycle.service;

import java.util.List;

/**
 * Outcome of pushing a plan edit into a running mesocycle.
 *
 * @param preservedCount workouts whose sets were kept because something was already logged
 */
public record PlanSyncResult(
        int affectedWorkoutCount,
        int addedSetsCount,
        int removedSetsCount,
        int modifiedSetsCount,
        int preservedCount,
        List<String> warnings
) {
    public static PlanSyncResult empty() {
        return new PlanSyncResult(0, 0, 0, 0, 0, List.of());
    }
}
