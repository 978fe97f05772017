package com.brados.backend.mesocycle.service;

import com.brados.backend.plan.entity.PlanDayExercise;

import java.util.List;

/**
 * What changed between two versions of a plan day's exercise list, matched by plan exercise id.
 */
public record PlanDayDiff(
        List<PlanDayExercise> added,
        List<PlanDayExercise> removed,
        List<Modified> modified
) {

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && modified.isEmpty();
    }

    public record Modified(PlanDayExercise exercise, Changes changes) {}

    /** New values of the fields that changed; null means unchanged. */
    public record Changes(
            Integer sets,
            Integer reps,
            Double weight,
            Integer restSeconds,
            Integer minReps,
            Integer maxReps
    ) {
        public boolean isEmpty() {
            return sets == null && reps == null && weight == null
                    && restSeconds == null && minReps == null && maxReps == null;
        }

        /** Rest time alone does not change any prescription. */
        public boolean affectsTargets() {
            return sets != null || reps != null || weight != null || minReps != null || maxReps != null;
        }
    }
}
