package com.brados.backend.progression.service;

import com.brados.backend.progression.model.PreviousWeekPerformance;
import com.brados.backend.progression.model.WeekTargets;
import com.brados.backend.workout.entity.WorkoutSet;

import java.util.Collection;

/**
 * Summarises one exercise's week from its sets. Computed on demand every time,
 * nothing here is cached or persisted.
 * <ul>
 *   <li>hitTarget: there were sets and every one of them was completed at or above
 *       target reps and target weight (a skipped or untouched set is a miss)</li>
 *   <li>actual weight / reps: the best completed set, heaviest first then most reps;
 *       0 / 0 when nothing was completed</li>
 *   <li>consecutiveFailures: the counter the week was prescribed with</li>
 * </ul>
 */
public final class WeekPerformanceProjector {

    private WeekPerformanceProjector() {}

    public static PreviousWeekPerformance project(WeekTargets targets, Collection<WorkoutSet> sets) {
        boolean hit = !sets.isEmpty();
        WorkoutSet best = null;

        for (WorkoutSet s : sets) {
            if (!s.isCompleted()) {
                hit = false;
                continue;
            }
            if (s.getActualReps() < targets.targetReps() || s.getActualWeight() < targets.targetWeight()) {
                hit = false;
            }
            if (best == null || isBetter(s, best)) best = s;
        }

        return new PreviousWeekPerformance(
                targets.exerciseId(),
                targets.weekNumber(),
                targets.targetWeight(),
                targets.targetReps(),
                best == null ? 0.0 : best.getActualWeight(),
                best == null ? 0 : best.getActualReps(),
                hit,
                targets.consecutiveFailures()
        );
    }

    private static boolean isBetter(WorkoutSet a, WorkoutSet b) {
        int byWeight = Double.compare(a.getActualWeight(), b.getActualWeight());
        if (byWeight != 0) return byWeight > 0;
        return a.getActualReps() > b.getActualReps();
    }
}
