package com.brados.backend.progression.model;

/**
 * How one exercise went in one week. Never stored: projected from that week's sets.
 * <p>
 * A deload week is never judged on its own sets. Its performance is the last
 * regular week before it (targets, actuals, hit) carried forward under the deload
 * week's number, with the counter that week already produced.
 *
 * @param consecutiveFailures missed weeks in a row before this one (0 after any hit);
 *                            for a deload week, the count including the week before it
 * @param deload              the week was a deload week
 */
public record PreviousWeekPerformance(
        Long exerciseId,
        int weekNumber,
        double targetWeight,
        int targetReps,
        double actualWeight,
        int actualReps,
        boolean hitTarget,
        int consecutiveFailures,
        boolean deload
) {
    public PreviousWeekPerformance {
        if (consecutiveFailures < 0) {
            throw new IllegalArgumentException("consecutiveFailures must be >= 0");
        }
    }

    public PreviousWeekPerformance(Long exerciseId, int weekNumber, double targetWeight, int targetReps,
                                   double actualWeight, int actualReps, boolean hitTarget,
                                   int consecutiveFailures) {
        this(exerciseId, weekNumber, targetWeight, targetReps, actualWeight, actualReps,
                hitTarget, consecutiveFailures, false);
    }

    /** Failure counter once this week is done. */
    public int failuresAfter() {
        if (deload) return consecutiveFailures;
        return hitTarget ? 0 : consecutiveFailures + 1;
    }

    /** This performance standing in for the deload week that followed it. */
    public PreviousWeekPerformance carriedThroughDeload(int deloadWeek) {
        return new PreviousWeekPerformance(exerciseId, deloadWeek, targetWeight, targetReps,
                actualWeight, actualReps, hitTarget, failuresAfter(), true);
    }
}
