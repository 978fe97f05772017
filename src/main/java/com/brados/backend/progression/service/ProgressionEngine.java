package com.brados.backend.progression.service;

import com.brados.backend.common.error.InvalidPerformanceException;
import com.brados.backend.common.error.InvalidProfileException;
import com.brados.backend.progression.config.ProgressionProperties;
import com.brados.backend.progression.model.ExerciseProgressionProfile;
import com.brados.backend.progression.model.PreviousWeekPerformance;
import com.brados.backend.progression.model.ProgressionReason;
import com.brados.backend.progression.model.WeekTargets;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Week-over-week prescription: double progression with deload weeks and
 * failure-driven regression.
 * <ul>
 *   <li>no previous week → base weight / reps / sets</li>
 *   <li>deload → one increment lighter, half the sets, same reps; the week before it
 *       still counts toward the failure counter</li>
 *   <li>hit → one increment heavier, reps back to minReps</li>
 *   <li>miss below the failure threshold → same weight, same reps (minReps if under the range)</li>
 *   <li>miss reaching the threshold → one increment lighter, reps to maxReps, counter reset</li>
 * </ul>
 * The week after a deload is prescribed from the last regular week before it
 * (see {@link PreviousWeekPerformance#deload()}).
 * Weight never drops under baseWeight, reps always stay in [minReps, maxReps].
 * Stateless: the same inputs always give the same targets.
 */
@Component
public class ProgressionEngine {

    private final int failureThreshold;

    @Autowired
    public ProgressionEngine(ProgressionProperties props) {
        this(props.getFailureThreshold());
    }

    public ProgressionEngine(int failureThreshold) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        this.failureThreshold = failureThreshold;
    }

    public int failureThreshold() { return failureThreshold; }

    public WeekTargets computeWeekTargets(ExerciseProgressionProfile profile,
                                          int weekNumber,
                                          PreviousWeekPerformance previous,
                                          boolean isDeloadWeek) {
        validate(profile);
        if (weekNumber < 1) {
            throw new InvalidPerformanceException("weekNumber must be >= 1, got " + weekNumber);
        }

        if (previous == null) {
            return targets(profile, weekNumber,
                    profile.baseWeight(), profile.baseReps(), profile.baseSets(),
                    isDeloadWeek, ProgressionReason.FIRST_WEEK, 0);
        }

        if (previous.weekNumber() != weekNumber - 1) {
            throw new InvalidPerformanceException(
                    "Performance of week " + previous.weekNumber() + " cannot seed week " + weekNumber);
        }

        if (isDeloadWeek) {
            return targets(profile, weekNumber,
                    previous.targetWeight() - profile.weightIncrement(),
                    previous.targetReps(),
                    deloadSets(profile.baseSets()),
                    true, ProgressionReason.DELOAD, previous.failuresAfter());
        }

        if (previous.hitTarget()) {
            return targets(profile, weekNumber,
                    previous.targetWeight() + profile.weightIncrement(),
                    profile.minReps(),
                    profile.baseSets(),
                    false, ProgressionReason.PROGRESS, 0);
        }

        int failures = previous.failuresAfter();
        if (failures < failureThreshold) {
            int reps = previous.actualReps() >= profile.minReps()
                    ? previous.targetReps()
                    : profile.minReps();
            return targets(profile, weekNumber,
                    previous.targetWeight(), reps, profile.baseSets(),
                    false, ProgressionReason.HOLD, failures);
        }

        return regress(profile, weekNumber, previous);
    }

    private static WeekTargets regress(ExerciseProgressionProfile profile, int weekNumber,
                                       PreviousWeekPerformance previous) {
        return targets(profile, weekNumber,
                previous.targetWeight() - profile.weightIncrement(),
                profile.maxReps(),
                profile.baseSets(),
                false, ProgressionReason.REGRESS, 0);
    }

    static int deloadSets(int baseSets) {
        return Math.max(1, (baseSets + 1) / 2);
    }

    private static WeekTargets targets(ExerciseProgressionProfile p, int week,
                                       double weight, int reps, int sets,
                                       boolean deload, ProgressionReason reason, int failures) {
        return new WeekTargets(
                p.exerciseId(),
                p.planExerciseId(),
                p.floorWeight(weight),
                p.clampReps(reps),
                Math.max(1, sets),
                week,
                deload,
                reason,
                failures
        );
    }

    private static void validate(ExerciseProgressionProfile p) {
        if (p == null) throw new InvalidProfileException("profile is required");
        if (p.minReps() > p.maxReps()) {
            throw new InvalidProfileException(
                    "minReps " + p.minReps() + " is greater than maxReps " + p.maxReps());
        }
        if (!(p.weightIncrement() > 0)) {
            throw new InvalidProfileException("weightIncrement must be > 0, got " + p.weightIncrement());
        }
        if (p.baseSets() < 1) {
            throw new InvalidProfileException("baseSets must be >= 1, got " + p.baseSets());
        }
        if (p.baseWeight() < 0) {
            throw new InvalidProfileException("baseWeight must be >= 0, got " + p.baseWeight());
        }
    }
}
