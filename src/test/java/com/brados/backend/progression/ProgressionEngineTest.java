package com.brados.backend.progression;

import com.brados.backend.common.error.InvalidPerformanceException;
import com.brados.backend.common.error.InvalidProfileException;
import com.brados.backend.progression.model.ExerciseProgressionProfile;
import com.brados.backend.progression.model.PreviousWeekPerformance;
import com.brados.backend.progression.model.ProgressionReason;
import com.brados.backend.progression.model.WeekTargets;
import com.brados.backend.progression.service.ProgressionEngine;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ProgressionEngineTest {

    private final ProgressionEngine engine = new ProgressionEngine(2);

    private static ExerciseProgressionProfile bench() {
        return new ExerciseProgressionProfile(1L, 11L, 135.0, 10, 3, 5.0, 8, 12);
    }

    private static PreviousWeekPerformance prev(int week, double tw, int tr, double aw, int ar,
                                                boolean hit, int failures) {
        return new PreviousWeekPerformance(1L, week, tw, tr, aw, ar, hit, failures);
    }

    @Test
    void firstWeek_withoutPrevious_shouldUseBaseValues() {
        WeekTargets t = engine.computeWeekTargets(bench(), 1, null, false);

        assertEquals(135.0, t.targetWeight());
        assertEquals(10, t.targetReps());
        assertEquals(3, t.targetSets());
        assertFalse(t.deload());
        assertEquals(ProgressionReason.FIRST_WEEK, t.reason());
        assertEquals(0, t.consecutiveFailures());
    }

    @Test
    void hitTarget_shouldAddIncrementAndDropToMinReps() {
        WeekTargets t = engine.computeWeekTargets(bench(), 2, prev(1, 135, 10, 135, 10, true, 0), false);

        assertEquals(140.0, t.targetWeight());
        assertEquals(8, t.targetReps());
        assertEquals(3, t.targetSets());
        assertFalse(t.deload());
        assertEquals(ProgressionReason.PROGRESS, t.reason());
        assertEquals(0, t.consecutiveFailures());
    }

    @Test
    void firstMiss_shouldHoldWeightAndCountFailure() {
        WeekTargets t = engine.computeWeekTargets(bench(), 2, prev(1, 135, 10, 135, 9, false, 0), false);

        assertEquals(135.0, t.targetWeight());
        assertEquals(10, t.targetReps());
        assertEquals(ProgressionReason.HOLD, t.reason());
        assertEquals(1, t.consecutiveFailures());
    }

    @Test
    void firstMiss_belowRepRange_shouldHoldAtMinReps() {
        WeekTargets t = engine.computeWeekTargets(bench(), 2, prev(1, 135, 10, 135, 5, false, 0), false);

        assertEquals(135.0, t.targetWeight());
        assertEquals(8, t.targetReps());
    }

    @Test
    void secondConsecutiveMiss_shouldRegressToMaxRepsAndResetCounter() {
        WeekTargets week2 = engine.computeWeekTargets(bench(), 2, prev(1, 135, 10, 135, 9, false, 0), false);
        WeekTargets week3 = engine.computeWeekTargets(bench(), 3,
                prev(2, week2.targetWeight(), week2.targetReps(), 135, 9, false, week2.consecutiveFailures()), false);

        assertEquals(135.0, week3.targetWeight(), "floored at baseWeight");
        assertEquals(12, week3.targetReps());
        assertEquals(0, week3.consecutiveFailures());
        assertEquals(ProgressionReason.REGRESS, week3.reason());
    }

    @Test
    void regression_aboveBase_shouldDropOneIncrement() {
        WeekTargets t = engine.computeWeekTargets(bench(), 5, prev(4, 150, 8, 150, 6, false, 1), false);

        assertEquals(145.0, t.targetWeight());
        assertEquals(12, t.targetReps());
        assertEquals(0, t.consecutiveFailures());
    }

    @Test
    void deloadWeek_shouldLightenAndHalveSets() {
        WeekTargets t = engine.computeWeekTargets(bench(), 7, prev(6, 150, 9, 150, 9, true, 1), true);

        assertEquals(145.0, t.targetWeight());
        assertEquals(9, t.targetReps());
        assertEquals(2, t.targetSets());
        assertTrue(t.deload());
        assertEquals(ProgressionReason.DELOAD, t.reason());
        assertEquals(0, t.consecutiveFailures(), "the hit before the deload resets the counter");
    }

    @Test
    void deloadWeek_afterMiss_shouldCountThatMiss() {
        WeekTargets t = engine.computeWeekTargets(bench(), 3, prev(2, 140, 8, 140, 6, false, 1), true);

        assertEquals(135.0, t.targetWeight());
        assertEquals(2, t.consecutiveFailures());
    }

    @Test
    void weekAfterDeload_whenMissesReachedThreshold_shouldRegressFromPreDeloadWeight() {
        ProgressionEngine e = new ProgressionEngine(2);
        ExerciseProgressionProfile p = new ExerciseProgressionProfile(1L, 11L, 130.0, 10, 3, 5.0, 8, 12);

        // week 2 at 140 was the second miss in a row
        PreviousWeekPerformance week2 = prev(2, 140, 8, 140, 6, false, 1);
        WeekTargets deload = e.computeWeekTargets(p, 3, week2, true);
        assertEquals(2, deload.consecutiveFailures());

        // hitting the light deload sets does not clear the misses before it
        WeekTargets week4 = e.computeWeekTargets(p, 4, week2.carriedThroughDeload(3), false);

        assertEquals(ProgressionReason.REGRESS, week4.reason());
        assertEquals(135.0, week4.targetWeight());
        assertEquals(12, week4.targetReps());
        assertEquals(3, week4.targetSets());
        assertEquals(0, week4.consecutiveFailures());
    }

    @Test
    void weekAfterDeload_afterHit_shouldProgressFromPreDeloadWeight() {
        PreviousWeekPerformance week2 = prev(2, 140, 8, 140, 8, true, 0);

        WeekTargets week4 = engine.computeWeekTargets(bench(), 4, week2.carriedThroughDeload(3), false);

        assertEquals(ProgressionReason.PROGRESS, week4.reason());
        assertEquals(145.0, week4.targetWeight());
        assertEquals(8, week4.targetReps());
        assertEquals(3, week4.targetSets());
    }

    @Test
    void weekAfterDeload_afterSingleMiss_shouldHoldWithCarriedCounter() {
        PreviousWeekPerformance week2 = prev(2, 140, 9, 140, 8, false, 0);

        WeekTargets week4 = engine.computeWeekTargets(bench(), 4, week2.carriedThroughDeload(3), false);

        assertEquals(ProgressionReason.HOLD, week4.reason());
        assertEquals(140.0, week4.targetWeight());
        assertEquals(9, week4.targetReps());
        assertEquals(1, week4.consecutiveFailures());
    }

    @Test
    void consecutiveDeloads_shouldKeepCounterAndPreDeloadWeight() {
        PreviousWeekPerformance week2 = prev(2, 140, 8, 140, 6, false, 0);
        PreviousWeekPerformance week3 = week2.carriedThroughDeload(3);

        WeekTargets week4 = engine.computeWeekTargets(bench(), 4, week3, true);
        assertEquals(135.0, week4.targetWeight());
        assertEquals(1, week4.consecutiveFailures());

        WeekTargets week5 = engine.computeWeekTargets(bench(), 5, week3.carriedThroughDeload(4), false);
        assertEquals(ProgressionReason.HOLD, week5.reason());
        assertEquals(140.0, week5.targetWeight());
        assertEquals(1, week5.consecutiveFailures());
    }

    @Test
    void deloadWeek_singleSet_shouldKeepOneSet() {
        ExerciseProgressionProfile p = new ExerciseProgressionProfile(1L, 11L, 0.0, 10, 1, 2.5, 8, 12);
        WeekTargets t = engine.computeWeekTargets(p, 2, prev(1, 0, 10, 0, 10, true, 0), true);

        assertEquals(1, t.targetSets());
        assertEquals(0.0, t.targetWeight());
    }

    @Test
    void deloadFlag_onFirstWeek_shouldBePassedThrough() {
        WeekTargets t = engine.computeWeekTargets(bench(), 1, null, true);
        assertTrue(t.deload());
        assertEquals(3, t.targetSets());
    }

    @Test
    void sameInputs_shouldGiveSameTargets() {
        PreviousWeekPerformance p = prev(3, 140, 9, 140, 8, false, 0);
        assertEquals(engine.computeWeekTargets(bench(), 4, p, false),
                engine.computeWeekTargets(bench(), 4, p, false));
    }

    @Test
    void invalidProfile_shouldBeRejected() {
        assertThrows(InvalidProfileException.class, () -> engine.computeWeekTargets(
                new ExerciseProgressionProfile(1L, 11L, 135.0, 10, 3, 5.0, 12, 8), 1, null, false));
        assertThrows(InvalidProfileException.class, () -> engine.computeWeekTargets(
                new ExerciseProgressionProfile(1L, 11L, 135.0, 10, 3, 0.0, 8, 12), 1, null, false));
        assertThrows(InvalidProfileException.class, () -> engine.computeWeekTargets(
                new ExerciseProgressionProfile(1L, 11L, 135.0, 10, 0, 5.0, 8, 12), 1, null, false));
    }

    @Test
    void previousWeekNotAdjacent_shouldBeRejected() {
        assertThrows(InvalidPerformanceException.class,
                () -> engine.computeWeekTargets(bench(), 4, prev(2, 135, 10, 135, 10, true, 0), false));
        assertThrows(InvalidPerformanceException.class,
                () -> engine.computeWeekTargets(bench(), 0, null, false));
    }

    @Test
    void negativeFailureCounter_shouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> prev(1, 135, 10, 135, 10, true, -1));
    }

    @Test
    void randomWeeks_shouldKeepRepsInRangeAndWeightAboveBase() {
        Random rnd = new Random(42);
        ExerciseProgressionProfile p = bench();

        for (int run = 0; run < 200; run++) {
            WeekTargets t = engine.computeWeekTargets(p, 1, null, false);
            for (int week = 2; week <= 12; week++) {
                boolean hit = rnd.nextBoolean();
                int actualReps = rnd.nextInt(15);
                PreviousWeekPerformance perf = prev(week - 1, t.targetWeight(), t.targetReps(),
                        t.targetWeight(), actualReps, hit, t.consecutiveFailures());
                t = engine.computeWeekTargets(p, week, perf, rnd.nextInt(5) == 0);

                assertThat(t.targetReps()).isBetween(p.minReps(), p.maxReps());
                assertThat(t.targetWeight()).isGreaterThanOrEqualTo(p.baseWeight());
                assertThat(t.targetSets()).isPositive();
            }
        }
    }

    @Test
    void consecutiveMisses_counterShouldIncreaseUntilRegression() {
        ProgressionEngine lenient = new ProgressionEngine(4);
        WeekTargets t = lenient.computeWeekTargets(bench(), 1, null, false);
        int last = t.consecutiveFailures();

        for (int week = 2; week <= 4; week++) {
            t = lenient.computeWeekTargets(bench(), week,
                    prev(week - 1, t.targetWeight(), t.targetReps(), t.targetWeight(), 9, false, t.consecutiveFailures()),
                    false);
            assertThat(t.consecutiveFailures()).isGreaterThan(last);
            last = t.consecutiveFailures();
        }

        t = lenient.computeWeekTargets(bench(), 5,
                prev(4, t.targetWeight(), t.targetReps(), t.targetWeight(), 9, false, t.consecutiveFailures()), false);
        assertEquals(ProgressionReason.REGRESS, t.reason());
        assertEquals(0, t.consecutiveFailures());
    }
}
