package com.brados.backend.workout.service;

import com.brados.backend.common.error.InvalidTransitionException;
import com.brados.backend.common.error.NotFoundException;
import com.brados.backend.common.error.ValidationException;
import com.brados.backend.progression.entity.WeekTargetsEntity;
import com.brados.backend.progression.model.ProgressionReason;
import com.brados.backend.progression.model.WeekTargets;
import com.brados.backend.progression.repo.WeekTargetsRepository;
import com.brados.backend.workout.dto.ModifySetCountResponse;
import com.brados.backend.workout.dto.WorkoutSetDto;
import com.brados.backend.workout.entity.Workout;
import com.brados.backend.workout.entity.WorkoutSet;
import com.brados.backend.workout.repo.WorkoutRepository;
import com.brados.backend.workout.repo.WorkoutSetRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WorkoutSetServiceTest {

    @Mock WorkoutSetRepository setRepo;
    @Mock WorkoutRepository workoutRepo;
    @Mock WeekTargetsRepository targetsRepo;

    WorkoutSetService service;
    Workout workout;

    @BeforeEach
    void setUp() {
        service = new WorkoutSetService(setRepo, workoutRepo, targetsRepo);
        workout = new Workout();
        workout.setId(100L);
        workout.setMesocycleId(5L);
        workout.setPlanDayId(7L);
        workout.setWeekNumber(2);
        workout.start(Instant.parse("2026-03-02T10:00:00Z"));
    }

    private static WorkoutSet set(long id, int number, WorkoutSet.Status status) {
        WorkoutSet s = new WorkoutSet();
        s.setId(id);
        s.setWorkoutId(100L);
        s.setExerciseId(1L);
        s.setPlanExerciseId(11L);
        s.setSetNumber(number);
        s.setTargetReps(8);
        s.setTargetWeight(140.0);
        if (status == WorkoutSet.Status.COMPLETED) s.log(8, 140);
        if (status == WorkoutSet.Status.SKIPPED) s.skip();
        return s;
    }

    @Test
    void logSet_shouldStoreActuals() {
        WorkoutSet s = set(1L, 1, WorkoutSet.Status.PENDING);
        when(setRepo.findById(1L)).thenReturn(Optional.of(s));
        when(workoutRepo.findById(100L)).thenReturn(Optional.of(workout));

        WorkoutSetDto dto = service.logSet(1L, 9, 140.0);

        assertEquals(WorkoutSet.Status.COMPLETED, dto.status());
        assertEquals(9, dto.actualReps());
        verify(setRepo).save(s);
    }

    @Test
    void logSet_negativeReps_shouldBeValidationErrorWithoutLoadingAnything() {
        ValidationException ex = assertThrows(ValidationException.class, () -> service.logSet(1L, -3, 140.0));

        assertEquals("Reps must be a non-negative number", ex.getMessage());
        verifyNoInteractions(setRepo, workoutRepo, targetsRepo);
    }

    @Test
    void logSet_negativeWeight_onPendingWorkout_shouldBeValidationErrorNotInvalidTransition() {
        // the workout is never looked at: bad actuals are rejected first
        assertThrows(ValidationException.class, () -> service.logSet(1L, 8, -5.0));
        verifyNoInteractions(setRepo, workoutRepo);
    }

    @Test
    void logSet_missingActuals_shouldBeValidationError() {
        assertThrows(ValidationException.class, () -> service.logSet(1L, null, 140.0));
        verifyNoInteractions(setRepo, workoutRepo);
    }

    @Test
    void logSet_missingSet_shouldBeNotFound() {
        when(setRepo.findById(9L)).thenReturn(Optional.empty());
        NotFoundException ex = assertThrows(NotFoundException.class, () -> service.logSet(9L, 5, 100.0));
        assertEquals("WORKOUTSET_NOT_FOUND", ex.code());
    }

    @Test
    void logSet_onPendingWorkout_shouldBeInvalidTransition() {
        Workout pending = new Workout();
        pending.setId(100L);
        when(setRepo.findById(1L)).thenReturn(Optional.of(set(1L, 1, WorkoutSet.Status.PENDING)));
        when(workoutRepo.findById(100L)).thenReturn(Optional.of(pending));

        assertThrows(InvalidTransitionException.class, () -> service.logSet(1L, 8, 140.0));
    }

    @Test
    void addSet_shouldAppendAfterHighestNumberWithStoredTargets() {
        when(workoutRepo.findById(100L)).thenReturn(Optional.of(workout));
        WeekTargetsEntity row = WeekTargetsEntity.of(5L, 7L,
                new WeekTargets(1L, 11L, 140.0, 8, 3, 2, false, ProgressionReason.PROGRESS, 0),
                Instant.parse("2026-03-02T03:10:00Z"));
        row.setId(50L);
        when(targetsRepo.findByMesocycleIdAndPlanDayIdAndExerciseIdAndWeekNumber(5L, 7L, 1L, 2))
                .thenReturn(List.of(row));
        when(setRepo.findByWorkoutIdAndExerciseIdOrderBySetNumberAsc(100L, 1L)).thenReturn(List.of(
                set(1L, 1, WorkoutSet.Status.COMPLETED), set(2L, 2, WorkoutSet.Status.PENDING),
                set(3L, 4, WorkoutSet.Status.PENDING)));
        when(setRepo.save(any(WorkoutSet.class))).thenAnswer(inv -> inv.getArgument(0));

        ModifySetCountResponse res = service.addSet(100L, 1L);

        ArgumentCaptor<WorkoutSet> saved = ArgumentCaptor.forClass(WorkoutSet.class);
        verify(setRepo).save(saved.capture());
        assertEquals(5, saved.getValue().getSetNumber());
        assertEquals(8, saved.getValue().getTargetReps());
        assertEquals(140.0, saved.getValue().getTargetWeight());
        assertTrue(saved.getValue().isPending());
        assertEquals(4, res.setCount());
    }

    @Test
    void addSet_withoutWeekTargets_shouldBeNotFound() {
        when(workoutRepo.findById(100L)).thenReturn(Optional.of(workout));
        when(targetsRepo.findByMesocycleIdAndPlanDayIdAndExerciseIdAndWeekNumber(5L, 7L, 99L, 2))
                .thenReturn(List.of());

        assertThrows(NotFoundException.class, () -> service.addSet(100L, 99L));
        verify(setRepo, never()).save(any());
    }

    @Test
    void removeSet_shouldDeleteHighestPendingSet() {
        when(workoutRepo.findById(100L)).thenReturn(Optional.of(workout));
        WorkoutSet pendingLow = set(2L, 2, WorkoutSet.Status.PENDING);
        WorkoutSet pendingHigh = set(3L, 3, WorkoutSet.Status.PENDING);
        List<WorkoutSet> sets = new ArrayList<>(List.of(
                set(1L, 1, WorkoutSet.Status.COMPLETED), pendingLow, pendingHigh,
                set(4L, 4, WorkoutSet.Status.COMPLETED)));
        when(setRepo.findByWorkoutIdAndExerciseIdOrderBySetNumberAsc(100L, 1L)).thenReturn(sets);

        ModifySetCountResponse res = service.removeSet(100L, 1L);

        verify(setRepo).delete(pendingHigh);
        assertEquals(3, res.set().setNumber());
        assertEquals(3, res.setCount());
    }

    @Test
    void removeSet_withoutPendingSet_shouldBeValidationError() {
        when(workoutRepo.findById(100L)).thenReturn(Optional.of(workout));
        when(setRepo.findByWorkoutIdAndExerciseIdOrderBySetNumberAsc(100L, 1L)).thenReturn(List.of(
                set(1L, 1, WorkoutSet.Status.COMPLETED), set(2L, 2, WorkoutSet.Status.SKIPPED)));

        assertThrows(ValidationException.class, () -> service.removeSet(100L, 1L));
        verify(setRepo, never()).delete(any());
    }

    @Test
    void removeSet_lastRemainingSet_shouldBeValidationError() {
        when(workoutRepo.findById(100L)).thenReturn(Optional.of(workout));
        when(setRepo.findByWorkoutIdAndExerciseIdOrderBySetNumberAsc(100L, 1L))
                .thenReturn(List.of(set(1L, 1, WorkoutSet.Status.PENDING)));

        assertThrows(ValidationException.class, () -> service.removeSet(100L, 1L));
        verify(setRepo, never()).delete(any());
    }

    @Test
    void skipSet_twice_shouldBeInvalidTransition() {
        WorkoutSet s = set(1L, 1, WorkoutSet.Status.SKIPPED);
        when(setRepo.findById(1L)).thenReturn(Optional.of(s));
        when(workoutRepo.findById(100L)).thenReturn(Optional.of(workout));

        assertThrows(InvalidTransitionException.class, () -> service.skipSet(1L));
    }
}
