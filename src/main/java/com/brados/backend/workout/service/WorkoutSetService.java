package com.brados.backend.workout.service;

import com.brados.backend.common.error.NotFoundException;
import com.brados.backend.common.error.ValidationException;
import com.brados.backend.mesocycle.service.PlanModificationService;
import com.brados.backend.progression.entity.WeekTargetsEntity;
import com.brados.backend.progression.repo.WeekTargetsRepository;
import com.brados.backend.workout.dto.ModifySetCountResponse;
import com.brados.backend.workout.dto.WorkoutSetDto;
import com.brados.backend.workout.entity.Workout;
import com.brados.backend.workout.entity.WorkoutSet;
import com.brados.backend.workout.repo.WorkoutRepository;
import com.brados.backend.workout.repo.WorkoutSetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;

/**
 * Set-level operations. All of them require the owning workout to be IN_PROGRESS;
 * add/remove reuse the week's stored targets and never run the progression engine.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkoutSetService {

    private final WorkoutSetRepository setRepo;
    private final WorkoutRepository workoutRepo;
    private final WeekTargetsRepository targetsRepo;

    @Transactional
    public WorkoutSetDto logSet(Long setId, Integer actualReps, Double actualWeight) {
        if (actualReps == null || actualWeight == null) {
            throw new ValidationException("actualReps and actualWeight are required");
        }
        if (actualReps < 0) throw new ValidationException("Reps must be a non-negative number");
        if (actualWeight < 0) throw new ValidationException("Weight must be a non-negative number");

        WorkoutSet set = loadSet(setId);
        loadWorkout(set.getWorkoutId()).requireInProgress("log a set");
        set.log(actualReps, actualWeight);
        setRepo.save(set);
        log.info("set_logged id={} workoutId={} reps={} weight={}", setId, set.getWorkoutId(), actualReps, actualWeight);
        return WorkoutSetDto.from(set);
    }

    @Transactional
    public WorkoutSetDto skipSet(Long setId) {
        WorkoutSet set = loadSet(setId);
        loadWorkout(set.getWorkoutId()).requireInProgress("skip a set");
        set.skip();
        setRepo.save(set);
        log.info("set_skipped id={} workoutId={}", setId, set.getWorkoutId());
        return WorkoutSetDto.from(set);
    }

    @Transactional
    public WorkoutSetDto unlogSet(Long setId) {
        WorkoutSet set = loadSet(setId);
        loadWorkout(set.getWorkoutId()).requireInProgress("unlog a set");
        set.unlog();
        setRepo.save(set);
        log.info("set_unlogged id={} workoutId={}", setId, set.getWorkoutId());
        return WorkoutSetDto.from(set);
    }

    /** Appends a pending set numbered max + 1 with the week's stored targets. */
    @Transactional
    public ModifySetCountResponse addSet(Long workoutId, Long exerciseId) {
        Workout w = loadWorkout(workoutId);
        w.requireInProgress("add a set");

        WeekTargetsEntity targets = targetsRepo
                .findByMesocycleIdAndPlanDayIdAndExerciseIdAndWeekNumber(
                        w.getMesocycleId(), w.getPlanDayId(), exerciseId, w.getWeekNumber())
                .stream()
                .max(Comparator.comparing(WeekTargetsEntity::getId))
                .orElseThrow(() -> new NotFoundException("WeekTargets", "WEEKTARGETS_NOT_FOUND",
                        "No targets for exercise " + exerciseId + " in week " + w.getWeekNumber()
                                + " of workout " + workoutId));

        ExerciseSetSlots slots = slots(workoutId, exerciseId);
        WorkoutSet added = setRepo.save(
                PlanModificationService.newSet(workoutId, targets.toTargets(), slots.nextSetNumber()));

        log.info("set_added workoutId={} exerciseId={} setNumber={}", workoutId, exerciseId, added.getSetNumber());
        return new ModifySetCountResponse(workoutId, exerciseId, WorkoutSetDto.from(added), slots.size() + 1);
    }

    /** Deletes the highest-numbered pending set; the last remaining set is kept. */
    @Transactional
    public ModifySetCountResponse removeSet(Long workoutId, Long exerciseId) {
        Workout w = loadWorkout(workoutId);
        w.requireInProgress("remove a set");

        ExerciseSetSlots slots = slots(workoutId, exerciseId);
        if (slots.isEmpty()) {
            throw new ValidationException("Exercise " + exerciseId + " has no sets in workout " + workoutId);
        }
        if (slots.size() == 1) {
            throw new ValidationException("Cannot remove the last set of exercise " + exerciseId);
        }
        WorkoutSet victim = slots.lastPending()
                .orElseThrow(() -> new ValidationException(
                        "No pending set to remove for exercise " + exerciseId + " in workout " + workoutId));

        setRepo.delete(victim);
        log.info("set_removed workoutId={} exerciseId={} setNumber={}", workoutId, exerciseId, victim.getSetNumber());
        return new ModifySetCountResponse(workoutId, exerciseId, WorkoutSetDto.from(victim), slots.size() - 1);
    }

    // ===== helpers =====

    private WorkoutSet loadSet(Long id) {
        return setRepo.findById(id).orElseThrow(() -> new NotFoundException("WorkoutSet", id));
    }

    private Workout loadWorkout(Long id) {
        return workoutRepo.findById(id).orElseThrow(() -> new NotFoundException("Workout", id));
    }

    private ExerciseSetSlots slots(Long workoutId, Long exerciseId) {
        List<WorkoutSet> sets = setRepo.findByWorkoutIdAndExerciseIdOrderBySetNumberAsc(workoutId, exerciseId);
        return new ExerciseSetSlots(sets);
    }
}
