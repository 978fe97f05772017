package com.brados.backend.mesocycle.service;

import com.brados.backend.common.error.NotFoundException;
import com.brados.backend.mesocycle.entity.Mesocycle;
import com.brados.backend.mesocycle.repo.MesocycleRepository;
import com.brados.backend.plan.entity.Exercise;
import com.brados.backend.plan.entity.PlanDay;
import com.brados.backend.plan.entity.PlanDayExercise;
import com.brados.backend.plan.repo.ExerciseRepository;
import com.brados.backend.plan.repo.PlanDayExerciseRepository;
import com.brados.backend.plan.repo.PlanDayRepository;
import com.brados.backend.progression.entity.WeekTargetsEntity;
import com.brados.backend.progression.model.ExerciseProgressionProfile;
import com.brados.backend.progression.model.PreviousWeekPerformance;
import com.brados.backend.progression.model.WeekTargets;
import com.brados.backend.progression.repo.WeekTargetsRepository;
import com.brados.backend.progression.service.DeloadSchedule;
import com.brados.backend.progression.service.ProgressionEngine;
import com.brados.backend.progression.service.WeekPerformanceProjector;
import com.brados.backend.workout.entity.Workout;
import com.brados.backend.workout.entity.WorkoutSet;
import com.brados.backend.workout.repo.WorkoutRepository;
import com.brados.backend.workout.repo.WorkoutSetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Glue between the pure {@link ProgressionEngine} and the stored lifecycles:
 * prescribes week 1 when a mesocycle is created and every following week when
 * the block moves on, then materialises the prescription as WorkoutSets.
 * <p>
 * Plan edits made while a mesocycle runs are pushed into its pending workouts
 * that already carry sets (the current week and any unstarted earlier ones).
 * Later weeks need nothing: they are prescribed from the plan as it is when
 * their week begins.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlanModificationService {

    private final PlanDayRepository planDayRepo;
    private final PlanDayExerciseRepository planExerciseRepo;
    private final ExerciseRepository exerciseRepo;
    private final MesocycleRepository mesocycleRepo;
    private final WorkoutRepository workoutRepo;
    private final WorkoutSetRepository setRepo;
    private final WeekTargetsRepository targetsRepo;
    private final ProgressionEngine engine;
    private final DeloadSchedule deloads;
    private final Clock clock;

    /** A plan exercise together with the plan day it belongs to. */
    record PlannedExercise(Long planDayId, ExerciseProgressionProfile profile) {}

    public record AdvanceResult(
            Long mesocycleId,
            int weekNumber,
            boolean deload,
            boolean mesocycleCompleted,
            List<WeekTargets> targets
    ) {}

    /** Week 1: base values for every exercise of the plan. */
    @Transactional
    public List<WeekTargets> seedFirstWeek(Mesocycle meso) {
        return prescribeWeek(meso, 1, loadPlannedExercises(meso.getPlanId()), Map.of());
    }

    /**
     * Closes the current week and prescribes the next one from how it went.
     * Advancing out of the final week completes the mesocycle instead.
     */
    @Transactional
    public AdvanceResult advanceWeek(Long mesocycleId) {
        Mesocycle meso = loadMesocycle(mesocycleId);

        if (meso.isActive() && meso.isFinalWeek()) {
            meso.complete(Instant.now(clock));
            mesocycleRepo.save(meso);
            log.info("mesocycle_completed_by_schedule id={} weeks={}", meso.getId(), meso.getDurationWeeks());
            return new AdvanceResult(meso.getId(), meso.getCurrentWeek(), false, true, List.of());
        }

        int finishedWeek = meso.getCurrentWeek();
        int newWeek = meso.nextWeek(Instant.now(clock));

        List<PlannedExercise> planned = loadPlannedExercises(meso.getPlanId());
        Map<Long, PreviousWeekPerformance> previous = summariseWeek(meso.getId(), finishedWeek);

        mesocycleRepo.save(meso);
        List<WeekTargets> targets = prescribeWeek(meso, newWeek, planned, previous);
        boolean deload = deloads.isDeloadWeek(newWeek, meso.getDurationWeeks());

        log.info("mesocycle_week_advanced id={} week={} deload={} exercises={}",
                meso.getId(), newWeek, deload, targets.size());
        return new AdvanceResult(meso.getId(), newWeek, deload, false, targets);
    }

    /**
     * Advances as many weeks as the calendar says have elapsed since the start
     * date. Returns how many advances were made.
     */
    @Transactional
    public int catchUp(Long mesocycleId, LocalDate today) {
        Mesocycle meso = loadMesocycle(mesocycleId);
        if (!meso.isActive()) return 0;

        long days = ChronoUnit.DAYS.between(meso.getStartDate(), today);
        if (days < 0) return 0;
        long calendarWeek = days / 7 + 1;

        int advances = 0;
        int week = meso.getCurrentWeek();
        while (week < calendarWeek) {
            AdvanceResult r = advanceWeek(mesocycleId);
            advances++;
            if (r.mesocycleCompleted()) break;
            week = r.weekNumber();
        }
        return advances;
    }

    /**
     * How each plan exercise did in {@code weekNumber}, keyed by plan exercise id.
     * Exercises without stored targets for that week are absent. A deload week
     * reports the regular week before it, see {@link PreviousWeekPerformance#deload()}.
     */
    @Transactional(readOnly = true)
    public Map<Long, PreviousWeekPerformance> summariseWeek(Long mesocycleId, int weekNumber) {
        List<WeekTargetsEntity> weekTargets = targetsRepo.findByMesocycleIdAndWeekNumber(mesocycleId, weekNumber);
        if (weekTargets.isEmpty()) return Map.of();

        boolean anyDeload = weekTargets.stream().anyMatch(WeekTargetsEntity::isDeload);
        Map<Long, PreviousWeekPerformance> beforeDeload = anyDeload && weekNumber > 1
                ? summariseWeek(mesocycleId, weekNumber - 1)
                : Map.of();

        List<Long> workoutIds = workoutRepo.findByMesocycleIdAndWeekNumber(mesocycleId, weekNumber)
                .stream().map(Workout::getId).toList();
        Map<Long, List<WorkoutSet>> setsByPlanExercise = workoutIds.isEmpty()
                ? Map.of()
                : setRepo.findByWorkoutIdIn(workoutIds).stream()
                        .filter(s -> s.getPlanExerciseId() != null)
                        .collect(Collectors.groupingBy(WorkoutSet::getPlanExerciseId));

        Map<Long, PreviousWeekPerformance> out = new HashMap<>();
        for (WeekTargetsEntity t : weekTargets) {
            PreviousWeekPerformance carried = t.isDeload() ? beforeDeload.get(t.getPlanExerciseId()) : null;
            if (carried != null) {
                out.put(t.getPlanExerciseId(), carried.carriedThroughDeload(weekNumber));
                continue;
            }
            List<WorkoutSet> sets = setsByPlanExercise.getOrDefault(t.getPlanExerciseId(), List.of());
            out.put(t.getPlanExerciseId(), WeekPerformanceProjector.project(t.toTargets(), sets));
        }
        return out;
    }

    // ===== plan edits =====

    /** Compares two versions of a plan day's exercises by plan exercise id. */
    public static PlanDayDiff diffPlanDayExercises(List<PlanDayExercise> before, List<PlanDayExercise> after) {
        Map<Long, PlanDayExercise> old = before.stream()
                .collect(Collectors.toMap(PlanDayExercise::getId, Function.identity(), (a, b) -> a));
        Set<Long> kept = after.stream().map(PlanDayExercise::getId).filter(Objects::nonNull)
                .collect(Collectors.toSet());

        List<PlanDayExercise> added = new ArrayList<>();
        List<PlanDayDiff.Modified> modified = new ArrayList<>();
        for (PlanDayExercise pde : after) {
            PlanDayExercise prior = pde.getId() == null ? null : old.get(pde.getId());
            if (prior == null) {
                added.add(pde);
                continue;
            }
            PlanDayDiff.Changes changes = new PlanDayDiff.Changes(
                    changed(prior.getSets(), pde.getSets()),
                    changed(prior.getReps(), pde.getReps()),
                    changed(prior.getWeight(), pde.getWeight()),
                    changed(prior.getRestSeconds(), pde.getRestSeconds()),
                    changed(prior.getMinReps(), pde.getMinReps()),
                    changed(prior.getMaxReps(), pde.getMaxReps()));
            if (!changes.isEmpty()) modified.add(new PlanDayDiff.Modified(pde, changes));
        }
        List<PlanDayExercise> removed = before.stream().filter(pde -> !kept.contains(pde.getId())).toList();
        return new PlanDayDiff(added, removed, modified);
    }

    /** Pending workouts of the mesocycle, in week order. */
    @Transactional(readOnly = true)
    public List<Workout> getFutureWorkouts(Long mesocycleId) {
        return workoutRepo.findByMesocycleIdOrderByWeekNumberAscScheduledDateAsc(mesocycleId).stream()
                .filter(w -> w.getStatus() == Workout.Status.PENDING)
                .toList();
    }

    /** Prescribes a newly planned exercise into the matching pending workouts. */
    @Transactional
    public PlanSyncResult addExerciseToFutureWorkouts(Long mesocycleId, PlanDayExercise pde, Exercise exercise) {
        Mesocycle meso = loadMesocycle(mesocycleId);
        Tally tally = new Tally();
        addExercise(meso, pde, exercise, new HashMap<>(), tally);
        return tally.toResult();
    }

    /**
     * Drops an exercise from the matching pending workouts. A workout where any
     * of its sets is already logged or skipped keeps all of them.
     */
    @Transactional
    public PlanSyncResult removeExerciseFromFutureWorkouts(Long mesocycleId, Long planDayId, Long planExerciseId) {
        Mesocycle meso = loadMesocycle(mesocycleId);
        Tally tally = new Tally();
        removeExercise(meso, planDayId, planExerciseId, tally);
        return tally.toResult();
    }

    /**
     * Re-runs the engine with the edited baseline and brings pending sets in line:
     * new targets, and sets added or dropped to match the set count. Logged sets stay as they are.
     */
    @Transactional
    public PlanSyncResult updateExerciseTargetsForFutureWorkouts(Long mesocycleId, PlanDayExercise pde, Exercise exercise) {
        Mesocycle meso = loadMesocycle(mesocycleId);
        Tally tally = new Tally();
        updateExercise(meso, pde, exercise, new HashMap<>(), tally);
        return tally.toResult();
    }

    /**
     * Makes the pending workouts of one plan day match the plan: missing exercises are
     * added, exercises no longer planned are removed, the rest are re-prescribed.
     */
    @Transactional
    public PlanSyncResult syncPlanToMesocycle(Long mesocycleId, Long planDayId) {
        Mesocycle meso = loadMesocycle(mesocycleId);
        List<Workout> workouts = prescribedPending(meso, planDayId);
        if (workouts.isEmpty()) return PlanSyncResult.empty();

        Set<Long> present = setRepo.findByWorkoutIdIn(workouts.stream().map(Workout::getId).toList()).stream()
                .map(WorkoutSet::getPlanExerciseId)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        List<PlanDayExercise> planned = planExerciseRepo.findByPlanDayIdOrderBySortOrderAscIdAsc(planDayId);

        Tally tally = new Tally();
        Map<Integer, Map<Long, PreviousWeekPerformance>> summaries = new HashMap<>();
        for (PlanDayExercise pde : planned) {
            Exercise exercise = exerciseRepo.findById(pde.getExerciseId())
                    .orElseThrow(() -> new NotFoundException("Exercise", pde.getExerciseId()));
            if (present.remove(pde.getId())) {
                updateExercise(meso, pde, exercise, summaries, tally);
            } else {
                addExercise(meso, pde, exercise, summaries, tally);
            }
        }
        for (Long gone : present) {
            removeExercise(meso, planDayId, gone, tally);
        }

        PlanSyncResult result = tally.toResult();
        log.info("plan_day_synced mesocycleId={} planDayId={} workouts={} added={} removed={} modified={} preserved={}",
                mesocycleId, planDayId, result.affectedWorkoutCount(), result.addedSetsCount(),
                result.removedSetsCount(), result.modifiedSetsCount(), result.preservedCount());
        return result;
    }

    // ===== helpers =====

    private List<WeekTargets> prescribeWeek(Mesocycle meso, int week,
                                            List<PlannedExercise> planned,
                                            Map<Long, PreviousWeekPerformance> previous) {
        boolean deload = deloads.isDeloadWeek(week, meso.getDurationWeeks());
        Instant now = Instant.now(clock);

        Map<Long, Workout> workoutByDay = workoutRepo.findByMesocycleIdAndWeekNumber(meso.getId(), week)
                .stream()
                .collect(Collectors.toMap(Workout::getPlanDayId, Function.identity(), (a, b) -> a));

        List<WeekTargets> out = new ArrayList<>(planned.size());
        List<WeekTargetsEntity> rows = new ArrayList<>(planned.size());
        List<WorkoutSet> sets = new ArrayList<>();

        for (PlannedExercise pe : planned) {
            PreviousWeekPerformance prev = previous.get(pe.profile().planExerciseId());
            WeekTargets t = engine.computeWeekTargets(pe.profile(), week, prev, deload);
            out.add(t);
            rows.add(WeekTargetsEntity.of(meso.getId(), pe.planDayId(), t, now));

            Workout w = workoutByDay.get(pe.planDayId());
            if (w == null) {
                log.warn("no_workout_for_plan_day mesocycleId={} week={} planDayId={}",
                        meso.getId(), week, pe.planDayId());
                continue;
            }
            for (int n = 1; n <= t.targetSets(); n++) {
                sets.add(newSet(w.getId(), t, n));
            }
        }

        targetsRepo.saveAll(rows);
        setRepo.saveAll(sets);
        return out;
    }

    public static WorkoutSet newSet(Long workoutId, WeekTargets t, int setNumber) {
        WorkoutSet s = new WorkoutSet();
        s.setWorkoutId(workoutId);
        s.setExerciseId(t.exerciseId());
        s.setPlanExerciseId(t.planExerciseId());
        s.setSetNumber(setNumber);
        s.setTargetReps(t.targetReps());
        s.setTargetWeight(t.targetWeight());
        return s;
    }

    List<PlannedExercise> loadPlannedExercises(Long planId) {
        List<PlanDay> days = planDayRepo.findByPlanIdOrderBySortOrderAscIdAsc(planId);
        if (days.isEmpty()) return List.of();

        List<PlanDayExercise> pdes = planExerciseRepo.findByPlanDayIdInOrderBySortOrderAscIdAsc(
                days.stream().map(PlanDay::getId).toList());

        Map<Long, Exercise> exercises = new HashMap<>();
        List<PlannedExercise> out = new ArrayList<>(pdes.size());
        for (PlanDayExercise pde : pdes) {
            Exercise ex = exercises.computeIfAbsent(pde.getExerciseId(), id -> exerciseRepo.findById(id)
                    .orElseThrow(() -> new NotFoundException("Exercise", id)));
            out.add(new PlannedExercise(pde.getPlanDayId(), ExerciseProgressionProfile.of(pde, ex)));
        }
        return out;
    }

    private void addExercise(Mesocycle meso, PlanDayExercise pde, Exercise exercise,
                             Map<Integer, Map<Long, PreviousWeekPerformance>> summaries, Tally tally) {
        ExerciseProgressionProfile profile = ExerciseProgressionProfile.of(pde, exercise);
        for (Workout w : prescribedPending(meso, pde.getPlanDayId())) {
            List<WorkoutSet> existing = setRepo.findByWorkoutIdAndExerciseIdOrderBySetNumberAsc(w.getId(), pde.getExerciseId());
            if (existing.stream().anyMatch(s -> pde.getId().equals(s.getPlanExerciseId()))) continue;

            WeekTargets t = targetsFor(meso, w.getWeekNumber(), profile, summaries);
            saveTargets(meso.getId(), pde.getPlanDayId(), t);

            int last = lastSetNumber(existing);
            List<WorkoutSet> sets = new ArrayList<>(t.targetSets());
            for (int n = 1; n <= t.targetSets(); n++) {
                sets.add(newSet(w.getId(), t, last + n));
            }
            setRepo.saveAll(sets);
            tally.touched(w);
            tally.added += sets.size();
        }
    }

    private void removeExercise(Mesocycle meso, Long planDayId, Long planExerciseId, Tally tally) {
        for (Workout w : prescribedPending(meso, planDayId)) {
            List<WorkoutSet> sets = setRepo.findByWorkoutIdOrderByExerciseIdAscSetNumberAsc(w.getId()).stream()
                    .filter(s -> planExerciseId.equals(s.getPlanExerciseId()))
                    .toList();
            if (sets.isEmpty()) continue;

            if (sets.stream().anyMatch(s -> !s.isPending())) {
                tally.preserved++;
                tally.warnings.add("Workout on " + w.getScheduledDate() + " has logged data - exercise sets preserved");
                log.warn("plan_sync_sets_preserved workoutId={} planExerciseId={}", w.getId(), planExerciseId);
                continue;
            }
            setRepo.deleteAll(sets);
            targetsRepo.findByMesocycleIdAndPlanExerciseIdAndWeekNumber(meso.getId(), planExerciseId, w.getWeekNumber())
                    .ifPresent(targetsRepo::delete);
            tally.touched(w);
            tally.removed += sets.size();
        }
    }

    private void updateExercise(Mesocycle meso, PlanDayExercise pde, Exercise exercise,
                                Map<Integer, Map<Long, PreviousWeekPerformance>> summaries, Tally tally) {
        ExerciseProgressionProfile profile = ExerciseProgressionProfile.of(pde, exercise);
        for (Workout w : prescribedPending(meso, pde.getPlanDayId())) {
            List<WorkoutSet> forExercise = setRepo.findByWorkoutIdAndExerciseIdOrderBySetNumberAsc(w.getId(), pde.getExerciseId());
            List<WorkoutSet> sets = forExercise.stream()
                    .filter(s -> pde.getId().equals(s.getPlanExerciseId()))
                    .toList();
            if (sets.isEmpty()) continue;

            WeekTargets t = targetsFor(meso, w.getWeekNumber(), profile, summaries);
            saveTargets(meso.getId(), pde.getPlanDayId(), t);

            List<WorkoutSet> changed = new ArrayList<>();
            for (WorkoutSet s : sets) {
                if (!s.isPending()) continue;
                if (s.getTargetReps() != t.targetReps() || Double.compare(s.getTargetWeight(), t.targetWeight()) != 0) {
                    s.setTargetReps(t.targetReps());
                    s.setTargetWeight(t.targetWeight());
                    changed.add(s);
                }
            }
            setRepo.saveAll(changed);

            int added = 0;
            int removed = 0;
            if (sets.size() < t.targetSets()) {
                int last = lastSetNumber(forExercise);
                List<WorkoutSet> extra = new ArrayList<>();
                for (int n = 1; n <= t.targetSets() - sets.size(); n++) {
                    extra.add(newSet(w.getId(), t, last + n));
                }
                setRepo.saveAll(extra);
                added = extra.size();
            } else if (sets.size() > t.targetSets()) {
                int surplus = sets.size() - t.targetSets();
                List<WorkoutSet> drop = new ArrayList<>();
                for (int i = sets.size() - 1; i >= 0 && drop.size() < surplus; i--) {
                    if (sets.get(i).isPending()) drop.add(sets.get(i));
                }
                setRepo.deleteAll(drop);
                removed = drop.size();
            }

            if (!changed.isEmpty() || added > 0 || removed > 0) tally.touched(w);
            tally.modified += changed.size();
            tally.added += added;
            tally.removed += removed;
        }
    }

    /** Pending workouts of one plan day that already have their week prescribed. */
    private List<Workout> prescribedPending(Mesocycle meso, Long planDayId) {
        return getFutureWorkouts(meso.getId()).stream()
                .filter(w -> planDayId.equals(w.getPlanDayId()))
                .filter(w -> w.getWeekNumber() <= meso.getCurrentWeek())
                .toList();
    }

    private WeekTargets targetsFor(Mesocycle meso, int week, ExerciseProgressionProfile profile,
                                   Map<Integer, Map<Long, PreviousWeekPerformance>> summaries) {
        PreviousWeekPerformance prev = week <= 1 ? null : summaries
                .computeIfAbsent(week - 1, wk -> summariseWeek(meso.getId(), wk))
                .get(profile.planExerciseId());
        return engine.computeWeekTargets(profile, week, prev, deloads.isDeloadWeek(week, meso.getDurationWeeks()));
    }

    private void saveTargets(Long mesocycleId, Long planDayId, WeekTargets t) {
        WeekTargetsEntity row = targetsRepo
                .findByMesocycleIdAndPlanExerciseIdAndWeekNumber(mesocycleId, t.planExerciseId(), t.weekNumber())
                .orElse(null);
        if (row == null) {
            row = WeekTargetsEntity.of(mesocycleId, planDayId, t, Instant.now(clock));
        } else {
            row.apply(t);
        }
        targetsRepo.save(row);
    }

    private static int lastSetNumber(List<WorkoutSet> sets) {
        return sets.stream().mapToInt(WorkoutSet::getSetNumber).max().orElse(0);
    }

    private static <T> T changed(T before, T after) {
        return Objects.equals(before, after) ? null : after;
    }

    private Mesocycle loadMesocycle(Long id) {
        return mesocycleRepo.findById(id).orElseThrow(() -> new NotFoundException("Mesocycle", id));
    }

    private static final class Tally {
        final Set<Long> workouts = new LinkedHashSet<>();
        int added;
        int removed;
        int modified;
        int preserved;
        final List<String> warnings = new ArrayList<>();

        void touched(Workout w) { workouts.add(w.getId()); }

        PlanSyncResult toResult() {
            return new PlanSyncResult(workouts.size(), added, removed, modified, preserved, List.copyOf(warnings));
        }
    }
}
