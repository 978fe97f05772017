package com.brados.backend.mesocycle.service;

import com.brados.backend.common.error.ConflictException;
import com.brados.backend.common.error.NotFoundException;
import com.brados.backend.common.error.ValidationException;
import com.brados.backend.mesocycle.dto.MesocycleDetailDto;
import com.brados.backend.mesocycle.dto.MesocycleDto;
import com.brados.backend.mesocycle.dto.WeekSummaryDto;
import com.brados.backend.mesocycle.entity.Mesocycle;
import com.brados.backend.mesocycle.repo.MesocycleRepository;
import com.brados.backend.plan.entity.Plan;
import com.brados.backend.plan.entity.PlanDay;
import com.brados.backend.plan.entity.PlanDayExercise;
import com.brados.backend.plan.repo.PlanDayExerciseRepository;
import com.brados.backend.plan.repo.PlanDayRepository;
import com.brados.backend.plan.repo.PlanRepository;
import com.brados.backend.progression.service.DeloadSchedule;
import com.brados.backend.workout.dto.WorkoutSummaryDto;
import com.brados.backend.workout.entity.Workout;
import com.brados.backend.workout.entity.WorkoutSet;
import com.brados.backend.workout.repo.WorkoutRepository;
import com.brados.backend.workout.repo.WorkoutSetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lifecycle of a training block: ACTIVE → COMPLETED | CANCELLED.
 * At most one ACTIVE mesocycle per plan; the check runs under a row lock on the plan.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MesocycleService {

    private final MesocycleRepository mesocycleRepo;
    private final PlanRepository planRepo;
    private final PlanDayRepository planDayRepo;
    private final PlanDayExerciseRepository planExerciseRepo;
    private final WorkoutRepository workoutRepo;
    private final WorkoutSetRepository setRepo;
    private final PlanModificationService planModification;
    private final DeloadSchedule deloads;
    private final Clock clock;

    /**
     * Starts a block: the mesocycle itself (ACTIVE, week 1), one workout per
     * training day per week, and week 1's targets and sets.
     */
    @Transactional
    public MesocycleDto create(Long planId, LocalDate startDate) {
        if (startDate == null) throw new ValidationException("startDate is required");

        Plan plan = planRepo.findByIdForUpdate(planId)
                .orElseThrow(() -> new NotFoundException("Plan", planId));

        List<PlanDay> trainingDays = trainingDays(planId);
        if (trainingDays.isEmpty()) {
            throw new ValidationException("Plan " + planId + " has no workout days");
        }
        if (mesocycleRepo.existsByPlanIdAndStatus(planId, Mesocycle.Status.ACTIVE)) {
            throw new ConflictException("An active mesocycle already exists for plan " + planId);
        }

        Mesocycle meso = new Mesocycle();
        meso.setPlanId(planId);
        meso.setStartDate(startDate);
        meso.setCurrentWeek(1);
        meso.setDurationWeeks(plan.getDurationWeeks() + 1);
        meso.setStatus(Mesocycle.Status.ACTIVE);
        Instant now = Instant.now(clock);
        meso.setCreatedAt(now);
        meso.setUpdatedAt(now);
        meso = mesocycleRepo.save(meso);

        List<Workout> workouts = new ArrayList<>();
        for (int week = 1; week <= meso.getDurationWeeks(); week++) {
            for (PlanDay day : trainingDays) {
                Workout w = new Workout();
                w.setMesocycleId(meso.getId());
                w.setPlanDayId(day.getId());
                w.setWeekNumber(week);
                w.setScheduledDate(scheduledDate(startDate, day.getDayOfWeek(), week));
                workouts.add(w);
            }
        }
        workoutRepo.saveAll(workouts);

        planModification.seedFirstWeek(meso);

        log.info("mesocycle_created id={} planId={} startDate={} weeks={} workouts={}",
                meso.getId(), planId, startDate, meso.getDurationWeeks(), workouts.size());
        return MesocycleDto.from(meso);
    }

    @Transactional
    public MesocycleDto complete(Long id) {
        Mesocycle meso = load(id);
        meso.complete(Instant.now(clock));
        mesocycleRepo.save(meso);
        log.info("mesocycle_completed id={} week={}", id, meso.getCurrentWeek());
        return MesocycleDto.from(meso);
    }

    /** Cancelling keeps every workout and logged set. */
    @Transactional
    public MesocycleDto cancel(Long id) {
        Mesocycle meso = load(id);
        meso.cancel(Instant.now(clock));
        mesocycleRepo.save(meso);
        log.info("mesocycle_cancelled id={} week={}", id, meso.getCurrentWeek());
        return MesocycleDto.from(meso);
    }

    @Transactional(readOnly = true)
    public List<MesocycleDto> list() {
        return mesocycleRepo.findAllByOrderByStartDateDescIdDesc().stream().map(MesocycleDto::from).toList();
    }

    @Transactional(readOnly = true)
    public Optional<MesocycleDetailDto> getActive() {
        return mesocycleRepo.findByStatus(Mesocycle.Status.ACTIVE).stream()
                .findFirst()
                .map(this::toDetail);
    }

    @Transactional(readOnly = true)
    public MesocycleDetailDto getById(Long id) {
        return toDetail(load(id));
    }

    // ===== helpers =====

    private Mesocycle load(Long id) {
        return mesocycleRepo.findById(id).orElseThrow(() -> new NotFoundException("Mesocycle", id));
    }

    /** Plan days that have at least one exercise, in plan order. */
    private List<PlanDay> trainingDays(Long planId) {
        List<PlanDay> days = planDayRepo.findByPlanIdOrderBySortOrderAscIdAsc(planId);
        if (days.isEmpty()) return List.of();
        Set<Long> withExercises = planExerciseRepo
                .findByPlanDayIdInOrderBySortOrderAscIdAsc(days.stream().map(PlanDay::getId).toList())
                .stream()
                .map(PlanDayExercise::getPlanDayId)
                .collect(Collectors.toSet());
        return days.stream().filter(d -> withExercises.contains(d.getId())).toList();
    }

    /**
     * First occurrence of the plan day on or after the start date, shifted by whole weeks.
     * dayOfWeek: 0 = Sunday ... 6 = Saturday.
     */
    static LocalDate scheduledDate(LocalDate startDate, int dayOfWeek, int weekNumber) {
        DayOfWeek dow = (dayOfWeek % 7 == 0) ? DayOfWeek.SUNDAY : DayOfWeek.of(dayOfWeek % 7);
        return startDate.with(TemporalAdjusters.nextOrSame(dow)).plusWeeks(weekNumber - 1L);
    }

    private MesocycleDetailDto toDetail(Mesocycle meso) {
        String planName = planRepo.findById(meso.getPlanId()).map(Plan::getName).orElse(null);
        Map<Long, String> dayNames = planDayRepo.findByPlanIdOrderBySortOrderAscIdAsc(meso.getPlanId()).stream()
                .collect(Collectors.toMap(PlanDay::getId, PlanDay::getName, (a, b) -> a));

        List<Workout> workouts = workoutRepo.findByMesocycleIdOrderByWeekNumberAscScheduledDateAsc(meso.getId());
        Map<Long, List<WorkoutSet>> setsByWorkout = workouts.isEmpty()
                ? Map.of()
                : setRepo.findByWorkoutIdIn(workouts.stream().map(Workout::getId).toList()).stream()
                        .collect(Collectors.groupingBy(WorkoutSet::getWorkoutId));
        Map<Integer, List<Workout>> byWeek = workouts.stream()
                .collect(Collectors.groupingBy(Workout::getWeekNumber));

        List<WeekSummaryDto> weeks = new ArrayList<>(meso.getDurationWeeks());
        int total = 0;
        int completed = 0;
        for (int week = 1; week <= meso.getDurationWeeks(); week++) {
            List<WorkoutSummaryDto> items = byWeek.getOrDefault(week, List.of()).stream()
                    .map(w -> summary(w, dayNames, setsByWorkout.getOrDefault(w.getId(), List.of())))
                    .toList();
            int done = (int) items.stream().filter(i -> i.status() == Workout.Status.COMPLETED).count();
            int skipped = (int) items.stream().filter(i -> i.status() == Workout.Status.SKIPPED).count();
            weeks.add(new WeekSummaryDto(week, deloads.isDeloadWeek(week, meso.getDurationWeeks()),
                    items, items.size(), done, skipped));
            total += items.size();
            completed += done;
        }

        return new MesocycleDetailDto(meso.getId(), meso.getPlanId(), planName, meso.getStartDate(),
                meso.getCurrentWeek(), meso.getDurationWeeks(), meso.getStatus(), weeks, total, completed);
    }

    private static WorkoutSummaryDto summary(Workout w, Map<Long, String> dayNames, List<WorkoutSet> sets) {
        int completedSets = (int) sets.stream().filter(WorkoutSet::isCompleted).count();
        return new WorkoutSummaryDto(w.getId(), w.getPlanDayId(), dayNames.get(w.getPlanDayId()),
                w.getWeekNumber(), w.getScheduledDate(), w.getStatus(), sets.size(), completedSets);
    }

}
