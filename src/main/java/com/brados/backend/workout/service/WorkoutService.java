package com.brados.backend.workout.service;

import com.brados.backend.common.error.NotFoundException;
import com.brados.backend.mesocycle.entity.Mesocycle;
import com.brados.backend.mesocycle.repo.MesocycleRepository;
import com.brados.backend.plan.entity.Exercise;
import com.brados.backend.plan.entity.PlanDay;
import com.brados.backend.plan.repo.ExerciseRepository;
import com.brados.backend.plan.repo.PlanDayRepository;
import com.brados.backend.workout.dto.WorkoutDetailDto;
import com.brados.backend.workout.dto.WorkoutDto;
import com.brados.backend.workout.dto.WorkoutExerciseDto;
import com.brados.backend.workout.dto.WorkoutSetDto;
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
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class WorkoutService {

    private final WorkoutRepository workoutRepo;
    private final WorkoutSetRepository setRepo;
    private final MesocycleRepository mesocycleRepo;
    private final PlanDayRepository planDayRepo;
    private final ExerciseRepository exerciseRepo;
    private final Clock clock;

    @Transactional
    public WorkoutDto start(Long workoutId) {
        Workout w = load(workoutId);
        w.start(Instant.now(clock));
        workoutRepo.save(w);
        log.info("workout_started id={} mesocycleId={} week={}", w.getId(), w.getMesocycleId(), w.getWeekNumber());
        return WorkoutDto.from(w);
    }

    /** Pending sets stay pending; they count as not done when the week is summarised. */
    @Transactional
    public WorkoutDto complete(Long workoutId) {
        Workout w = load(workoutId);
        w.complete(Instant.now(clock));
        workoutRepo.save(w);
        log.info("workout_completed id={} mesocycleId={} week={}", w.getId(), w.getMesocycleId(), w.getWeekNumber());
        return WorkoutDto.from(w);
    }

    @Transactional
    public WorkoutDto skip(Long workoutId) {
        Workout w = load(workoutId);
        w.skip();
        workoutRepo.save(w);
        log.info("workout_skipped id={} mesocycleId={} week={}", w.getId(), w.getMesocycleId(), w.getWeekNumber());
        return WorkoutDto.from(w);
    }

    @Transactional(readOnly = true)
    public WorkoutDetailDto getById(Long workoutId) {
        return toDetail(load(workoutId));
    }

    @Transactional(readOnly = true)
    public List<WorkoutSummaryDto> listByMesocycle(Long mesocycleId) {
        Mesocycle meso = mesocycleRepo.findById(mesocycleId)
                .orElseThrow(() -> new NotFoundException("Mesocycle", mesocycleId));

        List<Workout> workouts = workoutRepo.findByMesocycleIdOrderByWeekNumberAscScheduledDateAsc(meso.getId());
        if (workouts.isEmpty()) return List.of();

        Map<Long, String> dayNames = planDayRepo.findByPlanIdOrderBySortOrderAscIdAsc(meso.getPlanId()).stream()
                .collect(Collectors.toMap(PlanDay::getId, PlanDay::getName, (a, b) -> a));
        Map<Long, List<WorkoutSet>> setsByWorkout = setRepo
                .findByWorkoutIdIn(workouts.stream().map(Workout::getId).toList()).stream()
                .collect(Collectors.groupingBy(WorkoutSet::getWorkoutId));

        return workouts.stream().map(w -> {
            List<WorkoutSet> sets = setsByWorkout.getOrDefault(w.getId(), List.of());
            int done = (int) sets.stream().filter(WorkoutSet::isCompleted).count();
            return new WorkoutSummaryDto(w.getId(), w.getPlanDayId(), dayNames.get(w.getPlanDayId()),
                    w.getWeekNumber(), w.getScheduledDate(), w.getStatus(), sets.size(), done);
        }).toList();
    }

    /** Today's scheduled workout of the active mesocycle, if there is one. */
    @Transactional(readOnly = true)
    public Optional<WorkoutDetailDto> today() {
        LocalDate today = LocalDate.now(clock);
        for (Mesocycle meso : mesocycleRepo.findByStatus(Mesocycle.Status.ACTIVE)) {
            List<Workout> scheduled = workoutRepo.findScheduledOn(meso.getId(), today);
            if (!scheduled.isEmpty()) return Optional.of(toDetail(scheduled.get(0)));
        }
        return Optional.empty();
    }

    // ===== helpers =====

    private Workout load(Long id) {
        return workoutRepo.findById(id).orElseThrow(() -> new NotFoundException("Workout", id));
    }

    private WorkoutDetailDto toDetail(Workout w) {
        String dayName = planDayRepo.findById(w.getPlanDayId()).map(PlanDay::getName).orElse(null);
        List<WorkoutSet> sets = setRepo.findByWorkoutIdOrderByExerciseIdAscSetNumberAsc(w.getId());

        Map<Long, List<WorkoutSet>> byExercise = new LinkedHashMap<>();
        for (WorkoutSet s : sets) {
            byExercise.computeIfAbsent(s.getExerciseId(), k -> new ArrayList<>()).add(s);
        }
        Map<Long, Exercise> exercises = exerciseRepo.findAllById(byExercise.keySet()).stream()
                .collect(Collectors.toMap(Exercise::getId, Function.identity()));

        List<WorkoutExerciseDto> items = byExercise.entrySet().stream().map(e -> {
            Exercise ex = exercises.get(e.getKey());
            List<WorkoutSetDto> setDtos = e.getValue().stream().map(WorkoutSetDto::from).toList();
            int done = (int) e.getValue().stream().filter(WorkoutSet::isCompleted).count();
            return new WorkoutExerciseDto(e.getKey(), ex == null ? null : ex.getName(),
                    setDtos, setDtos.size(), done);
        }).toList();

        return new WorkoutDetailDto(WorkoutDto.from(w), dayName, items);
    }
}
