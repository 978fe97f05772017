package com.brados.backend.workout.service;

import com.brados.backend.common.error.NotFoundException;
import com.brados.backend.plan.entity.Exercise;
import com.brados.backend.plan.repo.ExerciseRepository;
import com.brados.backend.workout.dto.ExerciseHistoryDto;
import com.brados.backend.workout.entity.Workout;
import com.brados.backend.workout.entity.WorkoutSet;
import com.brados.backend.workout.repo.WorkoutRepository;
import com.brados.backend.workout.repo.WorkoutSetRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Per-exercise training log built from completed sets, one entry per workout.
 * A session is dated by the day its workout was completed, or by its scheduled day
 * while it is still open.
 */
@Service
@RequiredArgsConstructor
public class ExerciseHistoryService {

    private final ExerciseRepository exerciseRepo;
    private final WorkoutSetRepository setRepo;
    private final WorkoutRepository workoutRepo;
    private final Clock clock;

    @Transactional(readOnly = true)
    public ExerciseHistoryDto getHistory(Long exerciseId) {
        Exercise exercise = exerciseRepo.findById(exerciseId)
                .orElseThrow(() -> new NotFoundException("Exercise", exerciseId));

        Map<Long, List<WorkoutSet>> setsByWorkout = setRepo
                .findByExerciseIdAndStatus(exerciseId, WorkoutSet.Status.COMPLETED).stream()
                .collect(Collectors.groupingBy(WorkoutSet::getWorkoutId));
        if (setsByWorkout.isEmpty()) {
            return new ExerciseHistoryDto(exercise.getId(), exercise.getName(), List.of(), null);
        }

        Map<Long, Workout> workouts = workoutRepo.findAllById(setsByWorkout.keySet()).stream()
                .collect(Collectors.toMap(Workout::getId, Function.identity()));

        List<ExerciseHistoryDto.Entry> entries = new ArrayList<>(setsByWorkout.size());
        for (Map.Entry<Long, List<WorkoutSet>> e : setsByWorkout.entrySet()) {
            Workout w = workouts.get(e.getKey());
            if (w == null) continue;
            entries.add(entry(w, e.getValue()));
        }
        entries.sort(Comparator.comparing(ExerciseHistoryDto.Entry::date)
                .thenComparing(ExerciseHistoryDto.Entry::workoutId));

        return new ExerciseHistoryDto(exercise.getId(), exercise.getName(), entries, personalRecord(entries));
    }

    private ExerciseHistoryDto.Entry entry(Workout w, List<WorkoutSet> sets) {
        List<WorkoutSet> ordered = sets.stream()
                .sorted(Comparator.comparing(WorkoutSet::getSetNumber))
                .toList();

        WorkoutSet best = null;
        for (WorkoutSet s : ordered) {
            if (best == null || s.getActualWeight() > best.getActualWeight()
                    || (s.getActualWeight().equals(best.getActualWeight()) && s.getActualReps() > best.getActualReps())) {
                best = s;
            }
        }

        List<ExerciseHistoryDto.HistorySet> items = ordered.stream()
                .map(s -> new ExerciseHistoryDto.HistorySet(s.getSetNumber(), s.getActualWeight(), s.getActualReps()))
                .toList();
        return new ExerciseHistoryDto.Entry(w.getId(), w.getMesocycleId(), w.getWeekNumber(), sessionDate(w),
                items, best.getActualWeight(), best.getActualReps());
    }

    private LocalDate sessionDate(Workout w) {
        return w.getCompletedAt() != null
                ? LocalDate.ofInstant(w.getCompletedAt(), clock.getZone())
                : w.getScheduledDate();
    }

    // entries are oldest first, so a tie keeps the first time the weight was lifted
    private static ExerciseHistoryDto.PersonalRecord personalRecord(List<ExerciseHistoryDto.Entry> entries) {
        ExerciseHistoryDto.Entry top = null;
        for (ExerciseHistoryDto.Entry e : entries) {
            if (top == null || e.bestWeight() > top.bestWeight()) top = e;
        }
        return top == null ? null
                : new ExerciseHistoryDto.PersonalRecord(top.bestWeight(), top.bestSetReps(), top.date(), top.workoutId());
    }
}
