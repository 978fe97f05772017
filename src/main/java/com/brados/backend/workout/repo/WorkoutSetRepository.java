package com.brados.backend.workout.repo;

import com.brados.backend.workout.entity.WorkoutSet;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface WorkoutSetRepository extends JpaRepository<WorkoutSet, Long> {

    List<WorkoutSet> findByWorkoutIdOrderByExerciseIdAscSetNumberAsc(Long workoutId);

    List<WorkoutSet> findByWorkoutIdAndExerciseIdOrderBySetNumberAsc(Long workoutId, Long exerciseId);

    List<WorkoutSet> findByWorkoutIdIn(Collection<Long> workoutIds);

    long countByWorkoutId(Long workoutId);

    List<WorkoutSet> findByExerciseIdAndStatus(Long exerciseId, WorkoutSet.Status status);
}
