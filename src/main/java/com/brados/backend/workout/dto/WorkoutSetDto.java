package com.brados.backend.workout.dto;

import com.brados.backend.workout.entity.WorkoutSet;

public record WorkoutSetDto(
        Long id,
        Long workoutId,
        Long exerciseId,
        int setNumber,
        int targetReps,
        double targetWeight,
        Integer actualReps,
        Double actualWeight,
        WorkoutSet.Status status
) {
    public static WorkoutSetDto from(WorkoutSet s) {
        return new WorkoutSetDto(s.getId(), s.getWorkoutId(), s.getExerciseId(), s.getSetNumber(),
                s.getTargetReps(), s.getTargetWeight(), s.getActualReps(), s.getActualWeight(), s.getStatus());
    }
}
