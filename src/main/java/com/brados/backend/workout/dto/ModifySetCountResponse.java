package com.brados.backend.workout.dto;

/**
 * Outcome of adding / removing a set. {@code set} is the new set on add and the
 * removed one on remove.
 */
public record ModifySetCountResponse(
        Long workoutId,
        Long exerciseId,
        WorkoutSetDto set,
        int setCount
) {}
