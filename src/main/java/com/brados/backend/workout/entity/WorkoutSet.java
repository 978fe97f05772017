package com.brados.backend.workout.entity;

import com.brados.backend.common.error.InvalidTransitionException;
import com.brados.backend.common.error.ValidationException;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

/**
 * One prescribed set. Actual reps/weight are present exactly when the set is COMPLETED;
 * the mutators below are the only way status and actuals change together.
 */
@Getter
@Setter
@Entity
@Table(name = "workout_sets",
        uniqueConstraints = @UniqueConstraint(name = "ux_workout_sets_slot",
                columnNames = {"workout_id", "exercise_id", "set_number"}),
        indexes = @Index(name = "idx_workout_sets_workout", columnList = "workout_id"))
public class WorkoutSet {

    public enum Status { PENDING, COMPLETED, SKIPPED }

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "workout_id", nullable = false)
    private Long workoutId;

    @Column(name = "exercise_id", nullable = false)
    private Long exerciseId;

    @Column(name = "plan_exercise_id")
    private Long planExerciseId;

    @Column(name = "set_number", nullable = false)
    private Integer setNumber;

    @Column(name = "target_reps", nullable = false)
    private Integer targetReps;

    @Column(name = "target_weight", nullable = false)
    private Double targetWeight;

    @Column(name = "actual_reps")
    private Integer actualReps;

    @Column(name = "actual_weight")
    private Double actualWeight;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Status status = Status.PENDING;

    @Version
    private Long version;

    /** Records (or overwrites) what was actually lifted. */
    public void log(int reps, double weight) {
        if (reps < 0) throw new ValidationException("Reps must be a non-negative number");
        if (weight < 0) throw new ValidationException("Weight must be a non-negative number");
        this.actualReps = reps;
        this.actualWeight = weight;
        this.status = Status.COMPLETED;
    }

    public void skip() {
        if (status == Status.SKIPPED) throw new InvalidTransitionException("set", status, "skip");
        this.actualReps = null;
        this.actualWeight = null;
        this.status = Status.SKIPPED;
    }

    public void unlog() {
        if (status != Status.COMPLETED) throw new InvalidTransitionException("set", status, "unlog");
        this.actualReps = null;
        this.actualWeight = null;
        this.status = Status.PENDING;
    }

    public boolean isPending() { return status == Status.PENDING; }

    public boolean isCompleted() { return status == Status.COMPLETED; }
}
