package com.brados.backend.progression.entity;

import com.brados.backend.progression.model.ProgressionReason;
import com.brados.backend.progression.model.WeekTargets;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "week_targets",
        uniqueConstraints = @UniqueConstraint(name = "ux_week_targets_slot",
                columnNames = {"mesocycle_id", "plan_exercise_id", "week_number"}),
        indexes = @Index(name = "idx_week_targets_week", columnList = "mesocycle_id,week_number"))
public class WeekTargetsEntity {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "mesocycle_id", nullable = false)
    private Long mesocycleId;

    @Column(name = "plan_day_id", nullable = false)
    private Long planDayId;

    @Column(name = "plan_exercise_id", nullable = false)
    private Long planExerciseId;

    @Column(name = "exercise_id", nullable = false)
    private Long exerciseId;

    @Column(name = "week_number", nullable = false)
    private Integer weekNumber;

    @Column(name = "target_weight", nullable = false)
    private Double targetWeight;

    @Column(name = "target_reps", nullable = false)
    private Integer targetReps;

    @Column(name = "target_sets", nullable = false)
    private Integer targetSets;

    @Column(name = "is_deload", nullable = false)
    private boolean deload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ProgressionReason reason;

    @Column(name = "consecutive_failures", nullable = false)
    private int consecutiveFailures;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static WeekTargetsEntity of(Long mesocycleId, Long planDayId, WeekTargets t, Instant createdAt) {
        WeekTargetsEntity e = new WeekTargetsEntity();
        e.setCreatedAt(createdAt);
        e.setMesocycleId(mesocycleId);
        e.setPlanDayId(planDayId);
        e.setPlanExerciseId(t.planExerciseId());
        e.setExerciseId(t.exerciseId());
        e.setWeekNumber(t.weekNumber());
        e.setTargetWeight(t.targetWeight());
        e.setTargetReps(t.targetReps());
        e.setTargetSets(t.targetSets());
        e.setDeload(t.deload());
        e.setReason(t.reason());
        e.setConsecutiveFailures(t.consecutiveFailures());
        return e;
    }

    /** Overwrites the prescription in place, keeping the slot and its creation time. */
    public void apply(WeekTargets t) {
        setTargetWeight(t.targetWeight());
        setTargetReps(t.targetReps());
        setTargetSets(t.targetSets());
        setDeload(t.deload());
        setReason(t.reason());
        setConsecutiveFailures(t.consecutiveFailures());
    }

    public WeekTargets toTargets() {
        return new WeekTargets(exerciseId, planExerciseId, targetWeight, targetReps, targetSets,
                weekNumber, deload, reason, consecutiveFailures);
    }
}
