package com.brados.backend.plan.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "plan_day_exercises",
        indexes = @Index(name = "idx_pde_plan_day", columnList = "plan_day_id"))
@Getter @Setter @NoArgsConstructor
public class PlanDayExercise {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "plan_day_id", nullable = false)
    private Long planDayId;

    @Column(name = "exercise_id", nullable = false)
    private Long exerciseId;

    @Column(nullable = false)
    private Integer sets = 3;

    @Column(nullable = false)
    private Integer reps = 10;

    @Column(nullable = false)
    private Double weight = 0.0;

    @Column(name = "min_reps", nullable = false)
    private Integer minReps = 8;

    @Column(name = "max_reps", nullable = false)
    private Integer maxReps = 12;

    @Column(name = "rest_seconds", nullable = false)
    private Integer restSeconds = 90;

    @Column(name = "sort_order", nullable = false)
    private Integer sortOrder = 0;

    /** Detached snapshot, used to diff an edit against what was planned before. */
    public PlanDayExercise copy() {
        PlanDayExercise c = new PlanDayExercise();
        c.setId(id);
        c.setPlanDayId(planDayId);
        c.setExerciseId(exerciseId);
        c.setSets(sets);
        c.setReps(reps);
        c.setWeight(weight);
        c.setMinReps(minReps);
        c.setMaxReps(maxReps);
        c.setRestSeconds(restSeconds);
        c.setSortOrder(sortOrder);
        return c;
    }
}
