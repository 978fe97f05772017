package com.brados.backend.workout.entity;

import com.brados.backend.common.error.InvalidTransitionException;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One scheduled training day of a mesocycle.
 * <pre>
 * PENDING ──start──▶ IN_PROGRESS ──complete──▶ COMPLETED
 *    │                    │
 *    └──────skip──────────┴──────skip────────▶ SKIPPED
 * </pre>
 * COMPLETED and SKIPPED are terminal.
 */
@Getter
@Setter
@Entity
@Table(name = "workouts",
        indexes = {
                @Index(name = "idx_workouts_meso_week", columnList = "mesocycle_id,week_number"),
                @Index(name = "idx_workouts_scheduled", columnList = "scheduled_date")
        })
public class Workout {

    public enum Status { PENDING, IN_PROGRESS, COMPLETED, SKIPPED }

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "mesocycle_id", nullable = false)
    private Long mesocycleId;

    @Column(name = "plan_day_id", nullable = false)
    private Long planDayId;

    @Column(name = "week_number", nullable = false)
    private Integer weekNumber;

    @Column(name = "scheduled_date", nullable = false)
    private LocalDate scheduledDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Status status = Status.PENDING;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Version
    private Long version;

    public void start(Instant now) {
        if (status != Status.PENDING) throw new InvalidTransitionException("workout", status, "start");
        this.status = Status.IN_PROGRESS;
        this.startedAt = now;
    }

    public void complete(Instant now) {
        if (status != Status.IN_PROGRESS) throw new InvalidTransitionException("workout", status, "complete");
        this.status = Status.COMPLETED;
        this.completedAt = now;
    }

    public void skip() {
        if (status != Status.PENDING && status != Status.IN_PROGRESS) {
            throw new InvalidTransitionException("workout", status, "skip");
        }
        this.status = Status.SKIPPED;
    }

    /** Set-level changes are only accepted while the workout is being performed. */
    public void requireInProgress(String operation) {
        if (status != Status.IN_PROGRESS) {
            throw new InvalidTransitionException(
                    "Cannot " + operation + " while workout " + id + " is " + status);
        }
    }

    public boolean isTerminal() {
        return status == Status.COMPLETED || status == Status.SKIPPED;
    }
}
