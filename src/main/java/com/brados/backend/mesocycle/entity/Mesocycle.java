package com.brados.backend.mesocycle.entity;

import com.brados.backend.common.error.ValidationException;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One training block. Starts ACTIVE at week 1; COMPLETED and CANCELLED are terminal.
 */
@Getter
@Setter
@Entity
@Table(name = "mesocycles",
        indexes = @Index(name = "idx_mesocycles_plan_status", columnList = "plan_id,status"))
public class Mesocycle {

    public enum Status { ACTIVE, COMPLETED, CANCELLED }

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "plan_id", nullable = false)
    private Long planId;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "current_week", nullable = false)
    private Integer currentWeek = 1;

    /** Progression weeks of the plan plus the closing deload week. */
    @Column(name = "duration_weeks", nullable = false)
    private Integer durationWeeks;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Status status = Status.ACTIVE;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    public boolean isActive() { return status == Status.ACTIVE; }

    public boolean isFinalWeek() { return currentWeek >= durationWeeks; }

    public void complete(Instant now) {
        requireActive();
        this.status = Status.COMPLETED;
        this.updatedAt = now;
    }

    public void cancel(Instant now) {
        requireActive();
        this.status = Status.CANCELLED;
        this.updatedAt = now;
    }

    /** Moves to the next week; the caller has checked this is not the final week. */
    public int nextWeek(Instant now) {
        requireActive();
        if (isFinalWeek()) throw new ValidationException("Mesocycle " + id + " is already in its final week");
        this.currentWeek = currentWeek + 1;
        this.updatedAt = now;
        return currentWeek;
    }

    private void requireActive() {
        if (!isActive()) throw new ValidationException("Mesocycle " + id + " is not active (" + status + ")");
    }
}
