package com.brados.backend.workout.service;

import com.brados.backend.workout.entity.WorkoutSet;

import java.util.Collection;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Sets of one exercise inside one workout, addressed by set number. Add/remove
 * work on numbers (max + 1, highest pending) instead of list positions.
 */
final class ExerciseSetSlots {

    private final NavigableMap<Integer, WorkoutSet> bySetNumber = new TreeMap<>();

    ExerciseSetSlots(Collection<WorkoutSet> sets) {
        for (WorkoutSet s : sets) bySetNumber.put(s.getSetNumber(), s);
    }

    int size() { return bySetNumber.size(); }

    boolean isEmpty() { return bySetNumber.isEmpty(); }

    int nextSetNumber() {
        return bySetNumber.isEmpty() ? 1 : bySetNumber.lastKey() + 1;
    }

    /** Highest-numbered set still pending, if any. */
    Optional<WorkoutSet> lastPending() {
        for (WorkoutSet s : bySetNumber.descendingMap().values()) {
            if (s.isPending()) return Optional.of(s);
        }
        return Optional.empty();
    }

    Collection<WorkoutSet> view() {
        return Collections.unmodifiableCollection(bySetNumber.values());
    }
}
