package com.brados.backend.progression.model;

/**
 * FIRST_WEEK: no previous performance, base values
 * DELOAD: planned recovery week, lighter and fewer sets
 * PROGRESS: previous week hit target, add weight and drop to minReps
 * HOLD: missed once, same weight again
 * REGRESS: missed up to the failure threshold, drop weight and ease back in at maxReps
 */
public enum ProgressionReason {
    FIRST_WEEK, DELOAD, PROGRESS, HOLD, REGRESS
}
