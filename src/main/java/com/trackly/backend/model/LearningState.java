package com.trackly.backend.model;

/**
 * Phases of one learning cycle. The loop has no terminal state.
 */
public enum LearningState {
    IDLE,
    FETCHING,
    PARSING,
    UPDATING,
    SLEEPING
}
