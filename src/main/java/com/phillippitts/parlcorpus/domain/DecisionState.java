package com.phillippitts.parlcorpus.domain;

/**
 * Labeling state of a candidate segment. Only {@link #PENDING} has outgoing transitions.
 */
public enum DecisionState {
    PENDING,
    KEPT,
    DROPPED,
    QUEUED_FOR_REALIGNMENT;

    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * Returns true if a candidate in this state may move to {@code next}.
     */
    public boolean canTransitionTo(DecisionState next) {
        return this == PENDING && next != null && next.isTerminal();
    }
}
