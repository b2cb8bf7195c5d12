package com.phillippitts.parlcorpus.domain;

/**
 * Outcome of reconciling one candidate segment against the transcript.
 */
public enum Classification {
    /** Hypothesis equals its best reference span. */
    ACCURATE,
    /** Close to a reference span; boundaries or a few words are probably wrong. */
    NEEDS_REALIGNMENT,
    /** Too far from any reference span within the search window. */
    UNRECOVERABLE
}
