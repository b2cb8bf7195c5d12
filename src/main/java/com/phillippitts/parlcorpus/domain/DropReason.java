package com.phillippitts.parlcorpus.domain;

/**
 * Diagnostic reason recorded for a dropped candidate.
 */
public enum DropReason {
    UNRECOVERABLE,
    MINORITY_LANGUAGE,
    TOO_SHORT,
    TOO_LONG,
    MULTIPLE_SPEAKERS,
    UNRESOLVED_SPEAKER,
    DUPLICATE_BOUNDARY,
    REALIGNMENT_EXHAUSTED
}
