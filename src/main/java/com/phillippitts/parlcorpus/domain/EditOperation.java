package com.phillippitts.parlcorpus.domain;

/**
 * Word-level edit operation turning a reference into a hypothesis.
 */
public enum EditOperation {
    MATCH,
    SUBSTITUTION,
    INSERTION,
    DELETION
}
