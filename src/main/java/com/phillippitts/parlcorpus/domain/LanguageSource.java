package com.phillippitts.parlcorpus.domain;

/**
 * Where the language label of a speech turn came from.
 */
public enum LanguageSource {
    DECLARED,
    CLASSIFIED,
    PENDING
}
