package com.phillippitts.parlcorpus.domain;

/**
 * Language label of a speech turn relative to the corpus language.
 */
public enum Language {
    /** The corpus language. Only these turns contribute kept segments and vocabulary. */
    MAJORITY,
    /** The secondary official language, or any other foreign language. */
    MINORITY,
    /** Declared as containing both languages. */
    MIXED,
    /** Not declared in the transcript and not yet classified. */
    UNDETERMINED
}
