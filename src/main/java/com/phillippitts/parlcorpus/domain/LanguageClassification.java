package com.phillippitts.parlcorpus.domain;

import java.util.Objects;

/**
 * Output of a language classifier.
 *
 * @param language   predicted language
 * @param confidence confidence in [0, 1]
 */
public record LanguageClassification(Language language, double confidence) {

    public LanguageClassification {
        Objects.requireNonNull(language, "language");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }
}
