package com.phillippitts.parlcorpus.service.language;

import com.phillippitts.parlcorpus.domain.LanguageClassification;

/**
 * Language identification for text whose language the transcript does not declare.
 *
 * <p>Implementations must be pure functions of the text and safe to call from several session
 * tasks at once. A model-backed implementation registered as a bean replaces the lexical default.
 */
public interface LanguageClassifier {

    /**
     * Classifies a text span.
     *
     * @param text raw or normalized text, may be empty
     * @return language label and confidence, never null
     */
    LanguageClassification classify(String text);
}
