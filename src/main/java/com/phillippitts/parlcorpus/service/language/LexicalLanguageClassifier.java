package com.phillippitts.parlcorpus.service.language;

import com.phillippitts.parlcorpus.domain.Language;
import com.phillippitts.parlcorpus.domain.LanguageClassification;

import java.util.List;

/**
 * Deterministic fallback classifier based on the density of minority-language stopwords.
 *
 * <p>Text with no letters is reported as majority language with zero confidence.
 */
public class LexicalLanguageClassifier implements LanguageClassifier {

    private final MinorityStoplist stoplist;
    private final double minDensity;

    public LexicalLanguageClassifier(MinorityStoplist stoplist, double minDensity) {
        if (minDensity < 0.0 || minDensity > 1.0) {
            throw new IllegalArgumentException("minDensity in [0,1]");
        }
        this.stoplist = stoplist;
        this.minDensity = minDensity;
    }

    @Override
    public LanguageClassification classify(String text) {
        List<String> tokens = MinorityStoplist.tokens(text);
        if (tokens.isEmpty()) {
            return new LanguageClassification(Language.MAJORITY, 0.0);
        }
        int hits = stoplist.hits(tokens);
        double density = (double) hits / tokens.size();
        if (hits > 0 && density >= minDensity) {
            return new LanguageClassification(Language.MINORITY, density);
        }
        return new LanguageClassification(Language.MAJORITY, 1.0 - density);
    }
}
