package com.phillippitts.parlcorpus.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Typed properties for language labels and the lexical minority-language heuristics.
 */
@Validated
@ConfigurationProperties(prefix = "language")
public class LanguageProperties {

    /** Minority-language function words matched on word boundaries. */
    public static final List<String> DEFAULT_STOPLIST = List.of(
            "jag", "vi", "er", "man", "den", "det", "är", "har", "var", "hade", "inte", "på",
            "så", "som", "men", "att", "vid", "och", "ledamot");

    /** Declared language code of the corpus language. */
    @NotBlank
    private final String majorityCode;

    /** Declared language code of the secondary official language. */
    @NotBlank
    private final String minorityCode;

    private final List<String> stoplist;

    /** Stoplist density at which the lexical classifier labels text as minority language. */
    @Min(0)
    @Max(1)
    private final double classifierMinDensity;

    private final Filter filter;

    @ConstructorBinding
    public LanguageProperties(String majorityCode, String minorityCode, List<String> stoplist,
                              Double classifierMinDensity, Filter filter) {
        this.majorityCode = majorityCode == null || majorityCode.isBlank() ? "fi" : majorityCode.trim();
        this.minorityCode = minorityCode == null || minorityCode.isBlank() ? "sv" : minorityCode.trim();
        if (this.majorityCode.equalsIgnoreCase(this.minorityCode)) {
            throw new IllegalArgumentException("language.majority-code and language.minority-code must differ");
        }
        this.stoplist = stoplist == null || stoplist.isEmpty() ? DEFAULT_STOPLIST : List.copyOf(stoplist);
        double d = classifierMinDensity == null ? 0.15 : classifierMinDensity;
        if (d < 0.0 || d > 1.0) {
            throw new IllegalArgumentException("language.classifier-min-density must be in [0,1]");
        }
        this.classifierMinDensity = d;
        this.filter = filter == null ? new Filter(null, null, null) : filter;
    }

    public static LanguageProperties defaults() {
        return new LanguageProperties(null, null, null, null, null);
    }

    public String getMajorityCode() {
        return majorityCode;
    }

    public String getMinorityCode() {
        return minorityCode;
    }

    public List<String> getStoplist() {
        return stoplist;
    }

    public double getClassifierMinDensity() {
        return classifierMinDensity;
    }

    public Filter getFilter() {
        return filter;
    }

    /**
     * Post-assembly secondary language filter settings.
     *
     * @param enabled    run the filter before the tables are written
     * @param minHits    minimum number of stoplist tokens in a record's text
     * @param minDensity minimum share of stoplist tokens among the record's tokens
     */
    public record Filter(Boolean enabled, Integer minHits, Double minDensity) {

        public Filter {
            enabled = enabled == null ? Boolean.TRUE : enabled;
            minHits = minHits == null ? 1 : minHits;
            if (minHits < 1) {
                throw new IllegalArgumentException("language.filter.min-hits must be at least 1");
            }
            minDensity = minDensity == null ? 0.0 : minDensity;
            if (minDensity < 0.0 || minDensity > 1.0) {
                throw new IllegalArgumentException("language.filter.min-density must be in [0,1]");
            }
        }
    }
}
