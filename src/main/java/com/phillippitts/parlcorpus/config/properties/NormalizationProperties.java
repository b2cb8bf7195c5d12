package com.phillippitts.parlcorpus.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed properties for transcript text normalization.
 */
@ConfigurationProperties(prefix = "normalization")
public class NormalizationProperties {

    /** Spell out digits as words. */
    private final boolean expandNumbers;

    /** Character sequences replaced before any other rule, e.g. {@code ß -> ss}. */
    private final Map<String, String> translations;

    @ConstructorBinding
    public NormalizationProperties(Boolean expandNumbers, Map<String, String> translations) {
        this.expandNumbers = expandNumbers == null || expandNumbers;
        this.translations = translations == null
                ? Map.of("ß", "ss")
                : new LinkedHashMap<>(translations);
    }

    public static NormalizationProperties defaults() {
        return new NormalizationProperties(null, null);
    }

    public boolean isExpandNumbers() {
        return expandNumbers;
    }

    public Map<String, String> getTranslations() {
        return translations;
    }
}
