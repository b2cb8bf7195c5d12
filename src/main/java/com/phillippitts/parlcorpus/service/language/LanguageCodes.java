package com.phillippitts.parlcorpus.service.language;

import com.phillippitts.parlcorpus.config.properties.LanguageProperties;
import com.phillippitts.parlcorpus.domain.Language;

import java.util.Locale;

/**
 * Maps declared transcript language codes onto {@link Language}.
 *
 * <p>The majority code maps to {@link Language#MAJORITY}; a code naming both languages joined
 * by {@code +} (for example {@code fi+sv}) to {@link Language#MIXED}; any other non-empty code
 * to {@link Language#MINORITY}; a missing code to {@link Language#UNDETERMINED}.
 */
public final class LanguageCodes {

    private final String majority;
    private final String minority;

    public LanguageCodes(LanguageProperties properties) {
        this(properties.getMajorityCode(), properties.getMinorityCode());
    }

    public LanguageCodes(String majority, String minority) {
        this.majority = majority.toLowerCase(Locale.ROOT);
        this.minority = minority.toLowerCase(Locale.ROOT);
    }

    public Language fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Language.UNDETERMINED;
        }
        String c = code.trim().toLowerCase(Locale.ROOT);
        if (c.equals(majority)) {
            return Language.MAJORITY;
        }
        if (c.contains("+")) {
            boolean hasMajority = false;
            for (String part : c.split("\\+")) {
                if (part.trim().equals(majority)) {
                    hasMajority = true;
                }
            }
            return hasMajority ? Language.MIXED : Language.MINORITY;
        }
        return Language.MINORITY;
    }

    public String majorityCode() {
        return majority;
    }

    public String minorityCode() {
        return minority;
    }
}
