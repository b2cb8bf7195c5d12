package com.phillippitts.parlcorpus.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Typed properties for speaker resolution.
 */
@Validated
@ConfigurationProperties(prefix = "speaker")
public class SpeakerProperties {

    private static final List<String> DEFAULT_TITLES = List.of(
            "puhemies", "ensimmainen varapuhemies", "toinen varapuhemies", "varapuhemies",
            "ministeri", "paaministeri", "edustaja");

    /** Path of the {@code mp_id|firstname|lastname|variants} lookup table. */
    private final String tablePath;

    /**
     * Title words stripped from the start of printed names. Compared after name normalization,
     * so they are written without diacritics.
     */
    private final List<String> titlePrefixes;

    @ConstructorBinding
    public SpeakerProperties(String tablePath, List<String> titlePrefixes) {
        this.tablePath = tablePath == null || tablePath.isBlank() ? "data/mp-table.psv" : tablePath;
        this.titlePrefixes = titlePrefixes == null ? DEFAULT_TITLES : List.copyOf(titlePrefixes);
    }

    public String getTablePath() {
        return tablePath;
    }

    public List<String> getTitlePrefixes() {
        return titlePrefixes;
    }
}
