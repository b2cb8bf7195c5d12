package com.phillippitts.parlcorpus.config.properties;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the segment acceptance policy.
 */
@Validated
@ConfigurationProperties(prefix = "labeling")
public class LabelingProperties {

    /** Shortest kept segment in centiseconds. */
    @Min(1)
    private final long minDurationCs;

    /** Longest kept segment in centiseconds. */
    @Min(1)
    private final long maxDurationCs;

    /** Realignment passes a span may be queued for before it is dropped. */
    @Min(0)
    private final int maxRealignmentAttempts;

    /**
     * Words of turns without a resolved speaker tolerated inside a span attributed to one
     * resolved speaker.
     */
    @Min(0)
    private final int speakerToleranceWords;

    /** Keep segments whose speaker could not be resolved, under the sentinel id. */
    private final boolean keepUnresolvedSpeakers;

    @ConstructorBinding
    public LabelingProperties(Long minDurationCs, Long maxDurationCs, Integer maxRealignmentAttempts,
                              Integer speakerToleranceWords, Boolean keepUnresolvedSpeakers) {
        this.minDurationCs = minDurationCs == null ? 50 : minDurationCs;
        this.maxDurationCs = maxDurationCs == null ? 3000 : maxDurationCs;
        if (this.minDurationCs < 1 || this.maxDurationCs < this.minDurationCs) {
            throw new IllegalArgumentException(
                    "labeling durations must satisfy 1 <= min-duration-cs <= max-duration-cs");
        }
        this.maxRealignmentAttempts = maxRealignmentAttempts == null ? 1 : maxRealignmentAttempts;
        if (this.maxRealignmentAttempts < 0) {
            throw new IllegalArgumentException("labeling.max-realignment-attempts must not be negative");
        }
        this.speakerToleranceWords = speakerToleranceWords == null ? 1 : speakerToleranceWords;
        if (this.speakerToleranceWords < 0) {
            throw new IllegalArgumentException("labeling.speaker-tolerance-words must not be negative");
        }
        this.keepUnresolvedSpeakers = keepUnresolvedSpeakers == null || keepUnresolvedSpeakers;
    }

    public static LabelingProperties defaults() {
        return new LabelingProperties(null, null, null, null, null);
    }

    public long getMinDurationCs() {
        return minDurationCs;
    }

    public long getMaxDurationCs() {
        return maxDurationCs;
    }

    public int getMaxRealignmentAttempts() {
        return maxRealignmentAttempts;
    }

    public int getSpeakerToleranceWords() {
        return speakerToleranceWords;
    }

    public boolean isKeepUnresolvedSpeakers() {
        return keepUnresolvedSpeakers;
    }
}
