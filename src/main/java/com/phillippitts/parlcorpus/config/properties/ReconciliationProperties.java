package com.phillippitts.parlcorpus.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "reconciliation")
public class ReconciliationProperties {

    /** Highest edit rate still eligible for a realignment pass (0..1). */
    @Min(0)
    @Max(1)
    private final double realignThreshold;

    /** Reference words searched before the expected position. */
    @Min(0)
    private final int searchWindowBackward;

    /** Reference words searched after the expected position. */
    @Min(0)
    private final int searchWindowForward;

    /** Span lengths tried around the hypothesis length. */
    @Min(0)
    private final int lengthSlack;

    @ConstructorBinding
    public ReconciliationProperties(Double realignThreshold, Integer searchWindowBackward,
                                    Integer searchWindowForward, Integer lengthSlack) {
        double t = realignThreshold == null ? 0.5 : realignThreshold;
        if (t < 0.0 || t > 1.0) {
            throw new IllegalArgumentException("reconciliation.realign-threshold must be in [0,1]");
        }
        this.realignThreshold = t;
        this.searchWindowBackward = nonNegative(searchWindowBackward, 100, "search-window-backward");
        this.searchWindowForward = nonNegative(searchWindowForward, 1000, "search-window-forward");
        this.lengthSlack = nonNegative(lengthSlack, 3, "length-slack");
    }

    public static ReconciliationProperties defaults() {
        return new ReconciliationProperties(null, null, null, null);
    }

    private static int nonNegative(Integer value, int fallback, String name) {
        int v = value == null ? fallback : value;
        if (v < 0) {
            throw new IllegalArgumentException("reconciliation." + name + " must not be negative");
        }
        return v;
    }

    public double getRealignThreshold() {
        return realignThreshold;
    }

    public int getSearchWindowBackward() {
        return searchWindowBackward;
    }

    public int getSearchWindowForward() {
        return searchWindowForward;
    }

    public int getLengthSlack() {
        return lengthSlack;
    }
}
