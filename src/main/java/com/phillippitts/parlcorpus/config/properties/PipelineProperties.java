package com.phillippitts.parlcorpus.config.properties;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Typed properties for pipeline runs.
 */
@Validated
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /** Run the whole pipeline once when the application starts. */
    private final boolean runOnStartup;

    /** Upper bound for all sessions of one run to reach a terminal state. */
    @Min(1)
    private final long sessionTimeoutMs;

    /** Sessions to process; empty means every session found in the input directories. */
    private final List<String> sessions;

    @ConstructorBinding
    public PipelineProperties(Boolean runOnStartup, Long sessionTimeoutMs, List<String> sessions) {
        this.runOnStartup = runOnStartup != null && runOnStartup;
        this.sessionTimeoutMs = sessionTimeoutMs == null || sessionTimeoutMs <= 0 ? 600_000L : sessionTimeoutMs;
        this.sessions = sessions == null ? List.of() : List.copyOf(sessions);
    }

    public boolean isRunOnStartup() {
        return runOnStartup;
    }

    public long getSessionTimeoutMs() {
        return sessionTimeoutMs;
    }

    public List<String> getSessions() {
        return sessions;
    }
}
