package com.phillippitts.parlcorpus.service.metrics;

import com.phillippitts.parlcorpus.domain.DropReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for corpus pipeline runs.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Segment decisions by state and drop reason</li>
 *   <li>Session outcomes and processing time</li>
 *   <li>Merge conflicts found during assembly</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "parlcorpus";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the processing time of one session.
     *
     * @param status        terminal session status
     * @param durationNanos duration in nanoseconds
     */
    public void recordSession(String status, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".session.duration")
                .description("Time taken to process one session")
                .tag("status", status)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
        Counter.builder(METRIC_PREFIX + ".sessions")
                .description("Number of processed sessions")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * Adds segment decisions of one session.
     *
     * @param kept     kept segments
     * @param queued   segments queued for realignment
     * @param dropped  dropped segments by reason
     */
    public void recordSegments(int kept, int queued, Map<DropReason, Integer> dropped) {
        segments("kept", "none").increment(kept);
        segments("queued", "none").increment(queued);
        dropped.forEach((reason, count) -> segments("dropped", reason.name()).increment(count));
    }

    private Counter segments(String state, String reason) {
        return Counter.builder(METRIC_PREFIX + ".segments")
                .description("Number of labeled candidate segments")
                .tag("state", state)
                .tag("reason", reason)
                .register(registry);
    }

    /**
     * Increments the conflict counter by the number found in one assembly.
     */
    public void recordConflicts(int conflicts) {
        Counter.builder(METRIC_PREFIX + ".merge.conflicts")
                .description("Number of utterance ids excluded because of conflicting variants")
                .register(registry)
                .increment(conflicts);
    }
}
