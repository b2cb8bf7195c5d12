package com.phillippitts.parlcorpus.service.orchestration;

/**
 * Runs the whole pipeline: all sessions in parallel, then corpus and vocabulary assembly.
 */
public interface CorpusPipeline {

    /**
     * Runs once. Session and assembly failures are reported in the summary, not thrown.
     */
    PipelineSummary run();
}
