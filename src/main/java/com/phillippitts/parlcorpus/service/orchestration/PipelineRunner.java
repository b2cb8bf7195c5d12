package com.phillippitts.parlcorpus.service.orchestration;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the pipeline once at startup when {@code pipeline.run-on-startup=true}.
 */
@Component
@ConditionalOnProperty(prefix = "pipeline", name = "run-on-startup", havingValue = "true")
public class PipelineRunner implements ApplicationRunner {

    private static final Logger LOG = LogManager.getLogger(PipelineRunner.class);

    private final CorpusPipeline pipeline;

    public PipelineRunner(CorpusPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Override
    public void run(ApplicationArguments args) {
        PipelineSummary summary = pipeline.run();
        if (!summary.failures().isEmpty() || !summary.assemblySucceeded()) {
            LOG.warn("Pipeline finished with {} failed sessions{}", summary.failures().size(),
                    summary.assemblySucceeded() ? "" : " and a failed assembly");
        }
    }
}
