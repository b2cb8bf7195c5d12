package com.phillippitts.parlcorpus.service.health;

import com.phillippitts.parlcorpus.config.properties.CorpusProperties;
import com.phillippitts.parlcorpus.config.properties.SpeakerProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Health indicator for pipeline inputs.
 *
 * <p>Verifies that the transcript and decoder output directories exist. A missing speaker table
 * is reported but does not make the indicator DOWN, since every speaker then stays unresolved
 * instead of failing the run.
 */
@Component
public class CorpusInputsHealthIndicator implements HealthIndicator {

    private final CorpusProperties corpusProperties;
    private final SpeakerProperties speakerProperties;

    public CorpusInputsHealthIndicator(CorpusProperties corpusProperties, SpeakerProperties speakerProperties) {
        this.corpusProperties = corpusProperties;
        this.speakerProperties = speakerProperties;
    }

    @Override
    public Health health() {
        Path transcripts = corpusProperties.transcriptsPath();
        Path candidates = corpusProperties.candidatesPath();
        Path speakerTable = Paths.get(speakerProperties.getTablePath());

        boolean transcriptsExist = Files.isDirectory(transcripts);
        boolean candidatesExist = Files.isDirectory(candidates);
        boolean speakerTableExists = Files.isRegularFile(speakerTable);

        Health.Builder builder = transcriptsExist && candidatesExist ? Health.up() : Health.down();
        return builder
                .withDetail("status", transcriptsExist && candidatesExist
                        ? "Input directories accessible" : "Missing input directories")
                .withDetail("transcripts", formatStatus(transcriptsExist, transcripts))
                .withDetail("candidates", formatStatus(candidatesExist, candidates))
                .withDetail("speakerTable", formatStatus(speakerTableExists, speakerTable))
                .build();
    }

    private String formatStatus(boolean exists, Path path) {
        if (exists) {
            return "accessible at " + path;
        }
        return "NOT FOUND at " + path;
    }
}
