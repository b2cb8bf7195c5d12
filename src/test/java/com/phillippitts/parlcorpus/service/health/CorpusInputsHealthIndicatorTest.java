package com.phillippitts.parlcorpus.service.health;

import com.phillippitts.parlcorpus.config.properties.CorpusProperties;
import com.phillippitts.parlcorpus.config.properties.SpeakerProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CorpusInputsHealthIndicatorTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReportUpWhenInputDirectoriesExist() throws IOException {
        CorpusProperties corpus = CorpusProperties.under(tempDir);
        Files.createDirectories(corpus.transcriptsPath());
        Files.createDirectories(corpus.candidatesPath());
        Path table = Files.createFile(tempDir.resolve("mp-table.psv"));

        Health health = new CorpusInputsHealthIndicator(corpus, new SpeakerProperties(table.toString(), null))
                .health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("status", "Input directories accessible");
        assertThat(health.getDetails().get("transcripts")).asString().contains("accessible at");
        assertThat(health.getDetails().get("speakerTable")).asString().contains("accessible at");
    }

    @Test
    void shouldReportDownWhenDecoderOutputDirectoryMissing() throws IOException {
        CorpusProperties corpus = CorpusProperties.under(tempDir);
        Files.createDirectories(corpus.transcriptsPath());

        Health health = new CorpusInputsHealthIndicator(corpus, new SpeakerProperties(null, null)).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails().get("candidates")).asString().contains("NOT FOUND at");
    }

    @Test
    void shouldStayUpWithoutSpeakerTable() throws IOException {
        CorpusProperties corpus = CorpusProperties.under(tempDir);
        Files.createDirectories(corpus.transcriptsPath());
        Files.createDirectories(corpus.candidatesPath());

        Health health = new CorpusInputsHealthIndicator(corpus,
                new SpeakerProperties(tempDir.resolve("missing.psv").toString(), null)).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails().get("speakerTable")).asString().contains("NOT FOUND at");
    }
}
