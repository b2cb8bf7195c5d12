package com.phillippitts.parlcorpus.service.reconcile;

import com.phillippitts.parlcorpus.domain.CandidateSegment;
import com.phillippitts.parlcorpus.domain.RetryEntry;
import com.phillippitts.parlcorpus.domain.SessionId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RetryListTest {

    private static final SessionId SESSION = SessionId.parse("38-2019-042");

    @TempDir
    Path tempDir;

    @Test
    void shouldReportHighestOverlappingAttempt() {
        RetryList retries = new RetryList(List.of(
                new RetryEntry(SESSION, 100, 200, 1),
                new RetryEntry(SESSION, 150, 250, 2),
                new RetryEntry(SESSION, 900, 1000, 3)));

        assertThat(retries.attemptFor(CandidateSegment.of(SESSION, 180, 220, "x"))).isEqualTo(2);
        assertThat(retries.attemptFor(CandidateSegment.of(SESSION, 300, 400, "x"))).isZero();
    }

    @Test
    void shouldIgnoreOtherSessions() {
        RetryList retries = new RetryList(List.of(new RetryEntry(SessionId.parse("38-2019-043"), 100, 200, 1)));
        assertThat(retries.attemptFor(CandidateSegment.of(SESSION, 100, 200, "x"))).isZero();
    }

    @Test
    void shouldWriteSortedAndReadBack() {
        Path file = tempDir.resolve("work").resolve("38-2019-042.retry");
        RetryList.write(file, List.of(new RetryEntry(SESSION, 500, 600, 1), new RetryEntry(SESSION, 100, 200, 2)));

        RetryList read = RetryList.read(file);

        assertThat(read.entries()).extracting(RetryEntry::start).containsExactly(100L, 500L);
        assertThat(read.entries().get(0).attempt()).isEqualTo(2);
    }

    @Test
    void shouldTreatMissingFileAsEmptyAndSkipMalformedLines() throws IOException {
        assertThat(RetryList.read(tempDir.resolve("none.retry")).isEmpty()).isTrue();

        Path file = tempDir.resolve("bad.retry");
        Files.write(file, List.of("38-2019-042 100 200 1", "38-2019-042 x 200 1", "38-2019-042 300 200 1"),
                StandardCharsets.UTF_8);
        assertThat(RetryList.read(file).entries()).hasSize(1);
    }
}
