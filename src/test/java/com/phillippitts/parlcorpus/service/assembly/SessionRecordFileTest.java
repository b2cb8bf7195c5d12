package com.phillippitts.parlcorpus.service.assembly;

import com.phillippitts.parlcorpus.domain.CorpusRecord;
import com.phillippitts.parlcorpus.domain.SessionId;
import com.phillippitts.parlcorpus.domain.SpeakerId;
import com.phillippitts.parlcorpus.exception.CorpusFormatException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionRecordFileTest {

    private static final SessionId SESSION = SessionId.parse("38-2019-042");

    @TempDir
    Path tmp;

    @Test
    void shouldTreatMissingFileAsEmpty() {
        assertThat(SessionRecordFile.read(tmp.resolve("none.records"))).isEmpty();
    }

    @Test
    void shouldMergeWithoutDuplicatingOnRerun() throws Exception {
        Path file = tmp.resolve("work/session-38-2019-042.records");
        CorpusRecord a = CorpusRecord.of(SESSION, 200, 350, SpeakerId.of(7), "arvoisa puhemies");
        CorpusRecord b = CorpusRecord.of(SESSION, 0, 150, SpeakerId.UNRESOLVED, "hyvät kollegat");

        assertThat(SessionRecordFile.merge(file, List.of(a))).isEqualTo(1);
        assertThat(SessionRecordFile.merge(file, List.of(a, b))).isEqualTo(2);
        assertThat(SessionRecordFile.merge(file, List.of(b))).isEqualTo(2);

        assertThat(SessionRecordFile.read(file)).containsExactly(b, a);
        assertThat(Files.readAllLines(file, StandardCharsets.UTF_8)).containsExactly(
                "38-2019-042-00000000-00000150 38-2019-042 0 150 00000 hyvät kollegat",
                "38-2019-042-00000200-00000350 38-2019-042 200 350 00007 arvoisa puhemies");
    }

    @Test
    void shouldSkipMalformedLines() throws Exception {
        Path file = tmp.resolve("s.records");
        Files.write(file, List.of(
                "38-2019-042-00000000-00000150 38-2019-042 0 150 00001 hyvä",
                "garbage",
                "38-2019-042-00000000-00000999 38-2019-042 0 150 00001 wrong id"), StandardCharsets.UTF_8);

        assertThat(SessionRecordFile.read(file)).hasSize(1);
    }

    @Test
    void shouldReportLineNumberOfMalformedRecord() {
        assertThatThrownBy(() -> SessionRecordFile.parseLine("s.records", 3, "a b c"))
                .isInstanceOf(CorpusFormatException.class)
                .hasMessageStartingWith("s.records:3:");
    }
}
