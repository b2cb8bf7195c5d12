package com.phillippitts.parlcorpus.service.assembly;

import com.phillippitts.parlcorpus.domain.CorpusRecord;
import com.phillippitts.parlcorpus.domain.SessionId;
import com.phillippitts.parlcorpus.domain.SpeakerId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class CorpusTablesTest {

    private static final SessionId S1 = SessionId.parse("38-2019-042");
    private static final SessionId S2 = SessionId.parse("38-2019-043");

    private final List<CorpusRecord> records = List.of(
            CorpusRecord.of(S1, 0, 150, SpeakerId.of(2), "hyvä puhemies"),
            CorpusRecord.of(S1, 200, 1234, SpeakerId.of(1), "arvoisat edustajat"),
            CorpusRecord.of(S2, 5, 90, SpeakerId.of(2), "kiitos"));

    @TempDir
    Path out;

    @Test
    void shouldWriteAllTablesSortedByFirstColumn() throws Exception {
        CorpusTables.write(out, records, s -> "/audio/" + s + ".wav");

        assertThat(read(CorpusTables.SEGMENTS)).containsExactly(
                "38-2019-042-00000000-00000150 38-2019-042 0.00 1.50",
                "38-2019-042-00000200-00001234 38-2019-042 2.00 12.34",
                "38-2019-043-00000005-00000090 38-2019-043 0.05 0.90");
        assertThat(read(CorpusTables.TEXT)).containsExactly(
                "38-2019-042-00000000-00000150 hyvä puhemies",
                "38-2019-042-00000200-00001234 arvoisat edustajat",
                "38-2019-043-00000005-00000090 kiitos");
        assertThat(read(CorpusTables.WAV_SCP)).containsExactly(
                "38-2019-042 /audio/38-2019-042.wav",
                "38-2019-043 /audio/38-2019-043.wav");
        assertThat(read(CorpusTables.SPK2UTT)).containsExactly(
                "00001 38-2019-042-00000200-00001234",
                "00002 38-2019-042-00000000-00000150 38-2019-043-00000005-00000090");
        assertThat(read(CorpusTables.UTT2SPK)).hasSize(3)
                .contains("38-2019-042-00000200-00001234 00001");
    }

    @Test
    void shouldReadBackWrittenTables() {
        CorpusTables.write(out, records, s -> s + ".wav");

        assertThat(CorpusTables.read(out)).containsExactlyElementsOf(records);
    }

    @Test
    void shouldLeaveNoStagingFilesBehind() throws Exception {
        CorpusTables.write(out, records, s -> s + ".wav");

        try (Stream<Path> files = Files.list(out)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .noneMatch(name -> name.endsWith(".tmp"));
        }
    }

    @Test
    void shouldSkipUtteranceMissingFromTextTable() throws Exception {
        CorpusTables.write(out, records, s -> s + ".wav");
        Files.write(out.resolve(CorpusTables.TEXT), List.of("38-2019-043-00000005-00000090 kiitos"),
                StandardCharsets.UTF_8);

        assertThat(CorpusTables.read(out)).containsExactly(records.get(2));
    }

    @Test
    void shouldReadNothingFromEmptyDirectory() {
        assertThat(CorpusTables.read(out)).isEmpty();
    }

    private List<String> read(String table) throws Exception {
        return Files.readAllLines(out.resolve(table), StandardCharsets.UTF_8);
    }
}
