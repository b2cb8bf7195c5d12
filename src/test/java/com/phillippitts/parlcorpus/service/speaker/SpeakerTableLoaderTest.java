package com.phillippitts.parlcorpus.service.speaker;

import com.phillippitts.parlcorpus.domain.SpeakerEntry;
import com.phillippitts.parlcorpus.domain.SpeakerId;
import com.phillippitts.parlcorpus.exception.SpeakerTableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpeakerTableLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldParseRowsWithVariants() {
        List<SpeakerEntry> entries = SpeakerTableLoader.parse(List.of(
                "mp_id|firstname|lastname|variants",
                "101|Matti|Vanhanen|Matti Taneli Vanhanen; M. T. Vanhanen",
                "102|Li|Andersson|"), "table");

        assertThat(entries).hasSize(2);
        assertThat(entries.get(0).speakerId()).isEqualTo(SpeakerId.of(101));
        assertThat(entries.get(0).variants()).containsExactly("Matti Taneli Vanhanen", "M. T. Vanhanen");
        assertThat(entries.get(1).fullName()).isEqualTo("Li Andersson");
        assertThat(entries.get(1).variants()).isEmpty();
    }

    @Test
    void shouldSkipRowsWithInvalidIds() {
        List<SpeakerEntry> entries = SpeakerTableLoader.parse(List.of(
                "lastname|firstname|mp_id",
                "Vanhanen|Matti|abc",
                "Andersson|Li|0",
                "Rinne|Antti|103"), "table");

        assertThat(entries).extracting(SpeakerEntry::lastName).containsExactly("Rinne");
    }

    @Test
    void shouldRejectHeaderWithoutRequiredColumns() {
        assertThatThrownBy(() -> SpeakerTableLoader.parse(List.of("id|name", "1|x"), "table"))
                .isInstanceOf(SpeakerTableException.class)
                .hasMessageContaining("mp_id");
    }

    @Test
    void shouldReturnEmptyTableForMissingFile() {
        SpeakerTable table = SpeakerTableLoader.load(tempDir.resolve("missing.psv"), new NameNormalizer(List.of()));
        assertThat(table.isEmpty()).isTrue();
    }

    @Test
    void shouldLoadTableFromFile() throws IOException {
        Path file = tempDir.resolve("mp-table.psv");
        Files.write(file, List.of("mp_id|firstname|lastname", "101|Matti|Vanhanen"), StandardCharsets.UTF_8);

        SpeakerTable table = SpeakerTableLoader.load(file, new NameNormalizer(List.of()));

        assertThat(table.size()).isEqualTo(1);
    }
}
