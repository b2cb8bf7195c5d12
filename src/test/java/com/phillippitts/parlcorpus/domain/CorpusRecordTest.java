package com.phillippitts.parlcorpus.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CorpusRecordTest {

    private static final SessionId SESSION = SessionId.parse("38-2019-042");

    @Test
    void shouldDeriveUtteranceIdFromSessionAndOffsets() {
        CorpusRecord r = CorpusRecord.of(SESSION, 1200, 1550, SpeakerId.of(7), "hyvä puhemies");
        assertThat(r.uttId()).isEqualTo("38-2019-042-00001200-00001550");
    }

    @Test
    void shouldRejectMismatchingUtteranceId() {
        assertThatThrownBy(() -> new CorpusRecord("38-2019-042-00000001-00000002", SESSION, 1, 3,
                SpeakerId.of(7), "text"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not match");
    }

    @Test
    void shouldRejectEmptySpanAndBlankText() {
        assertThatThrownBy(() -> CorpusRecord.of(SESSION, 10, 10, SpeakerId.of(7), "text"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CorpusRecord.of(SESSION, -1, 10, SpeakerId.of(7), "text"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CorpusRecord.of(SESSION, 0, 10, SpeakerId.of(7), "  "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldKeepVariantsOfOneUtteranceAdjacentWhenSorted() {
        CorpusRecord a1 = CorpusRecord.of(SESSION, 0, 100, SpeakerId.of(2), "b");
        CorpusRecord a2 = CorpusRecord.of(SESSION, 0, 100, SpeakerId.of(1), "a");
        CorpusRecord b = CorpusRecord.of(SESSION, 50, 150, SpeakerId.of(1), "a");
        List<CorpusRecord> records = new ArrayList<>(List.of(b, a1, a2));
        records.sort(null);
        assertThat(records).containsExactly(a2, a1, b);
    }
}
