package com.phillippitts.parlcorpus.service.reconcile;

import com.phillippitts.parlcorpus.domain.EditOperation;
import com.phillippitts.parlcorpus.domain.EditSummary;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WordEditDistanceTest {

    @Test
    void shouldCountSubstitution() {
        List<String> ref = List.of("hyvä", "puhemies");
        List<String> hyp = List.of("hyvä", "puhemiehet");

        assertThat(WordEditDistance.summary(ref, hyp).edits()).isEqualTo(1);
        assertThat(WordEditDistance.operations(ref, hyp))
                .containsExactly(EditOperation.MATCH, EditOperation.SUBSTITUTION);
    }

    @Test
    void shouldSummarizeInsertionsAndDeletions() {
        EditSummary inserted = WordEditDistance.summary(List.of("a", "c"), List.of("a", "b", "c"));
        assertThat(inserted.insertions()).isEqualTo(1);
        assertThat(inserted.matches()).isEqualTo(2);
        assertThat(inserted.referenceLength()).isEqualTo(2);

        EditSummary deleted = WordEditDistance.summary(List.of("a", "b", "c"), List.of("a", "c"));
        assertThat(deleted.deletions()).isEqualTo(1);
        assertThat(deleted.edits()).isEqualTo(1);
    }

    @Test
    void shouldHandleEmptySides() {
        assertThat(WordEditDistance.summary(List.of(), List.of("a", "b")).edits()).isEqualTo(2);
        assertThat(WordEditDistance.summary(List.of("a"), List.of()).edits()).isEqualTo(1);
        assertThat(WordEditDistance.prefixDistances(List.of("a"), 0, 1, List.of())).containsExactly(0, 1);
    }

    @Test
    void shouldComputeDistancesForAllPrefixes() {
        List<String> ref = List.of("x", "a", "b", "c", "y");
        int[] d = WordEditDistance.prefixDistances(ref, 1, 4, List.of("a", "b"));

        assertThat(d).containsExactly(2, 1, 0, 1, 2);
    }

    @Test
    void shouldClipPrefixesAtReferenceEnd() {
        int[] d = WordEditDistance.prefixDistances(List.of("a", "b"), 1, 5, List.of("b"));
        assertThat(d).containsExactly(1, 0);
    }
}
