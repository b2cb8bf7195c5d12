package com.phillippitts.parlcorpus.service.text;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VocabularyCollectorTest {

    @Test
    void shouldCollectDistinctWordsSorted() {
        VocabularyCollector collector = new VocabularyCollector();
        collector.addCanonical("kiitos puhemies");
        collector.addCanonical("arvoisa puhemies");
        collector.addCanonical("");
        collector.addCanonical(null);

        assertThat(collector.size()).isEqualTo(3);
        assertThat(collector.contains("puhemies")).isTrue();
        assertThat(collector.sorted()).containsExactly("arvoisa", "kiitos", "puhemies");
    }
}
