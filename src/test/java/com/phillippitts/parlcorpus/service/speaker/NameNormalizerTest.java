package com.phillippitts.parlcorpus.service.speaker;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NameNormalizerTest {

    private final NameNormalizer normalizer =
            new NameNormalizer(List.of("puhemies", "ensimmäinen varapuhemies", "ministeri"));

    @Test
    void shouldStripTitlesCaseAndWhitespace() {
        assertThat(normalizer.normalize("Puhemies Matti Vanhanen")).isEqualTo("matti vanhanen");
        assertThat(normalizer.normalize("  matti   VANHANEN ")).isEqualTo("matti vanhanen");
    }

    @Test
    void shouldPreferLongestTitle() {
        assertThat(normalizer.normalize("Ensimmäinen varapuhemies Antti Rinne")).isEqualTo("antti rinne");
    }

    @Test
    void shouldRemoveDiacriticsAndHyphens() {
        assertThat(normalizer.normalize("Päivi Räsänen")).isEqualTo("paivi rasanen");
        assertThat(normalizer.normalize("Anna-Maja Henriksson")).isEqualTo("anna maja henriksson");
    }

    @Test
    void shouldKeepInitialDotsUntilKeyIsBuilt() {
        assertThat(normalizer.normalize("A. Virtanen")).isEqualTo("a. virtanen");
        assertThat(normalizer.key("A. Virtanen")).isEqualTo("a virtanen");
    }

    @Test
    void shouldReturnEmptyForTitleOnly() {
        assertThat(normalizer.normalize("Puhemies")).isEmpty();
        assertThat(normalizer.normalize(null)).isEmpty();
    }
}
