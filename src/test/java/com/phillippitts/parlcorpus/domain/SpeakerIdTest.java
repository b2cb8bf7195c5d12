package com.phillippitts.parlcorpus.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpeakerIdTest {

    @Test
    void shouldKeepSentinelDistinctFromResolvedIds() {
        assertThat(SpeakerId.UNRESOLVED.isResolved()).isFalse();
        assertThat(SpeakerId.of(1).isResolved()).isTrue();
        assertThat(SpeakerId.of(1)).isNotEqualTo(SpeakerId.UNRESOLVED);
    }

    @Test
    void shouldRenderFiveDigits() {
        assertThat(SpeakerId.of(123)).hasToString("00123");
        assertThat(SpeakerId.UNRESOLVED).hasToString("00000");
    }

    @Test
    void shouldParseRenderedForm() {
        assertThat(SpeakerId.parse("00123")).isEqualTo(SpeakerId.of(123));
        assertThat(SpeakerId.parse("00000")).isEqualTo(SpeakerId.UNRESOLVED);
    }

    @Test
    void shouldRejectInvalidIds() {
        assertThatThrownBy(() -> SpeakerId.of(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SpeakerId(-5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SpeakerId.parse("abc"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Not a speaker id");
    }
}
