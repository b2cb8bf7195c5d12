package com.phillippitts.parlcorpus.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeUtilsTest {

    @Test
    void shouldFormatCentisecondsAsSecondsWithTwoDecimals() {
        assertThat(TimeUtils.centisToSeconds(120)).isEqualTo("1.20");
        assertThat(TimeUtils.centisToSeconds(5)).isEqualTo("0.05");
        assertThat(TimeUtils.centisToSeconds(0)).isEqualTo("0.00");
        assertThat(TimeUtils.centisToSeconds(360_001)).isEqualTo("3600.01");
    }

    @Test
    void shouldRejectNegativeOffsets() {
        assertThatThrownBy(() -> TimeUtils.centisToSeconds(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TimeUtils.secondsToCentis("-0.5")).isInstanceOf(NumberFormatException.class);
    }

    @Test
    void shouldParseSecondsIntoCentiseconds() {
        assertThat(TimeUtils.secondsToCentis("1.20")).isEqualTo(120L);
        assertThat(TimeUtils.secondsToCentis("1.2")).isEqualTo(120L);
        assertThat(TimeUtils.secondsToCentis("0.07")).isEqualTo(7L);
        assertThat(TimeUtils.secondsToCentis("3600.01")).isEqualTo(360_001L);
    }

    @Test
    void shouldCalculateElapsedMillisFromPastTimestamp() {
        long startNanos = System.nanoTime() - (1_000L * TimeUtils.NANOS_PER_MILLI);

        long elapsedMs = TimeUtils.elapsedMillis(startNanos);

        assertThat(elapsedMs).isGreaterThanOrEqualTo(1_000L);
        assertThat(elapsedMs).isLessThan(5_000L);
    }
}
