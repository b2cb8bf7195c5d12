package com.phillippitts.parlcorpus.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionIdTest {

    @Test
    void shouldRenderWithZeroPaddedNumber() {
        assertThat(new SessionId(38, 2019, 42)).hasToString("38-2019-042");
        assertThat(new SessionId(38, 2019, 1234)).hasToString("38-2019-1234");
    }

    @Test
    void shouldParseRenderedForm() {
        SessionId id = SessionId.parse(" 38-2019-042 ");
        assertThat(id.term()).isEqualTo(38);
        assertThat(id.year()).isEqualTo(2019);
        assertThat(id.number()).isEqualTo(42);
    }

    @Test
    void shouldRejectMalformedText() {
        assertThat(SessionId.isValid("38-19-042")).isFalse();
        assertThat(SessionId.isValid("session-38-2019-042")).isFalse();
        assertThat(SessionId.isValid(null)).isFalse();
        assertThatThrownBy(() -> SessionId.parse("38-2019-42"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Not a session id");
    }

    @Test
    void shouldRejectNonPositiveParts() {
        assertThatThrownBy(() -> new SessionId(0, 2019, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SessionId(38, 2019, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SessionId(38, 19, 1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldOrderByRenderedForm() {
        List<SessionId> ids = new ArrayList<>(List.of(
                SessionId.parse("38-2019-010"), SessionId.parse("37-2018-100"), SessionId.parse("38-2019-002")));
        ids.sort(null);
        assertThat(ids).extracting(SessionId::toString)
                .containsExactly("37-2018-100", "38-2019-002", "38-2019-010");
    }
}
