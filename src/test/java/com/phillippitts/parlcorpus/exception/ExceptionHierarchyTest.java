package com.phillippitts.parlcorpus.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void parlCorpusExceptionShouldIncludeMessageAndCause() {
        IOException cause = new IOException("IO failure");
        ParlCorpusException ex = new ParlCorpusException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void corpusIoExceptionShouldNameActionAndPath() {
        CorpusIoException ex = new CorpusIoException("read records", Path.of("work/a.records"),
                new IOException("denied"));

        assertThat(ex).isInstanceOf(ParlCorpusException.class);
        assertThat(ex.getMessage()).isEqualTo("Failed to read records work/a.records: denied");
        assertThat(ex.getPath()).isEqualTo("work/a.records");
    }

    @Test
    void corpusFormatExceptionShouldCarryLocation() {
        CorpusFormatException ex = new CorpusFormatException("a.candidates", 12, "bad offsets");

        assertThat(ex.getMessage()).isEqualTo("a.candidates:12: bad offsets");
        assertThat(ex.getFile()).isEqualTo("a.candidates");
        assertThat(ex.getLineNumber()).isEqualTo(12);
    }

    @Test
    void sessionInputMissingExceptionShouldNameSessionAndPath() {
        SessionInputMissingException ex = new SessionInputMissingException("38-2019-042", "in/x.json");

        assertThat(ex.getMessage()).contains("38-2019-042").contains("in/x.json");
        assertThat(ex.getSession()).isEqualTo("38-2019-042");
        assertThat(ex.getMissingPath()).isEqualTo("in/x.json");
    }

    @Test
    void sessionCancelledExceptionShouldNameSession() {
        SessionCancelledException ex = new SessionCancelledException("38-2019-042");

        assertThat(ex).isInstanceOf(ParlCorpusException.class);
        assertThat(ex.getMessage()).isEqualTo("Session 38-2019-042 cancelled before writing its results");
        assertThat(ex.getSession()).isEqualTo("38-2019-042");
    }

    @Test
    void transcriptParseExceptionShouldNameSession() {
        TranscriptParseException ex = new TranscriptParseException("38-2019-042", "not JSON");

        assertThat(ex).isInstanceOf(ParlCorpusException.class);
        assertThat(ex.getMessage()).isEqualTo("Unreadable transcript for session 38-2019-042: not JSON");
        assertThat(ex.getSession()).isEqualTo("38-2019-042");
    }

    @Test
    void speakerTableExceptionShouldNamePath() {
        SpeakerTableException ex = new SpeakerTableException("mp.psv", "no header");

        assertThat(ex.getMessage()).isEqualTo("Invalid speaker table mp.psv: no header");
        assertThat(ex.getTablePath()).isEqualTo("mp.psv");
    }
}
