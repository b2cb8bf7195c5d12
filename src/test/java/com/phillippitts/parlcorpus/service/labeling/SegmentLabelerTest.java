package com.phillippitts.parlcorpus.service.labeling;

import com.phillippitts.parlcorpus.config.properties.LabelingProperties;
import com.phillippitts.parlcorpus.domain.CandidateSegment;
import com.phillippitts.parlcorpus.domain.Classification;
import com.phillippitts.parlcorpus.domain.CorpusRecord;
import com.phillippitts.parlcorpus.domain.DecisionState;
import com.phillippitts.parlcorpus.domain.DropReason;
import com.phillippitts.parlcorpus.domain.EditSummary;
import com.phillippitts.parlcorpus.domain.Language;
import com.phillippitts.parlcorpus.domain.ReconciliationResult;
import com.phillippitts.parlcorpus.domain.SegmentDecision;
import com.phillippitts.parlcorpus.domain.SessionId;
import com.phillippitts.parlcorpus.domain.SessionTranscript;
import com.phillippitts.parlcorpus.domain.SpeakerId;
import com.phillippitts.parlcorpus.domain.SpeechTurn;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SegmentLabelerTest {

    private static final SessionId SESSION = SessionId.parse("38-2019-042");

    private final SegmentLabeler labeler = new SegmentLabeler(LabelingProperties.defaults());

    private final List<SpeechTurn> turns = new ArrayList<>();

    private SegmentLabelerTest turn(String name, SpeakerId speaker, Language language, String canonical) {
        turns.add(SpeechTurn.parsed(SESSION, turns.size(), name, SpeakerId.UNRESOLVED, canonical, language)
                .withSpeaker(speaker)
                .withCanonicalText(canonical));
        return this;
    }

    private SessionTranscript transcript() {
        return new SessionTranscript(SESSION, turns, 0);
    }

    private static ReconciliationResult result(long start, long end, Classification c, double rate,
                                               int spanStart, int spanLength, String referenceText, int attempt) {
        return new ReconciliationResult(CandidateSegment.of(SESSION, start, end, referenceText), c, rate,
                spanStart, spanLength, referenceText, EditSummary.NONE, attempt);
    }

    private static ReconciliationResult accurate(long start, long end, int spanStart, int spanLength, String text) {
        return result(start, end, Classification.ACCURATE, 0.0, spanStart, spanLength, text, 0);
    }

    private SegmentDecision labelOne(ReconciliationResult r) {
        return labeler.label(transcript(), List.of(r)).decisions().get(0);
    }

    @Test
    void shouldKeepAccurateSingleSpeakerSegment() {
        turn("Matti Vanhanen", SpeakerId.of(1), Language.MAJORITY, "hello world");

        SegmentDecision d = labelOne(accurate(0, 150, 0, 2, "hello world"));

        assertThat(d.state()).isEqualTo(DecisionState.KEPT);
        CorpusRecord record = d.record();
        assertThat(record.speakerId()).isEqualTo(SpeakerId.of(1));
        assertThat(record.text()).isEqualTo("hello world");
        assertThat(record.uttId()).isEqualTo("38-2019-042-00000000-00000150");
    }

    @Test
    void shouldQueueRealignableSegmentUntilAttemptsAreUsed() {
        turn("Matti Vanhanen", SpeakerId.of(1), Language.MAJORITY, "hello world");

        SegmentDecision first = labelOne(result(0, 150, Classification.NEEDS_REALIGNMENT, 0.5, 0, 2,
                "hello world", 0));
        assertThat(first.state()).isEqualTo(DecisionState.QUEUED_FOR_REALIGNMENT);
        assertThat(first.retry().attempt()).isEqualTo(1);
        assertThat(first.retry().toLine()).isEqualTo("38-2019-042 0 150 1");

        SegmentDecision exhausted = labelOne(result(0, 150, Classification.NEEDS_REALIGNMENT, 0.5, 0, 2,
                "hello world", 1));
        assertThat(exhausted.state()).isEqualTo(DecisionState.DROPPED);
        assertThat(exhausted.dropReason()).isEqualTo(DropReason.REALIGNMENT_EXHAUSTED);
    }

    @Test
    void shouldDropUnrecoverableSegment() {
        turn("Matti Vanhanen", SpeakerId.of(1), Language.MAJORITY, "hello world");
        CandidateSegment candidate = CandidateSegment.of(SESSION, 0, 150, "foo bar");

        SegmentDecision d = labelOne(ReconciliationResult.unrecoverable(candidate, 0));

        assertThat(d.dropReason()).isEqualTo(DropReason.UNRECOVERABLE);
    }

    @Test
    void shouldDropSegmentsOutsideDurationBounds() {
        turn("Matti Vanhanen", SpeakerId.of(1), Language.MAJORITY, "hello world");

        assertThat(labelOne(accurate(0, 30, 0, 2, "hello world")).dropReason()).isEqualTo(DropReason.TOO_SHORT);
        assertThat(labelOne(accurate(0, 4000, 0, 2, "hello world")).dropReason()).isEqualTo(DropReason.TOO_LONG);
    }

    @Test
    void shouldDropSegmentsTouchingMinorityLanguage() {
        turn("Matti Vanhanen", SpeakerId.of(1), Language.MAJORITY, "hyvä puhemies")
                .turn("Li Andersson", SpeakerId.of(1), Language.MINORITY, "tack");

        SegmentDecision d = labelOne(accurate(0, 200, 1, 2, "puhemies tack"));

        assertThat(d.dropReason()).isEqualTo(DropReason.MINORITY_LANGUAGE);
    }

    @Test
    void shouldDropSegmentsSpanningTwoSpeakers() {
        turn("Matti Vanhanen", SpeakerId.of(1), Language.MAJORITY, "yksi kaksi")
                .turn("Li Andersson", SpeakerId.of(2), Language.MAJORITY, "kolme nelja");

        SegmentDecision d = labelOne(accurate(0, 200, 0, 4, "yksi kaksi kolme nelja"));

        assertThat(d.dropReason()).isEqualTo(DropReason.MULTIPLE_SPEAKERS);
    }

    @Test
    void shouldTolerateShortUnresolvedInterjection() {
        turn("Matti Vanhanen", SpeakerId.of(1), Language.MAJORITY, "yksi kaksi kolme")
                .turn("Puhemies", SpeakerId.UNRESOLVED, Language.MAJORITY, "kiitos");

        SegmentDecision d = labelOne(accurate(0, 200, 0, 4, "yksi kaksi kolme kiitos"));

        assertThat(d.state()).isEqualTo(DecisionState.KEPT);
        assertThat(d.record().speakerId()).isEqualTo(SpeakerId.of(1));
    }

    @Test
    void shouldKeepUnresolvedSpeakerWithSentinelByDefault() {
        turn("Tuntematon", SpeakerId.UNRESOLVED, Language.MAJORITY, "hello world");

        SessionLabels labels = labeler.label(transcript(), List.of(accurate(0, 150, 0, 2, "hello world")));

        assertThat(labels.keptCount()).isEqualTo(1);
        assertThat(labels.keptRecords().get(0).speakerId()).isEqualTo(SpeakerId.UNRESOLVED);
        assertThat(labels.unresolvedCount()).isEqualTo(1);
    }

    @Test
    void shouldDropUnresolvedSpeakerWhenConfigured() {
        SegmentLabeler strict = new SegmentLabeler(new LabelingProperties(null, null, null, null, false));
        turn("Tuntematon", SpeakerId.UNRESOLVED, Language.MAJORITY, "hello world");

        SegmentDecision d = strict.label(transcript(), List.of(accurate(0, 150, 0, 2, "hello world")))
                .decisions().get(0);

        assertThat(d.dropReason()).isEqualTo(DropReason.UNRESOLVED_SPEAKER);
    }

    @Test
    void shouldDropSecondSegmentWithSameBoundaries() {
        turn("Matti Vanhanen", SpeakerId.of(1), Language.MAJORITY, "hello world hello world");

        SessionLabels labels = labeler.label(transcript(), List.of(
                accurate(0, 150, 0, 2, "hello world"),
                accurate(0, 150, 2, 2, "hello world")));

        assertThat(labels.decisions()).extracting(SegmentDecision::state)
                .containsExactly(DecisionState.KEPT, DecisionState.DROPPED);
        assertThat(labels.droppedByReason()).containsEntry(DropReason.DUPLICATE_BOUNDARY, 1);
    }

    @Test
    void shouldGiveEveryCandidateExactlyOneTerminalDecision() {
        turn("Matti Vanhanen", SpeakerId.of(1), Language.MAJORITY, "yksi kaksi kolme nelja viisi");

        SessionLabels labels = labeler.label(transcript(), List.of(
                accurate(0, 150, 0, 2, "yksi kaksi"),
                result(200, 350, Classification.NEEDS_REALIGNMENT, 0.5, 2, 2, "kolme nelja", 0),
                ReconciliationResult.unrecoverable(CandidateSegment.of(SESSION, 400, 500, "x"), 0)));

        assertThat(labels.keptCount() + labels.droppedCount() + labels.queuedCount()).isEqualTo(3);
        assertThat(labels.retries()).hasSize(1);
        assertThat(labels.dropped()).hasSize(1);
    }
}
