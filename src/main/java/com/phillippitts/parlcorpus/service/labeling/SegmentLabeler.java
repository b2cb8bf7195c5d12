package com.phillippitts.parlcorpus.service.labeling;

import com.phillippitts.parlcorpus.config.properties.LabelingProperties;
import com.phillippitts.parlcorpus.domain.CandidateSegment;
import com.phillippitts.parlcorpus.domain.Classification;
import com.phillippitts.parlcorpus.domain.CorpusRecord;
import com.phillippitts.parlcorpus.domain.DropReason;
import com.phillippitts.parlcorpus.domain.Language;
import com.phillippitts.parlcorpus.domain.ReconciliationResult;
import com.phillippitts.parlcorpus.domain.ReferenceWords;
import com.phillippitts.parlcorpus.domain.RetryEntry;
import com.phillippitts.parlcorpus.domain.SegmentDecision;
import com.phillippitts.parlcorpus.domain.SessionTranscript;
import com.phillippitts.parlcorpus.domain.SpeakerId;
import com.phillippitts.parlcorpus.domain.SpeechTurn;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Applies the acceptance policy to reconciled candidates.
 *
 * <p>Every candidate moves from pending to exactly one terminal state:
 * <ul>
 *   <li>unrecoverable → dropped</li>
 *   <li>needs realignment → queued with the next attempt number, or dropped once the
 *       configured number of attempts is used up</li>
 *   <li>accurate → kept if its duration is within bounds, every covered turn is majority
 *       language, a single speaker can be attributed and no kept candidate has the same
 *       boundaries; dropped with the failing check's reason otherwise</li>
 * </ul>
 *
 * <p><b>Check Order:</b> for accurate candidates the duration bounds are tested first, then
 * language, then speaker attribution, then duplicate boundaries. The first failing check
 * names the {@link DropReason}.
 *
 * <p><b>Speaker Attribution:</b> the span must belong to one resolved speaker, allowing up to
 * {@code labeling.speaker-tolerance-words} words from turns without a resolved speaker. A span
 * made only of unresolved turns with one printed name goes to the unresolved sentinel, and is
 * kept only with {@code labeling.keep-unresolved-speakers}.
 *
 * <p><b>Realignment:</b> queued candidates become {@link RetryEntry retry entries} with the
 * next attempt number. The next run reads them back, and the candidate is dropped as
 * realignment-exhausted once {@code labeling.max-realignment-attempts} is reached.
 *
 * <p>Stateless apart from its configuration; one instance labels all sessions concurrently.
 *
 * @see SpeakerAttribution
 * @see SessionLabels
 * @see com.phillippitts.parlcorpus.service.reconcile.AlignmentReconciler
 * @since 0.1
 */
public class SegmentLabeler {

    private static final Logger LOG = LogManager.getLogger(SegmentLabeler.class);

    private final LabelingProperties properties;

    public SegmentLabeler(LabelingProperties properties) {
        this.properties = properties;
    }

    /**
     * Labels one session's reconciliation results.
     *
     * @param transcript normalized transcript the results were reconciled against
     * @param results    reconciliation results in candidate time order
     */
    public SessionLabels label(SessionTranscript transcript, List<ReconciliationResult> results) {
        ReferenceWords reference = transcript.referenceWords();
        Set<String> keptIds = new HashSet<>();
        List<SegmentDecision> decisions = new ArrayList<>(results.size());
        for (ReconciliationResult result : results) {
            decisions.add(decide(transcript, reference, result, keptIds));
        }
        SessionLabels labels = new SessionLabels(transcript.session(), decisions);
        LOG.info("Session {}: kept={} dropped={} queued={} unresolved={}", transcript.session(),
                labels.keptCount(), labels.droppedCount(), labels.queuedCount(), labels.unresolvedCount());
        return labels;
    }

    private SegmentDecision decide(SessionTranscript transcript, ReferenceWords reference,
                                   ReconciliationResult result, Set<String> keptIds) {
        CandidateSegment candidate = result.candidate();
        double rate = result.editRate();
        if (result.classification() == Classification.UNRECOVERABLE) {
            return SegmentDecision.dropped(candidate, DropReason.UNRECOVERABLE, rate);
        }
        if (result.classification() == Classification.NEEDS_REALIGNMENT) {
            if (result.attempt() < properties.getMaxRealignmentAttempts()) {
                RetryEntry retry = new RetryEntry(candidate.session(), candidate.start(), candidate.end(),
                        result.attempt() + 1);
                return SegmentDecision.queued(candidate, retry, rate);
            }
            return SegmentDecision.dropped(candidate, DropReason.REALIGNMENT_EXHAUSTED, rate);
        }

        if (candidate.durationCs() < properties.getMinDurationCs()) {
            return SegmentDecision.dropped(candidate, DropReason.TOO_SHORT, rate);
        }
        if (candidate.durationCs() > properties.getMaxDurationCs()) {
            return SegmentDecision.dropped(candidate, DropReason.TOO_LONG, rate);
        }

        List<SpeechTurn> covered = coveredTurns(transcript, reference, result);
        for (SpeechTurn turn : covered) {
            if (turn.language() != Language.MAJORITY) {
                return SegmentDecision.dropped(candidate, DropReason.MINORITY_LANGUAGE, rate);
            }
        }

        SpeakerAttribution attribution = SpeakerAttribution.of(transcript, reference, result.spanStart(),
                result.spanLength(), properties.getSpeakerToleranceWords());
        if (!attribution.isSingleSpeaker()) {
            return SegmentDecision.dropped(candidate, DropReason.MULTIPLE_SPEAKERS, rate);
        }
        SpeakerId speaker = attribution.speaker();
        if (!speaker.isResolved() && !properties.isKeepUnresolvedSpeakers()) {
            return SegmentDecision.dropped(candidate, DropReason.UNRESOLVED_SPEAKER, rate);
        }

        CorpusRecord record = CorpusRecord.of(candidate.session(), candidate.start(), candidate.end(),
                speaker, result.referenceText());
        if (!keptIds.add(record.uttId())) {
            return SegmentDecision.dropped(candidate, DropReason.DUPLICATE_BOUNDARY, rate);
        }
        return SegmentDecision.kept(candidate, record, rate);
    }

    private static List<SpeechTurn> coveredTurns(SessionTranscript transcript, ReferenceWords reference,
                                                 ReconciliationResult result) {
        Set<Integer> positions = new LinkedHashSet<>();
        for (int w = result.spanStart(); w < result.spanStart() + result.spanLength(); w++) {
            positions.add(reference.ownerOf(w));
        }
        List<SpeechTurn> turns = new ArrayList<>(positions.size());
        for (int p : positions) {
            turns.add(transcript.turns().get(p));
        }
        return turns;
    }
}
