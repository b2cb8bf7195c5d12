package com.phillippitts.parlcorpus.service.reconcile;

import com.phillippitts.parlcorpus.domain.CandidateSegment;
import com.phillippitts.parlcorpus.domain.Classification;
import com.phillippitts.parlcorpus.domain.ReconciliationResult;
import com.phillippitts.parlcorpus.domain.ReferenceWords;
import com.phillippitts.parlcorpus.domain.SessionTranscript;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Base class for alignment reconcilers implementing the per-session scan.
 *
 * <p>This class implements the Template Method pattern: {@link #reconcile} orders the candidates,
 * keeps the cursor (the reference position right after the last matched span), looks up retry
 * attempts and classifies each match; subclasses implement {@link #findBestSpan} and
 * {@link #hypothesisWords}.
 *
 * <p><b>Classification:</b>
 * <ul>
 *   <li>edit rate 0 → {@link Classification#ACCURATE}</li>
 *   <li>0 &lt; edit rate ≤ realign threshold → {@link Classification#NEEDS_REALIGNMENT}</li>
 *   <li>higher rate, empty hypothesis or no span inside the window →
 *       {@link Classification#UNRECOVERABLE}</li>
 * </ul>
 * Only accurate and realignable matches move the cursor.
 */
public abstract class AbstractAlignmentReconciler implements AlignmentReconciler {

    private static final Logger LOG = LogManager.getLogger(AbstractAlignmentReconciler.class);

    private static final Comparator<CandidateSegment> TIME_ORDER = Comparator
            .comparingLong(CandidateSegment::start)
            .thenComparingLong(CandidateSegment::end);

    private final double realignThreshold;

    protected AbstractAlignmentReconciler(double realignThreshold) {
        if (realignThreshold < 0.0 || realignThreshold > 1.0) {
            throw new IllegalArgumentException("realignThreshold in [0,1]");
        }
        this.realignThreshold = realignThreshold;
    }

    @Override
    public final List<ReconciliationResult> reconcile(SessionTranscript transcript,
                                                      List<CandidateSegment> candidates,
                                                      RetryList retries) {
        ReferenceWords reference = transcript.referenceWords();
        List<CandidateSegment> ordered = new ArrayList<>(candidates);
        ordered.sort(TIME_ORDER);

        List<ReconciliationResult> results = new ArrayList<>(ordered.size());
        int cursor = 0;
        for (CandidateSegment candidate : ordered) {
            if (!candidate.session().equals(transcript.session())) {
                throw new IllegalArgumentException("Candidate of session " + candidate.session()
                        + " passed with transcript of session " + transcript.session());
            }
            int attempt = retries.attemptFor(candidate);
            List<String> hypothesis = hypothesisWords(candidate);
            SpanMatch match = hypothesis.isEmpty() || reference.size() == 0
                    ? null
                    : findBestSpan(reference.words(), hypothesis, cursor);

            ReconciliationResult result = match == null
                    ? ReconciliationResult.unrecoverable(candidate, attempt)
                    : toResult(candidate, reference, hypothesis, match, attempt);
            if (result.classification() != Classification.UNRECOVERABLE) {
                cursor = match.end();
            }
            LOG.trace("{} {}-{} -> {} rate={}", candidate.session(), candidate.start(), candidate.end(),
                    result.classification(), result.editRate());
            results.add(result);
        }
        return results;
    }

    private ReconciliationResult toResult(CandidateSegment candidate, ReferenceWords reference,
                                          List<String> hypothesis, SpanMatch match, int attempt) {
        double rate = match.editRate();
        Classification classification = classify(rate);
        List<String> span = reference.span(match.start(), match.length());
        return new ReconciliationResult(candidate, classification, rate, match.start(), match.length(),
                String.join(" ", span), WordEditDistance.summary(span, hypothesis), attempt);
    }

    /**
     * Maps an edit rate onto a classification.
     */
    protected final Classification classify(double editRate) {
        if (editRate == 0.0) {
            return Classification.ACCURATE;
        }
        return editRate <= realignThreshold ? Classification.NEEDS_REALIGNMENT : Classification.UNRECOVERABLE;
    }

    /**
     * Finds the best reference span for a non-empty hypothesis.
     *
     * @param reference  canonical reference words of the session, non-empty
     * @param hypothesis normalized hypothesis words, non-empty
     * @param cursor     reference position right after the last matched span
     * @return best span, or null if no span lies within the search window
     */
    protected abstract SpanMatch findBestSpan(List<String> reference, List<String> hypothesis, int cursor);

    /**
     * Normalized words of the candidate's hypothesis.
     */
    protected abstract List<String> hypothesisWords(CandidateSegment candidate);

    protected final double getRealignThreshold() {
        return realignThreshold;
    }
}
