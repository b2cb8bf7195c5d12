package com.phillippitts.parlcorpus.service.reconcile;

import com.phillippitts.parlcorpus.domain.CandidateSegment;
import com.phillippitts.parlcorpus.domain.ReconciliationResult;
import com.phillippitts.parlcorpus.domain.SessionTranscript;

import java.util.List;

/**
 * Strategy interface for reconciling decoder candidate segments against a session transcript.
 *
 * <p>Implementations find, for each candidate, the best-matching contiguous span of the
 * session's canonical reference words and classify the candidate as
 * {@link com.phillippitts.parlcorpus.domain.Classification#ACCURATE ACCURATE},
 * {@link com.phillippitts.parlcorpus.domain.Classification#NEEDS_REALIGNMENT NEEDS_REALIGNMENT} or
 * {@link com.phillippitts.parlcorpus.domain.Classification#UNRECOVERABLE UNRECOVERABLE}.
 * They flag realignment eligibility only and never run a second alignment pass themselves.
 *
 * <p><b>Thread Safety:</b> Implementations hold no state between calls; one instance serves all
 * sessions concurrently.
 *
 * @see AbstractAlignmentReconciler
 */
public interface AlignmentReconciler {

    /**
     * Reconciles the candidates of one session.
     *
     * @param transcript normalized session transcript
     * @param candidates candidates of the same session, in any order
     * @param retries    spans queued by earlier runs, used for the attempt count
     * @return one result per candidate, ordered by candidate start and end
     */
    List<ReconciliationResult> reconcile(SessionTranscript transcript, List<CandidateSegment> candidates,
                                         RetryList retries);
}
