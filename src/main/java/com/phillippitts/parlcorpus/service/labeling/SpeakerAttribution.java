package com.phillippitts.parlcorpus.service.labeling;

import com.phillippitts.parlcorpus.domain.ReferenceWords;
import com.phillippitts.parlcorpus.domain.SessionTranscript;
import com.phillippitts.parlcorpus.domain.SpeakerId;
import com.phillippitts.parlcorpus.domain.SpeechTurn;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Speaker of a reference span.
 *
 * <p>A span has a single speaker when its words belong to one resolved speaker, allowing up to
 * {@code toleranceWords} words from turns without a resolved speaker (a chairman's short
 * interjection, a misprinted name). A span made only of unresolved turns has a single speaker
 * if those turns carry the same printed name; it is attributed to {@link SpeakerId#UNRESOLVED}.
 *
 * @param singleSpeaker true when one speaker could be attributed
 * @param speaker       attributed speaker, {@link SpeakerId#UNRESOLVED} when none or unresolved
 */
record SpeakerAttribution(boolean singleSpeaker, SpeakerId speaker) {

    private static final SpeakerAttribution MULTIPLE = new SpeakerAttribution(false, SpeakerId.UNRESOLVED);

    static SpeakerAttribution of(SessionTranscript transcript, ReferenceWords reference, int spanStart,
                                 int spanLength, int toleranceWords) {
        Set<SpeakerId> resolved = new LinkedHashSet<>();
        Set<String> unresolvedNames = new LinkedHashSet<>();
        int unresolvedWords = 0;
        for (int w = spanStart; w < spanStart + spanLength; w++) {
            SpeechTurn turn = transcript.turns().get(reference.ownerOf(w));
            if (turn.speakerId().isResolved()) {
                resolved.add(turn.speakerId());
            } else {
                unresolvedWords++;
                unresolvedNames.add(turn.speakerName());
            }
        }
        if (resolved.size() > 1) {
            return MULTIPLE;
        }
        if (resolved.size() == 1) {
            return unresolvedWords <= toleranceWords
                    ? new SpeakerAttribution(true, resolved.iterator().next())
                    : MULTIPLE;
        }
        return unresolvedNames.size() <= 1 ? new SpeakerAttribution(true, SpeakerId.UNRESOLVED) : MULTIPLE;
    }

    boolean isSingleSpeaker() {
        return singleSpeaker;
    }
}
