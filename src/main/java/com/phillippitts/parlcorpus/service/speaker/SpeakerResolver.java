package com.phillippitts.parlcorpus.service.speaker;

import com.phillippitts.parlcorpus.domain.SessionId;
import com.phillippitts.parlcorpus.domain.SpeakerId;

/**
 * Maps a printed speaker name to a canonical speaker id.
 */
public interface SpeakerResolver {

    /**
     * Resolves a printed name.
     *
     * @param rawName name as printed in the transcript, possibly with a title, abbreviated first
     *                name or diacritics; may be empty
     * @param session session the name appears in, for diagnostics
     * @return resolved id, or {@link SpeakerId#UNRESOLVED} when the name is unknown or ambiguous;
     *         never null
     */
    SpeakerId resolve(String rawName, SessionId session);
}
