package com.phillippitts.parlcorpus.domain;

import java.util.Objects;

/**
 * One speaker's contiguous contribution in a session transcript.
 *
 * <p>Produced by the transcript parser with the raw text and the declared language, then
 * enriched by copy with the resolved speaker, the classified language and the canonical text.
 * Downstream components only read turns.
 *
 * @param session           session the turn belongs to
 * @param index             position of the turn within the session, starting at 0
 * @param speakerName       printed speaker name, empty when the transcript names nobody
 * @param declaredSpeakerId speaker id printed in the transcript, {@link SpeakerId#UNRESOLVED} if absent
 * @param speakerId         resolved speaker, {@link SpeakerId#UNRESOLVED} until resolution succeeds
 * @param speakerMissing    true when the transcript carried neither a name nor an id
 * @param rawText           text as printed in the transcript
 * @param canonicalText     normalized text, empty until normalization
 * @param language          declared or classified language
 * @param languageSource    origin of {@code language}
 */
public record SpeechTurn(
        SessionId session,
        int index,
        String speakerName,
        SpeakerId declaredSpeakerId,
        SpeakerId speakerId,
        boolean speakerMissing,
        String rawText,
        String canonicalText,
        Language language,
        LanguageSource languageSource
) {

    public SpeechTurn {
        Objects.requireNonNull(session, "session");
        if (index < 0) {
            throw new IllegalArgumentException("Turn index must not be negative, got: " + index);
        }
        speakerName = speakerName == null ? "" : speakerName;
        declaredSpeakerId = declaredSpeakerId == null ? SpeakerId.UNRESOLVED : declaredSpeakerId;
        speakerId = speakerId == null ? SpeakerId.UNRESOLVED : speakerId;
        Objects.requireNonNull(rawText, "rawText");
        canonicalText = canonicalText == null ? "" : canonicalText;
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(languageSource, "languageSource");
    }

    /**
     * Creates a freshly parsed turn: not yet resolved or normalized.
     */
    public static SpeechTurn parsed(SessionId session, int index, String speakerName,
                                    SpeakerId declaredSpeakerId, String rawText, Language language) {
        boolean missing = (speakerName == null || speakerName.isBlank())
                && (declaredSpeakerId == null || !declaredSpeakerId.isResolved());
        LanguageSource source = language == Language.UNDETERMINED
                ? LanguageSource.PENDING : LanguageSource.DECLARED;
        return new SpeechTurn(session, index, speakerName, declaredSpeakerId, SpeakerId.UNRESOLVED,
                missing, rawText, "", language, source);
    }

    public SpeechTurn withSpeaker(SpeakerId resolved) {
        return new SpeechTurn(session, index, speakerName, declaredSpeakerId, resolved, speakerMissing,
                rawText, canonicalText, language, languageSource);
    }

    public SpeechTurn withLanguage(Language classified, LanguageSource source) {
        return new SpeechTurn(session, index, speakerName, declaredSpeakerId, speakerId, speakerMissing,
                rawText, canonicalText, classified, source);
    }

    public SpeechTurn withCanonicalText(String text) {
        return new SpeechTurn(session, index, speakerName, declaredSpeakerId, speakerId, speakerMissing,
                rawText, text, language, languageSource);
    }

    public boolean needsClassification() {
        return languageSource == LanguageSource.PENDING;
    }
}
