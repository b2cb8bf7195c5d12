package com.phillippitts.parlcorpus.service.transcript;

import com.phillippitts.parlcorpus.domain.SessionId;
import com.phillippitts.parlcorpus.domain.SessionTranscript;

import java.nio.file.Path;

/**
 * Parses an official session transcript into ordered speech turns.
 *
 * <p>Implementations skip and log individual malformed statements; only a document that cannot
 * be read at all is an error.
 */
public interface TranscriptParser {

    /**
     * Parses a transcript file.
     *
     * @param session session the file belongs to
     * @param file    transcript document
     * @return turns in transcript order, with the number of skipped statements
     * @throws com.phillippitts.parlcorpus.exception.TranscriptParseException if the document is unreadable
     */
    SessionTranscript parse(SessionId session, Path file);

    /**
     * Parses transcript content already in memory.
     */
    SessionTranscript parse(SessionId session, String content);
}
