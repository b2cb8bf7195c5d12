/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.parlcorpus.exception.ParlCorpusException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.parlcorpus.exception.TranscriptParseException} - Thrown when
 *       a transcript document is unreadable; fatal for that session</li>
 *   <li>{@link com.phillippitts.parlcorpus.exception.SessionInputMissingException} - Thrown when
 *       a session has no transcript or no decoder output; fatal for that session</li>
 *   <li>{@link com.phillippitts.parlcorpus.exception.CorpusFormatException} - Thrown for a
 *       malformed line; callers log it and skip the line</li>
 *   <li>{@link com.phillippitts.parlcorpus.exception.CorpusIoException} - Thrown when a
 *       pipeline file cannot be read or written</li>
 *   <li>{@link com.phillippitts.parlcorpus.exception.SpeakerTableException} - Thrown when the
 *       speaker lookup table cannot be read</li>
 * </ul>
 *
 * <p>All exceptions are unchecked, support chaining via {@code cause} and carry context fields
 * (session id, file and line) for the per-session failure report.
 *
 * @see com.phillippitts.parlcorpus.exception.ParlCorpusException
 */
package com.phillippitts.parlcorpus.exception;
