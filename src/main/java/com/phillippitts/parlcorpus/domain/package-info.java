/**
 * Immutable domain model of the corpus pipeline.
 *
 * <p>{@link com.phillippitts.parlcorpus.domain.SpeechTurn} and
 * {@link com.phillippitts.parlcorpus.domain.CandidateSegment} live for one session run;
 * {@link com.phillippitts.parlcorpus.domain.CorpusRecord} is the persisted unit whose utterance id
 * must be unique in the merged corpus.
 */
package com.phillippitts.parlcorpus.domain;
