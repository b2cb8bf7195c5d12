package com.phillippitts.parlcorpus.service.orchestration;

import com.phillippitts.parlcorpus.config.properties.CorpusProperties;
import com.phillippitts.parlcorpus.domain.CandidateSegment;
import com.phillippitts.parlcorpus.domain.Language;
import com.phillippitts.parlcorpus.domain.LanguageClassification;
import com.phillippitts.parlcorpus.domain.LanguageSource;
import com.phillippitts.parlcorpus.domain.ReconciliationResult;
import com.phillippitts.parlcorpus.domain.SegmentDecision;
import com.phillippitts.parlcorpus.domain.SessionId;
import com.phillippitts.parlcorpus.domain.SessionTranscript;
import com.phillippitts.parlcorpus.domain.SpeakerId;
import com.phillippitts.parlcorpus.domain.SpeechTurn;
import com.phillippitts.parlcorpus.exception.CorpusIoException;
import com.phillippitts.parlcorpus.exception.SessionCancelledException;
import com.phillippitts.parlcorpus.exception.SessionInputMissingException;
import com.phillippitts.parlcorpus.service.assembly.SessionRecordFile;
import com.phillippitts.parlcorpus.service.assembly.VocabularyAssembler;
import com.phillippitts.parlcorpus.service.decoder.CandidateFileReader;
import com.phillippitts.parlcorpus.service.labeling.SegmentLabeler;
import com.phillippitts.parlcorpus.service.labeling.SessionLabels;
import com.phillippitts.parlcorpus.service.language.LanguageClassifier;
import com.phillippitts.parlcorpus.service.reconcile.AlignmentReconciler;
import com.phillippitts.parlcorpus.service.reconcile.RetryList;
import com.phillippitts.parlcorpus.service.speaker.SpeakerResolver;
import com.phillippitts.parlcorpus.service.text.TextNormalizer;
import com.phillippitts.parlcorpus.service.text.VocabularyCollector;
import com.phillippitts.parlcorpus.service.transcript.TranscriptParser;
import com.phillippitts.parlcorpus.util.AtomicFiles;
import com.phillippitts.parlcorpus.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Runs every per-session step for one session and writes its intermediate files.
 *
 * <p>Steps: parse the transcript, resolve speakers, classify undeclared languages, normalize
 * text and collect vocabulary, read decoder candidates and the previous retry list, reconcile,
 * label, and write {@code {id}.records}, {@code {id}.words}, {@code {id}.dropped} and
 * {@code {id}.retry} to the work directory. Records and words are merged with earlier runs;
 * the dropped and retry files describe the latest run only.
 *
 * <p>Every file is replaced through a staged temporary copy, and nothing is written once the
 * worker thread has been interrupted, so a cancelled session leaves its earlier files intact.
 *
 * <p>Instances share no mutable state between sessions and may process several sessions at once.
 */
public class SessionPipeline {

    private static final Logger LOG = LogManager.getLogger(SessionPipeline.class);

    /** Log4j2 ThreadContext key holding the session being processed. */
    public static final String SESSION_KEY = "session";

    public static final String TRANSCRIPT_SUFFIX = ".json";
    public static final String CANDIDATES_SUFFIX = ".candidates";
    public static final String FILE_PREFIX = "session-";
    public static final String DROPPED_SUFFIX = ".dropped";
    public static final String RETRY_SUFFIX = ".retry";

    private final CorpusProperties corpus;
    private final TranscriptParser parser;
    private final SpeakerResolver speakerResolver;
    private final LanguageClassifier classifier;
    private final TextNormalizer normalizer;
    private final CandidateFileReader candidateReader;
    private final AlignmentReconciler reconciler;
    private final SegmentLabeler labeler;

    public SessionPipeline(CorpusProperties corpus,
                           TranscriptParser parser,
                           SpeakerResolver speakerResolver,
                           LanguageClassifier classifier,
                           TextNormalizer normalizer,
                           CandidateFileReader candidateReader,
                           AlignmentReconciler reconciler,
                           SegmentLabeler labeler) {
        this.corpus = corpus;
        this.parser = parser;
        this.speakerResolver = speakerResolver;
        this.classifier = classifier;
        this.normalizer = normalizer;
        this.candidateReader = candidateReader;
        this.reconciler = reconciler;
        this.labeler = labeler;
    }

    /**
     * Processes one session.
     *
     * @throws SessionInputMissingException if the transcript or the decoder output is missing
     * @throws SessionCancelledException    if the thread was interrupted before the writes began
     */
    public SessionReport process(SessionId session) {
        long t0 = System.nanoTime();
        ThreadContext.put(SESSION_KEY, session.toString());
        try {
            Path transcriptFile = transcriptFile(session);
            Path candidatesFile = candidatesFile(session);
            requireInput(session, transcriptFile);
            requireInput(session, candidatesFile);

            VocabularyCollector vocabulary = new VocabularyCollector();
            SessionTranscript transcript = prepare(parser.parse(session, transcriptFile), vocabulary);
            List<CandidateSegment> candidates = candidateReader.read(session, candidatesFile);

            Path work = corpus.workPath();
            Path retryFile = work.resolve(session + RETRY_SUFFIX);
            List<ReconciliationResult> results =
                    reconciler.reconcile(transcript, candidates, RetryList.read(retryFile));
            SessionLabels labels = labeler.label(transcript, results);

            // a cancelled session must not touch the files the assembler is about to read
            if (Thread.currentThread().isInterrupted()) {
                throw new SessionCancelledException(session.toString());
            }
            SessionRecordFile.merge(work.resolve(session + SessionRecordFile.SUFFIX), labels.keptRecords());
            VocabularyAssembler.mergeWords(work.resolve(session + VocabularyAssembler.SUFFIX), vocabulary.sorted());
            writeDropped(work.resolve(session + DROPPED_SUFFIX), labels.dropped());
            RetryList.write(retryFile, labels.retries());

            SessionReport report = SessionReport.completed(labels, transcript.skippedTurns(),
                    TimeUtils.elapsedMillis(t0));
            LOG.info("Session done: turns={}, candidates={}, kept={}, dropped={}, queued={}, unresolved={} in {} ms",
                    transcript.turns().size(), candidates.size(), report.kept(), report.dropped(),
                    report.queued(), report.unresolved(), report.durationMs());
            return report;
        } finally {
            ThreadContext.remove(SESSION_KEY);
        }
    }

    public Path transcriptFile(SessionId session) {
        return corpus.transcriptsPath().resolve(FILE_PREFIX + session + TRANSCRIPT_SUFFIX);
    }

    public Path candidatesFile(SessionId session) {
        return corpus.candidatesPath().resolve(FILE_PREFIX + session + CANDIDATES_SUFFIX);
    }

    private static void requireInput(SessionId session, Path file) {
        if (!Files.isRegularFile(file)) {
            throw new SessionInputMissingException(session.toString(), file.toString());
        }
    }

    /**
     * Resolves speakers, classifies pending languages and normalizes text. Only majority-language
     * turns contribute to the vocabulary.
     */
    SessionTranscript prepare(SessionTranscript transcript, VocabularyCollector vocabulary) {
        List<SpeechTurn> prepared = new ArrayList<>(transcript.turns().size());
        for (SpeechTurn turn : transcript.turns()) {
            SpeechTurn t = turn.withSpeaker(resolveSpeaker(turn));
            if (t.needsClassification()) {
                LanguageClassification c = classifier.classify(t.rawText());
                t = t.withLanguage(c.language(), LanguageSource.CLASSIFIED);
            }
            t = t.withCanonicalText(normalizer.normalize(t.rawText()));
            if (t.language() == Language.MAJORITY) {
                vocabulary.addCanonical(t.canonicalText());
            }
            prepared.add(t);
        }
        return transcript.withTurns(prepared);
    }

    private SpeakerId resolveSpeaker(SpeechTurn turn) {
        if (turn.declaredSpeakerId().isResolved()) {
            return turn.declaredSpeakerId();
        }
        if (turn.speakerName().isBlank()) {
            return SpeakerId.UNRESOLVED;
        }
        return speakerResolver.resolve(turn.speakerName(), turn.session());
    }

    private static void writeDropped(Path file, List<SegmentDecision> dropped) {
        List<String> lines = dropped.stream()
                .map(d -> String.format(Locale.ROOT, "%s %d %d %s %.3f %s",
                        d.candidate().session(), d.candidate().start(), d.candidate().end(),
                        d.dropReason(), d.editRate(), d.candidate().hypothesis()).trim())
                .toList();
        try {
            AtomicFiles.writeLines(file, lines);
        } catch (IOException e) {
            throw new CorpusIoException("write dropped segments", file, e);
        }
    }
}
