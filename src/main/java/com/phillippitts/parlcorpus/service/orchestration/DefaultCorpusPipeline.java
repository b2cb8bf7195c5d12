package com.phillippitts.parlcorpus.service.orchestration;

import com.phillippitts.parlcorpus.config.properties.CorpusProperties;
import com.phillippitts.parlcorpus.config.properties.PipelineProperties;
import com.phillippitts.parlcorpus.domain.SessionId;
import com.phillippitts.parlcorpus.exception.CorpusIoException;
import com.phillippitts.parlcorpus.exception.ParlCorpusException;
import com.phillippitts.parlcorpus.service.assembly.AssemblyReport;
import com.phillippitts.parlcorpus.service.assembly.CorpusAssembler;
import com.phillippitts.parlcorpus.service.assembly.SessionRecordFile;
import com.phillippitts.parlcorpus.service.assembly.VocabularyAssembler;
import com.phillippitts.parlcorpus.service.metrics.PipelineMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Default pipeline: discover sessions, process them in parallel, then assemble.
 *
 * <p>Assembly starts only after every session task has reached a terminal state. It reads all
 * record and word files in the work directory, so sessions from earlier runs stay in the corpus.
 * The files of sessions that timed out in this run are left out; their earlier records are still
 * present in the existing corpus tables, which the assembler merges as well.
 *
 * @see ParallelSessionService
 * @see CorpusAssembler
 * @since 0.1
 */
public class DefaultCorpusPipeline implements CorpusPipeline {

    private static final Logger LOG = LogManager.getLogger(DefaultCorpusPipeline.class);

    /** File name of the assembled vocabulary in the output directory. */
    public static final String VOCABULARY = "vocabulary";

    private final CorpusProperties corpus;
    private final PipelineProperties pipeline;
    private final ParallelSessionService sessions;
    private final CorpusAssembler assembler;
    private final VocabularyAssembler vocabularyAssembler;
    private final PipelineMetrics metrics;

    public DefaultCorpusPipeline(CorpusProperties corpus,
                                 PipelineProperties pipeline,
                                 ParallelSessionService sessions,
                                 CorpusAssembler assembler,
                                 VocabularyAssembler vocabularyAssembler,
                                 PipelineMetrics metrics) {
        this.corpus = Objects.requireNonNull(corpus);
        this.pipeline = Objects.requireNonNull(pipeline);
        this.sessions = Objects.requireNonNull(sessions);
        this.assembler = Objects.requireNonNull(assembler);
        this.vocabularyAssembler = Objects.requireNonNull(vocabularyAssembler);
        this.metrics = metrics;
    }

    @Override
    public PipelineSummary run() {
        List<SessionId> ids = discoverSessions();
        LOG.info("Processing {} sessions", ids.size());
        List<SessionReport> reports = new ArrayList<>(sessions.processAll(ids, pipeline.getSessionTimeoutMs()));
        reports.sort(Comparator.comparing(SessionReport::session));
        if (metrics != null) {
            for (SessionReport r : reports) {
                metrics.recordSession(r.status().name().toLowerCase(Locale.ROOT), r.durationMs() * 1_000_000L);
                metrics.recordSegments(r.kept(), r.queued(), r.droppedByReason());
            }
        }

        Set<String> timedOut = new HashSet<>();
        for (SessionReport r : reports) {
            if (r.isTimedOut()) {
                timedOut.add(r.session().toString());
            }
        }

        AssemblyReport assembly = null;
        int vocabularySize = -1;
        String assemblyFailure = null;
        try {
            Path work = corpus.workPath();
            assembly = assembler.assemble(finishedSessionFiles(work, SessionRecordFile.SUFFIX, timedOut),
                    corpus.outputPath());
            vocabularySize = vocabularyAssembler.assemble(
                    finishedSessionFiles(work, VocabularyAssembler.SUFFIX, timedOut),
                    corpus.outputPath().resolve(VOCABULARY));
            if (metrics != null) {
                metrics.recordConflicts(assembly.conflictCount());
            }
        } catch (ParlCorpusException e) {
            LOG.error("Corpus assembly failed: {}", e.getMessage(), e);
            assemblyFailure = e.getMessage();
        }

        PipelineSummary summary = new PipelineSummary(reports, assembly, vocabularySize, assemblyFailure);
        logSummary(summary);
        return summary;
    }

    /**
     * Sessions named by {@code pipeline.sessions}, or else the union of sessions found in the
     * transcript and decoder output directories. A session present in only one directory is
     * included and fails with its missing input.
     */
    List<SessionId> discoverSessions() {
        TreeSet<SessionId> ids = new TreeSet<>();
        if (!pipeline.getSessions().isEmpty()) {
            for (String s : pipeline.getSessions()) {
                addIfValid(ids, s, "pipeline.sessions");
            }
            return List.copyOf(ids);
        }
        collect(ids, corpus.transcriptsPath(), SessionPipeline.TRANSCRIPT_SUFFIX);
        collect(ids, corpus.candidatesPath(), SessionPipeline.CANDIDATES_SUFFIX);
        return List.copyOf(ids);
    }

    private static void collect(TreeSet<SessionId> ids, Path dir, String suffix) {
        for (Path file : filesWithSuffix(dir, suffix)) {
            String name = file.getFileName().toString();
            if (name.startsWith(SessionPipeline.FILE_PREFIX)) {
                String id = name.substring(SessionPipeline.FILE_PREFIX.length(), name.length() - suffix.length());
                addIfValid(ids, id, file.toString());
            }
        }
    }

    private static void addIfValid(TreeSet<SessionId> ids, String id, String source) {
        if (SessionId.isValid(id)) {
            ids.add(SessionId.parse(id));
        } else {
            LOG.warn("Ignoring invalid session id '{}' from {}", id, source);
        }
    }

    /**
     * Per-session files in {@code dir} except those of the {@code excluded} sessions.
     */
    static List<Path> finishedSessionFiles(Path dir, String suffix, Set<String> excluded) {
        List<Path> files = new ArrayList<>();
        for (Path file : filesWithSuffix(dir, suffix)) {
            String name = file.getFileName().toString();
            String session = name.substring(0, name.length() - suffix.length());
            if (excluded.contains(session)) {
                LOG.warn("Skipping {} of timed-out session {}", name, session);
            } else {
                files.add(file);
            }
        }
        return files;
    }

    private static List<Path> filesWithSuffix(Path dir, String suffix) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(suffix))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new CorpusIoException("list", dir, e);
        }
    }

    private static void logSummary(PipelineSummary summary) {
        LOG.info("Pipeline summary: sessions={}, kept={}, dropped={}, queued={}, unresolved={}, failed={}",
                summary.sessions().size(), summary.kept(), summary.dropped(), summary.queued(),
                summary.unresolved(), summary.failures().size());
        for (SessionReport failed : summary.failures()) {
            LOG.warn("Session {} failed: {}", failed.session(), failed.failureReason());
        }
        if (summary.assembly() != null) {
            LOG.info("Corpus: records={}, sessions={}, speakers={}, conflicts={}, filtered={}, vocabulary={}",
                    summary.assembly().writtenRecords(), summary.assembly().sessions(),
                    summary.assembly().speakers(), summary.assembly().conflictCount(),
                    summary.assembly().filteredMinority(), summary.vocabularySize());
        }
    }
}
