package com.phillippitts.parlcorpus.service.assembly;

import com.phillippitts.parlcorpus.domain.CorpusRecord;
import com.phillippitts.parlcorpus.domain.SessionId;
import com.phillippitts.parlcorpus.service.language.SecondaryLanguageFilter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges per-session record files and the existing corpus tables into one corpus.
 *
 * <p>This is the single serialization point of a pipeline run. It is called once, after every
 * session task has reached a terminal state, and performs these steps:
 * <ol>
 *   <li><b>Collect:</b> reads every {@code .records} file handed in plus the current tables
 *       in the output directory, so earlier runs and sessions not processed now stay in</li>
 *   <li><b>Merge:</b> sort-unique merge by utterance id through {@link SortedRecordMerger};
 *       identical records collapse, differing variants of one id become a {@link MergeConflict}
 *       and all of them are excluded</li>
 *   <li><b>Audio Check:</b> with {@code corpus.require-existing-audio}, records of sessions
 *       whose audio file is missing are excluded</li>
 *   <li><b>Language Filter:</b> the optional {@link SecondaryLanguageFilter} prunes
 *       minority-language records; they are listed in {@value #FILTERED_SEGMENTS} and
 *       {@value #FILTERED_TEXT}</li>
 *   <li><b>Write:</b> all tables are derived from the one surviving record list and replaced
 *       through staged files by {@link CorpusTables}</li>
 * </ol>
 *
 * <p><b>Idempotence:</b> merging is commutative, and reading the previous tables back as an
 * input means a rerun over the same files yields byte-identical tables.
 *
 * <p><b>Diagnostics:</b> conflicts are written to {@value #CONFLICTS}, one line per utterance
 * id: the id followed by each variant's {@code speaker text}, tab-separated.
 *
 * @see SortedRecordMerger
 * @see CorpusTables
 * @see com.phillippitts.parlcorpus.service.orchestration.DefaultCorpusPipeline
 * @since 0.1
 */
public class CorpusAssembler {

    private static final Logger LOG = LogManager.getLogger(CorpusAssembler.class);

    public static final String CONFLICTS = "conflicts";
    public static final String FILTERED_SEGMENTS = "filtered_minority.segments";
    public static final String FILTERED_TEXT = "filtered_minority.text";

    private final AudioPathResolver audioPaths;
    private final SecondaryLanguageFilter filter;
    private final boolean requireExistingAudio;

    /**
     * @param audioPaths           session audio locations
     * @param filter               secondary language filter, or null to skip filtering
     * @param requireExistingAudio exclude records whose audio file is missing
     */
    public CorpusAssembler(AudioPathResolver audioPaths, SecondaryLanguageFilter filter,
                           boolean requireExistingAudio) {
        this.audioPaths = audioPaths;
        this.filter = filter;
        this.requireExistingAudio = requireExistingAudio;
    }

    /**
     * Assembles the corpus tables in {@code outputDir}.
     *
     * @param sessionRecordFiles per-session {@code .records} files
     * @param outputDir          directory of the corpus tables, created if needed
     * @return counts and conflicts of this assembly
     */
    public AssemblyReport assemble(List<Path> sessionRecordFiles, Path outputDir) {
        List<List<CorpusRecord>> inputs = new ArrayList<>(sessionRecordFiles.size() + 1);
        int inputRecords = 0;
        for (Path file : sessionRecordFiles) {
            List<CorpusRecord> records = SessionRecordFile.read(file);
            inputRecords += records.size();
            inputs.add(records);
        }
        List<CorpusRecord> existing = CorpusTables.read(outputDir);
        inputRecords += existing.size();
        inputs.add(existing);

        SortedRecordMerger.MergeResult merged = SortedRecordMerger.merge(inputs);
        for (MergeConflict c : merged.conflicts()) {
            LOG.warn("Conflicting variants for {} excluded ({} variants)", c.uttId(), c.variants().size());
        }

        List<CorpusRecord> records = merged.records();
        int missingAudio = 0;
        if (requireExistingAudio) {
            Map<SessionId, Boolean> present = new HashMap<>();
            List<CorpusRecord> withAudio = new ArrayList<>(records.size());
            for (CorpusRecord r : records) {
                if (present.computeIfAbsent(r.session(), audioPaths::exists)) {
                    withAudio.add(r);
                } else {
                    missingAudio++;
                }
            }
            present.forEach((session, found) -> {
                if (!found) {
                    LOG.warn("Audio for session {} not found at {}, its records are excluded",
                            session, audioPaths.resolve(session));
                }
            });
            records = withAudio;
        }

        List<CorpusRecord> removed = List.of();
        if (filter != null) {
            SecondaryLanguageFilter.FilterResult result = filter.filter(records);
            records = result.kept();
            removed = result.removed();
        }

        CorpusTables.write(outputDir, records, audioPaths::resolve);
        Map<String, List<String>> diagnostics = new LinkedHashMap<>();
        diagnostics.put(CONFLICTS, merged.conflicts().stream().map(MergeConflict::toLine).toList());
        diagnostics.put(FILTERED_SEGMENTS, CorpusTables.segmentLines(removed));
        diagnostics.put(FILTERED_TEXT, CorpusTables.textLines(removed));
        CorpusTables.writeAll(outputDir, diagnostics);

        AssemblyReport report = new AssemblyReport(
                inputRecords,
                records.size(),
                merged.conflicts(),
                missingAudio,
                removed.size(),
                (int) records.stream().map(CorpusRecord::session).distinct().count(),
                (int) records.stream().map(CorpusRecord::speakerId).distinct().count());
        LOG.info("Assembled {} records from {} inputs into {} (conflicts={}, missingAudio={}, filtered={})",
                report.writtenRecords(), sessionRecordFiles.size(), outputDir, report.conflictCount(),
                missingAudio, removed.size());
        return report;
    }
}
