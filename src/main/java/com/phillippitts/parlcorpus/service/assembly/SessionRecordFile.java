package com.phillippitts.parlcorpus.service.assembly;

import com.phillippitts.parlcorpus.domain.CorpusRecord;
import com.phillippitts.parlcorpus.domain.SessionId;
import com.phillippitts.parlcorpus.domain.SpeakerId;
import com.phillippitts.parlcorpus.exception.CorpusFormatException;
import com.phillippitts.parlcorpus.exception.CorpusIoException;
import com.phillippitts.parlcorpus.util.AtomicFiles;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Per-session file of kept records.
 *
 * <p>One record per line: {@code utt_id session start_cs end_cs speaker_id text...}, sorted by
 * utterance id. A session run merges its kept records into the existing file, so reprocessing a
 * session never duplicates or loses earlier records. Differing variants of one utterance id are
 * both kept here and reported as a conflict by the assembler.
 */
public final class SessionRecordFile {

    private static final Logger LOG = LogManager.getLogger(SessionRecordFile.class);

    /** File name suffix of per-session record files. */
    public static final String SUFFIX = ".records";

    private SessionRecordFile() {
    }

    /**
     * Reads a record file; malformed lines are logged and skipped. A missing file has no records.
     */
    public static List<CorpusRecord> read(Path file) {
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CorpusIoException("read records", file, e);
        }
        List<CorpusRecord> records = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            try {
                records.add(parseLine(file.toString(), i + 1, line));
            } catch (CorpusFormatException e) {
                LOG.warn("Skipping record: {}", e.getMessage());
            }
        }
        return records;
    }

    static CorpusRecord parseLine(String file, int lineNumber, String line) {
        String[] f = line.split("\\s+", 6);
        if (f.length < 6) {
            throw new CorpusFormatException(file, lineNumber, "expected 6 fields, got " + f.length);
        }
        try {
            return new CorpusRecord(f[0], SessionId.parse(f[1]), Long.parseLong(f[2]), Long.parseLong(f[3]),
                    SpeakerId.parse(f[4]), f[5]);
        } catch (IllegalArgumentException e) {
            throw new CorpusFormatException(file, lineNumber, e.getMessage(), e);
        }
    }

    static String toLine(CorpusRecord r) {
        return r.uttId() + " " + r.session() + " " + r.start() + " " + r.end() + " " + r.speakerId() + " " + r.text();
    }

    /**
     * Merges {@code records} with the file's current content and rewrites it sorted and
     * de-duplicated.
     *
     * @return number of records in the file afterwards
     */
    public static int merge(Path file, Collection<CorpusRecord> records) {
        TreeSet<CorpusRecord> merged = new TreeSet<>(read(file));
        merged.addAll(records);
        write(file, merged);
        return merged.size();
    }

    /**
     * Writes the records sorted, replacing the file through a staged copy.
     */
    public static void write(Path file, Collection<CorpusRecord> records) {
        List<String> lines = new TreeSet<>(records).stream().map(SessionRecordFile::toLine).toList();
        try {
            AtomicFiles.writeLines(file, lines);
        } catch (IOException e) {
            throw new CorpusIoException("write records", file, e);
        }
    }
}
