package com.phillippitts.parlcorpus.service.reconcile;

import com.phillippitts.parlcorpus.domain.CandidateSegment;
import com.phillippitts.parlcorpus.domain.RetryEntry;
import com.phillippitts.parlcorpus.domain.SessionId;
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
import java.util.Comparator;
import java.util.List;

/**
 * Session spans queued for a further alignment pass by an earlier run.
 *
 * <p>File format, one entry per line: {@code session start_cs end_cs attempt}.
 */
public final class RetryList {

    private static final Logger LOG = LogManager.getLogger(RetryList.class);

    private static final RetryList EMPTY = new RetryList(List.of());

    private final List<RetryEntry> entries;

    public RetryList(List<RetryEntry> entries) {
        this.entries = List.copyOf(entries);
    }

    public static RetryList empty() {
        return EMPTY;
    }

    /**
     * Highest attempt of the entries overlapping the candidate, 0 when none does.
     */
    public int attemptFor(CandidateSegment candidate) {
        int attempt = 0;
        for (RetryEntry e : entries) {
            if (e.overlaps(candidate)) {
                attempt = Math.max(attempt, e.attempt());
            }
        }
        return attempt;
    }

    public List<RetryEntry> entries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Reads a retry file; a missing file is an empty list and malformed lines are skipped.
     */
    public static RetryList read(Path file) {
        if (!Files.isRegularFile(file)) {
            return EMPTY;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CorpusIoException("read retry list", file, e);
        }
        List<RetryEntry> entries = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            try {
                entries.add(parseLine(file.toString(), i + 1, line));
            } catch (CorpusFormatException e) {
                LOG.warn("Skipping retry entry: {}", e.getMessage());
            }
        }
        return new RetryList(entries);
    }

    static RetryEntry parseLine(String file, int lineNumber, String line) {
        String[] parts = line.split("\\s+");
        if (parts.length != 4) {
            throw new CorpusFormatException(file, lineNumber, "expected 4 fields, got " + parts.length);
        }
        try {
            return new RetryEntry(SessionId.parse(parts[0]), Long.parseLong(parts[1]),
                    Long.parseLong(parts[2]), Integer.parseInt(parts[3]));
        } catch (IllegalArgumentException e) {
            throw new CorpusFormatException(file, lineNumber, e.getMessage(), e);
        }
    }

    /**
     * Writes the entries sorted by start and end, replacing the file.
     */
    public static void write(Path file, List<RetryEntry> entries) {
        List<String> lines = entries.stream()
                .sorted(Comparator.comparingLong(RetryEntry::start).thenComparingLong(RetryEntry::end))
                .map(RetryEntry::toLine)
                .toList();
        try {
            AtomicFiles.writeLines(file, lines);
        } catch (IOException e) {
            throw new CorpusIoException("write retry list", file, e);
        }
    }
}
