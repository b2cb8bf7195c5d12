package com.phillippitts.parlcorpus.service.decoder;

import com.phillippitts.parlcorpus.domain.CandidateSegment;
import com.phillippitts.parlcorpus.domain.EditSummary;
import com.phillippitts.parlcorpus.domain.SessionId;
import com.phillippitts.parlcorpus.exception.CorpusFormatException;
import com.phillippitts.parlcorpus.exception.CorpusIoException;
import com.phillippitts.parlcorpus.service.reconcile.WordEditDistance;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads the decoder's per-session candidate segment list.
 *
 * <p>One candidate per line:
 * <pre>
 * &lt;start_cs&gt; &lt;end_cs&gt; &lt;hypothesis words...&gt; [| &lt;decoder reference words...&gt;]
 * </pre>
 * Blank lines and lines starting with {@code #} are ignored. Malformed lines (non-integer
 * offsets, negative start, start not before end) are logged and skipped.
 */
public class CandidateFileReader {

    private static final Logger LOG = LogManager.getLogger(CandidateFileReader.class);

    /**
     * Reads all well-formed candidates of a session file, in file order.
     *
     * @throws CorpusIoException if the file cannot be read
     */
    public List<CandidateSegment> read(SessionId session, Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CorpusIoException("read decoder output", file, e);
        }
        List<CandidateSegment> candidates = new ArrayList<>(lines.size());
        int malformed = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            try {
                candidates.add(parseLine(session, file.toString(), i + 1, line));
            } catch (CorpusFormatException e) {
                LOG.warn("Skipping candidate: {}", e.getMessage());
                malformed++;
            }
        }
        if (malformed > 0) {
            LOG.warn("Session {}: skipped {} malformed candidate lines in {}", session, malformed, file);
        }
        return candidates;
    }

    static CandidateSegment parseLine(SessionId session, String file, int lineNumber, String line) {
        String hypothesisPart = line;
        String referencePart = "";
        int bar = line.indexOf('|');
        if (bar >= 0) {
            hypothesisPart = line.substring(0, bar);
            referencePart = line.substring(bar + 1).trim();
        }
        String[] fields = hypothesisPart.trim().split("\\s+", 3);
        if (fields.length < 2) {
            throw new CorpusFormatException(file, lineNumber, "expected start and end offsets");
        }
        long start;
        long end;
        try {
            start = Long.parseLong(fields[0]);
            end = Long.parseLong(fields[1]);
        } catch (NumberFormatException e) {
            throw new CorpusFormatException(file, lineNumber, "offsets must be integer centiseconds", e);
        }
        if (start < 0 || start >= end) {
            throw new CorpusFormatException(file, lineNumber, "invalid span " + start + ".." + end);
        }
        String hypothesis = fields.length > 2 ? fields[2].trim() : "";
        EditSummary edits = referencePart.isEmpty()
                ? EditSummary.NONE
                : WordEditDistance.summary(words(referencePart), words(hypothesis));
        return new CandidateSegment(session, start, end, hypothesis, referencePart, edits);
    }

    private static List<String> words(String text) {
        return text.isBlank() ? List.of() : Arrays.asList(text.trim().split("\\s+"));
    }
}
