package com.phillippitts.parlcorpus.service.speaker;

import com.phillippitts.parlcorpus.domain.SpeakerEntry;
import com.phillippitts.parlcorpus.domain.SpeakerId;
import com.phillippitts.parlcorpus.exception.SpeakerTableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reads the pipe-separated speaker lookup table.
 *
 * <p>The first non-blank line is a header naming at least {@code mp_id}, {@code firstname} and
 * {@code lastname}; an optional {@code variants} column holds {@code ;}-separated alternative
 * full names. Rows with a missing or non-positive id are skipped.
 */
public final class SpeakerTableLoader {

    private static final Logger LOG = LogManager.getLogger(SpeakerTableLoader.class);
    private static final Pattern SEPARATOR = Pattern.compile("\\|");

    private SpeakerTableLoader() {
    }

    /**
     * Loads the table; a missing file yields an empty table.
     *
     * @throws SpeakerTableException if the file exists but cannot be read or lacks a usable header
     */
    public static SpeakerTable load(Path path, NameNormalizer normalizer) {
        if (!Files.isRegularFile(path)) {
            LOG.warn("Speaker table not found at {}; every speaker will be unresolved", path);
            return new SpeakerTable(List.of(), normalizer);
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SpeakerTableException(path.toString(), e);
        }
        List<SpeakerEntry> entries = parse(lines, path.toString());
        LOG.info("Loaded {} speakers from {}", entries.size(), path);
        return new SpeakerTable(entries, normalizer);
    }

    static List<SpeakerEntry> parse(List<String> lines, String source) {
        int headerLine = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (!lines.get(i).isBlank()) {
                headerLine = i;
                break;
            }
        }
        if (headerLine < 0) {
            return List.of();
        }
        List<String> header = Arrays.stream(SEPARATOR.split(lines.get(headerLine), -1))
                .map(h -> h.trim().toLowerCase(Locale.ROOT))
                .toList();
        int idCol = header.indexOf("mp_id");
        int firstCol = header.indexOf("firstname");
        int lastCol = header.indexOf("lastname");
        int variantsCol = header.indexOf("variants");
        if (idCol < 0 || firstCol < 0 || lastCol < 0) {
            throw new SpeakerTableException(source, "header must name mp_id, firstname and lastname");
        }

        List<SpeakerEntry> entries = new ArrayList<>();
        for (int i = headerLine + 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            String[] cols = SEPARATOR.split(line, -1);
            try {
                int id = Integer.parseInt(column(cols, idCol));
                List<String> variants = variantsCol < 0 || column(cols, variantsCol).isEmpty()
                        ? List.of()
                        : Arrays.stream(column(cols, variantsCol).split(";"))
                                .map(String::trim)
                                .filter(v -> !v.isEmpty())
                                .toList();
                entries.add(new SpeakerEntry(SpeakerId.of(id), column(cols, firstCol),
                        column(cols, lastCol), variants));
            } catch (IllegalArgumentException e) {
                LOG.warn("Skipping speaker table row {}:{}: {}", source, i + 1, e.getMessage());
            }
        }
        return entries;
    }

    private static String column(String[] cols, int index) {
        return index < cols.length ? cols[index].trim() : "";
    }
}
