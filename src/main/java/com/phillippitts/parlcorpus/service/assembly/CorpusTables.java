package com.phillippitts.parlcorpus.service.assembly;

import com.phillippitts.parlcorpus.domain.CorpusRecord;
import com.phillippitts.parlcorpus.domain.SessionId;
import com.phillippitts.parlcorpus.domain.SpeakerId;
import com.phillippitts.parlcorpus.exception.CorpusIoException;
import com.phillippitts.parlcorpus.util.AtomicFiles;
import com.phillippitts.parlcorpus.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Reads and writes the merged corpus tables.
 *
 * <ul>
 *   <li>{@code segments}: {@code utt_id session start end} (seconds, two decimals)</li>
 *   <li>{@code text}: {@code utt_id canonical_text}</li>
 *   <li>{@code wav.scp}: {@code session audio_path}</li>
 *   <li>{@code spk2utt}: {@code speaker_id utt_id utt_id ...}</li>
 *   <li>{@code utt2spk}: {@code utt_id speaker_id}</li>
 * </ul>
 * Every table is derived from one record list and sorted by its first column. All tables are
 * first written to temporary files in the output directory and then moved over the old ones.
 */
public final class CorpusTables {

    private static final Logger LOG = LogManager.getLogger(CorpusTables.class);

    public static final String SEGMENTS = "segments";
    public static final String TEXT = "text";
    public static final String WAV_SCP = "wav.scp";
    public static final String SPK2UTT = "spk2utt";
    public static final String UTT2SPK = "utt2spk";

    private CorpusTables() {
    }

    /**
     * Reconstructs records from existing {@code segments}, {@code text} and {@code spk2utt}
     * tables. Returns an empty list when the directory holds no segment table. Utterances missing
     * from one of the tables are logged and skipped.
     */
    public static List<CorpusRecord> read(Path outputDir) {
        Path segmentsFile = outputDir.resolve(SEGMENTS);
        if (!Files.isRegularFile(segmentsFile)) {
            return List.of();
        }
        Map<String, String[]> segments = keyed(segmentsFile, 4);
        Map<String, String[]> texts = keyed(outputDir.resolve(TEXT), 2);
        Map<String, String> speakers = new HashMap<>();
        for (String[] row : rows(outputDir.resolve(SPK2UTT))) {
            for (int i = 1; i < row.length; i++) {
                speakers.put(row[i], row[0]);
            }
        }

        List<CorpusRecord> records = new ArrayList<>(segments.size());
        for (Map.Entry<String, String[]> e : segments.entrySet()) {
            String uttId = e.getKey();
            String[] seg = e.getValue();
            String[] text = texts.get(uttId);
            String speaker = speakers.get(uttId);
            if (text == null || speaker == null) {
                LOG.warn("Existing corpus entry {} is missing from the {} table, skipped", uttId,
                        text == null ? TEXT : SPK2UTT);
                continue;
            }
            try {
                records.add(new CorpusRecord(uttId, SessionId.parse(seg[1]), TimeUtils.secondsToCentis(seg[2]),
                        TimeUtils.secondsToCentis(seg[3]), SpeakerId.parse(speaker), text[1]));
            } catch (IllegalArgumentException ex) {
                LOG.warn("Existing corpus entry {} is malformed, skipped: {}", uttId, ex.getMessage());
            }
        }
        return records;
    }

    private static Map<String, String[]> keyed(Path file, int fields) {
        Map<String, String[]> byId = new LinkedHashMap<>();
        List<String> lines = lines(file);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] row = line.split("\\s+", fields);
            if (row.length < fields) {
                LOG.warn("Skipping table line {}:{}: expected {} fields", file, i + 1, fields);
                continue;
            }
            byId.put(row[0], row);
        }
        return byId;
    }

    private static List<String[]> rows(Path file) {
        List<String[]> rows = new ArrayList<>();
        for (String line : lines(file)) {
            if (!line.isBlank()) {
                rows.add(line.trim().split("\\s+"));
            }
        }
        return rows;
    }

    private static List<String> lines(Path file) {
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CorpusIoException("read corpus table", file, e);
        }
    }

    /**
     * Writes all tables for the given records.
     *
     * @param records   records sorted by utterance id
     * @param audioPath audio path per session
     */
    public static void write(Path outputDir, List<CorpusRecord> records, Function<SessionId, String> audioPath) {
        Map<String, List<String>> tables = new LinkedHashMap<>();
        tables.put(SEGMENTS, segmentLines(records));
        tables.put(TEXT, textLines(records));
        tables.put(WAV_SCP, wavLines(records, audioPath));
        tables.put(SPK2UTT, speakerLines(records));
        tables.put(UTT2SPK, records.stream().map(r -> r.uttId() + " " + r.speakerId()).toList());
        writeAll(outputDir, tables);
    }

    static List<String> segmentLines(List<CorpusRecord> records) {
        return records.stream()
                .map(r -> r.uttId() + " " + r.session() + " " + TimeUtils.centisToSeconds(r.start())
                        + " " + TimeUtils.centisToSeconds(r.end()))
                .toList();
    }

    static List<String> textLines(List<CorpusRecord> records) {
        return records.stream().map(r -> r.uttId() + " " + r.text()).toList();
    }

    static List<String> wavLines(List<CorpusRecord> records, Function<SessionId, String> audioPath) {
        TreeMap<String, String> bySession = new TreeMap<>();
        for (CorpusRecord r : records) {
            bySession.computeIfAbsent(r.session().toString(), k -> audioPath.apply(r.session()));
        }
        return bySession.entrySet().stream().map(e -> e.getKey() + " " + e.getValue()).toList();
    }

    /**
     * Speaker index: speaker id followed by its sorted utterance ids, one speaker per line.
     */
    static List<String> speakerLines(List<CorpusRecord> records) {
        TreeMap<String, TreeSet<String>> bySpeaker = new TreeMap<>();
        for (CorpusRecord r : records) {
            bySpeaker.computeIfAbsent(r.speakerId().toString(), k -> new TreeSet<>()).add(r.uttId());
        }
        return bySpeaker.entrySet().stream()
                .map(e -> e.getKey() + " " + String.join(" ", e.getValue()))
                .toList();
    }

    /**
     * Writes every table to a temporary file first, then moves each into place.
     */
    static void writeAll(Path outputDir, Map<String, List<String>> tables) {
        Map<String, Path> staged = new LinkedHashMap<>();
        try {
            Files.createDirectories(outputDir);
            for (Map.Entry<String, List<String>> table : tables.entrySet()) {
                staged.put(table.getKey(), AtomicFiles.stage(outputDir, table.getKey(), table.getValue()));
            }
            for (Map.Entry<String, Path> s : staged.entrySet()) {
                AtomicFiles.moveReplacing(s.getValue(), outputDir.resolve(s.getKey()));
            }
        } catch (IOException e) {
            for (Path tmp : staged.values()) {
                AtomicFiles.deleteQuietly(tmp, e);
            }
            throw new CorpusIoException("write corpus tables in", outputDir, e);
        }
    }
}
