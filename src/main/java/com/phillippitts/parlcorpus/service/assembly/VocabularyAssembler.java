package com.phillippitts.parlcorpus.service.assembly;

import com.phillippitts.parlcorpus.exception.CorpusIoException;
import com.phillippitts.parlcorpus.util.AtomicFiles;
import com.phillippitts.parlcorpus.service.language.MinorityStoplist;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds the corpus vocabulary from per-session word files.
 *
 * <p>Word files hold one word per line. The vocabulary is the sorted union of all session word
 * files and the existing vocabulary, minus minority-language stoplist words and the optional
 * minority word list.
 */
public class VocabularyAssembler {

    private static final Logger LOG = LogManager.getLogger(VocabularyAssembler.class);

    /** File name suffix of per-session word files. */
    public static final String SUFFIX = ".words";

    private final Set<String> excluded;

    /**
     * @param stoplist      minority-language function words
     * @param minorityWords additional words never added to the vocabulary
     */
    public VocabularyAssembler(MinorityStoplist stoplist, Collection<String> minorityWords) {
        TreeSet<String> all = new TreeSet<>(stoplist.words());
        for (String w : minorityWords) {
            if (w != null && !w.isBlank()) {
                all.add(w.trim());
            }
        }
        this.excluded = Set.copyOf(all);
    }

    /**
     * Merges the word files into {@code outputFile}.
     *
     * @return number of words in the written vocabulary
     */
    public int assemble(List<Path> wordFiles, Path outputFile) {
        TreeSet<String> vocabulary = new TreeSet<>(readWords(outputFile));
        for (Path file : wordFiles) {
            vocabulary.addAll(readWords(file));
        }
        int before = vocabulary.size();
        vocabulary.removeAll(excluded);
        if (before != vocabulary.size()) {
            LOG.debug("Excluded {} minority words from the vocabulary", before - vocabulary.size());
        }
        Path dir = outputFile.toAbsolutePath().getParent();
        CorpusTables.writeAll(dir, Map.of(outputFile.getFileName().toString(), List.copyOf(vocabulary)));
        LOG.info("Vocabulary of {} words written to {}", vocabulary.size(), outputFile);
        return vocabulary.size();
    }

    /**
     * Reads a word list, one word per line; a missing file is empty.
     */
    public static List<String> readWords(Path file) {
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8).stream()
                    .map(String::trim)
                    .filter(w -> !w.isEmpty())
                    .toList();
        } catch (IOException e) {
            throw new CorpusIoException("read word list", file, e);
        }
    }

    /**
     * Merges words into a word file, keeping it sorted and unique.
     *
     * @return number of words in the file afterwards
     */
    public static int mergeWords(Path file, Collection<String> words) {
        TreeSet<String> merged = new TreeSet<>(readWords(file));
        merged.addAll(words);
        try {
            AtomicFiles.writeLines(file, merged);
        } catch (IOException e) {
            throw new CorpusIoException("write word list", file, e);
        }
        return merged.size();
    }
}
