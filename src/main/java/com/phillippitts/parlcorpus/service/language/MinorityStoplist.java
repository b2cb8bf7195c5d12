package com.phillippitts.parlcorpus.service.language;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fixed list of minority-language function words matched against whole tokens.
 *
 * <p>Quoted minority-language phrases inside majority-language speech match too; callers
 * accept that as a known limitation of the heuristic.
 */
public final class MinorityStoplist {

    private final Set<String> words;

    public MinorityStoplist(Collection<String> words) {
        this.words = words.stream()
                .filter(w -> w != null && !w.isBlank())
                .map(w -> Normalizer.normalize(w.trim(), Normalizer.Form.NFC).toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean contains(String token) {
        return token != null && words.contains(token);
    }

    /**
     * Splits text into lower-case letter tokens.
     */
    public static List<String> tokens(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String lowered = Normalizer.normalize(text, Normalizer.Form.NFC).toLowerCase(Locale.ROOT);
        return Arrays.stream(lowered.split("[^\\p{L}]+"))
                .filter(t -> !t.isEmpty())
                .toList();
    }

    /**
     * Number of the given tokens that are stoplist words.
     */
    public int hits(List<String> tokens) {
        int n = 0;
        for (String t : tokens) {
            if (words.contains(t)) {
                n++;
            }
        }
        return n;
    }

    public Set<String> words() {
        return words;
    }
}
