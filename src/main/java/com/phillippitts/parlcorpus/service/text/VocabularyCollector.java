package com.phillippitts.parlcorpus.service.text;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Distinct normalized words of one session.
 *
 * <p>Each session owns its own collector; the per-session word files are combined by
 * {@link com.phillippitts.parlcorpus.service.assembly.VocabularyAssembler}. Not thread-safe.
 */
public class VocabularyCollector {

    private final Set<String> words = new HashSet<>();

    /**
     * Adds every word of already normalized text.
     */
    public void addCanonical(String canonicalText) {
        if (canonicalText == null || canonicalText.isBlank()) {
            return;
        }
        for (String w : canonicalText.trim().split("\\s+")) {
            words.add(w);
        }
    }

    public int size() {
        return words.size();
    }

    public boolean contains(String word) {
        return words.contains(word);
    }

    /**
     * Words in sorted order.
     */
    public List<String> sorted() {
        return List.copyOf(new TreeSet<>(words));
    }
}
