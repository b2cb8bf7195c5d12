package com.phillippitts.parlcorpus.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattened canonical words of a session transcript with the turn that owns each word.
 *
 * <p>Reconciliation searches spans of this list; labeling maps a span back to the covered turns.
 */
public final class ReferenceWords {

    private final List<String> words;
    private final int[] owners;

    private ReferenceWords(List<String> words, int[] owners) {
        this.words = List.copyOf(words);
        this.owners = owners;
    }

    /**
     * Builds the index from the canonical text of the given turns, in turn order.
     */
    public static ReferenceWords of(List<SpeechTurn> turns) {
        List<String> words = new ArrayList<>();
        List<Integer> owners = new ArrayList<>();
        for (int t = 0; t < turns.size(); t++) {
            String text = turns.get(t).canonicalText();
            if (text.isBlank()) {
                continue;
            }
            for (String w : text.trim().split("\\s+")) {
                words.add(w);
                owners.add(t);
            }
        }
        int[] ownerArray = new int[owners.size()];
        for (int i = 0; i < ownerArray.length; i++) {
            ownerArray[i] = owners.get(i);
        }
        return new ReferenceWords(words, ownerArray);
    }

    public int size() {
        return words.size();
    }

    public List<String> words() {
        return words;
    }

    /**
     * Words {@code [start, start + length)}; the range is clipped to the list.
     */
    public List<String> span(int start, int length) {
        int from = Math.max(0, Math.min(start, words.size()));
        int to = Math.max(from, Math.min(start + length, words.size()));
        return words.subList(from, to);
    }

    /**
     * Position in the turn list of the turn owning word {@code wordIndex}.
     */
    public int ownerOf(int wordIndex) {
        return owners[wordIndex];
    }
}
