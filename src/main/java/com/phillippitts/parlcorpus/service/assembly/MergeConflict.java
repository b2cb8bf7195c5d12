package com.phillippitts.parlcorpus.service.assembly;

import com.phillippitts.parlcorpus.domain.CorpusRecord;

import java.util.List;

/**
 * Two or more accepted records sharing an utterance id with different fields.
 * All variants are excluded from the corpus.
 *
 * @param uttId    shared utterance id
 * @param variants the differing records, sorted
 */
public record MergeConflict(String uttId, List<CorpusRecord> variants) {

    public MergeConflict {
        variants = List.copyOf(variants);
        if (variants.size() < 2) {
            throw new IllegalArgumentException("A conflict needs at least two variants of " + uttId);
        }
    }

    /** Diagnostic line: id followed by each variant's speaker and text. */
    public String toLine() {
        StringBuilder sb = new StringBuilder(uttId);
        for (CorpusRecord v : variants) {
            sb.append('\t').append(v.speakerId()).append(' ').append(v.text());
        }
        return sb.toString();
    }
}
