package com.phillippitts.parlcorpus.service.language;

import com.phillippitts.parlcorpus.domain.CorpusRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Post-assembly lexical pass that removes records which still look like minority-language
 * speech.
 *
 * <p>The filter works on the merged record set from which every corpus table is derived, so a
 * removed utterance disappears from the segment, text, audio-path and speaker tables together.
 */
public class SecondaryLanguageFilter {

    private static final Logger LOG = LogManager.getLogger(SecondaryLanguageFilter.class);

    private final MinorityStoplist stoplist;
    private final int minHits;
    private final double minDensity;

    public SecondaryLanguageFilter(MinorityStoplist stoplist, int minHits, double minDensity) {
        if (minHits < 1) {
            throw new IllegalArgumentException("minHits must be at least 1");
        }
        if (minDensity < 0.0 || minDensity > 1.0) {
            throw new IllegalArgumentException("minDensity in [0,1]");
        }
        this.stoplist = stoplist;
        this.minHits = minHits;
        this.minDensity = minDensity;
    }

    /**
     * Partitions records into those kept and those removed as minority language.
     */
    public FilterResult filter(List<CorpusRecord> records) {
        List<CorpusRecord> kept = new ArrayList<>(records.size());
        List<CorpusRecord> removed = new ArrayList<>();
        for (CorpusRecord r : records) {
            if (isMinority(r.text())) {
                removed.add(r);
            } else {
                kept.add(r);
            }
        }
        if (!removed.isEmpty()) {
            LOG.info("Secondary language filter removed {} of {} records", removed.size(), records.size());
        }
        return new FilterResult(List.copyOf(kept), List.copyOf(removed));
    }

    boolean isMinority(String text) {
        List<String> tokens = MinorityStoplist.tokens(text);
        if (tokens.isEmpty()) {
            return false;
        }
        int hits = stoplist.hits(tokens);
        return hits >= minHits && (double) hits / tokens.size() >= minDensity;
    }

    /**
     * Records surviving the filter and records removed by it.
     */
    public record FilterResult(List<CorpusRecord> kept, List<CorpusRecord> removed) {
    }
}
