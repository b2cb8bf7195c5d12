package com.phillippitts.parlcorpus.service.assembly;

import com.phillippitts.parlcorpus.domain.CorpusRecord;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.TreeSet;

/**
 * Sort-then-unique merge of record lists by utterance id.
 *
 * <p>Each input is sorted on its own, then all inputs are merged through a priority queue.
 * Identical records collapse into one; an utterance id with differing variants becomes a
 * {@link MergeConflict} and none of its variants is emitted. The result depends only on the
 * multiset of input records, so merging is commutative, associative and idempotent.
 */
public final class SortedRecordMerger {

    private SortedRecordMerger() {
    }

    /**
     * Merges the inputs.
     *
     * @param inputs record lists in any order; they are not modified
     */
    public static MergeResult merge(List<? extends List<CorpusRecord>> inputs) {
        PriorityQueue<Head> queue = new PriorityQueue<>();
        for (List<CorpusRecord> input : inputs) {
            List<CorpusRecord> sorted = new ArrayList<>(input);
            sorted.sort(null);
            Iterator<CorpusRecord> it = sorted.iterator();
            if (it.hasNext()) {
                queue.add(new Head(it.next(), it));
            }
        }

        List<CorpusRecord> merged = new ArrayList<>();
        List<MergeConflict> conflicts = new ArrayList<>();
        String currentId = null;
        TreeSet<CorpusRecord> variants = new TreeSet<>();
        while (!queue.isEmpty()) {
            Head head = queue.poll();
            CorpusRecord record = head.record();
            if (!record.uttId().equals(currentId)) {
                flush(currentId, variants, merged, conflicts);
                currentId = record.uttId();
                variants = new TreeSet<>();
            }
            variants.add(record);
            if (head.rest().hasNext()) {
                queue.add(new Head(head.rest().next(), head.rest()));
            }
        }
        flush(currentId, variants, merged, conflicts);
        return new MergeResult(merged, conflicts);
    }

    private static void flush(String uttId, TreeSet<CorpusRecord> variants, List<CorpusRecord> merged,
                              List<MergeConflict> conflicts) {
        if (uttId == null || variants.isEmpty()) {
            return;
        }
        if (variants.size() == 1) {
            merged.add(variants.first());
        } else {
            conflicts.add(new MergeConflict(uttId, new ArrayList<>(variants)));
        }
    }

    private record Head(CorpusRecord record, Iterator<CorpusRecord> rest) implements Comparable<Head> {
        @Override
        public int compareTo(Head other) {
            return record.compareTo(other.record);
        }
    }

    /**
     * Merged records sorted by utterance id, and the excluded conflicts.
     */
    public record MergeResult(List<CorpusRecord> records, List<MergeConflict> conflicts) {
        public MergeResult {
            records = List.copyOf(records);
            conflicts = List.copyOf(conflicts);
        }
    }
}
