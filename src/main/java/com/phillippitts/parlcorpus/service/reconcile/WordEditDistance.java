package com.phillippitts.parlcorpus.service.reconcile;

import com.phillippitts.parlcorpus.domain.EditOperation;
import com.phillippitts.parlcorpus.domain.EditSummary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Word-level Levenshtein distance between a reference and a hypothesis.
 */
public final class WordEditDistance {

    private WordEditDistance() {
        // Prevent instantiation
    }

    /**
     * Minimal edit script turning {@code reference} into {@code hypothesis}.
     * Among equal-cost scripts, matches and substitutions are preferred over deletions, and
     * deletions over insertions.
     */
    public static List<EditOperation> operations(List<String> reference, List<String> hypothesis) {
        int n = reference.size();
        int m = hypothesis.size();
        int[][] d = new int[n + 1][m + 1];
        for (int i = 0; i <= n; i++) {
            d[i][0] = i;
        }
        for (int j = 0; j <= m; j++) {
            d[0][j] = j;
        }
        for (int i = 1; i <= n; i++) {
            for (int j = 1; j <= m; j++) {
                int cost = reference.get(i - 1).equals(hypothesis.get(j - 1)) ? 0 : 1;
                d[i][j] = Math.min(d[i - 1][j - 1] + cost, Math.min(d[i - 1][j] + 1, d[i][j - 1] + 1));
            }
        }

        List<EditOperation> ops = new ArrayList<>(Math.max(n, m));
        int i = n;
        int j = m;
        while (i > 0 || j > 0) {
            if (i > 0 && j > 0) {
                boolean same = reference.get(i - 1).equals(hypothesis.get(j - 1));
                if (d[i][j] == d[i - 1][j - 1] + (same ? 0 : 1)) {
                    ops.add(same ? EditOperation.MATCH : EditOperation.SUBSTITUTION);
                    i--;
                    j--;
                    continue;
                }
            }
            if (i > 0 && d[i][j] == d[i - 1][j] + 1) {
                ops.add(EditOperation.DELETION);
                i--;
            } else {
                ops.add(EditOperation.INSERTION);
                j--;
            }
        }
        Collections.reverse(ops);
        return ops;
    }

    /**
     * Edit counts between {@code reference} and {@code hypothesis}.
     */
    public static EditSummary summary(List<String> reference, List<String> hypothesis) {
        return EditSummary.of(operations(reference, hypothesis));
    }

    /**
     * Distances between {@code hypothesis} and every prefix of {@code reference} starting at
     * {@code start}, up to {@code maxLength} words, computed in one pass.
     *
     * @return array {@code r} where {@code r[len]} is the distance to
     *         {@code reference[start, start + len)}; its length is
     *         {@code min(maxLength, reference.size() - start) + 1}
     */
    public static int[] prefixDistances(List<String> reference, int start, int maxLength, List<String> hypothesis) {
        int available = Math.max(0, Math.min(maxLength, reference.size() - start));
        int m = hypothesis.size();
        int[] result = new int[available + 1];
        int[] prev = new int[m + 1];
        int[] cur = new int[m + 1];
        for (int j = 0; j <= m; j++) {
            prev[j] = j;
        }
        result[0] = m;
        for (int i = 1; i <= available; i++) {
            String refWord = reference.get(start + i - 1);
            cur[0] = i;
            for (int j = 1; j <= m; j++) {
                int cost = refWord.equals(hypothesis.get(j - 1)) ? 0 : 1;
                cur[j] = Math.min(prev[j - 1] + cost, Math.min(prev[j] + 1, cur[j - 1] + 1));
            }
            result[i] = cur[m];
            int[] tmp = prev;
            prev = cur;
            cur = tmp;
        }
        return result;
    }
}
