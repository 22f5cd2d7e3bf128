package com.williamcallahan.corpussync.search;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reciprocal rank fusion over any number of ranked lists.
 *
 * <p>Each candidate scores {@code sum(1 / (k + rank))} over the lists it appears in, with 1-based
 * ranks; a list the candidate is absent from contributes nothing. Only the first occurrence of a
 * candidate in a list counts.</p>
 */
public final class ReciprocalRankFusion {

    private ReciprocalRankFusion() {}

    /**
     * Fuses the rankings.
     *
     * @param rankings ranked lists, best first
     * @param k smoothing constant, positive
     * @param <T> candidate type
     * @return fused score per candidate, in first-seen order
     */
    public static <T> Map<T, Double> fuse(List<List<T>> rankings, int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive");
        }
        Map<T, Double> fused = new LinkedHashMap<>();
        for (List<T> ranking : rankings) {
            Set<T> seen = new HashSet<>();
            int rank = 0;
            for (T candidate : ranking) {
                if (!seen.add(candidate)) {
                    continue;
                }
                rank++;
                fused.merge(candidate, 1.0 / (k + rank), Double::sum);
            }
        }
        return fused;
    }
}
