package com.registry.reconciliation.dedup;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Precedence of source tags: a higher rank wins a duplicate.
 *
 * <p>Tags in the configured priority list rank by their position (last = highest). Tags not
 * in the list rank below every listed tag, ordered among themselves by first appearance in
 * the batch order. With no configured list, batch order alone decides.</p>
 */
public final class SourceRanking {

    private final Map<String, Integer> ranks;

    private SourceRanking(Map<String, Integer> ranks) {
        this.ranks = ranks;
    }

    public static SourceRanking of(List<String> configuredPriority, List<String> batchOrder) {
        Map<String, Integer> ranks = new HashMap<>();
        int next = 0;
        for (String tag : batchOrder) {
            if (!configuredPriority.contains(tag) && !ranks.containsKey(tag)) {
                ranks.put(tag, next++);
            }
        }
        for (String tag : configuredPriority) {
            ranks.put(tag, next++);
        }
        return new SourceRanking(Map.copyOf(ranks));
    }

    /**
     * Returns the rank of a source tag; unknown tags rank lowest.
     */
    public int rankOf(String sourceTag) {
        if (sourceTag == null) {
            return -1;
        }
        return ranks.getOrDefault(sourceTag, -1);
    }
}
