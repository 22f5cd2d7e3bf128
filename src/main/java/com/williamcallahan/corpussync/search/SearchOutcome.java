package com.williamcallahan.corpussync.search;

import java.util.List;

/**
 * Search results plus the notices explaining any degradation.
 *
 * @param hits ranked results, possibly empty
 * @param servedModes modes that actually contributed
 * @param notices human-readable degradation notices, empty when nothing failed
 */
public record SearchOutcome(List<SearchHit> hits, List<SearchMode> servedModes, List<String> notices) {

    public SearchOutcome {
        hits = List.copyOf(hits);
        servedModes = List.copyOf(servedModes);
        notices = List.copyOf(notices);
    }

    public boolean degraded() {
        return !notices.isEmpty();
    }
}
