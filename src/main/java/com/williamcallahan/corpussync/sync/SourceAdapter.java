package com.williamcallahan.corpussync.sync;

import java.time.Instant;
import java.util.Optional;

/**
 * Fetch capabilities of one configured source. Implementations are selected per source by
 * strategy name and must be safe for concurrent {@link #fetchItemContent} calls.
 *
 * <p>Implementations throw {@link TransientFetchException} for failures worth retrying,
 * {@link MalformedItemException} for unusable items and {@link SourceFetchException} for
 * permanent upstream errors.</p>
 */
public interface SourceAdapter {

    /**
     * Lists the upstream items visible from {@code cursor}.
     *
     * @param cursor last committed cursor, empty on the first cycle
     * @return listing with the cursor to commit afterwards
     */
    SourceListing fetchListing(String cursor);

    /**
     * Returns whether {@link #fetchItemContent} honours the {@code ifModifiedSince} hint.
     */
    boolean supportsConditionalFetch();

    /**
     * Fetches one item.
     *
     * @param item listed item
     * @param ifModifiedSince last confirmation of the stored version; when present and the
     *        adapter supports it, the upstream may answer "not modified"
     * @return fetched content, or a not-modified marker
     */
    ItemContent fetchItemContent(ListedItem item, Optional<Instant> ifModifiedSince);
}
