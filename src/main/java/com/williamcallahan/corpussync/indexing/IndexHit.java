package com.williamcallahan.corpussync.indexing;

import com.williamcallahan.corpussync.domain.ItemIdentity;
import java.util.Objects;

/**
 * One ranked candidate returned by a vector or lexical index.
 *
 * @param identity matched item identity
 * @param recordId record version the entry was built from
 * @param score backend-native score, higher is better
 */
public record IndexHit(ItemIdentity identity, String recordId, double score) {

    public IndexHit {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(recordId, "recordId");
    }
}
