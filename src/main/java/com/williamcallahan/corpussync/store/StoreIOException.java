package com.williamcallahan.corpussync.store;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Signals that a durable store could not read or append its journal.
 *
 * <p>Store operations that throw this exception have not been applied in memory, so the
 * caller may treat the write as not having happened.</p>
 */
public class StoreIOException extends UncheckedIOException {

    /**
     * Creates an exception with a message and the underlying I/O failure.
     *
     * @param message explanation including the affected journal
     * @param cause underlying I/O failure
     */
    public StoreIOException(String message, IOException cause) {
        super(message, cause);
    }
}
