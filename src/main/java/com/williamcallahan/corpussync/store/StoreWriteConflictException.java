package com.williamcallahan.corpussync.store;

/**
 * Signals a write that would break the single-current-version invariant or touch history,
 * such as superseding a record that is no longer current.
 *
 * <p>Ownership of identities by exactly one source makes this an internal consistency error
 * rather than an expected race.</p>
 */
public class StoreWriteConflictException extends RuntimeException {

    public StoreWriteConflictException(String message) {
        super(message);
    }
}
