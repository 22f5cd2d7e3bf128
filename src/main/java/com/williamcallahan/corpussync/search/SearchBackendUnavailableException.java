package com.williamcallahan.corpussync.search;

import java.util.List;

/**
 * Raised when no requested retrieval mode could be served, so an empty result would be a lie.
 */
public class SearchBackendUnavailableException extends RuntimeException {

    private final List<String> failures;

    public SearchBackendUnavailableException(String message, List<String> failures) {
        super(message);
        this.failures = List.copyOf(failures);
    }

    public List<String> failures() {
        return failures;
    }
}
