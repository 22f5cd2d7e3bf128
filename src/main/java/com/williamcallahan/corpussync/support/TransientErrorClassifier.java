package com.williamcallahan.corpussync.support;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.RestClientResponseException;

/**
 * Decides whether a failure from an upstream source, the embedding service or an index backend
 * is transient and worth retrying.
 */
public final class TransientErrorClassifier {

    private TransientErrorClassifier() {}

    /**
     * Walks the cause chain looking for a transient signal.
     *
     * <p>Transient errors include network I/O failures, timeouts, rate limits (429), server
     * errors (5xx) and gRPC UNAVAILABLE / DEADLINE_EXCEEDED / RESOURCE_EXHAUSTED statuses.
     * Programming errors such as {@link IllegalArgumentException} are never transient.
     *
     * @param error failure to classify
     * @return true if a retry may succeed
     */
    public static boolean isTransient(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof TransientFailure
                    || current instanceof IOException
                    || current instanceof UncheckedIOException
                    || current instanceof TimeoutException) {
                return true;
            }
            if (current instanceof RestClientResponseException responseException) {
                int status = responseException.getStatusCode().value();
                return status == HttpStatus.TOO_MANY_REQUESTS.value() || status >= 500;
            }
            if (current instanceof IllegalArgumentException || current instanceof IllegalStateException) {
                return false;
            }
            if (isTransientGrpcStatus(current)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static boolean isTransientGrpcStatus(Throwable error) {
        String exceptionName = error.getClass().getName().toLowerCase(Locale.ROOT);
        if (!exceptionName.contains("grpc") && !exceptionName.contains("qdrant")) {
            return false;
        }
        String message = error.getMessage() == null ? "" : error.getMessage().toLowerCase(Locale.ROOT);
        return message.contains("unavailable")
                || message.contains("deadline exceeded")
                || message.contains("deadline_exceeded")
                || message.contains("resource exhausted")
                || message.contains("resource_exhausted");
    }
}
