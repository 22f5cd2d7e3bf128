package com.williamcallahan.corpussync.support;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exponential backoff retry for operations that may fail transiently.
 *
 * <p>Only failures accepted by the supplied classifier are retried; anything else is rethrown
 * on the first attempt. Interruption during a backoff sleep aborts the retry loop so that a
 * cancelled reconciliation cycle or indexing pass stops promptly.</p>
 */
public final class RetrySupport {

    private static final Logger log = LoggerFactory.getLogger(RetrySupport.class);

    /** Default maximum retry attempts. */
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    /** Default initial backoff duration. */
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(500);
    /** Default backoff multiplier. */
    public static final double DEFAULT_MULTIPLIER = 2.0;
    /** Maximum backoff duration to prevent excessive waits. */
    public static final Duration MAX_BACKOFF = Duration.ofSeconds(30);

    private RetrySupport() {}

    /**
     * Executes a supplier with the default policy, retrying failures that
     * {@link TransientErrorClassifier} considers transient.
     */
    public static <T> T executeWithRetry(Supplier<T> operation, String operationName) {
        return executeWithRetry(
                operation,
                operationName,
                DEFAULT_MAX_ATTEMPTS,
                DEFAULT_INITIAL_BACKOFF,
                TransientErrorClassifier::isTransient);
    }

    /**
     * Executes a supplier with configurable retry for transient failures.
     *
     * @param operation the operation to execute
     * @param operationName name for logging purposes
     * @param maxAttempts maximum number of attempts, at least one
     * @param initialBackoff initial backoff duration
     * @param isTransient classifier deciding whether a failure is retried
     * @param <T> return type
     * @return the result of the operation
     * @throws RuntimeException the last failure once retries are exhausted, or the first non-transient one
     */
    public static <T> T executeWithRetry(
            Supplier<T> operation,
            String operationName,
            int maxAttempts,
            Duration initialBackoff,
            Predicate<Throwable> isTransient) {
        int attempts = Math.max(1, maxAttempts);
        RuntimeException lastException = null;
        Duration currentBackoff = initialBackoff;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return operation.get();
            } catch (RuntimeException exception) {
                lastException = exception;

                if (!isTransient.test(exception)) {
                    log.warn("{} failed with non-transient error on attempt {}/{}, not retrying",
                            operationName, attempt, attempts);
                    throw exception;
                }

                if (attempt < attempts) {
                    log.warn("{} failed with transient error on attempt {}/{}, retrying in {}ms",
                            operationName, attempt, attempts, currentBackoff.toMillis());
                    sleep(currentBackoff);
                    long nextBackoffMillis = (long) (currentBackoff.toMillis() * DEFAULT_MULTIPLIER);
                    currentBackoff = Duration.ofMillis(Math.min(nextBackoffMillis, MAX_BACKOFF.toMillis()));
                } else {
                    log.error("{} failed after {} attempts, giving up", operationName, attempts);
                }
            }
        }

        throw lastException;
    }

    /**
     * Executes a runnable with configurable retry for transient failures.
     */
    public static void executeWithRetry(
            Runnable operation,
            String operationName,
            int maxAttempts,
            Duration initialBackoff,
            Predicate<Throwable> isTransient) {
        executeWithRetry(
                () -> {
                    operation.run();
                    return null;
                },
                operationName,
                maxAttempts,
                initialBackoff,
                isTransient);
    }

    private static void sleep(Duration backoff) {
        if (backoff.isZero() || backoff.isNegative()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new RetryInterruptedException();
            }
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new RetryInterruptedException();
        }
    }

    /**
     * Raised when the calling thread is interrupted while waiting between attempts.
     */
    public static final class RetryInterruptedException extends IllegalStateException {
        RetryInterruptedException() {
            super("Retry interrupted");
        }
    }
}
