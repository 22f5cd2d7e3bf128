package com.williamcallahan.corpussync.support;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.UncheckedIOException;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

/**
 * Verifies retry classification and attempt accounting.
 */
class RetrySupportTest {

    @Test
    void retriesTransientFailuresUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();

        String result = RetrySupport.executeWithRetry(
                () -> {
                    if (calls.incrementAndGet() < 3) {
                        throw new UncheckedIOException(new IOException("connection reset"));
                    }
                    return "ok";
                },
                "flaky call",
                3,
                Duration.ZERO,
                TransientErrorClassifier::isTransient);

        assertEquals("ok", result);
        assertEquals(3, calls.get());
    }

    @Test
    void rethrowsNonTransientFailureImmediately() {
        AtomicInteger calls = new AtomicInteger();
        IllegalArgumentException failure = new IllegalArgumentException("bad input");

        IllegalArgumentException thrown = assertThrows(
                IllegalArgumentException.class,
                () -> RetrySupport.executeWithRetry(
                        () -> {
                            calls.incrementAndGet();
                            throw failure;
                        },
                        "bad call",
                        5,
                        Duration.ZERO,
                        TransientErrorClassifier::isTransient));

        assertSame(failure, thrown);
        assertEquals(1, calls.get());
    }

    @Test
    void givesUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(
                UncheckedIOException.class,
                () -> RetrySupport.executeWithRetry(
                        () -> {
                            calls.incrementAndGet();
                            throw new UncheckedIOException(new IOException("down"));
                        },
                        "down call",
                        2,
                        Duration.ZERO,
                        TransientErrorClassifier::isTransient));

        assertEquals(2, calls.get());
    }
}
