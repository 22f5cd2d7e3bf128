package com.williamcallahan.corpussync.support;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;

class TransientErrorClassifierTest {

    @Test
    void treatsIoAndServerErrorsAsTransient() {
        assertTrue(TransientErrorClassifier.isTransient(new RuntimeException(new SocketTimeoutException("slow"))));
        assertTrue(TransientErrorClassifier.isTransient(new IOException("reset")));
        assertTrue(TransientErrorClassifier.isTransient(
                HttpServerErrorException.create(
                        HttpStatus.BAD_GATEWAY, "bad gateway", HttpHeaders.EMPTY,
                        new byte[0], StandardCharsets.UTF_8)));
        assertTrue(TransientErrorClassifier.isTransient(
                HttpClientErrorException.create(
                        HttpStatus.TOO_MANY_REQUESTS, "slow down", HttpHeaders.EMPTY,
                        new byte[0], StandardCharsets.UTF_8)));
    }

    @Test
    void treatsClientAndProgrammingErrorsAsPermanent() {
        assertFalse(TransientErrorClassifier.isTransient(
                HttpClientErrorException.create(
                        HttpStatus.NOT_FOUND, "missing", HttpHeaders.EMPTY,
                        new byte[0], StandardCharsets.UTF_8)));
        assertFalse(TransientErrorClassifier.isTransient(new IllegalArgumentException("bad")));
        assertFalse(TransientErrorClassifier.isTransient(new RuntimeException("unknown")));
    }
}
