package com.williamcallahan.corpussync.sync.adapters;

import com.williamcallahan.corpussync.sync.SourceFetchException;
import com.williamcallahan.corpussync.sync.SyncSettings;
import com.williamcallahan.corpussync.sync.TransientFetchException;
import java.io.IOException;
import java.net.MalformedURLException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import org.jsoup.Connection;
import org.jsoup.Jsoup;

/**
 * Single-request HTTP GET over jsoup with the reconciler's timeout and status classification.
 */
final class JsoupFetcher {

    static final int HTTP_NOT_MODIFIED = 304;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024;

    private final SyncSettings settings;

    JsoupFetcher(SyncSettings settings) {
        this.settings = settings;
    }

    /**
     * Issues one GET.
     *
     * @param url target URL
     * @param ifModifiedSince optional conditional-fetch instant
     * @return a 2xx or 304 response
     * @throws TransientFetchException on I/O errors, timeouts, 429 and 5xx
     * @throws SourceFetchException on malformed URLs and other 4xx statuses
     */
    Connection.Response get(String url, Optional<Instant> ifModifiedSince) {
        Connection.Response response;
        try {
            Connection connection = Jsoup.connect(url)
                    .userAgent(settings.userAgent())
                    .timeout((int) settings.fetchTimeout().toMillis())
                    .maxBodySize(MAX_BODY_BYTES)
                    .ignoreHttpErrors(true)
                    .ignoreContentType(true)
                    .followRedirects(true);
            ifModifiedSince.ifPresent(since -> connection.header("If-Modified-Since", httpDate(since)));
            response = connection.execute();
        } catch (MalformedURLException | IllegalArgumentException invalidUrl) {
            throw new SourceFetchException("Invalid URL " + url, invalidUrl);
        } catch (IOException ioFailure) {
            throw new TransientFetchException("GET " + url + " failed: " + ioFailure.getMessage(), ioFailure);
        }
        int status = response.statusCode();
        if (status == HTTP_NOT_MODIFIED || (status >= 200 && status < 300)) {
            return response;
        }
        if (status == HTTP_TOO_MANY_REQUESTS || status >= 500) {
            throw new TransientFetchException("GET " + url + " returned HTTP " + status);
        }
        throw new SourceFetchException("GET " + url + " returned HTTP " + status);
    }

    static String httpDate(Instant instant) {
        return DateTimeFormatter.RFC_1123_DATE_TIME.format(instant.atZone(ZoneOffset.UTC));
    }

    /**
     * Parses an RFC 1123 date such as a {@code Last-Modified} header or an RSS {@code pubDate}.
     */
    static Instant parseHttpDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return ZonedDateTime.parse(value.trim(), DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException unparseable) {
            return null;
        }
    }
}
