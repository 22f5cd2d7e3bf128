package com.williamcallahan.corpussync.sync.adapters;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.williamcallahan.corpussync.domain.SourceDescriptor;
import com.williamcallahan.corpussync.sync.ItemContent;
import com.williamcallahan.corpussync.sync.ListedItem;
import com.williamcallahan.corpussync.sync.MalformedItemException;
import com.williamcallahan.corpussync.sync.SourceListing;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

/**
 * Verifies page listing, extraction and the not-modified path.
 */
class WebPageSourceAdapterTest {

    private static final String PAGE = """
            <html><head><title>Release notes</title><script>var x = 1;</script></head>
            <body>
              <nav>Home | Docs</nav>
              <main><h1>Release 2.0</h1><p>Adds   incremental sync.</p></main>
              <aside>Related links</aside>
              <footer>Copyright</footer>
            </body></html>
            """;

    @Test
    void listingIsCompleteAndStripsFragments() {
        WebPageSourceAdapter adapter = new WebPageSourceAdapter(
                source(List.of("https://example.com/a#intro", " https://example.com/b ", "")), mock(JsoupFetcher.class));

        SourceListing listing = adapter.fetchListing("");

        assertTrue(listing.complete());
        assertEquals(
                List.of("https://example.com/a", "https://example.com/b"),
                listing.items().stream().map(ListedItem::key).toList());
    }

    @Test
    void extractsMainContentWithoutNavigationNoise() {
        Document page = Jsoup.parse(PAGE, "https://example.com/notes");

        ItemContent content = WebPageSourceAdapter.extract(page, "main, article, body", null);

        assertEquals("Release notes", content.title());
        assertEquals("Release 2.0 Adds incremental sync.", content.body());
        assertFalse(content.body().contains("Home"));
        assertFalse(content.body().contains("Related"));
    }

    @Test
    void emptyContentAreaIsMalformed() {
        Document page = Jsoup.parse("<html><body><nav>only nav</nav></body></html>", "https://example.com/");

        assertThrows(MalformedItemException.class, () -> WebPageSourceAdapter.extract(page, "main, body", null));
    }

    @Test
    void notModifiedResponseShortCircuitsParsing() {
        Instant since = Instant.parse("2026-03-01T10:00:00Z");
        ListedItem item = ListedItem.of("https://example.com/a", "https://example.com/a");
        Connection.Response response = mock(Connection.Response.class);
        when(response.statusCode()).thenReturn(304);
        JsoupFetcher fetcher = mock(JsoupFetcher.class);
        when(fetcher.get("https://example.com/a", Optional.of(since))).thenReturn(response);
        WebPageSourceAdapter adapter = new WebPageSourceAdapter(source(List.of(item.key())), fetcher);

        ItemContent content = adapter.fetchItemContent(item, Optional.of(since));

        assertTrue(content.notModified());
        verify(fetcher).get("https://example.com/a", Optional.of(since));
    }

    @Test
    void formatsConditionalFetchDatesInRfc1123() {
        assertEquals("Sun, 1 Mar 2026 10:00:00 GMT", JsoupFetcher.httpDate(Instant.parse("2026-03-01T10:00:00Z")));
        assertEquals(Instant.parse("2026-03-01T10:00:00Z"), JsoupFetcher.parseHttpDate("Sun, 01 Mar 2026 10:00:00 GMT"));
    }

    private static SourceDescriptor source(List<String> urls) {
        return new SourceDescriptor(
                "pages", WebPageSourceAdapter.STRATEGY, "docs", Duration.ofHours(6), true, urls, Map.of());
    }
}
