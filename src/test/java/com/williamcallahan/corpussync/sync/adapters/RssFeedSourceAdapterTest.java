package com.williamcallahan.corpussync.sync.adapters;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
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
import org.junit.jupiter.api.Test;

/**
 * Verifies RSS and Atom parsing and cursor-based listing windows.
 */
class RssFeedSourceAdapterTest {

    private static final String FEED_URL = "https://example.com/feed.xml";

    private static final String RSS = """
            <?xml version="1.0" encoding="UTF-8"?>
            <rss version="2.0" xmlns:content="http://purl.org/rss/1.0/modules/content/">
              <channel>
                <title>Example</title>
                <item>
                  <title>First post</title>
                  <link>https://example.com/posts/1</link>
                  <guid>post-1</guid>
                  <pubDate>Sun, 01 Mar 2026 10:00:00 GMT</pubDate>
                  <description>&lt;p&gt;Hello &lt;b&gt;world&lt;/b&gt;&lt;/p&gt;</description>
                </item>
                <item>
                  <title>Second post</title>
                  <link>https://example.com/posts/2</link>
                  <pubDate>Mon, 02 Mar 2026 10:00:00 GMT</pubDate>
                  <content:encoded>&lt;div&gt;Full text&lt;/div&gt;</content:encoded>
                </item>
                <item>
                  <title>No key at all</title>
                </item>
              </channel>
            </rss>
            """;

    private static final String ATOM = """
            <?xml version="1.0" encoding="utf-8"?>
            <feed xmlns="http://www.w3.org/2005/Atom">
              <title>Atom example</title>
              <entry>
                <title>Atom entry</title>
                <link rel="alternate" href="/entries/7"/>
                <id>urn:uuid:7</id>
                <updated>2026-03-03T08:30:00Z</updated>
                <summary>Short summary</summary>
              </entry>
            </feed>
            """;

    @Test
    void parsesRssItemsWithGuidOrLinkAsKey() {
        List<ListedItem> entries = RssFeedSourceAdapter.parseFeed(RSS, FEED_URL);

        assertEquals(2, entries.size());
        ListedItem first = entries.get(0);
        assertEquals("post-1", first.key());
        assertEquals("https://example.com/posts/1", first.location());
        assertEquals(Instant.parse("2026-03-01T10:00:00Z"), first.updatedAt());
        assertEquals("Hello world", first.inline().get("body"));

        ListedItem second = entries.get(1);
        assertEquals("https://example.com/posts/2", second.key());
        assertEquals("Full text", second.inline().get("body"));
    }

    @Test
    void parsesAtomEntriesWithResolvedLinks() {
        List<ListedItem> entries = RssFeedSourceAdapter.parseFeed(ATOM, "https://example.com/atom.xml");

        assertEquals(1, entries.size());
        ListedItem entry = entries.get(0);
        assertEquals("urn:uuid:7", entry.key());
        assertEquals("https://example.com/entries/7", entry.location());
        assertEquals(Instant.parse("2026-03-03T08:30:00Z"), entry.updatedAt());
        assertEquals("Short summary", entry.inline().get("body"));
    }

    @Test
    void incrementalListingSkipsEntriesNotNewerThanCursor() {
        RssFeedSourceAdapter adapter = new RssFeedSourceAdapter(source(Map.of()), fetcherServing(RSS));

        SourceListing listing = adapter.fetchListing("2026-03-01T10:00:00Z");

        assertFalse(listing.complete());
        assertEquals(List.of("https://example.com/posts/2"), listing.items().stream().map(ListedItem::key).toList());
        assertEquals("2026-03-02T10:00:00Z", listing.nextCursor());
    }

    @Test
    void completeFeedListsEverythingRegardlessOfCursor() {
        RssFeedSourceAdapter adapter =
                new RssFeedSourceAdapter(source(Map.of("complete", "true")), fetcherServing(RSS));

        SourceListing listing = adapter.fetchListing("2026-03-05T00:00:00Z");

        assertEquals(2, listing.items().size());
        assertEquals(true, listing.complete());
    }

    @Test
    void itemContentComesFromTheListingEntry() {
        RssFeedSourceAdapter adapter = new RssFeedSourceAdapter(source(Map.of()), fetcherServing(RSS));
        ListedItem first = RssFeedSourceAdapter.parseFeed(RSS, FEED_URL).get(0);

        ItemContent content = adapter.fetchItemContent(first, Optional.empty());

        assertEquals("First post", content.title());
        assertEquals("Hello world", content.body());
        assertEquals("https://example.com/posts/1", content.fields().get("link"));
    }

    @Test
    void entryWithoutTextIsMalformed() {
        RssFeedSourceAdapter adapter = new RssFeedSourceAdapter(source(Map.of()), fetcherServing(RSS));
        ListedItem empty = new ListedItem("k", "k", null, Map.of("title", " ", "body", ""));

        assertThrows(MalformedItemException.class, () -> adapter.fetchItemContent(empty, Optional.empty()));
    }

    private static SourceDescriptor source(Map<String, String> settings) {
        return new SourceDescriptor(
                "blog", RssFeedSourceAdapter.STRATEGY, "docs", Duration.ofMinutes(15), true, List.of(FEED_URL),
                settings);
    }

    private static JsoupFetcher fetcherServing(String body) {
        Connection.Response response = mock(Connection.Response.class);
        when(response.body()).thenReturn(body);
        JsoupFetcher fetcher = mock(JsoupFetcher.class);
        when(fetcher.get(eq(FEED_URL), any())).thenReturn(response);
        return fetcher;
    }
}
