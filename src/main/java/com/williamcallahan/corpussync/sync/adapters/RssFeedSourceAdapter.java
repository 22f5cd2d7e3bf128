package com.williamcallahan.corpussync.sync.adapters;

import com.williamcallahan.corpussync.domain.SourceDescriptor;
import com.williamcallahan.corpussync.sync.ItemContent;
import com.williamcallahan.corpussync.sync.ListedItem;
import com.williamcallahan.corpussync.sync.MalformedItemException;
import com.williamcallahan.corpussync.sync.SourceAdapter;
import com.williamcallahan.corpussync.sync.SourceAdapterFactory;
import com.williamcallahan.corpussync.sync.SourceListing;
import com.williamcallahan.corpussync.sync.SyncSettings;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads RSS 2.0 and Atom feeds. Each feed entry is one item and carries its own content,
 * so items are never fetched separately.
 *
 * <p>A feed only shows a recent window of its corpus, so listings are incomplete and absence
 * never repeals an item, unless the source sets {@code complete: "true"}. Incomplete listings
 * skip entries not updated since the cursor, an ISO-8601 instant of the newest entry seen.</p>
 */
public class RssFeedSourceAdapter implements SourceAdapter {

    /** Strategy name. */
    public static final String STRATEGY = "rss";

    static final String FIELD_TITLE = "title";
    static final String FIELD_BODY = "body";
    static final String FIELD_LINK = "link";

    private static final Logger log = LoggerFactory.getLogger(RssFeedSourceAdapter.class);

    private final SourceDescriptor source;
    private final JsoupFetcher fetcher;
    private final boolean complete;

    RssFeedSourceAdapter(SourceDescriptor source, JsoupFetcher fetcher) {
        this.source = source;
        this.fetcher = fetcher;
        this.complete = Boolean.parseBoolean(source.setting("complete", "false"));
    }

    @Override
    public SourceListing fetchListing(String cursor) {
        Instant since = complete ? null : parseCursor(cursor);
        Instant newest = since;
        List<ListedItem> items = new ArrayList<>();
        for (String feedUrl : source.urls()) {
            String xml = fetcher.get(feedUrl, Optional.empty()).body();
            for (ListedItem entry : parseFeed(xml, feedUrl)) {
                Instant updated = entry.updatedAt();
                if (updated != null && (newest == null || updated.isAfter(newest))) {
                    newest = updated;
                }
                if (since != null && updated != null && !updated.isAfter(since)) {
                    continue;
                }
                items.add(entry);
            }
        }
        log.debug("[SYNC] Feed source {} listed {} entr(ies) since {}", source.name(), items.size(), since);
        return new SourceListing(items, newest == null ? null : newest.toString(), complete);
    }

    @Override
    public boolean supportsConditionalFetch() {
        return false;
    }

    @Override
    public ItemContent fetchItemContent(ListedItem item, Optional<Instant> ifModifiedSince) {
        Map<String, String> inline = item.inline();
        String title = inline.getOrDefault(FIELD_TITLE, "");
        String body = inline.getOrDefault(FIELD_BODY, "");
        if (title.isBlank() && body.isBlank()) {
            throw new MalformedItemException("Feed entry " + item.key() + " has neither title nor content");
        }
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(FIELD_LINK, inline.getOrDefault(FIELD_LINK, ""));
        return ItemContent.of(title, body, fields, item.updatedAt());
    }

    /**
     * Parses RSS {@code <item>} or Atom {@code <entry>} elements into listed items.
     *
     * @param xml feed document
     * @param baseUri feed URL used to resolve relative links
     * @return entries in document order; entries without any usable key are dropped
     */
    static List<ListedItem> parseFeed(String xml, String baseUri) {
        Document feed = Jsoup.parse(xml, baseUri, Parser.xmlParser());
        List<ListedItem> entries = new ArrayList<>();
        for (Element item : feed.select("item")) {
            String link = text(item, "link");
            String key = firstNonBlank(text(item, "guid"), link);
            String html = firstNonBlank(text(item, "content|encoded"), text(item, "description"));
            Instant published = firstNonNull(
                    JsoupFetcher.parseHttpDate(text(item, "pubDate")), parseIsoDate(text(item, "dc|date")));
            addEntry(entries, key, link, text(item, FIELD_TITLE), html, published);
        }
        for (Element entry : feed.select("entry")) {
            Element alternate = entry.selectFirst("link[rel=alternate], link:not([rel])");
            String link = alternate != null ? alternate.absUrl("href") : "";
            String key = firstNonBlank(text(entry, "id"), link);
            String html = firstNonBlank(text(entry, "content"), text(entry, "summary"));
            Instant updated = firstNonNull(parseIsoDate(text(entry, "updated")), parseIsoDate(text(entry, "published")));
            addEntry(entries, key, link, text(entry, FIELD_TITLE), html, updated);
        }
        return entries;
    }

    private static void addEntry(
            List<ListedItem> entries, String key, String link, String title, String html, Instant updatedAt) {
        if (key.isBlank()) {
            return;
        }
        Map<String, String> inline = new LinkedHashMap<>();
        inline.put(FIELD_TITLE, title);
        inline.put(FIELD_BODY, html.isBlank() ? "" : Jsoup.parse(html).text());
        inline.put(FIELD_LINK, link);
        entries.add(new ListedItem(key, link.isBlank() ? key : link, updatedAt, inline));
    }

    private static String text(Element parent, String selector) {
        Element child = parent.selectFirst(selector);
        return child == null ? "" : child.text().trim();
    }

    private static String firstNonBlank(String first, String second) {
        return first.isBlank() ? second : first;
    }

    private static Instant firstNonNull(Instant first, Instant second) {
        return first != null ? first : second;
    }

    private static Instant parseIsoDate(String value) {
        if (value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException unparseable) {
            return null;
        }
    }

    private static Instant parseCursor(String cursor) {
        if (cursor == null || cursor.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(cursor);
        } catch (DateTimeParseException unparseable) {
            log.warn("[SYNC] Ignoring unparseable feed cursor '{}'", cursor);
            return null;
        }
    }

    /**
     * Creates feed adapters for sources with strategy {@value #STRATEGY}.
     */
    @Component
    public static class Factory implements SourceAdapterFactory {

        @Override
        public String strategy() {
            return STRATEGY;
        }

        @Override
        public SourceAdapter create(SourceDescriptor source, SyncSettings settings) {
            return new RssFeedSourceAdapter(source, new JsoupFetcher(settings));
        }
    }
}
