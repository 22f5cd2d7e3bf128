package com.williamcallahan.corpussync.sync.adapters;

import com.williamcallahan.corpussync.domain.SourceDescriptor;
import com.williamcallahan.corpussync.sync.ItemContent;
import com.williamcallahan.corpussync.sync.ListedItem;
import com.williamcallahan.corpussync.sync.MalformedItemException;
import com.williamcallahan.corpussync.sync.SourceAdapter;
import com.williamcallahan.corpussync.sync.SourceAdapterFactory;
import com.williamcallahan.corpussync.sync.SourceListing;
import com.williamcallahan.corpussync.sync.SyncSettings;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jsoup.Connection;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Treats a fixed list of page URLs as the whole corpus of a source. Pages are fetched with
 * {@code If-Modified-Since} so unchanged pages cost a 304.
 */
public class WebPageSourceAdapter implements SourceAdapter {

    /** Strategy name. */
    public static final String STRATEGY = "web-pages";

    private static final String DEFAULT_CONTENT_SELECTOR = "main, article, #content, body";
    private static final String NOISE_SELECTOR = "script, style, noscript, nav, header, footer, .sidebar, .navbar";

    private final SourceDescriptor source;
    private final JsoupFetcher fetcher;
    private final String contentSelector;

    WebPageSourceAdapter(SourceDescriptor source, JsoupFetcher fetcher) {
        this.source = source;
        this.fetcher = fetcher;
        this.contentSelector = source.setting("content-selector", DEFAULT_CONTENT_SELECTOR);
    }

    @Override
    public SourceListing fetchListing(String cursor) {
        List<ListedItem> items = new ArrayList<>();
        for (String url : source.urls()) {
            String canonical = canonicalUrl(url);
            if (!canonical.isEmpty()) {
                items.add(ListedItem.of(canonical, canonical));
            }
        }
        return new SourceListing(items, null, true);
    }

    @Override
    public boolean supportsConditionalFetch() {
        return true;
    }

    @Override
    public ItemContent fetchItemContent(ListedItem item, Optional<Instant> ifModifiedSince) {
        Connection.Response response = fetcher.get(item.location(), ifModifiedSince);
        if (response.statusCode() == JsoupFetcher.HTTP_NOT_MODIFIED) {
            return ItemContent.notModifiedResponse();
        }
        Document page;
        try {
            page = response.parse();
        } catch (IOException unparseable) {
            throw new MalformedItemException("Cannot parse " + item.location() + ": " + unparseable.getMessage());
        }
        return extract(page, contentSelector, JsoupFetcher.parseHttpDate(response.header("Last-Modified")));
    }

    /**
     * Extracts the title and main text of a page.
     *
     * @throws MalformedItemException if the page has no text in its content area
     */
    static ItemContent extract(Document page, String contentSelector, Instant lastModified) {
        page.select(NOISE_SELECTOR).remove();
        String body = "";
        // Selectors are alternatives in priority order, not a document-order union.
        for (String candidate : contentSelector.split(",")) {
            Element content = candidate.isBlank() ? null : page.selectFirst(candidate.trim());
            if (content != null && !content.text().isBlank()) {
                body = content.text();
                break;
            }
        }
        if (body.isBlank()) {
            throw new MalformedItemException("Page " + page.location() + " has no text content");
        }
        return ItemContent.of(page.title(), body, Map.of(), lastModified);
    }

    static String canonicalUrl(String url) {
        if (url == null) {
            return "";
        }
        String trimmed = url.trim();
        int fragment = trimmed.indexOf('#');
        return fragment >= 0 ? trimmed.substring(0, fragment) : trimmed;
    }

    /**
     * Creates page-list adapters for sources with strategy {@value #STRATEGY}.
     */
    @Component
    public static class Factory implements SourceAdapterFactory {

        @Override
        public String strategy() {
            return STRATEGY;
        }

        @Override
        public SourceAdapter create(SourceDescriptor source, SyncSettings settings) {
            return new WebPageSourceAdapter(source, new JsoupFetcher(settings));
        }
    }
}
