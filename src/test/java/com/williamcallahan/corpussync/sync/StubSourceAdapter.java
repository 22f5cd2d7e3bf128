package com.williamcallahan.corpussync.sync;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory adapter whose listing and item contents tests rewrite between cycles.
 */
final class StubSourceAdapter implements SourceAdapter {

    private final Map<String, ItemContent> contents = new ConcurrentHashMap<>();
    private final Set<String> failingKeys = ConcurrentHashMap.newKeySet();
    private final Set<String> notModifiedKeys = ConcurrentHashMap.newKeySet();
    private final List<Optional<Instant>> conditionalHints = new CopyOnWriteArrayList<>();
    private final AtomicInteger listingCalls = new AtomicInteger();
    private volatile List<String> listedKeys = new ArrayList<>();
    private volatile boolean complete = true;
    private volatile boolean conditional;
    private volatile RuntimeException listingFailure;
    private volatile String nextCursor;
    private volatile Runnable beforeListing = () -> { };

    StubSourceAdapter put(String key, String title, String body) {
        contents.put(key, ItemContent.of(title, body, Map.of(), null));
        return this;
    }

    StubSourceAdapter list(String... keys) {
        this.listedKeys = List.of(keys);
        return this;
    }

    StubSourceAdapter incomplete() {
        this.complete = false;
        return this;
    }

    StubSourceAdapter nextCursor(String cursor) {
        this.nextCursor = cursor;
        return this;
    }

    StubSourceAdapter conditional(boolean supported) {
        this.conditional = supported;
        return this;
    }

    StubSourceAdapter failItem(String key) {
        failingKeys.add(key);
        return this;
    }

    StubSourceAdapter recoverItem(String key) {
        failingKeys.remove(key);
        return this;
    }

    StubSourceAdapter answerNotModified(String key) {
        notModifiedKeys.add(key);
        return this;
    }

    StubSourceAdapter failListing(RuntimeException failure) {
        this.listingFailure = failure;
        return this;
    }

    StubSourceAdapter beforeListing(Runnable hook) {
        this.beforeListing = hook;
        return this;
    }

    List<Optional<Instant>> conditionalHints() {
        return conditionalHints;
    }

    int listingCalls() {
        return listingCalls.get();
    }

    @Override
    public SourceListing fetchListing(String cursor) {
        listingCalls.incrementAndGet();
        beforeListing.run();
        RuntimeException failure = listingFailure;
        if (failure != null) {
            throw failure;
        }
        List<ListedItem> items = new ArrayList<>();
        for (String key : listedKeys) {
            items.add(ListedItem.of(key, "https://example.com/" + key));
        }
        return new SourceListing(items, nextCursor, complete);
    }

    @Override
    public boolean supportsConditionalFetch() {
        return conditional;
    }

    @Override
    public ItemContent fetchItemContent(ListedItem item, Optional<Instant> ifModifiedSince) {
        conditionalHints.add(ifModifiedSince);
        if (failingKeys.contains(item.key())) {
            throw new TransientFetchException("upstream unavailable for " + item.key());
        }
        if (ifModifiedSince.isPresent() && notModifiedKeys.contains(item.key())) {
            return ItemContent.notModifiedResponse();
        }
        ItemContent content = contents.get(item.key());
        if (content == null) {
            throw new MalformedItemException("no content for " + item.key());
        }
        return content;
    }
}
