package com.williamcallahan.corpussync.search;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.williamcallahan.corpussync.config.AppProperties;
import com.williamcallahan.corpussync.config.CollectionCatalog;
import com.williamcallahan.corpussync.config.SearchProperties;
import com.williamcallahan.corpussync.domain.CollectionDescriptor;
import com.williamcallahan.corpussync.domain.ItemIdentity;
import com.williamcallahan.corpussync.domain.VersionedRecord;
import com.williamcallahan.corpussync.indexing.EmbeddingClient;
import com.williamcallahan.corpussync.indexing.IndexHit;
import com.williamcallahan.corpussync.indexing.LexicalIndex;
import com.williamcallahan.corpussync.indexing.VectorIndex;
import com.williamcallahan.corpussync.store.VersionedDocumentStore;
import com.williamcallahan.corpussync.support.PipelineMetrics;
import com.williamcallahan.corpussync.support.TextNormalizer;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.function.ToDoubleFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Answers ranked queries over the vector and lexical indexes of the visible collections.
 *
 * <p>The audience filter is applied to the collection set before any backend call. Index hits are
 * checked against the document store before ranking: identities without a current record are
 * dropped, so a lagging index never serves repealed content and never shifts the ranks of live
 * results. In hybrid mode a failed backend degrades the response to the surviving mode; a query
 * where no requested mode could be served raises {@link SearchBackendUnavailableException}.</p>
 */
@Service
public class SearchGateway {

    private static final Logger log = LoggerFactory.getLogger(SearchGateway.class);
    private static final int SEARCH_THREADS = 8;
    private static final int MAX_FAILURE_DETAIL_LENGTH = 240;

    private final CollectionCatalog collectionCatalog;
    private final VectorIndex vectorIndex;
    private final LexicalIndex lexicalIndex;
    private final EmbeddingClient embeddingClient;
    private final VersionedDocumentStore documentStore;
    private final SearchProperties settings;
    private final Cache<String, float[]> queryEmbeddings;
    private final ExecutorService searchExecutor = Executors.newFixedThreadPool(
            SEARCH_THREADS, new ThreadFactoryBuilder().setNameFormat("search-%d").setDaemon(true).build());

    @Autowired
    public SearchGateway(
            CollectionCatalog collectionCatalog,
            VectorIndex vectorIndex,
            LexicalIndex lexicalIndex,
            EmbeddingClient embeddingClient,
            VersionedDocumentStore documentStore,
            AppProperties appProperties) {
        this(collectionCatalog, vectorIndex, lexicalIndex, embeddingClient, documentStore, appProperties.getSearch());
    }

    SearchGateway(
            CollectionCatalog collectionCatalog,
            VectorIndex vectorIndex,
            LexicalIndex lexicalIndex,
            EmbeddingClient embeddingClient,
            VersionedDocumentStore documentStore,
            SearchProperties settings) {
        this.collectionCatalog = collectionCatalog;
        this.vectorIndex = vectorIndex;
        this.lexicalIndex = lexicalIndex;
        this.embeddingClient = embeddingClient;
        this.documentStore = documentStore;
        this.settings = settings;
        this.queryEmbeddings = Caffeine.newBuilder()
                .maximumSize(settings.getQueryCacheSize())
                .expireAfterWrite(settings.getQueryCacheTtl())
                .build();
    }

    /**
     * Runs the query.
     *
     * @param query validated request
     * @return ranked results and degradation notices
     * @throws com.williamcallahan.corpussync.domain.UnknownCollectionException if a named collection is not configured
     * @throws SearchBackendUnavailableException if no requested mode could be served
     */
    public SearchOutcome search(SearchQuery query) {
        List<CollectionDescriptor> targets = collectionCatalog.resolveVisible(query.collections(), query.audience());
        if (targets.isEmpty()) {
            return new SearchOutcome(List.of(), List.of(query.mode()), List.of());
        }
        int limit = Math.min(query.limit(), settings.getMaxLimit());
        int candidates = Math.max(limit, settings.getCandidateLimit());

        Map<SearchMode, ModeRun> runs = new LinkedHashMap<>();
        if (query.mode().usesVectors()) {
            runs.put(SearchMode.VECTOR, startVectorRun(query.query(), targets, candidates));
        }
        if (query.mode().usesLexical()) {
            runs.put(SearchMode.LEXICAL, startLexicalRun(query.query(), targets, candidates));
        }

        Map<SearchMode, List<Candidate>> rankings = new LinkedHashMap<>();
        List<String> failures = new ArrayList<>();
        for (Map.Entry<SearchMode, ModeRun> run : runs.entrySet()) {
            collect(run.getKey(), run.getValue(), candidates).ifPresentOrElse(
                    ranking -> rankings.put(run.getKey(), ranking),
                    () -> failures.addAll(run.getValue().failures));
        }

        if (rankings.isEmpty()) {
            log.warn("[SEARCH] No backend could serve {} query over {} collection(s)",
                    query.mode().wireName(), targets.size());
            PipelineMetrics.recordSearch(query.mode().wireName(), PipelineMetrics.OUTCOME_FAILED);
            throw new SearchBackendUnavailableException(
                    "Search backend unavailable for mode " + query.mode().wireName(), failures);
        }

        List<SearchHit> hits = rankings.size() == 1
                ? rankSingle(rankings.values().iterator().next(), limit)
                : rankFused(rankings, limit);
        List<String> notices = new ArrayList<>();
        if (!failures.isEmpty()) {
            notices.add("Degraded to " + rankings.keySet().iterator().next().wireName() + " results: "
                    + String.join("; ", failures));
        }
        PipelineMetrics.recordSearch(query.mode().wireName(),
                failures.isEmpty() ? PipelineMetrics.OUTCOME_SERVED : PipelineMetrics.OUTCOME_DEGRADED);
        return new SearchOutcome(hits, new ArrayList<>(rankings.keySet()), notices);
    }

    @PreDestroy
    public void shutdown() {
        searchExecutor.shutdownNow();
    }

    private ModeRun startVectorRun(String queryText, List<CollectionDescriptor> targets, int candidates) {
        CompletableFuture<float[]> embedding = CompletableFuture.supplyAsync(() -> embedQuery(queryText), searchExecutor);
        ModeRun run = new ModeRun();
        for (CollectionDescriptor target : targets) {
            run.add(target.name(), embedding.thenApplyAsync(
                    queryVector -> vectorIndex.search(target.name(), queryVector, candidates), searchExecutor));
        }
        return run;
    }

    private ModeRun startLexicalRun(String queryText, List<CollectionDescriptor> targets, int candidates) {
        ModeRun run = new ModeRun();
        for (CollectionDescriptor target : targets) {
            run.add(target.name(), supplyAsync(() -> lexicalIndex.search(target.name(), queryText, candidates)));
        }
        return run;
    }

    private <T> CompletableFuture<T> supplyAsync(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, searchExecutor);
    }

    private float[] embedQuery(String queryText) {
        String cacheKey = TextNormalizer.canonicalize(queryText);
        return queryEmbeddings.get(cacheKey, embeddingClient::embed);
    }

    /**
     * Waits for every collection of one mode and merges their hits into one ranking, or returns
     * empty when any collection failed so a partial list never skews fused ranks.
     */
    private Optional<List<Candidate>> collect(SearchMode mode, ModeRun run, int candidates) {
        long deadline = System.nanoTime() + settings.getQueryTimeout().toNanos();
        List<Candidate> merged = new ArrayList<>();
        for (Map.Entry<String, CompletableFuture<List<IndexHit>>> pending : run.futures.entrySet()) {
            String collection = pending.getKey();
            CompletableFuture<List<IndexHit>> future = pending.getValue();
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                for (IndexHit hit : future.get(remaining, TimeUnit.NANOSECONDS)) {
                    merged.add(new Candidate(hit.identity(), collection, hit.score()));
                }
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                run.failures.add(mode.wireName() + "/" + collection + ": interrupted");
            } catch (ExecutionException executionException) {
                Throwable cause = executionException.getCause() == null ? executionException : executionException.getCause();
                log.warn("[SEARCH] {} search failed for collection={} (exceptionType={})",
                        mode.wireName(), collection, cause.getClass().getSimpleName());
                run.failures.add(mode.wireName() + "/" + collection + ": " + describe(cause));
            } catch (TimeoutException timeout) {
                future.cancel(true);
                log.warn("[SEARCH] {} search timed out for collection={}", mode.wireName(), collection);
                run.failures.add(mode.wireName() + "/" + collection + ": timed out after "
                        + settings.getQueryTimeout().toMillis() + "ms");
            }
        }
        if (!run.failures.isEmpty()) {
            return Optional.empty();
        }

        merged.sort(Comparator.comparingDouble(Candidate::score).reversed()
                .thenComparing(candidate -> candidate.identity().qualifiedKey()));
        Map<ItemIdentity, Candidate> deduplicated = new LinkedHashMap<>();
        for (Candidate candidate : merged) {
            deduplicated.putIfAbsent(candidate.identity(), candidate);
        }
        List<Candidate> live = new ArrayList<>();
        for (Candidate candidate : deduplicated.values()) {
            if (live.size() >= candidates) {
                break;
            }
            currentRecord(candidate).ifPresent(record -> live.add(candidate.withRecord(record)));
        }
        return Optional.of(live);
    }

    private Optional<VersionedRecord> currentRecord(Candidate candidate) {
        return documentStore.currentFor(candidate.identity())
                .filter(record -> record.collection().equals(candidate.collection()));
    }

    private List<SearchHit> rankSingle(List<Candidate> ranking, int limit) {
        List<Candidate> ordered = new ArrayList<>(ranking);
        ordered.sort(resultOrder(Candidate::score));
        return ordered.stream().limit(limit).map(candidate -> toHit(candidate, candidate.score())).toList();
    }

    private List<SearchHit> rankFused(Map<SearchMode, List<Candidate>> rankings, int limit) {
        List<List<ItemIdentity>> identityRankings = new ArrayList<>();
        Map<ItemIdentity, Candidate> byIdentity = new HashMap<>();
        for (List<Candidate> ranking : rankings.values()) {
            identityRankings.add(ranking.stream().map(Candidate::identity).toList());
            ranking.forEach(candidate -> byIdentity.putIfAbsent(candidate.identity(), candidate));
        }
        Map<ItemIdentity, Double> fused = ReciprocalRankFusion.fuse(identityRankings, settings.getRrfK());

        List<Candidate> ordered = new ArrayList<>(byIdentity.values());
        ordered.sort(resultOrder(candidate -> fused.get(candidate.identity())));
        return ordered.stream()
                .limit(limit)
                .map(candidate -> toHit(candidate, fused.get(candidate.identity())))
                .toList();
    }

    /**
     * Score descending, then more recently checked first, then identity for a stable order.
     */
    private static Comparator<Candidate> resultOrder(ToDoubleFunction<Candidate> score) {
        Comparator<Candidate> byScore = Comparator.comparingDouble(score);
        Comparator<Candidate> byLastChecked = Comparator.comparing(
                candidate -> candidate.record().lastChecked(), Comparator.nullsFirst(Comparator.<Instant>naturalOrder()));
        return byScore.reversed()
                .thenComparing(byLastChecked.reversed())
                .thenComparing(candidate -> candidate.identity().qualifiedKey());
    }

    private SearchHit toHit(Candidate candidate, double score) {
        VersionedRecord record = candidate.record();
        return new SearchHit(
                record.identity().toString(),
                score,
                TextNormalizer.snippet(record.body(), settings.getSnippetLength()),
                candidate.collection(),
                record.lastChecked(),
                record.title(),
                record.location());
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        String singleLine = message.replace('\n', ' ').replace('\r', ' ').trim();
        return singleLine.length() > MAX_FAILURE_DETAIL_LENGTH
                ? singleLine.substring(0, MAX_FAILURE_DETAIL_LENGTH) + "..."
                : singleLine;
    }

    private static final class ModeRun {
        private final Map<String, CompletableFuture<List<IndexHit>>> futures = new LinkedHashMap<>();
        private final List<String> failures = new ArrayList<>();

        void add(String collection, CompletableFuture<List<IndexHit>> future) {
            futures.put(collection, future);
        }
    }

    private record Candidate(ItemIdentity identity, String collection, double score, VersionedRecord record) {

        Candidate(ItemIdentity identity, String collection, double score) {
            this(identity, collection, score, null);
        }

        Candidate withRecord(VersionedRecord current) {
            return new Candidate(identity, collection, score, current);
        }
    }
}
