package com.williamcallahan.corpussync.indexing;

import com.williamcallahan.corpussync.domain.ItemIdentity;
import com.williamcallahan.corpussync.support.TextNormalizer;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.BoostQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lucene BM25 index shared by all collections, partitioned by a collection keyword field.
 *
 * <p>Writes commit and refresh the searcher before returning, so a search issued after an
 * upsert sees it.</p>
 */
public class LuceneLexicalIndex implements LexicalIndex, Closeable {

    private static final Logger log = LoggerFactory.getLogger(LuceneLexicalIndex.class);

    private static final String FIELD_UID = "uid";
    private static final String FIELD_COLLECTION = "collection";
    private static final String FIELD_SOURCE = "source";
    private static final String FIELD_KEY = "key";
    private static final String FIELD_RECORD_ID = "recordId";
    private static final String FIELD_TITLE = "title";
    private static final String FIELD_BODY = "body";
    private static final float TITLE_BOOST = 2.0f;
    private static final int MAX_QUERY_TERMS = 64;

    private final Directory directory;
    private final Analyzer analyzer = new StandardAnalyzer();
    private final IndexWriter writer;
    private final SearcherManager searcherManager;
    private final boolean durable;

    /**
     * @param indexDir on-disk location, or null to keep the index in memory
     */
    public LuceneLexicalIndex(Path indexDir) {
        this.durable = indexDir != null;
        try {
            if (indexDir == null) {
                this.directory = new ByteBuffersDirectory();
            } else {
                Files.createDirectories(indexDir);
                this.directory = FSDirectory.open(indexDir);
            }
            this.writer = new IndexWriter(directory, new IndexWriterConfig(analyzer));
            this.writer.commit();
            this.searcherManager = new SearcherManager(writer, null);
        } catch (IOException ioException) {
            throw new UncheckedIOException("Failed to open lexical index", ioException);
        }
        log.info("[INDEXING] Lexical index opened ({})", indexDir == null ? "in memory" : indexDir);
    }

    @Override
    public synchronized void upsert(String collection, List<LexicalEntry> entries) {
        if (entries.isEmpty()) {
            return;
        }
        try {
            for (LexicalEntry entry : entries) {
                writer.updateDocument(uidTerm(collection, entry.identity()), toDocument(collection, entry));
            }
            commitAndRefresh();
        } catch (IOException ioException) {
            throw new IndexBackendUnavailableException("lucene", "Lexical upsert failed", ioException);
        }
    }

    @Override
    public synchronized void delete(String collection, Collection<ItemIdentity> identities) {
        if (identities.isEmpty()) {
            return;
        }
        try {
            Term[] terms = identities.stream().map(identity -> uidTerm(collection, identity)).toArray(Term[]::new);
            writer.deleteDocuments(terms);
            commitAndRefresh();
        } catch (IOException ioException) {
            throw new IndexBackendUnavailableException("lucene", "Lexical delete failed", ioException);
        }
    }

    @Override
    public List<IndexHit> search(String collection, String query, int limit) {
        Set<String> terms = analyze(query);
        if (terms.isEmpty() || limit <= 0) {
            return List.of();
        }
        BooleanQuery.Builder matchBuilder = new BooleanQuery.Builder();
        for (String term : terms) {
            matchBuilder.add(new BoostQuery(new TermQuery(new Term(FIELD_TITLE, term)), TITLE_BOOST),
                    BooleanClause.Occur.SHOULD);
            matchBuilder.add(new TermQuery(new Term(FIELD_BODY, term)), BooleanClause.Occur.SHOULD);
        }
        BooleanQuery luceneQuery = new BooleanQuery.Builder()
                .add(new TermQuery(new Term(FIELD_COLLECTION, collection)), BooleanClause.Occur.FILTER)
                .add(matchBuilder.build(), BooleanClause.Occur.MUST)
                .build();

        IndexSearcher searcher = null;
        try {
            searcher = searcherManager.acquire();
            TopDocs topDocs = searcher.search(luceneQuery, limit);
            List<IndexHit> hits = new ArrayList<>(topDocs.scoreDocs.length);
            for (ScoreDoc scoreDoc : topDocs.scoreDocs) {
                Document document = searcher.storedFields().document(scoreDoc.doc);
                hits.add(new IndexHit(
                        new ItemIdentity(document.get(FIELD_SOURCE), document.get(FIELD_KEY)),
                        document.get(FIELD_RECORD_ID),
                        scoreDoc.score));
            }
            return hits;
        } catch (IOException ioException) {
            throw new IndexBackendUnavailableException("lucene", "Lexical search failed", ioException);
        } finally {
            release(searcher);
        }
    }

    @Override
    public long count(String collection) {
        IndexSearcher searcher = null;
        try {
            searcher = searcherManager.acquire();
            return searcher.count(new TermQuery(new Term(FIELD_COLLECTION, collection)));
        } catch (IOException ioException) {
            throw new IndexBackendUnavailableException("lucene", "Lexical count failed", ioException);
        } finally {
            release(searcher);
        }
    }

    @Override
    public boolean isHealthy() {
        return writer.isOpen();
    }

    @Override
    public boolean isDurable() {
        return durable;
    }

    @Override
    public synchronized void close() throws IOException {
        searcherManager.close();
        writer.close();
        directory.close();
    }

    private void commitAndRefresh() throws IOException {
        writer.commit();
        searcherManager.maybeRefreshBlocking();
    }

    private void release(IndexSearcher searcher) {
        if (searcher == null) {
            return;
        }
        try {
            searcherManager.release(searcher);
        } catch (IOException ioException) {
            log.warn("[INDEXING] Failed to release lexical searcher: {}", ioException.getMessage());
        }
    }

    private Set<String> analyze(String query) {
        Set<String> terms = new LinkedHashSet<>();
        if (query == null || query.isBlank()) {
            return terms;
        }
        String normalized = TextNormalizer.toLowerAscii(query);
        try (TokenStream tokenStream = analyzer.tokenStream(FIELD_BODY, normalized)) {
            CharTermAttribute termAttribute = tokenStream.addAttribute(CharTermAttribute.class);
            tokenStream.reset();
            while (tokenStream.incrementToken() && terms.size() < MAX_QUERY_TERMS) {
                terms.add(termAttribute.toString());
            }
            tokenStream.end();
        } catch (IOException ioException) {
            throw new IllegalStateException("Failed to tokenize lexical query", ioException);
        }
        return terms;
    }

    private Document toDocument(String collection, LexicalEntry entry) {
        Document document = new Document();
        document.add(new StringField(FIELD_UID, uid(collection, entry.identity()), Field.Store.NO));
        document.add(new StringField(FIELD_COLLECTION, collection, Field.Store.NO));
        document.add(new StoredField(FIELD_SOURCE, entry.identity().source()));
        document.add(new StoredField(FIELD_KEY, entry.identity().key()));
        document.add(new StoredField(FIELD_RECORD_ID, entry.recordId()));
        document.add(new TextField(FIELD_TITLE, TextNormalizer.toLowerAscii(entry.title()), Field.Store.NO));
        document.add(new TextField(FIELD_BODY, TextNormalizer.toLowerAscii(entry.body()), Field.Store.NO));
        return document;
    }

    private static Term uidTerm(String collection, ItemIdentity identity) {
        return new Term(FIELD_UID, uid(collection, identity));
    }

    private static String uid(String collection, ItemIdentity identity) {
        return collection + '\u0000' + identity.qualifiedKey();
    }
}
