package com.williamcallahan.corpussync.config;

import com.williamcallahan.corpussync.indexing.EmbeddingClient;
import com.williamcallahan.corpussync.indexing.HashingEmbeddingClient;
import com.williamcallahan.corpussync.indexing.InMemoryVectorIndex;
import com.williamcallahan.corpussync.indexing.Indexer;
import com.williamcallahan.corpussync.indexing.IndexerSettings;
import com.williamcallahan.corpussync.indexing.LexicalIndex;
import com.williamcallahan.corpussync.indexing.LuceneLexicalIndex;
import com.williamcallahan.corpussync.indexing.QdrantVectorIndex;
import com.williamcallahan.corpussync.indexing.RemoteEmbeddingClient;
import com.williamcallahan.corpussync.indexing.VectorIndex;
import com.williamcallahan.corpussync.store.CheckpointStore;
import com.williamcallahan.corpussync.store.VersionedDocumentStore;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.QdrantGrpcClient;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the embedding provider, the vector and lexical index backends, and the indexer.
 *
 * <p>Qdrant is used when {@code app.qdrant.enabled=true}; otherwise vectors live in memory.</p>
 */
@Configuration
public class IndexBackendConfig {

    private static final Logger log = LoggerFactory.getLogger(IndexBackendConfig.class);

    private static final long KEEPALIVE_TIME_SECONDS = 30;
    private static final long KEEPALIVE_TIMEOUT_SECONDS = 10;
    private static final long IDLE_TIMEOUT_MINUTES = 5;

    /**
     * Qdrant client with gRPC keepalive, so idle connections behind load balancers are not dropped.
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "app.qdrant", name = "enabled", havingValue = "true")
    public QdrantClient qdrantClient(AppProperties appProperties) {
        QdrantProperties qdrant = appProperties.getQdrant();
        log.info("[QDRANT] Creating client for {}:{} (tls={})", qdrant.getHost(), qdrant.getPort(), qdrant.isUseTls());

        ManagedChannelBuilder<?> channelBuilder = ManagedChannelBuilder.forAddress(qdrant.getHost(), qdrant.getPort());
        if (qdrant.isUseTls()) {
            channelBuilder.useTransportSecurity();
        } else {
            channelBuilder.usePlaintext();
        }
        channelBuilder
                .keepAliveTime(KEEPALIVE_TIME_SECONDS, TimeUnit.SECONDS)
                .keepAliveTimeout(KEEPALIVE_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .keepAliveWithoutCalls(true)
                .idleTimeout(IDLE_TIMEOUT_MINUTES, TimeUnit.MINUTES);

        ManagedChannel channel = Objects.requireNonNull(channelBuilder.build(), "ManagedChannel");
        QdrantGrpcClient.Builder grpcClientBuilder = QdrantGrpcClient.newBuilder(channel, true);
        String apiKey = qdrant.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            grpcClientBuilder.withApiKey(apiKey);
        }
        return new QdrantClient(grpcClientBuilder.build());
    }

    @Bean
    public VectorIndex vectorIndex(AppProperties appProperties, ObjectProvider<QdrantClient> qdrantClient) {
        QdrantProperties qdrant = appProperties.getQdrant();
        if (qdrant.isEnabled()) {
            return new QdrantVectorIndex(
                    qdrantClient.getObject(), qdrant.getCollectionPrefix(), qdrant.getTimeout());
        }
        log.info("[INDEXING] Qdrant disabled, using in-memory vector index");
        return new InMemoryVectorIndex();
    }

    @Bean(destroyMethod = "close")
    public LuceneLexicalIndex lexicalIndex(AppProperties appProperties) {
        String indexDir = appProperties.getLexical().getIndexDir();
        return new LuceneLexicalIndex(indexDir.isBlank() ? null : Path.of(indexDir));
    }

    @Bean
    public EmbeddingClient embeddingClient(AppProperties appProperties, RestTemplateBuilder restTemplateBuilder) {
        EmbeddingProperties embedding = appProperties.getEmbedding();
        if (embedding.isRemote()) {
            log.info("[EMBEDDING] Using remote embedding provider at {} (model={}, dimensions={})",
                    embedding.getServerUrl(), embedding.getModel(), embedding.getDimensions());
            return new RemoteEmbeddingClient(
                    embedding.getServerUrl(),
                    embedding.getModel(),
                    embedding.getApiKey(),
                    embedding.getDimensions(),
                    embedding.getBatchSize(),
                    embedding.getTimeout(),
                    restTemplateBuilder);
        }
        log.info("[EMBEDDING] Using hashing embeddings (dimensions={})", embedding.getDimensions());
        return new HashingEmbeddingClient(embedding.getDimensions());
    }

    @Bean
    public Indexer indexer(
            VersionedDocumentStore documentStore,
            CheckpointStore checkpointStore,
            VectorIndex vectorIndex,
            LexicalIndex lexicalIndex,
            EmbeddingClient embeddingClient,
            AppProperties appProperties) {
        return new Indexer(
                documentStore,
                checkpointStore,
                vectorIndex,
                lexicalIndex,
                embeddingClient,
                IndexerSettings.from(appProperties.getIndexer()));
    }
}
