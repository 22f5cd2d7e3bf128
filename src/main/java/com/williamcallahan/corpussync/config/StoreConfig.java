package com.williamcallahan.corpussync.config;

import com.williamcallahan.corpussync.store.CheckpointStore;
import com.williamcallahan.corpussync.store.FingerprintStore;
import com.williamcallahan.corpussync.store.VersionedDocumentStore;
import java.nio.file.Path;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * File-backed stores under {@code app.store.data-dir}.
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public CheckpointStore checkpointStore(AppProperties appProperties, Clock clock) {
        AppProperties.Store store = appProperties.getStore();
        return new CheckpointStore(dataDir(appProperties).resolve("checkpoints"), store.isFsync(), clock);
    }

    @Bean(destroyMethod = "close")
    public FingerprintStore fingerprintStore(AppProperties appProperties, Clock clock) {
        AppProperties.Store store = appProperties.getStore();
        return new FingerprintStore(dataDir(appProperties).resolve("fingerprints"), store.isFsync(), clock);
    }

    @Bean(destroyMethod = "close")
    public VersionedDocumentStore versionedDocumentStore(AppProperties appProperties, Clock clock) {
        Path recordsDir = dataDir(appProperties).resolve("records");
        log.info("[STORE] Opening document store at {}", recordsDir.toAbsolutePath());
        return new VersionedDocumentStore(recordsDir, appProperties.getStore().isFsync(), clock);
    }

    private static Path dataDir(AppProperties appProperties) {
        return Path.of(appProperties.getStore().getDataDir());
    }
}
