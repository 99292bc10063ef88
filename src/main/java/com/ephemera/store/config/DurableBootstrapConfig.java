package com.ephemera.store.config;

import com.ephemera.store.model.documents.ApiKeyDocument;
import com.ephemera.store.model.documents.CacheEntryDocument;
import com.ephemera.store.repo.documents.ApiKeyRepo;
import com.ephemera.store.service.DurableStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;

import java.time.Duration;

import static com.ephemera.store.model.documents.CacheEntryDocument.F_EXPIRE_AT;
import static com.ephemera.store.model.documents.CacheEntryDocument.F_KEY;
import static com.ephemera.store.model.documents.CacheEntryDocument.F_NAMESPACE;
import static com.ephemera.store.model.documents.CacheEntryDocument.F_WRITE_CURSOR;

/**
 * MongoDB bootstrap for the durable tier.
 * <p>
 * Ensures on cache_entries:
 * - unique {namespace:1, key:1}
 * - TTL {expireAt:1} with expireAfterSeconds=0 (server removes expired documents)
 * - {namespace:1, writeCursor:-1} for recency listings
 * and on api_keys a unique {key:1}; then seeds every static token as a wildcard record.
 * <p>
 * Toggle with ephemera.durable.init=false. Failures are logged, never fatal: the service
 * keeps serving the memory tier.
 */
@Configuration
@Slf4j
public class DurableBootstrapConfig {

    @Bean
    public ApplicationRunner durableBootstrap(MongoTemplate mongoTemplate, ApiKeyRepo apiKeyRepo,
                                              DurableStatus status, StoreProperties props) {
        return args -> {
            if (!props.getDurable().isEnabled() || !props.getDurable().isInit()) {
                log.info("Durable bootstrap disabled. Skipping.");
                return;
            }
            if (!status.ping()) {
                log.warn("Durable tier unreachable at startup; indexes and key seeding skipped.");
                return;
            }
            ensureIndexes(mongoTemplate);
            seedKeys(apiKeyRepo, props);
            log.info("Durable bootstrap complete.");
        };
    }

    private void ensureIndexes(MongoTemplate template) {
        try {
            IndexOperations entries = template.indexOps(CacheEntryDocument.class);
            entries.ensureIndex(new Index()
                    .on(F_NAMESPACE, Sort.Direction.ASC)
                    .on(F_KEY, Sort.Direction.ASC)
                    .unique()
                    .named("namespace_key_uq"));
            entries.ensureIndex(new Index()
                    .on(F_EXPIRE_AT, Sort.Direction.ASC)
                    .expire(Duration.ZERO)
                    .named("expire_at_ttl"));
            entries.ensureIndex(new Index()
                    .on(F_NAMESPACE, Sort.Direction.ASC)
                    .on(F_WRITE_CURSOR, Sort.Direction.DESC)
                    .named("namespace_write_cursor"));

            template.indexOps(ApiKeyDocument.class).ensureIndex(new Index()
                    .on("key", Sort.Direction.ASC)
                    .unique()
                    .named("key_uq"));
        } catch (RuntimeException ex) {
            log.warn("Failed to ensure durable indexes: {}", ex.getMessage());
        }
    }

    private void seedKeys(ApiKeyRepo repo, StoreProperties props) {
        for (String key : props.getAuth().getKeys()) {
            if (key == null || key.isBlank()) continue;
            final String token = key.trim();
            try {
                if (!repo.existsByKey(token)) {
                    repo.save(ApiKeyDocument.builder().key(token).build());
                    log.info("Seeded env key: {}...", token.substring(0, Math.min(3, token.length())));
                }
            } catch (RuntimeException ex) {
                log.warn("Failed to seed env key {}...: {}", token.substring(0, Math.min(3, token.length())), ex.getMessage());
            }
        }
    }
}
