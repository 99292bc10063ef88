package com.ephemera.store.config;

import com.ephemera.store.core.NamespaceRegistry;
import com.ephemera.store.core.WriteCursorSource;
import com.ephemera.store.repo.documents.ApiKeyRepo;
import com.ephemera.store.repo.documents.CacheEntryRepo;
import com.ephemera.store.service.CacheService;
import com.ephemera.store.service.DurableStatus;
import com.ephemera.store.service.PermissionCache;
import com.ephemera.store.service.WriteBehindBatcher;
import com.ephemera.store.service.tier.DurableTier;
import com.ephemera.store.service.tier.MemoryTier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;

/**
 * Wires the cache engine. Everything is a plain object built here, so tests can build the
 * same graph by hand.
 */
@Configuration
public class StoreConfig {

    @Bean
    @ConfigurationProperties(prefix = "ephemera")
    public StoreProperties storeProperties() {
        return new StoreProperties();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public NamespaceRegistry namespaceRegistry(Clock clock) {
        return new NamespaceRegistry(clock);
    }

    @Bean
    public WriteCursorSource writeCursorSource(Clock clock) {
        return new WriteCursorSource(clock);
    }

    @Bean
    public MemoryTier memoryTier(NamespaceRegistry registry) {
        return new MemoryTier(registry);
    }

    @Bean
    public DurableStatus durableStatus(MongoTemplate mongoTemplate, StoreProperties props) {
        return new DurableStatus(mongoTemplate, props.getDurable().isEnabled());
    }

    @Bean
    public DurableTier durableTier(MongoTemplate mongoTemplate, CacheEntryRepo repo, Clock clock) {
        return new DurableTier(mongoTemplate, repo, clock);
    }

    @Bean
    public WriteBehindBatcher writeBehindBatcher(DurableTier durableTier, StoreProperties props) {
        return new WriteBehindBatcher(durableTier, props.getBatch().getSize());
    }

    @Bean
    public PermissionCache permissionCache(ApiKeyRepo apiKeyRepo, DurableStatus status, StoreProperties props, Clock clock) {
        return new PermissionCache(apiKeyRepo, status, props.getAuth().getKeys(), props.getAuth().getCacheTtl(), clock);
    }

    @Bean
    public CacheService cacheService(MemoryTier memory, DurableTier durable, DurableStatus status,
                                     WriteBehindBatcher batcher, WriteCursorSource cursors, StoreProperties props) {
        return new CacheService(memory, durable, status, batcher, cursors, props.getDefaultTtlSeconds());
    }
}
