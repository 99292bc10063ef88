package com.ephemera.store.service;

import com.ephemera.store.core.ExpiringStore;
import com.ephemera.store.model.AccessScope;
import com.ephemera.store.model.documents.ApiKeyDocument;
import com.ephemera.store.repo.documents.ApiKeyRepo;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves API tokens to the namespaces they may use.
 * <p>
 * Lookups hit the {@code api_keys} collection at most once per token per cache TTL.
 * While the durable tier is down, tokens from the static allow-list get wildcard access
 * and everything else is rejected; those fallback grants are not cached.
 */
@Slf4j
public class PermissionCache {

    private final ExpiringStore<String, AccessScope> cache;
    private final ApiKeyRepo apiKeys;
    private final DurableStatus durable;
    private final Set<String> staticKeys;
    private final long ttlSeconds;

    public PermissionCache(ApiKeyRepo apiKeys, DurableStatus durable, Collection<String> staticKeys,
                           Duration ttl, Clock clock) {
        this.cache = new ExpiringStore<>(clock);
        this.apiKeys = apiKeys;
        this.durable = durable;
        this.staticKeys = staticKeys == null ? Set.of() : staticKeys.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(String::trim)
                .collect(Collectors.toUnmodifiableSet());
        this.ttlSeconds = Math.max(1L, ttl.toSeconds());
    }

    public Optional<AccessScope> resolve(String token) {
        if (token == null || token.isBlank()) return Optional.empty();

        final Optional<AccessScope> cached = cache.get(token);
        if (cached.isPresent()) return cached;

        if (durable.isAvailable()) {
            final Optional<ApiKeyDocument> record = apiKeys.findByKeyAndActiveTrue(token);
            if (record.isEmpty()) {
                log.debug("No active API key record for token {}", mask(token));
                return Optional.empty();
            }
            final AccessScope scope = AccessScope.of(record.get().getAllowedNamespaces());
            cache.set(token, scope, ttlSeconds);
            return Optional.of(scope);
        }

        if (staticKeys.contains(token)) {
            return Optional.of(AccessScope.universal());
        }
        return Optional.empty();
    }

    public void invalidate(String token) {
        cache.delete(token);
    }

    public int prune(int chunkSize) {
        return cache.prune(chunkSize);
    }

    static String mask(String token) {
        return token.length() <= 3 ? "***" : token.substring(0, 3) + "...";
    }
}
