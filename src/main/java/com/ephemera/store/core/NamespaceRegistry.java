package com.ephemera.store.core;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Process-local set of namespaces, each an {@link ExpiringStore} of cached entries.
 * Namespaces never expire at this level; only the sweeper removes them, and only once
 * they hold nothing.
 */
public final class NamespaceRegistry {

    private static final long NO_TTL = 0L;

    private final ExpiringStore<String, ExpiringStore<String, CachedEntry>> namespaces;
    private final Clock clock;

    public NamespaceRegistry(Clock clock) {
        this.clock = clock;
        this.namespaces = new ExpiringStore<>(clock);
    }

    public ExpiringStore<String, CachedEntry> getOrCreate(String namespace) {
        return namespaces.computeIfAbsent(namespace, ns -> new ExpiringStore<>(clock), NO_TTL);
    }

    /**
     * Mutates a namespace while holding its registry slot, so the sweeper cannot unlink
     * the store between lookup and write.
     */
    public void write(String namespace, Consumer<ExpiringStore<String, CachedEntry>> action) {
        namespaces.update(namespace, ns -> new ExpiringStore<>(clock), NO_TTL, action);
    }

    public Optional<ExpiringStore<String, CachedEntry>> find(String namespace) {
        return namespaces.get(namespace);
    }

    public List<String> namespaces() {
        return new ArrayList<>(namespaces.keys());
    }

    public boolean removeIfEmpty(String namespace) {
        return namespaces.removeIf(namespace, ExpiringStore::isEmpty);
    }
}
