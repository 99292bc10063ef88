package com.ephemera.store.jobs;

import com.ephemera.store.config.StoreProperties;
import com.ephemera.store.core.CachedEntry;
import com.ephemera.store.core.ExpiringStore;
import com.ephemera.store.core.NamespaceRegistry;
import com.ephemera.store.service.PermissionCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reclaims memory held by expired entries that are never read again, and drops
 * namespaces left empty. Reads already ignore expired entries, so nothing depends on
 * this job for correctness.
 * <p>
 * Configure (optional):
 * ephemera.sweep.interval=PT5M
 * ephemera.sweep.chunk-size=1000
 * <p>
 * Runs with a fixed delay: the next sweep is scheduled only after the previous one ends.
 */
@Component
@Slf4j
public class NamespaceSweeper {

    private final NamespaceRegistry registry;
    private final PermissionCache permissions;
    private final int chunkSize;

    public NamespaceSweeper(NamespaceRegistry registry, PermissionCache permissions, StoreProperties props) {
        this.registry = registry;
        this.permissions = permissions;
        this.chunkSize = props.getSweep().getChunkSize();
    }

    @Scheduled(
            initialDelayString = "${ephemera.sweep.interval:PT5M}",
            fixedDelayString = "${ephemera.sweep.interval:PT5M}"
    )
    public void scheduledSweep() {
        try {
            sweep();
        } catch (RuntimeException ex) {
            log.warn("Namespace sweep failed: {}", ex.getMessage(), ex);
        }
    }

    /**
     * One full pass. Returns the number of namespaces removed.
     */
    public int sweep() {
        long t0 = System.currentTimeMillis();
        int visited = 0;
        int removed = 0;
        int evicted = 0;
        for (String namespace : registry.namespaces()) {
            visited++;
            Optional<ExpiringStore<String, CachedEntry>> store = registry.find(namespace);
            if (store.isPresent() && !store.get().isEmpty()) {
                evicted += store.get().prune(chunkSize);
            }
            // re-checked under the registry slot, so a concurrent write keeps the namespace
            if (registry.removeIfEmpty(namespace)) {
                removed++;
            }
            Thread.yield();
        }
        int authEvicted = permissions.prune(chunkSize);
        log.debug("Sweep done: {} namespaces visited, {} removed, {} entries and {} auth entries evicted ({} ms)",
                visited, removed, evicted, authEvicted, System.currentTimeMillis() - t0);
        return removed;
    }
}
