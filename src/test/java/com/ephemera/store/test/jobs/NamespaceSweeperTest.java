package com.ephemera.store.test.jobs;

import com.ephemera.store.config.StoreProperties;
import com.ephemera.store.core.CachedEntry;
import com.ephemera.store.core.NamespaceRegistry;
import com.ephemera.store.jobs.NamespaceSweeper;
import com.ephemera.store.service.PermissionCache;
import com.ephemera.store.test.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class NamespaceSweeperTest {

    MutableClock clock;
    NamespaceRegistry registry;
    PermissionCache permissions;
    NamespaceSweeper sweeper;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochMillis(10_000L);
        registry = new NamespaceRegistry(clock);
        permissions = mock(PermissionCache.class);
        StoreProperties props = new StoreProperties();
        props.getSweep().setChunkSize(2);
        sweeper = new NamespaceSweeper(registry, permissions, props);
    }

    @Test
    void dropsNamespacesWhoseEntriesAllExpired() {
        registry.write("temp", s -> {
            s.set("a", new CachedEntry("x", 1L), 1);
            s.set("b", new CachedEntry("y", 2L), 1);
        });
        registry.write("keep", s -> s.set("a", new CachedEntry("z", 3L), 0));

        clock.advanceSeconds(5);
        int removed = sweeper.sweep();

        assertThat(removed).isEqualTo(1);
        assertThat(registry.namespaces()).containsExactly("keep");
        verify(permissions).prune(2);
    }

    @Test
    void keepsNamespacesThatStillHoldLiveEntries() {
        registry.write("mixed", s -> {
            s.set("old", new CachedEntry("x", 1L), 1);
            s.set("new", new CachedEntry("y", 2L), 60);
        });

        clock.advanceSeconds(5);
        sweeper.sweep();

        assertThat(registry.find("mixed")).isPresent();
        assertThat(registry.find("mixed").get().keys()).containsExactly("new");
    }

    @Test
    void scheduledRunSwallowsAndLogsFailures() {
        doThrow(new IllegalStateException("boom")).when(permissions).prune(anyInt());
        registry.getOrCreate("empty");

        sweeper.scheduledSweep();

        assertThat(registry.namespaces()).isEmpty();
    }
}
