package com.ephemera.store.test.service;

import com.ephemera.store.model.AccessScope;
import com.ephemera.store.model.documents.ApiKeyDocument;
import com.ephemera.store.repo.documents.ApiKeyRepo;
import com.ephemera.store.service.DurableStatus;
import com.ephemera.store.service.PermissionCache;
import com.ephemera.store.test.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PermissionCacheTest {

    MutableClock clock;
    ApiKeyRepo repo;
    DurableStatus status;
    PermissionCache cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochMillis(5_000L);
        repo = mock(ApiKeyRepo.class);
        status = mock(DurableStatus.class);
        cache = new PermissionCache(repo, status, List.of("static-key", " "), Duration.ofSeconds(60), clock);
    }

    private static ApiKeyDocument key(String token, String... namespaces) {
        ApiKeyDocument doc = new ApiKeyDocument();
        doc.setKey(token);
        doc.setAllowedNamespaces(List.of(namespaces));
        doc.setActive(true);
        return doc;
    }

    @Test
    void resolvesFromStoreAndCachesForTheTtl() {
        when(status.isAvailable()).thenReturn(true);
        when(repo.findByKeyAndActiveTrue("t1")).thenReturn(Optional.of(key("t1", "users")));

        Optional<AccessScope> first = cache.resolve("t1");
        clock.advanceSeconds(30);
        Optional<AccessScope> second = cache.resolve("t1");

        assertThat(first).hasValueSatisfying(s -> {
            assertThat(s.allows("users")).isTrue();
            assertThat(s.allows("orders")).isFalse();
        });
        assertThat(second).isEqualTo(first);
        verify(repo, times(1)).findByKeyAndActiveTrue("t1");

        clock.advanceSeconds(31);
        cache.resolve("t1");
        verify(repo, times(2)).findByKeyAndActiveTrue("t1");
    }

    @Test
    void unknownTokenIsRejected() {
        when(status.isAvailable()).thenReturn(true);
        when(repo.findByKeyAndActiveTrue(anyString())).thenReturn(Optional.empty());

        assertThat(cache.resolve("nobody")).isEmpty();
        assertThat(cache.resolve("")).isEmpty();
        assertThat(cache.resolve(null)).isEmpty();
    }

    @Test
    void staticKeysGetWildcardWhileDurableTierIsDown() {
        when(status.isAvailable()).thenReturn(false);

        assertThat(cache.resolve("static-key")).hasValueSatisfying(s -> assertThat(s.isUniversal()).isTrue());
        assertThat(cache.resolve("other")).isEmpty();
        verify(repo, never()).findByKeyAndActiveTrue(anyString());
    }

    @Test
    void invalidateForcesALookup() {
        when(status.isAvailable()).thenReturn(true);
        when(repo.findByKeyAndActiveTrue("t1")).thenReturn(Optional.of(key("t1", "*")));

        cache.resolve("t1");
        cache.invalidate("t1");
        cache.resolve("t1");

        verify(repo, times(2)).findByKeyAndActiveTrue("t1");
    }

    @Test
    void wildcardScopeAllowsEveryNamespace() {
        AccessScope scope = AccessScope.of(List.of("*"));
        assertThat(scope.allows("anything")).isTrue();
        assertThat(AccessScope.of(null).allows("x")).isFalse();
    }
}
