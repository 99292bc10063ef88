package com.ephemera.store.core;

import java.time.Clock;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Key/value map where every entry carries an absolute expiry instant.
 * <p>
 * Contracts:
 * - All methods are thread-safe.
 * - TTL of zero or less means "no expiry" (never "expire immediately").
 * - Expiry is lazy: an expired entry is removed by the read that observes it.
 * {@link #prune(int)} only reclaims memory for keys nobody reads again.
 */
public final class ExpiringStore<K, V> {

    private static final long NO_EXPIRY = Long.MAX_VALUE;

    private static final class Entry<V> {
        final V value;
        final long expAtMillis;

        Entry(V value, long expAtMillis) {
            this.value = value;
            this.expAtMillis = expAtMillis;
        }
    }

    private final ConcurrentMap<K, Entry<V>> map = new ConcurrentHashMap<>();
    private final Clock clock;

    public ExpiringStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.clock = clock;
    }

    private long now() {
        return clock.millis();
    }

    private static boolean isExpired(Entry<?> e, long now) {
        return e.expAtMillis < now;
    }

    /**
     * Saturates at {@link #NO_EXPIRY}: a TTL too large to represent never expires.
     */
    private long expiryFor(long ttlSeconds) {
        if (ttlSeconds <= 0) return NO_EXPIRY;
        try {
            return Math.addExact(now(), Math.multiplyExact(ttlSeconds, 1000L));
        } catch (ArithmeticException overflow) {
            return NO_EXPIRY;
        }
    }

    public void set(K key, V value, long ttlSeconds) {
        map.put(key, new Entry<>(value, expiryFor(ttlSeconds)));
    }

    /**
     * Same as {@link #set} with an absolute expiry; {@code Long.MAX_VALUE} never expires.
     */
    public void setUntil(K key, V value, long expAtMillis) {
        map.put(key, new Entry<>(value, expAtMillis));
    }

    public Optional<V> get(K key) {
        final Entry<V> e = map.get(key);
        if (e == null) return Optional.empty();
        if (isExpired(e, now())) {
            // only drop the instance we saw; a concurrent set() must survive
            map.remove(key, e);
            return Optional.empty();
        }
        return Optional.ofNullable(e.value);
    }

    public boolean has(K key) {
        return get(key).isPresent();
    }

    public boolean delete(K key) {
        return map.remove(key) != null;
    }

    public void clear() {
        map.clear();
    }

    /**
     * Weakly consistent view of the stored keys. Expired entries that were not read yet
     * are still listed; callers re-check through {@link #get(Object)}.
     */
    public Set<K> keys() {
        return Collections.unmodifiableSet(map.keySet());
    }

    /**
     * Number of live entries. Walks the whole map, evicting as it goes.
     */
    public int size() {
        int count = 0;
        for (K key : map.keySet()) {
            if (has(key)) count++;
        }
        return count;
    }

    /**
     * True when nothing is stored, expired or not.
     */
    public boolean isEmpty() {
        return map.isEmpty();
    }

    /**
     * Returns the live value for {@code key}, creating it with {@code factory} when it is
     * missing or expired. Concurrent callers for the same key observe the same instance.
     */
    public V computeIfAbsent(K key, Function<? super K, ? extends V> factory, long ttlSeconds) {
        final long n = now();
        return map.compute(key, (k, cur) -> {
            if (cur != null && !isExpired(cur, n)) return cur;
            return new Entry<>(factory.apply(k), expiryFor(ttlSeconds));
        }).value;
    }

    /**
     * Atomically applies {@code action} to the live value for {@code key} (creating it when
     * absent) while holding the slot, so no concurrent {@link #removeIf} can unlink it midway.
     */
    public V update(K key, Function<? super K, ? extends V> factory, long ttlSeconds,
                    Consumer<? super V> action) {
        final long n = now();
        return map.compute(key, (k, cur) -> {
            Entry<V> e = cur;
            if (e == null || isExpired(e, n)) {
                e = new Entry<>(factory.apply(k), expiryFor(ttlSeconds));
            }
            action.accept(e.value);
            return e;
        }).value;
    }

    /**
     * Removes the entry for {@code key} when its value matches {@code predicate}.
     * Evaluated atomically with respect to {@link #update} and {@link #computeIfAbsent}.
     */
    public boolean removeIf(K key, Predicate<? super V> predicate) {
        final boolean[] removed = {false};
        map.computeIfPresent(key, (k, cur) -> {
            if (predicate.test(cur.value)) {
                removed[0] = true;
                return null;
            }
            return cur;
        });
        return removed[0];
    }

    /**
     * Walks every key, forcing the lazy expiry check, and yields the thread every
     * {@code chunkSize} entries so a large sweep does not hog the scheduler.
     *
     * @return number of entries evicted
     */
    public int prune(int chunkSize) {
        final int chunk = Math.max(1, chunkSize);
        int checked = 0;
        int removed = 0;
        for (K key : map.keySet()) {
            final Entry<V> e = map.get(key);
            if (e != null && isExpired(e, now()) && map.remove(key, e)) {
                removed++;
            }
            if (++checked % chunk == 0) {
                Thread.yield();
            }
        }
        return removed;
    }
}
