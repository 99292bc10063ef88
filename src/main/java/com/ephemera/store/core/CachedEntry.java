package com.ephemera.store.core;

/**
 * What the memory tier keeps per key: the caller's payload plus the write time used
 * for recency ordering and as the pagination cursor.
 */
public record CachedEntry(Object payload, long writeCursor) {
}
