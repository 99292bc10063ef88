package com.ephemera.store.common.constants;

import java.time.Instant;
import java.util.Set;

public final class StoreConstants {

    private StoreConstants() {
    }

    /** Grants access to every namespace. */
    public static final String WILDCARD = "*";

    /** First path segments that are routes, not namespaces. */
    public static final Set<String> RESERVED_SEGMENTS = Set.of("batch", "sorted", "rank");

    /** Stored as expireAt for entries written with ttl <= 0; the TTL index never reaches it. */
    public static final Instant NEVER_EXPIRES = Instant.parse("9999-12-31T23:59:59Z");

    public static final String REQ_ATTR_ACCESS_SCOPE = "ephemera.accessScope";

    public static final String BEARER_PREFIX = "Bearer ";
}
