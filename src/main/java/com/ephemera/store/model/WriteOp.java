package com.ephemera.store.model;

import com.ephemera.store.common.constants.StoreConstants;

import java.time.Instant;

/**
 * A single upsert, as queued by the write-behind batcher or sent as one item of a batch.
 */
public record WriteOp(String namespace, String key, Object payload, long writeCursor, Instant expireAt) {

    /**
     * Expiry is measured from {@code writeCursor}; {@code ttlSeconds <= 0} never expires.
     */
    public static WriteOp of(String namespace, String key, Object payload, long writeCursor, long ttlSeconds) {
        return new WriteOp(namespace, key, payload, writeCursor, expiryOf(writeCursor, ttlSeconds));
    }

    /**
     * Capped at {@link StoreConstants#NEVER_EXPIRES}, which also absorbs arithmetic overflow.
     */
    static Instant expiryOf(long writeCursor, long ttlSeconds) {
        if (ttlSeconds <= 0) return StoreConstants.NEVER_EXPIRES;
        final Instant expireAt;
        try {
            expireAt = Instant.ofEpochMilli(Math.addExact(writeCursor, Math.multiplyExact(ttlSeconds, 1000L)));
        } catch (ArithmeticException overflow) {
            return StoreConstants.NEVER_EXPIRES;
        }
        return expireAt.isAfter(StoreConstants.NEVER_EXPIRES) ? StoreConstants.NEVER_EXPIRES : expireAt;
    }

    public boolean neverExpires() {
        return !expireAt.isBefore(StoreConstants.NEVER_EXPIRES);
    }
}
