package com.ephemera.store.service;

import com.ephemera.store.common.exception.DurableTierUnavailableException;
import com.ephemera.store.common.exception.EntryNotFoundException;
import com.ephemera.store.core.WriteCursorSource;
import com.ephemera.store.dto.BatchItem;
import com.ephemera.store.dto.BatchWriteRequest;
import com.ephemera.store.dto.DeleteView;
import com.ephemera.store.dto.EntryView;
import com.ephemera.store.dto.PageResult;
import com.ephemera.store.dto.RankResult;
import com.ephemera.store.dto.SortQuery;
import com.ephemera.store.dto.WriteRequest;
import com.ephemera.store.enums.SortOrder;
import com.ephemera.store.model.AccessScope;
import com.ephemera.store.model.WriteOp;
import com.ephemera.store.service.tier.CacheTier;
import com.ephemera.store.service.tier.DurableTier;
import com.ephemera.store.service.tier.MemoryTier;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for every cache operation. Picks the tier from the caller's flag and never
 * substitutes one tier for the other: asking for the durable tier while it is down fails.
 */
@Slf4j
public class CacheService {

    private final MemoryTier memory;
    private final DurableTier durable;
    private final DurableStatus durableStatus;
    private final WriteBehindBatcher batcher;
    private final WriteCursorSource cursors;
    private final long defaultTtlSeconds;

    public CacheService(MemoryTier memory, DurableTier durable, DurableStatus durableStatus,
                        WriteBehindBatcher batcher, WriteCursorSource cursors, long defaultTtlSeconds) {
        this.memory = memory;
        this.durable = durable;
        this.durableStatus = durableStatus;
        this.batcher = batcher;
        this.cursors = cursors;
        this.defaultTtlSeconds = defaultTtlSeconds;
    }

    CacheTier tierFor(boolean useDurable) {
        if (!useDurable) return memory;
        if (!durableStatus.isAvailable()) {
            throw new DurableTierUnavailableException();
        }
        return durable;
    }

    private long ttlOf(Long ttl) {
        return ttl == null ? defaultTtlSeconds : ttl;
    }

    public void write(String namespace, String key, WriteRequest req) {
        final CacheTier tier = tierFor(Boolean.TRUE.equals(req.getPersist()));
        tier.write(namespace, key, req.getData(), cursors.next(), ttlOf(req.getTtl()));
    }

    public EntryView read(String namespace, String key, boolean useDb) {
        final CacheTier tier = tierFor(useDb);
        final Object data = tier.read(namespace, key)
                .orElseThrow(() -> new EntryNotFoundException(namespace, key));
        return new EntryView(key, data, tier.tier());
    }

    public DeleteView delete(String namespace, String key, boolean useDb) {
        final CacheTier tier = tierFor(useDb);
        return new DeleteView(key, tier.delete(namespace, key), tier.tier());
    }

    public PageResult listByRecency(String namespace, Long cursor, int pageSize, boolean useDb) {
        return tierFor(useDb).listByRecency(namespace, cursor, pageSize);
    }

    public PageResult listBySortedField(String namespace, SortQuery query, boolean useDb) {
        return tierFor(useDb).listBySortedField(namespace, query);
    }

    public RankResult rank(String namespace, String key, String field, SortOrder order,
                           Object defaultValue, boolean useDb) {
        return tierFor(useDb).rank(namespace, key, field, order, defaultValue);
    }

    /**
     * Writes items spanning several namespaces synchronously. Every namespace is checked
     * against {@code scope} before anything is written; one disallowed item rejects all.
     *
     * @return number of items written
     */
    public int writeBatch(AccessScope scope, BatchWriteRequest req) {
        checkAll(scope, req.getItems());
        final CacheTier tier = tierFor(Boolean.TRUE.equals(req.getPersist()));
        final List<WriteOp> ops = toOps(req.getItems());
        tier.writeAll(ops);
        return ops.size();
    }

    /**
     * Same checks as {@link #writeBatch}, but the items go to the write-behind queue of the
     * durable tier and may be lost if the later bulk fails.
     *
     * @return number of items queued
     */
    public int writeBuffered(AccessScope scope, BatchWriteRequest req) {
        checkAll(scope, req.getItems());
        tierFor(true);
        final List<WriteOp> ops = toOps(req.getItems());
        batcher.enqueueMany(ops);
        log.debug("Queued {} buffered writes", ops.size());
        return ops.size();
    }

    private static void checkAll(AccessScope scope, List<BatchItem> items) {
        for (BatchItem item : items) {
            scope.check(item.getNamespace());
        }
    }

    private List<WriteOp> toOps(List<BatchItem> items) {
        final List<WriteOp> ops = new ArrayList<>(items.size());
        for (BatchItem item : items) {
            ops.add(WriteOp.of(item.getNamespace(), item.getKey(), item.getData(), cursors.next(), ttlOf(item.getTtl())));
        }
        return ops;
    }
}
