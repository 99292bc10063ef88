package com.ephemera.store.service;

import com.ephemera.store.model.WriteOp;
import com.ephemera.store.service.tier.CacheTier;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Queues durable upserts and applies them as one unordered bulk, either as soon as the
 * queue reaches {@code threshold} (on the enqueuing thread) or when the periodic flush
 * job runs.
 * <p>
 * Delivery is at-most-once: a bulk that fails is logged and dropped, never retried.
 * Callers that need a guarantee write synchronously instead.
 */
@Slf4j
public class WriteBehindBatcher {

    private final CacheTier durable;
    private final int threshold;

    private final Object lock = new Object();
    private List<WriteOp> queue = new ArrayList<>();

    public WriteBehindBatcher(CacheTier durable, int threshold) {
        this.durable = durable;
        this.threshold = Math.max(1, threshold);
    }

    public void enqueue(WriteOp op) {
        enqueueMany(List.of(op));
    }

    public void enqueueMany(List<WriteOp> ops) {
        List<WriteOp> full = null;
        synchronized (lock) {
            queue.addAll(ops);
            if (queue.size() >= threshold) {
                full = swap();
            }
        }
        if (full != null) {
            apply(full);
        }
    }

    /**
     * Swaps the queue for an empty one and writes the snapshot.
     *
     * @return number of operations written, 0 when nothing was pending or the bulk failed
     */
    public int flush() {
        final List<WriteOp> snapshot;
        synchronized (lock) {
            if (queue.isEmpty()) return 0;
            snapshot = swap();
        }
        return apply(snapshot);
    }

    public int pending() {
        synchronized (lock) {
            return queue.size();
        }
    }

    @PreDestroy
    public void drain() {
        final int n = flush();
        if (n > 0) {
            log.info("Drained {} buffered writes on shutdown", n);
        }
    }

    // caller holds lock
    private List<WriteOp> swap() {
        final List<WriteOp> snapshot = queue;
        queue = new ArrayList<>();
        return snapshot;
    }

    private int apply(List<WriteOp> ops) {
        try {
            durable.writeAll(ops);
            log.debug("Flushed {} buffered writes", ops.size());
            return ops.size();
        } catch (RuntimeException ex) {
            log.error("Failed to flush {} buffered writes; batch dropped", ops.size(), ex);
            return 0;
        }
    }
}
