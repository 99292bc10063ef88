package com.ephemera.store.test.service;

import com.ephemera.store.model.WriteOp;
import com.ephemera.store.service.WriteBehindBatcher;
import com.ephemera.store.service.tier.CacheTier;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class WriteBehindBatcherTest {

    private static WriteOp op(int i) {
        return WriteOp.of("ns", "k" + i, i, 1_000L + i, 60);
    }

    @Test
    void reachingTheThresholdFlushesImmediately() {
        CacheTier durable = mock(CacheTier.class);
        WriteBehindBatcher batcher = new WriteBehindBatcher(durable, 3);

        batcher.enqueue(op(1));
        batcher.enqueue(op(2));
        verify(durable, never()).writeAll(anyList());

        batcher.enqueue(op(3));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<WriteOp>> captor = ArgumentCaptor.forClass(List.class);
        verify(durable).writeAll(captor.capture());
        assertThat(captor.getValue()).extracting(WriteOp::key).containsExactly("k1", "k2", "k3");
        assertThat(batcher.pending()).isZero();
    }

    @Test
    void flushWritesWhateverIsPending() {
        CacheTier durable = mock(CacheTier.class);
        WriteBehindBatcher batcher = new WriteBehindBatcher(durable, 100);

        batcher.enqueueMany(List.of(op(1), op(2)));

        assertThat(batcher.flush()).isEqualTo(2);
        assertThat(batcher.flush()).isZero();
        verify(durable, times(1)).writeAll(anyList());
    }

    @Test
    void failedBulkIsDroppedNotRetried() {
        CacheTier durable = mock(CacheTier.class);
        doThrow(new IllegalStateException("down")).when(durable).writeAll(anyList());
        WriteBehindBatcher batcher = new WriteBehindBatcher(durable, 100);

        batcher.enqueue(op(1));

        assertThat(batcher.flush()).isZero();
        assertThat(batcher.pending()).isZero();
        batcher.flush();
        verify(durable, times(1)).writeAll(anyList());
    }

    @Test
    void drainFlushesOnShutdown() {
        CacheTier durable = mock(CacheTier.class);
        WriteBehindBatcher batcher = new WriteBehindBatcher(durable, 100);
        batcher.enqueue(op(1));

        batcher.drain();

        verify(durable).writeAll(anyList());
    }

    @Test
    void concurrentEnqueuesAreNeitherLostNorDuplicated() throws Exception {
        List<WriteOp> written = Collections.synchronizedList(new ArrayList<>());
        CacheTier durable = mock(CacheTier.class);
        doAnswer(inv -> {
            List<WriteOp> ops = inv.getArgument(0);
            written.addAll(ops);
            return null;
        }).when(durable).writeAll(anyList());
        WriteBehindBatcher batcher = new WriteBehindBatcher(durable, 7);

        int threads = 8;
        int perThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        for (int t = 0; t < threads; t++) {
            int base = t * perThread;
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    batcher.enqueue(op(base + i));
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        batcher.flush();

        assertThat(written).hasSize(threads * perThread);
        assertThat(written).extracting(WriteOp::key).doesNotHaveDuplicates();
    }
}
