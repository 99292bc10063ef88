package com.ephemera.store.jobs;

import com.ephemera.store.service.WriteBehindBatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Bounds how long a buffered write can wait when the queue never reaches its size
 * threshold.
 * <p>
 * Configure (optional):
 * ephemera.batch.flush-interval=PT5S
 */
@Component
@Slf4j
public class WriteBehindFlushJob {

    private final WriteBehindBatcher batcher;

    public WriteBehindFlushJob(WriteBehindBatcher batcher) {
        this.batcher = batcher;
    }

    @Scheduled(fixedDelayString = "${ephemera.batch.flush-interval:PT5S}")
    public void flushPending() {
        if (batcher.pending() == 0) return;
        try {
            int n = batcher.flush();
            log.debug("Periodic flush wrote {} buffered writes", n);
        } catch (RuntimeException ex) {
            log.warn("Periodic flush error: {}", ex.getMessage(), ex);
        }
    }
}
