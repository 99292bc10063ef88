package com.ephemera.store.service;

import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Whether the durable tier can be used right now. Disabled by configuration, or unreachable
 * according to the last {@code ping}.
 */
@Slf4j
public class DurableStatus {

    private final MongoTemplate mongo;
    private final boolean enabled;
    private volatile boolean reachable;

    public DurableStatus(MongoTemplate mongo, boolean enabled) {
        this.mongo = mongo;
        this.enabled = enabled;
        if (!enabled) {
            log.info("Durable tier disabled; persist/useDb requests will be rejected");
        }
    }

    public boolean isAvailable() {
        return enabled && reachable;
    }

    @Scheduled(initialDelay = 0, fixedDelayString = "${ephemera.durable.ping-interval:PT10S}")
    public void refresh() {
        ping();
    }

    /**
     * Pings the server and records the outcome. Logs only on transitions.
     */
    public boolean ping() {
        if (!enabled) return false;
        boolean ok;
        try {
            mongo.executeCommand(new Document("ping", 1));
            ok = true;
        } catch (RuntimeException ex) {
            ok = false;
            if (reachable) {
                log.warn("Durable tier unreachable: {}", ex.getMessage());
            } else {
                log.debug("Durable tier still unreachable: {}", ex.getMessage());
            }
        }
        if (ok && !reachable) {
            log.info("Durable tier connected");
        }
        reachable = ok;
        return ok;
    }
}
