package com.ephemera.store.config;

import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Externalized knobs under the {@code ephemera.*} prefix. Defaults shown below can be
 * overridden in application.yml or through the environment.
 */
@Data
public class StoreProperties {

    /**
     * TTL applied when a write does not carry one.
     */
    private long defaultTtlSeconds = 120;

    private Sweep sweep = new Sweep();
    private Batch batch = new Batch();
    private Auth auth = new Auth();
    private Durable durable = new Durable();
    private Payload payload = new Payload();

    @Data
    public static class Sweep {
        private Duration interval = Duration.ofMinutes(5);
        /**
         * Entries checked between two yields of the sweeping thread.
         */
        private int chunkSize = 1000;
    }

    @Data
    public static class Batch {
        /**
         * Queue length that triggers an immediate flush.
         */
        private int size = 500;
        private Duration flushInterval = Duration.ofSeconds(5);
    }

    @Data
    public static class Auth {
        private Duration cacheTtl = Duration.ofSeconds(60);
        /**
         * Static tokens accepted (with wildcard access) while the durable tier is down.
         * Seeded into api_keys on startup.
         */
        private List<String> keys = new ArrayList<>();
    }

    @Data
    public static class Durable {
        private boolean enabled = true;
        private Duration pingInterval = Duration.ofSeconds(10);
        /**
         * Create indexes and seed static keys at startup.
         */
        private boolean init = true;
    }

    @Data
    public static class Payload {
        /**
         * Requests above this many bytes are logged as a warning.
         */
        private long warnBytes = 1024L * 1024L;
    }
}
