package com.ephemera.store.test.model;

import com.ephemera.store.common.constants.StoreConstants;
import com.ephemera.store.model.WriteOp;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class WriteOpTest {

    private static final long CURSOR = 1_700_000_000_000L;

    @Test
    void expiryIsMeasuredFromTheWriteCursor() {
        WriteOp op = WriteOp.of("ns", "k", "v", CURSOR, 30);
        assertThat(op.expireAt()).isEqualTo(Instant.ofEpochMilli(CURSOR + 30_000L));
        assertThat(op.neverExpires()).isFalse();
    }

    @Test
    void nonPositiveTtlNeverExpires() {
        assertThat(WriteOp.of("ns", "k", "v", CURSOR, 0).expireAt()).isEqualTo(StoreConstants.NEVER_EXPIRES);
        assertThat(WriteOp.of("ns", "k", "v", CURSOR, -1).neverExpires()).isTrue();
    }

    @Test
    void hugeTtlIsCappedInsteadOfWrapping() {
        WriteOp overflowing = WriteOp.of("ns", "k", "v", CURSOR, 9_300_000_000_000_000L);
        WriteOp pastYear9999 = WriteOp.of("ns", "k", "v", CURSOR, 400_000_000_000L);

        assertThat(overflowing.expireAt()).isEqualTo(StoreConstants.NEVER_EXPIRES);
        assertThat(pastYear9999.expireAt()).isEqualTo(StoreConstants.NEVER_EXPIRES);
        assertThat(overflowing.neverExpires()).isTrue();
    }
}
