package com.ephemera.store.service.tier;

import com.ephemera.store.dto.PageResult;
import com.ephemera.store.dto.RankResult;
import com.ephemera.store.dto.SortQuery;
import com.ephemera.store.enums.SortOrder;
import com.ephemera.store.enums.Tier;
import com.ephemera.store.model.WriteOp;

import java.util.List;
import java.util.Optional;

/**
 * The operations every backing tier supports. Implementations must agree on result
 * shape and semantics so a caller cannot tell the tiers apart except by {@link #tier()}.
 */
public interface CacheTier {

    Tier tier();

    /**
     * Inserts or overwrites; {@code ttlSeconds <= 0} never expires.
     */
    void write(String namespace, String key, Object payload, long writeCursor, long ttlSeconds);

    /**
     * Writes all ops; they are independent of each other.
     */
    void writeAll(List<WriteOp> ops);

    Optional<Object> read(String namespace, String key);

    boolean delete(String namespace, String key);

    /**
     * Newest first. Only entries with writeCursor strictly below {@code cursor} when one is given.
     */
    PageResult listByRecency(String namespace, Long cursor, int pageSize);

    PageResult listBySortedField(String namespace, SortQuery query);

    /**
     * @throws com.ephemera.store.common.exception.EntryNotFoundException when the key is absent
     * @throws com.ephemera.store.common.exception.FieldMissingException  when the entry lacks the
     *                                                                     field and no default is given
     */
    RankResult rank(String namespace, String key, String field, SortOrder order, Object defaultValue);
}
