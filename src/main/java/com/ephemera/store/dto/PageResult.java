package com.ephemera.store.dto;

import com.ephemera.store.enums.Tier;

import java.util.List;

/**
 * One page of a namespace listing. Both tiers fill every field with the same meaning:
 * {@code nextCursor} is the sort value (or write time) of the last item and is null on an
 * empty page; {@code hasMore} is true only when continuing from {@code nextCursor} yields
 * at least one more entry.
 */
public record PageResult(List<PageItem> items,
                         int pageSize,
                         long totalItems,
                         Object nextCursor,
                         boolean hasMore,
                         Tier source) {

    public static PageResult empty(int pageSize, long totalItems, Tier source) {
        return new PageResult(List.of(), pageSize, totalItems, null, false, source);
    }
}
