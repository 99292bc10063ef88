package com.ephemera.store.dto;

import com.ephemera.store.enums.SortOrder;
import com.ephemera.store.enums.Tier;

/**
 * 1-based position of {@code key} when the namespace is ordered by {@code field}.
 * {@code value} is the effective value the rank was computed from.
 */
public record RankResult(String key, long rank, Object value, String field, SortOrder order, Tier source) {
}
