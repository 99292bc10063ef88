package com.ephemera.store.service.tier;

import com.ephemera.store.common.exception.EntryNotFoundException;
import com.ephemera.store.common.exception.FieldMissingException;
import com.ephemera.store.core.CachedEntry;
import com.ephemera.store.core.ExpiringStore;
import com.ephemera.store.core.NamespaceRegistry;
import com.ephemera.store.dto.PageItem;
import com.ephemera.store.dto.PageResult;
import com.ephemera.store.dto.RankResult;
import com.ephemera.store.dto.SortQuery;
import com.ephemera.store.enums.SortOrder;
import com.ephemera.store.enums.Tier;
import com.ephemera.store.model.WriteOp;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Process-local tier. Every query works on a snapshot of the live entries of one
 * namespace, so totals and "has more" are exact.
 */
public class MemoryTier implements CacheTier {

    private record Row(String key, Object payload, long writeCursor) {
    }

    private record SortedRow(String key, Object payload, Object value) {
    }

    private final NamespaceRegistry registry;

    public MemoryTier(NamespaceRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Tier tier() {
        return Tier.MEMORY;
    }

    @Override
    public void write(String namespace, String key, Object payload, long writeCursor, long ttlSeconds) {
        final CachedEntry entry = new CachedEntry(payload, writeCursor);
        registry.write(namespace, store -> store.set(key, entry, ttlSeconds));
    }

    @Override
    public void writeAll(List<WriteOp> ops) {
        for (WriteOp op : ops) {
            final CachedEntry entry = new CachedEntry(op.payload(), op.writeCursor());
            final long expAt = op.neverExpires() ? Long.MAX_VALUE : op.expireAt().toEpochMilli();
            registry.write(op.namespace(), store -> store.setUntil(op.key(), entry, expAt));
        }
    }

    @Override
    public Optional<Object> read(String namespace, String key) {
        return registry.getOrCreate(namespace).get(key).map(CachedEntry::payload);
    }

    @Override
    public boolean delete(String namespace, String key) {
        return registry.find(namespace).map(store -> store.delete(key)).orElse(false);
    }

    @Override
    public PageResult listByRecency(String namespace, Long cursor, int pageSize) {
        final List<Row> rows = snapshot(namespace);
        rows.sort(Comparator.comparingLong(Row::writeCursor).reversed().thenComparing(Row::key));
        final long total = rows.size();

        final List<Row> filtered = cursor == null
                ? rows
                : rows.stream().filter(r -> r.writeCursor() < cursor).collect(Collectors.toList());
        final List<Row> page = filtered.subList(0, Math.min(pageSize, filtered.size()));
        if (page.isEmpty()) {
            return PageResult.empty(pageSize, total, Tier.MEMORY);
        }

        final long next = page.get(page.size() - 1).writeCursor();
        final boolean hasMore = filtered.stream().skip(page.size()).anyMatch(r -> r.writeCursor() < next);
        final List<PageItem> items = page.stream()
                .map(r -> new PageItem(r.key(), r.payload()))
                .collect(Collectors.toList());
        return new PageResult(items, pageSize, total, next, hasMore, Tier.MEMORY);
    }

    @Override
    public PageResult listBySortedField(String namespace, SortQuery query) {
        final SortOrder order = query.getOrder();
        final List<SortedRow> rows = new ArrayList<>();
        for (Row r : snapshot(namespace)) {
            final Object value = SortValues.effectiveValue(r.payload(), query.getField(), query.getDefaultValue());
            if (value != SortValues.MISSING) {
                rows.add(new SortedRow(r.key(), r.payload(), value));
            }
        }
        final long total = rows.size();

        List<SortedRow> filtered = rows;
        if (query.getCursor() != null) {
            filtered = rows.stream()
                    .filter(r -> SortValues.isBeyond(r.value(), query.getCursor(), order))
                    .collect(Collectors.toCollection(ArrayList::new));
        }
        filtered.sort((a, b) -> {
            final int c = SortValues.compare(a.value(), b.value(), order);
            return c != 0 ? c : a.key().compareTo(b.key());
        });

        final int pageSize = query.getPageSize();
        final List<SortedRow> page = filtered.subList(0, Math.min(pageSize, filtered.size()));
        if (page.isEmpty()) {
            return PageResult.empty(pageSize, total, Tier.MEMORY);
        }

        final Object next = page.get(page.size() - 1).value();
        final boolean hasMore = filtered.stream()
                .skip(page.size())
                .anyMatch(r -> SortValues.isBeyond(r.value(), next, order));
        final List<PageItem> items = page.stream()
                .map(r -> new PageItem(r.key(), r.payload()))
                .collect(Collectors.toList());
        return new PageResult(items, pageSize, total, next, hasMore, Tier.MEMORY);
    }

    @Override
    public RankResult rank(String namespace, String key, String field, SortOrder order, Object defaultValue) {
        final ExpiringStore<String, CachedEntry> store = registry.getOrCreate(namespace);
        final CachedEntry target = store.get(key).orElseThrow(() -> new EntryNotFoundException(namespace, key));
        final Object targetValue = SortValues.effectiveValue(target.payload(), field, defaultValue);
        // an explicit null has no rank either, as with $ifNull
        if (targetValue == SortValues.MISSING || targetValue == null) {
            throw new FieldMissingException(namespace, key, field);
        }

        // linear scan; rank is not indexed
        long better = 0;
        for (Row r : snapshot(namespace)) {
            final Object value = SortValues.effectiveValue(r.payload(), field, defaultValue);
            if (value != SortValues.MISSING && SortValues.isBetter(value, targetValue, order)) {
                better++;
            }
        }
        return new RankResult(key, better + 1, targetValue, field, order, Tier.MEMORY);
    }

    private List<Row> snapshot(String namespace) {
        final ExpiringStore<String, CachedEntry> store = registry.getOrCreate(namespace);
        final List<Row> rows = new ArrayList<>();
        for (String key : store.keys()) {
            store.get(key).ifPresent(e -> rows.add(new Row(key, e.payload(), e.writeCursor())));
        }
        return rows;
    }
}
