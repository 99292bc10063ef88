package com.ephemera.store.service.tier;

import com.ephemera.store.common.exception.EntryNotFoundException;
import com.ephemera.store.common.exception.FieldMissingException;
import com.ephemera.store.dto.PageItem;
import com.ephemera.store.dto.PageResult;
import com.ephemera.store.dto.RankResult;
import com.ephemera.store.dto.SortQuery;
import com.ephemera.store.enums.SortOrder;
import com.ephemera.store.enums.Tier;
import com.ephemera.store.model.WriteOp;
import com.ephemera.store.model.documents.CacheEntryDocument;
import com.ephemera.store.repo.documents.CacheEntryRepo;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationOperation;
import org.springframework.data.mongodb.core.aggregation.ConditionalOperators;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.ephemera.store.model.documents.CacheEntryDocument.F_EXPIRE_AT;
import static com.ephemera.store.model.documents.CacheEntryDocument.F_KEY;
import static com.ephemera.store.model.documents.CacheEntryDocument.F_NAMESPACE;
import static com.ephemera.store.model.documents.CacheEntryDocument.F_PAYLOAD;
import static com.ephemera.store.model.documents.CacheEntryDocument.F_WRITE_CURSOR;

/**
 * MongoDB tier. One document per (namespace, key); expired documents are filtered out on
 * every read because the server-side TTL monitor only runs about once a minute.
 * <p>
 * Sorted listings without a default value are plain indexed finds; with a default value
 * they go through an aggregation that adds a computed {@code sortValue} field first.
 */
@Slf4j
public class DurableTier implements CacheTier {

    static final String F_SORT_VALUE = "sortValue";

    private final MongoTemplate mongo;
    private final CacheEntryRepo repo;
    private final Clock clock;

    public DurableTier(MongoTemplate mongo, CacheEntryRepo repo, Clock clock) {
        this.mongo = mongo;
        this.repo = repo;
        this.clock = clock;
    }

    @Override
    public Tier tier() {
        return Tier.DURABLE;
    }

    private Criteria live(String namespace) {
        return Criteria.where(F_NAMESPACE).is(namespace).and(F_EXPIRE_AT).gt(Date.from(clock.instant()));
    }

    private static Query byKey(String namespace, String key) {
        return new Query(Criteria.where(F_NAMESPACE).is(namespace).and(F_KEY).is(key));
    }

    private static Update upsertOf(WriteOp op) {
        return new Update()
                .set(F_PAYLOAD, op.payload())
                .set(F_WRITE_CURSOR, op.writeCursor())
                .set(F_EXPIRE_AT, Date.from(op.expireAt()));
    }

    private static String payloadPath(String field) {
        return F_PAYLOAD + "." + field;
    }

    /**
     * Applies the strictly-past filter for {@code order} to {@code c}: {@code $gt} ascending,
     * {@code $lt} descending.
     */
    private static Criteria beyond(Criteria c, Object bound, SortOrder order) {
        return order == SortOrder.ASC ? c.gt(bound) : c.lt(bound);
    }

    /**
     * Opposite of {@link #beyond}: values ranked ahead of {@code bound}.
     */
    private static Criteria better(Criteria c, Object bound, SortOrder order) {
        return order == SortOrder.ASC ? c.lt(bound) : c.gt(bound);
    }

    private static Sort.Direction direction(SortOrder order) {
        return order == SortOrder.ASC ? Sort.Direction.ASC : Sort.Direction.DESC;
    }

    private String collection() {
        return mongo.getCollectionName(CacheEntryDocument.class);
    }

    // ---------- writes ----------

    @Override
    public void write(String namespace, String key, Object payload, long writeCursor, long ttlSeconds) {
        final WriteOp op = WriteOp.of(namespace, key, payload, writeCursor, ttlSeconds);
        mongo.findAndModify(byKey(namespace, key), upsertOf(op),
                FindAndModifyOptions.options().upsert(true).returnNew(true), CacheEntryDocument.class);
    }

    /**
     * One unordered bulk: a failing document does not stop the others.
     */
    @Override
    public void writeAll(List<WriteOp> ops) {
        if (ops.isEmpty()) return;
        final BulkOperations bulk = mongo.bulkOps(BulkOperations.BulkMode.UNORDERED, CacheEntryDocument.class);
        for (WriteOp op : ops) {
            bulk.upsert(byKey(op.namespace(), op.key()), upsertOf(op));
        }
        bulk.execute();
        log.debug("Bulk upserted {} entries", ops.size());
    }

    // ---------- reads ----------

    @Override
    public Optional<Object> read(String namespace, String key) {
        return repo.findByNamespaceAndKeyAndExpireAtAfter(namespace, key, clock.instant())
                .map(CacheEntryDocument::getPayload);
    }

    @Override
    public boolean delete(String namespace, String key) {
        return repo.deleteByNamespaceAndKey(namespace, key) > 0;
    }

    @Override
    public PageResult listByRecency(String namespace, Long cursor, int pageSize) {
        Criteria c = live(namespace);
        if (cursor != null) {
            c = c.and(F_WRITE_CURSOR).lt(cursor);
        }
        final Query q = new Query(c)
                .with(Sort.by(Sort.Direction.DESC, F_WRITE_CURSOR).and(Sort.by(Sort.Direction.ASC, F_KEY)))
                .limit(pageSize);
        final List<CacheEntryDocument> docs = mongo.find(q, CacheEntryDocument.class);
        final long total = repo.countByNamespaceAndExpireAtAfter(namespace, clock.instant());
        if (docs.isEmpty()) {
            return PageResult.empty(pageSize, total, Tier.DURABLE);
        }

        final long next = docs.get(docs.size() - 1).getWriteCursor();
        final boolean hasMore = mongo.exists(
                new Query(live(namespace).and(F_WRITE_CURSOR).lt(next)), CacheEntryDocument.class);
        final List<PageItem> items = docs.stream()
                .map(d -> new PageItem(d.getKey(), d.getPayload()))
                .collect(Collectors.toList());
        return new PageResult(items, pageSize, total, next, hasMore, Tier.DURABLE);
    }

    @Override
    public PageResult listBySortedField(String namespace, SortQuery query) {
        return query.hasDefault()
                ? sortedWithDefault(namespace, query)
                : sortedByRawField(namespace, query);
    }

    private PageResult sortedByRawField(String namespace, SortQuery query) {
        final String path = payloadPath(query.getField());
        final SortOrder order = query.getOrder();

        Criteria c = live(namespace).and(path).exists(true);
        if (query.getCursor() != null) {
            c = beyond(c, query.getCursor(), order);
        }
        final Query q = new Query(c)
                .with(Sort.by(direction(order), path).and(Sort.by(Sort.Direction.ASC, F_KEY)))
                .limit(query.getPageSize());
        final List<CacheEntryDocument> docs = mongo.find(q, CacheEntryDocument.class);
        final long total = mongo.count(new Query(live(namespace).and(path).exists(true)), CacheEntryDocument.class);
        if (docs.isEmpty()) {
            return PageResult.empty(query.getPageSize(), total, Tier.DURABLE);
        }

        final Object next = SortValues.lookup(docs.get(docs.size() - 1).getPayload(), query.getField());
        final boolean hasMore = mongo.exists(
                new Query(beyond(live(namespace).and(path).exists(true), next, order)), CacheEntryDocument.class);
        final List<PageItem> items = docs.stream()
                .map(d -> new PageItem(d.getKey(), d.getPayload()))
                .collect(Collectors.toList());
        return new PageResult(items, query.getPageSize(), total, next, hasMore, Tier.DURABLE);
    }

    private PageResult sortedWithDefault(String namespace, SortQuery query) {
        final SortOrder order = query.getOrder();

        final List<AggregationOperation> stages = withSortValue(namespace, query.getField(), query.getDefaultValue());
        if (query.getCursor() != null) {
            stages.add(Aggregation.match(beyond(Criteria.where(F_SORT_VALUE), query.getCursor(), order)));
        }
        stages.add(Aggregation.sort(Sort.by(direction(order), F_SORT_VALUE).and(Sort.by(Sort.Direction.ASC, F_KEY))));
        stages.add(Aggregation.limit(query.getPageSize()));

        final List<Document> docs = mongo.aggregate(Aggregation.newAggregation(stages), collection(), Document.class)
                .getMappedResults();
        final long total = mongo.count(new Query(live(namespace)), CacheEntryDocument.class);
        if (docs.isEmpty()) {
            return PageResult.empty(query.getPageSize(), total, Tier.DURABLE);
        }

        final Object next = docs.get(docs.size() - 1).get(F_SORT_VALUE);
        final List<AggregationOperation> probe = withSortValue(namespace, query.getField(), query.getDefaultValue());
        probe.add(Aggregation.match(beyond(Criteria.where(F_SORT_VALUE), next, order)));
        probe.add(Aggregation.limit(1));
        final boolean hasMore = !mongo.aggregate(Aggregation.newAggregation(probe), collection(), Document.class)
                .getMappedResults().isEmpty();

        final List<PageItem> items = docs.stream()
                .map(d -> new PageItem(d.getString(F_KEY), d.get(F_PAYLOAD)))
                .collect(Collectors.toList());
        return new PageResult(items, query.getPageSize(), total, next, hasMore, Tier.DURABLE);
    }

    /**
     * Live documents of the namespace with {@code sortValue = $ifNull(payload.field, default)}.
     */
    private List<AggregationOperation> withSortValue(String namespace, String field, Object defaultValue) {
        final List<AggregationOperation> stages = new ArrayList<>();
        stages.add(Aggregation.match(live(namespace)));
        stages.add(Aggregation.addFields()
                .addFieldWithValue(F_SORT_VALUE, ConditionalOperators.ifNull(payloadPath(field)).then(defaultValue))
                .build());
        return stages;
    }

    // ---------- rank ----------

    @Override
    public RankResult rank(String namespace, String key, String field, SortOrder order, Object defaultValue) {
        final CacheEntryDocument target = repo.findByNamespaceAndKeyAndExpireAtAfter(namespace, key, clock.instant())
                .orElseThrow(() -> new EntryNotFoundException(namespace, key));
        final Object targetValue = SortValues.effectiveValue(target.getPayload(), field, defaultValue);
        // an explicit null has no rank either, as with $ifNull
        if (targetValue == SortValues.MISSING || targetValue == null) {
            throw new FieldMissingException(namespace, key, field);
        }

        final long better;
        if (defaultValue == null) {
            better = mongo.count(
                    new Query(better(live(namespace).and(payloadPath(field)), targetValue, order)),
                    CacheEntryDocument.class);
        } else {
            final List<AggregationOperation> stages = withSortValue(namespace, field, defaultValue);
            stages.add(Aggregation.match(better(Criteria.where(F_SORT_VALUE), targetValue, order)));
            stages.add(Aggregation.count().as("count"));
            final Document counted = mongo.aggregate(Aggregation.newAggregation(stages), collection(), Document.class)
                    .getUniqueMappedResult();
            better = counted == null ? 0L : ((Number) counted.get("count")).longValue();
        }
        return new RankResult(key, better + 1, targetValue, field, order, Tier.DURABLE);
    }
}
