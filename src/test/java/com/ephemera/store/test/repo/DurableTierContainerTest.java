package com.ephemera.store.test.repo;

import com.ephemera.store.common.constants.StoreConstants;
import com.ephemera.store.common.exception.EntryNotFoundException;
import com.ephemera.store.core.NamespaceRegistry;
import com.ephemera.store.dto.PageItem;
import com.ephemera.store.dto.PageResult;
import com.ephemera.store.dto.SortQuery;
import com.ephemera.store.enums.SortOrder;
import com.ephemera.store.enums.Tier;
import com.ephemera.store.model.WriteOp;
import com.ephemera.store.model.documents.CacheEntryDocument;
import com.ephemera.store.repo.documents.CacheEntryRepo;
import com.ephemera.store.service.tier.CacheTier;
import com.ephemera.store.service.tier.DurableTier;
import com.ephemera.store.service.tier.MemoryTier;
import com.ephemera.store.test.support.MutableClock;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the MongoDB tier against a real server and checks it answers like the memory tier.
 * Skipped when no Docker daemon is available.
 */
@DataMongoTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class DurableTierContainerTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer(DockerImageName.parse("mongo:7.0"));

    @DynamicPropertySource
    static void registerProps(DynamicPropertyRegistry reg) {
        reg.add("spring.data.mongodb.uri", MONGO::getReplicaSetUrl);
    }

    @Autowired
    MongoTemplate mongoTemplate;

    @Autowired
    CacheEntryRepo cacheEntryRepo;

    MutableClock clock;
    DurableTier durable;
    MemoryTier memory;

    @BeforeEach
    void setUp() {
        mongoTemplate.dropCollection(CacheEntryDocument.class);
        clock = new MutableClock(Instant.now());
        durable = new DurableTier(mongoTemplate, cacheEntryRepo, clock);
        memory = new MemoryTier(new NamespaceRegistry(clock));
    }

    private void writeBoth(String ns, String key, Object payload, long cursor, long ttl) {
        durable.write(ns, key, payload, cursor, ttl);
        memory.write(ns, key, payload, cursor, ttl);
    }

    private static List<String> keys(PageResult page) {
        return page.items().stream().map(PageItem::key).toList();
    }

    @Test
    void upsertReplacesTheSingleDocument() {
        long t = clock.millis();
        durable.write("users", "u1", Map.of("v", 1), t, 60);
        durable.write("users", "u1", Map.of("v", 2), t + 1, 60);

        assertThat(cacheEntryRepo.count()).isEqualTo(1);
        assertThat(durable.read("users", "u1")).hasValueSatisfying(p ->
                assertThat(p).asInstanceOf(InstanceOfAssertFactories.MAP).containsEntry("v", 2));
    }

    @Test
    void expiredDocumentsAreInvisibleBeforeTheTtlMonitorRuns() {
        durable.write("users", "u1", "x", clock.millis(), 1);
        clock.advanceSeconds(5);

        assertThat(durable.read("users", "u1")).isEmpty();
        assertThat(durable.listByRecency("users", null, 10).totalItems()).isZero();
    }

    @Test
    void nonPositiveTtlIsStoredAsNeverExpiring() {
        durable.write("users", "forever", "x", clock.millis(), 0);

        CacheEntryDocument doc = cacheEntryRepo.findAll().get(0);
        assertThat(doc.getExpireAt()).isEqualTo(StoreConstants.NEVER_EXPIRES);
    }

    @Test
    void recencyPagesMatchTheMemoryTier() {
        long t = clock.millis();
        writeBoth("ns", "a", "A", t + 1, 0);
        writeBoth("ns", "b", "B", t + 2, 0);
        writeBoth("ns", "c", "C", t + 3, 0);

        for (CacheTier tier : List.<CacheTier>of(memory, durable)) {
            PageResult first = tier.listByRecency("ns", null, 2);
            assertThat(keys(first)).containsExactly("c", "b");
            assertThat(first.hasMore()).isTrue();
            assertThat(first.totalItems()).isEqualTo(3);
            assertThat(((Number) first.nextCursor()).longValue()).isEqualTo(t + 2);

            PageResult second = tier.listByRecency("ns", ((Number) first.nextCursor()).longValue(), 2);
            assertThat(keys(second)).containsExactly("a");
            assertThat(second.hasMore()).isFalse();
        }
    }

    @Test
    void sortedWithDefaultMatchesTheMemoryTier() {
        long t = clock.millis();
        writeBoth("ns", "low", Map.of("score", 10), t + 1, 0);
        writeBoth("ns", "high", Map.of("score", 30), t + 2, 0);
        writeBoth("ns", "none", Map.of("name", "x"), t + 3, 0);

        SortQuery query = SortQuery.builder().field("score").order(SortOrder.DESC)
                .defaultValue(20L).pageSize(2).build();
        for (CacheTier tier : List.<CacheTier>of(memory, durable)) {
            PageResult first = tier.listBySortedField("ns", query);
            assertThat(keys(first)).containsExactly("high", "none");
            assertThat(first.hasMore()).isTrue();
            assertThat(((Number) first.nextCursor()).longValue()).isEqualTo(20L);

            SortQuery next = SortQuery.builder().field("score").order(SortOrder.DESC)
                    .defaultValue(20L).cursor(first.nextCursor()).pageSize(2).build();
            PageResult second = tier.listBySortedField("ns", next);
            assertThat(keys(second)).containsExactly("low");
            assertThat(second.hasMore()).isFalse();
        }
    }

    @Test
    void sortedWithoutDefaultSkipsEntriesWithoutTheField() {
        long t = clock.millis();
        writeBoth("ns", "low", Map.of("score", 10), t + 1, 0);
        writeBoth("ns", "high", Map.of("score", 30), t + 2, 0);
        writeBoth("ns", "none", Map.of("name", "x"), t + 3, 0);

        SortQuery query = SortQuery.builder().field("score").order(SortOrder.ASC).pageSize(10).build();
        for (CacheTier tier : List.<CacheTier>of(memory, durable)) {
            PageResult page = tier.listBySortedField("ns", query);
            assertThat(keys(page)).containsExactly("low", "high");
            assertThat(page.totalItems()).isEqualTo(2);
            assertThat(page.hasMore()).isFalse();
        }
    }

    @Test
    void rankMatchesTheMemoryTier() {
        long t = clock.millis();
        writeBoth("ns", "ten", Map.of("score", 10), t + 1, 0);
        writeBoth("ns", "twenty", Map.of("score", 20), t + 2, 0);
        writeBoth("ns", "thirty", Map.of("score", 30), t + 3, 0);
        writeBoth("ns", "bare", Map.of("name", "x"), t + 4, 0);

        for (CacheTier tier : List.<CacheTier>of(memory, durable)) {
            assertThat(tier.rank("ns", "twenty", "score", SortOrder.DESC, null).rank()).isEqualTo(2);
            assertThat(tier.rank("ns", "thirty", "score", SortOrder.DESC, null).rank()).isEqualTo(1);
            assertThat(tier.rank("ns", "bare", "score", SortOrder.DESC, 15L).rank()).isEqualTo(3);
            assertThatThrownBy(() -> tier.rank("ns", "missing", "score", SortOrder.DESC, null))
                    .isInstanceOf(EntryNotFoundException.class);
        }
    }

    @Test
    void bulkWriteSpansNamespaces() {
        long t = clock.millis();
        durable.writeAll(List.of(
                WriteOp.of("a", "1", "x", t, 60),
                WriteOp.of("b", "2", "y", t + 1, 60)));

        assertThat(durable.read("a", "1")).contains("x");
        assertThat(durable.read("b", "2")).contains("y");
        assertThat(durable.tier()).isEqualTo(Tier.DURABLE);
    }

    @Test
    void deleteRemovesTheDocument() {
        durable.write("users", "u1", "x", clock.millis(), 60);

        assertThat(durable.delete("users", "u1")).isTrue();
        assertThat(durable.delete("users", "u1")).isFalse();
        assertThat(durable.read("users", "u1")).isEmpty();
    }
}
