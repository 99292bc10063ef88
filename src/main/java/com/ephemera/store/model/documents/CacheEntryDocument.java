package com.ephemera.store.model.documents;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * Durable copy of an entry. Indexes (unique namespace+key, TTL on expireAt,
 * namespace+writeCursor) are created by the durable bootstrap at startup.
 */
@Document("cache_entries")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntryDocument {

    public static final String F_NAMESPACE = "namespace";
    public static final String F_KEY = "key";
    public static final String F_PAYLOAD = "payload";
    public static final String F_WRITE_CURSOR = "writeCursor";
    public static final String F_EXPIRE_AT = "expireAt";

    private @Id String id;

    @Field(F_NAMESPACE)
    private String namespace;

    @Field(F_KEY)
    private String key;

    @Field(F_PAYLOAD)
    private Object payload;

    @Field(F_WRITE_CURSOR)
    private long writeCursor;

    @Field(F_EXPIRE_AT)
    private Instant expireAt;
}
