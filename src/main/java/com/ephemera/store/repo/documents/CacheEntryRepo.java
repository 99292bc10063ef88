package com.ephemera.store.repo.documents;

import com.ephemera.store.model.documents.CacheEntryDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface CacheEntryRepo extends MongoRepository<CacheEntryDocument, String> {

    /**
     * Live document lookup; the TTL monitor may lag behind expireAt.
     */
    Optional<CacheEntryDocument> findByNamespaceAndKeyAndExpireAtAfter(String namespace, String key, Instant now);

    long countByNamespaceAndExpireAtAfter(String namespace, Instant now);

    long deleteByNamespaceAndKey(String namespace, String key);
}
