package com.ephemera.store.repo.documents;

import com.ephemera.store.model.documents.ApiKeyDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ApiKeyRepo extends MongoRepository<ApiKeyDocument, String> {

    /**
     * Only active records authenticate.
     */
    Optional<ApiKeyDocument> findByKeyAndActiveTrue(String key);

    boolean existsByKey(String key);
}
