package com.ephemera.store.web;

import com.ephemera.store.common.Result;
import com.ephemera.store.common.constants.StoreConstants;
import com.ephemera.store.dto.BatchWriteRequest;
import com.ephemera.store.model.AccessScope;
import com.ephemera.store.service.CacheService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Multi-namespace writes. The interceptor does not check namespaces here; the service
 * checks every item and rejects the whole request on the first disallowed one.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/batch")
public class BatchController {

    private final CacheService cacheService;

    @PostMapping("/set")
    public ResponseEntity<Result<Map<String, Integer>>> set(
            @RequestAttribute(StoreConstants.REQ_ATTR_ACCESS_SCOPE) AccessScope scope,
            @Valid @RequestBody BatchWriteRequest req) {
        int written = cacheService.writeBatch(scope, req);
        return ResponseEntity.ok(Result.ok(Map.of("written", written)));
    }

    @PostMapping("/buffered")
    public ResponseEntity<Result<Map<String, Integer>>> buffered(
            @RequestAttribute(StoreConstants.REQ_ATTR_ACCESS_SCOPE) AccessScope scope,
            @Valid @RequestBody BatchWriteRequest req) {
        int queued = cacheService.writeBuffered(scope, req);
        return ResponseEntity.ok(Result.ok(Map.of("queued", queued)));
    }
}
