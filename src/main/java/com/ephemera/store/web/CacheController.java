package com.ephemera.store.web;

import com.ephemera.store.common.Result;
import com.ephemera.store.common.constants.StoreConstants;
import com.ephemera.store.common.exception.ValidationException;
import com.ephemera.store.dto.DeleteView;
import com.ephemera.store.dto.EntryView;
import com.ephemera.store.dto.PageResult;
import com.ephemera.store.dto.WriteRequest;
import com.ephemera.store.service.CacheService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Single-entry reads and writes plus recency listing of a namespace.
 */
@RestController
@RequiredArgsConstructor
public class CacheController {

    private final CacheService cacheService;

    @PostMapping("/{namespace}/{key}")
    public ResponseEntity<Result<Void>> write(@PathVariable("namespace") String namespace,
                                              @PathVariable("key") String key,
                                              @RequestBody WriteRequest req) {
        requireNamespace(namespace);
        if (req.getData() == null) {
            throw new ValidationException("ERR-VAL-003", "data: must not be null");
        }
        cacheService.write(namespace, key, req);
        return ResponseEntity.ok(Result.ok());
    }

    @GetMapping("/{namespace}/{key}")
    public ResponseEntity<Result<EntryView>> read(@PathVariable("namespace") String namespace,
                                                  @PathVariable("key") String key,
                                                  @RequestParam(defaultValue = "false") boolean useDb) {
        requireNamespace(namespace);
        return ResponseEntity.ok(Result.ok(cacheService.read(namespace, key, useDb)));
    }

    @DeleteMapping("/{namespace}/{key}")
    public ResponseEntity<Result<DeleteView>> delete(@PathVariable("namespace") String namespace,
                                                     @PathVariable("key") String key,
                                                     @RequestParam(defaultValue = "false") boolean useDb) {
        requireNamespace(namespace);
        return ResponseEntity.ok(Result.ok(cacheService.delete(namespace, key, useDb)));
    }

    @GetMapping("/{namespace}")
    public ResponseEntity<Result<PageResult>> list(@PathVariable("namespace") String namespace,
                                                   @RequestParam(required = false) Long cursor,
                                                   @RequestParam(defaultValue = "5000") @Min(1) @Max(5000) int pageSize,
                                                   @RequestParam(defaultValue = "false") boolean useDb) {
        requireNamespace(namespace);
        return ResponseEntity.ok(Result.ok(cacheService.listByRecency(namespace, cursor, pageSize, useDb)));
    }

    static void requireNamespace(String namespace) {
        if (StoreConstants.RESERVED_SEGMENTS.contains(namespace)) {
            throw new ValidationException("Reserved namespace: " + namespace);
        }
    }
}
