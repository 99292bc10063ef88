package com.ephemera.store.web;

import com.ephemera.store.common.Result;
import com.ephemera.store.dto.PageResult;
import com.ephemera.store.dto.RankResult;
import com.ephemera.store.dto.SortQuery;
import com.ephemera.store.enums.SortOrder;
import com.ephemera.store.service.CacheService;
import com.ephemera.store.service.tier.SortValues;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Field-sorted listings and rank lookups. {@code cursor} and {@code defaultValue} are read
 * as numbers when they parse as numbers, strings otherwise.
 */
@RestController
@RequiredArgsConstructor
public class QueryController {

    private final CacheService cacheService;

    @GetMapping("/sorted/{namespace}")
    public ResponseEntity<Result<PageResult>> sorted(@PathVariable("namespace") String namespace,
                                                     @RequestParam @NotBlank String field,
                                                     @RequestParam(defaultValue = "desc") String order,
                                                     @RequestParam(required = false) String cursor,
                                                     @RequestParam(required = false) String defaultValue,
                                                     @RequestParam(defaultValue = "5000") @Min(1) @Max(5000) int pageSize,
                                                     @RequestParam(defaultValue = "false") boolean useDb) {
        CacheController.requireNamespace(namespace);
        SortQuery query = SortQuery.builder()
                .field(field)
                .order(SortOrder.parse(order))
                .cursor(SortValues.parse(cursor))
                .defaultValue(SortValues.parse(defaultValue))
                .pageSize(pageSize)
                .build();
        return ResponseEntity.ok(Result.ok(cacheService.listBySortedField(namespace, query, useDb)));
    }

    @GetMapping("/rank/{namespace}/{key}")
    public ResponseEntity<Result<RankResult>> rank(@PathVariable("namespace") String namespace,
                                                   @PathVariable("key") String key,
                                                   @RequestParam @NotBlank String field,
                                                   @RequestParam(defaultValue = "desc") String order,
                                                   @RequestParam(required = false) String defaultValue,
                                                   @RequestParam(defaultValue = "false") boolean useDb) {
        CacheController.requireNamespace(namespace);
        RankResult rank = cacheService.rank(namespace, key, field, SortOrder.parse(order),
                SortValues.parse(defaultValue), useDb);
        return ResponseEntity.ok(Result.ok(rank));
    }
}
