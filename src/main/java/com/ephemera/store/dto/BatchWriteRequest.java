package com.ephemera.store.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchWriteRequest {

    @NotEmpty
    private List<@Valid BatchItem> items;

    /** Ignored by the buffered route, which always targets the durable tier. */
    @Builder.Default
    private Boolean persist = Boolean.FALSE;
}
