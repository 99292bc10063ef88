package com.ephemera.store.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WriteRequest {

    /** Seconds to live; zero or less never expires. Null means the configured default. */
    private Long ttl;

    private Object data;

    @Builder.Default
    private Boolean persist = Boolean.FALSE;
}
