package com.ephemera.store.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchItem {

    @NotBlank
    private String namespace;

    @NotBlank
    private String key;

    @NotNull
    private Object data;

    private Long ttl;
}
