package com.ephemera.store.dto;

import com.ephemera.store.enums.SortOrder;
import lombok.Builder;
import lombok.Value;

/**
 * Parameters of a field-sorted listing. {@code cursor} and {@code defaultValue} are
 * already typed (number or string).
 */
@Value
@Builder
public class SortQuery {
    String field;
    @Builder.Default
    SortOrder order = SortOrder.DESC;
    Object cursor;
    Object defaultValue;
    int pageSize;

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
