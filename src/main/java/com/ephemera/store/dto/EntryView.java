package com.ephemera.store.dto;

import com.ephemera.store.enums.Tier;

public record EntryView(String key, Object data, Tier source) {
}
