package com.ephemera.store.dto;

import com.ephemera.store.enums.Tier;

public record DeleteView(String key, boolean deleted, Tier source) {
}
