package com.ephemera.store.dto;

public record PageItem(String key, Object data) {
}
