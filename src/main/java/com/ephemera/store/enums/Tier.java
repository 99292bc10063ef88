package com.ephemera.store.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Tier {
    MEMORY("memory"),
    DURABLE("db");

    private final String wireName;

    Tier(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
