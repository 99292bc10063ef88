package com.ephemera.store.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SortOrder {
    ASC,
    DESC;

    /**
     * Accepts asc/desc in any case plus 1 / -1, the way sort directions are usually written
     * in MongoDB queries.
     */
    public static SortOrder parse(String raw) {
        if (raw == null || raw.isBlank()) return DESC;
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "asc":
            case "ascending":
            case "1":
                return ASC;
            case "desc":
            case "descending":
            case "-1":
                return DESC;
            default:
                throw new IllegalArgumentException("order must be asc or desc, got: " + raw);
        }
    }

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
