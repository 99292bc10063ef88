package com.ephemera.store.common.exception;

/**
 * A rank was requested on a field the target entry does not have, and no default
 * value was supplied. A usage error rather than an absence.
 */
public class FieldMissingException extends ValidationException {
    private static final String ERROR_CODE = "ERR-VAL-004";

    public FieldMissingException(String namespace, String key, String field) {
        super(ERROR_CODE, String.format("Entry %s/%s has no value for field '%s'", namespace, key, field));
    }
}
