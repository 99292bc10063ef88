package com.ephemera.store.common.exception;

/**
 * Thrown when a caller asked for the durable tier while it is disabled or unreachable.
 * The request is never redirected to the memory tier instead.
 */
public class DurableTierUnavailableException extends BaseStoreException {
    private static final String DEFAULT_ERROR_CODE = "ERR-DB-003";

    public DurableTierUnavailableException() {
        super("Database not connected");
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
