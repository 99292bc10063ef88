package com.ephemera.store.common.exception;

/**
 * The requested (namespace, key) holds no live entry in the selected tier.
 */
public class EntryNotFoundException extends BaseStoreException {
    private static final String DEFAULT_ERROR_CODE = "ERR-NOT-FOUND";

    public EntryNotFoundException(String message) {
        super(message);
    }

    public EntryNotFoundException(String namespace, String key) {
        super(String.format("Entry %s/%s not found", namespace, key));
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
