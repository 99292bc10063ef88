package com.ephemera.store.common.exception;

/**
 * The token is valid but not allowed to touch the namespace.
 */
public class NamespaceForbiddenException extends BaseStoreException {
    private static final String DEFAULT_ERROR_CODE = "ERR-AUTH-002";

    public NamespaceForbiddenException(String namespace) {
        super("Key not allowed for namespace: " + namespace);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
