package com.ephemera.store.common.exception;

import lombok.Getter;

/**
 * Root of the coded store errors. The code is what clients see in {@code code}; its prefix
 * picks the HTTP status in {@link Http#statusOf}: ERR-VAL / ERR-REQ are 400, ERR-AUTH-001
 * is 401, ERR-AUTH-002 is 403, ERR-NOT-FOUND is 404, ERR-DB-003 is 503.
 * Subclasses supply a default code and may override it per instance.
 */
@Getter
public abstract class BaseStoreException extends RuntimeException {

    private final String errorCode;

    public BaseStoreException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    public BaseStoreException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    public BaseStoreException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * Each subclass must provide a default error code.
     */
    protected abstract String getDefaultErrorCode();
}
