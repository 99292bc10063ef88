package com.ephemera.store.common.exception;

public class UnauthenticatedException extends BaseStoreException {
    private static final String DEFAULT_ERROR_CODE = "ERR-AUTH-001";

    public UnauthenticatedException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
