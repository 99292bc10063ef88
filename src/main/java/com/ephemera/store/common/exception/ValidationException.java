package com.ephemera.store.common.exception;

/**
 * Exception for validation errors in the application.
 */
public class ValidationException extends BaseStoreException {
    private static final String DEFAULT_ERROR_CODE = "ERR-VAL-001";

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String errorCode, String message) {
        super(errorCode, message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
