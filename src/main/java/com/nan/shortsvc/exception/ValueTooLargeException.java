package com.nan.shortsvc.exception;

/**
 * Thrown when a value (on create) or a key (on lookup) is longer than the configured maximum.
 */
public class ValueTooLargeException extends ShortServiceException {
    private static final String DEFAULT_ERROR_CODE = "ERR-VAL-413";

    public ValueTooLargeException(int length, int maxLen) {
        super(String.format("result exceeds maximum size: %d > %d", length, maxLen));
    }

    public ValueTooLargeException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
