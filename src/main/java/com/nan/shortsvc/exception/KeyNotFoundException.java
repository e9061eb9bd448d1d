package com.nan.shortsvc.exception;

/**
 * Lookup of a key that was never issued. An expected outcome, not a fault.
 */
public class KeyNotFoundException extends ShortServiceException {
    private static final String DEFAULT_ERROR_CODE = "ERR-KEY-404";

    public KeyNotFoundException(String key) {
        super(String.format("key not found: %s", key));
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
