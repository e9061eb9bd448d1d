package com.nan.shortsvc.exception;

/**
 * Internal failure while deriving a key: the digest could not be computed,
 * or every probe window up to the full digest was already taken.
 * Never caused by client input.
 */
public class KeyDerivationException extends ShortServiceException {
    private static final String DEFAULT_ERROR_CODE = "ERR-SYS-001";

    public KeyDerivationException(String message) {
        super(message);
    }

    public KeyDerivationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
