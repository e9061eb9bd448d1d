package com.nan.shortsvc.exception;

/**
 * Base exception for the short key service.
 * Every subclass carries a stable error code that the HTTP layer echoes back to clients.
 */
public abstract class ShortServiceException extends RuntimeException {

    private final String errorCode;

    protected ShortServiceException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected ShortServiceException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Each subclass must provide a default error code.
     */
    protected abstract String getDefaultErrorCode();
}
