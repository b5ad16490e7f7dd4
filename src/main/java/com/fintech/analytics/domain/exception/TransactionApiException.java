package com.fintech.analytics.domain.exception;

/**
 * Base exception for the transaction analytics service.
 * Carries a stable error code for programmatic handling.
 */
public class TransactionApiException extends RuntimeException {

    private final String errorCode;

    public TransactionApiException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public TransactionApiException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
