package com.fintech.analytics.domain.exception;

/**
 * Thrown when the transaction source cannot be read at all.
 * Aborts the load; a previously loaded store stays untouched.
 */
public class DataLoadException extends TransactionApiException {

    public DataLoadException(String message) {
        super("DATA_LOAD_FAILED", message);
    }

    public DataLoadException(String message, Throwable cause) {
        super("DATA_LOAD_FAILED", message, cause);
    }
}
