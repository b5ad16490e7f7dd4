package com.fintech.analytics.domain.exception;

/**
 * Thrown for a single source row that cannot be parsed.
 * Recovered by the loader: the row is skipped and counted.
 */
public class InvalidRecordDataException extends TransactionApiException {

    public InvalidRecordDataException(String message) {
        super("INVALID_RECORD_DATA", message);
    }

    public InvalidRecordDataException(String message, Throwable cause) {
        super("INVALID_RECORD_DATA", message, cause);
    }
}
