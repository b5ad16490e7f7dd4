package com.fintech.analytics.domain.exception;

/**
 * Thrown when page or limit fall outside the accepted range.
 * Results in HTTP 400 Bad Request
 */
public class InvalidPaginationException extends TransactionApiException {

    public InvalidPaginationException(String message) {
        super("INVALID_PAGINATION", message);
    }
}
