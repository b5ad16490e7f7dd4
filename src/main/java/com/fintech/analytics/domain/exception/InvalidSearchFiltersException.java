package com.fintech.analytics.domain.exception;

/**
 * Reserved for structurally invalid search criteria. Amount bounds of any sign are accepted.
 * Results in HTTP 400 Bad Request
 */
public class InvalidSearchFiltersException extends TransactionApiException {

    public InvalidSearchFiltersException(String message) {
        super("INVALID_SEARCH_FILTERS", message);
    }
}
