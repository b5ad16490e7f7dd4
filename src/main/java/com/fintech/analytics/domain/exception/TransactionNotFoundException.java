package com.fintech.analytics.domain.exception;

/**
 * Thrown when a transaction lookup or delete targets an unknown id.
 * Results in HTTP 404 Not Found
 */
public class TransactionNotFoundException extends TransactionApiException {

    public TransactionNotFoundException(String transactionId) {
        super("TRANSACTION_NOT_FOUND", "Transaction with ID " + transactionId + " not found");
    }
}
