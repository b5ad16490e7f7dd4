package com.fintech.analytics.infrastructure.store;

import com.fintech.analytics.domain.model.Transaction;

import java.util.function.Consumer;

/**
 * Source of a bulk load. Feeds every accepted record into the sink and returns
 * a result describing the load.
 *
 * @param <R> load outcome reported back to the caller
 */
@FunctionalInterface
public interface TransactionLoader<R> {

    R loadInto(Consumer<Transaction> sink);
}
