package com.fintech.analytics.infrastructure.store;

import com.fintech.analytics.domain.model.Transaction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * In-memory indexed transaction store.
 *
 * Single source of truth for every query service. Holds the records keyed by id
 * together with secondary indexes by customer, merchant, category code and
 * channel type, the list of flagged (fraudulent) ids and the date bounds.
 *
 * Concurrency:
 * - Reads share a read lock and return copies, so callers can iterate freely
 * - {@link #read(Function)} runs several queries against one consistent state
 * - add, delete and load take the write lock; once they return every later read sees the change
 * - load builds a staging index and publishes it only if the loader completes
 *
 * Lookups never fail: unknown keys produce empty results.
 */
@Slf4j
@Component
public class TransactionStore implements TransactionView {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final TransactionView view = new IndexView();

    private TransactionIndexes indexes = new TransactionIndexes();
    private LocalDateTime loadedAt;

    /**
     * Replace the whole store with the records produced by the loader.
     *
     * Holds exclusive access for the duration of the load. If the loader throws,
     * the exception propagates and the previously loaded records stay in place.
     */
    public <R> R load(TransactionLoader<R> loader) {
        return withWriteLock(() -> {
            TransactionIndexes staging = new TransactionIndexes();
            R result = loader.loadInto(staging::add);

            indexes = staging;
            loadedAt = LocalDateTime.now();
            log.info("Transaction store loaded: {} records", staging.size());
            return result;
        });
    }

    /**
     * Insert or overwrite a record by id.
     */
    public void add(Transaction transaction) {
        withWriteLock(() -> {
            indexes.add(transaction);
            return null;
        });
    }

    /**
     * Remove a record and its index memberships.
     *
     * @return true if a record was removed, false if the id was unknown
     */
    public boolean delete(String id) {
        return withWriteLock(() -> {
            Transaction removed = indexes.remove(id);
            if (removed != null) {
                log.debug("Removed transaction {} from store", id);
            }
            return removed != null;
        });
    }

    /**
     * Run a read-only computation against one consistent state of the store.
     *
     * The whole function runs under a single read lock, so no add, delete or load
     * can land between the queries it makes. The view must not escape the function.
     */
    public <T> T read(Function<TransactionView, T> query) {
        return withReadLock(() -> query.apply(view));
    }

    @Override
    public Optional<Transaction> findById(String id) {
        return read(v -> v.findById(id));
    }

    @Override
    public List<Transaction> findAll() {
        return read(TransactionView::findAll);
    }

    @Override
    public List<Transaction> findByAttribute(IndexedAttribute attribute, String value) {
        return read(v -> v.findByAttribute(attribute, value));
    }

    @Override
    public int countByAttribute(IndexedAttribute attribute, String value) {
        return read(v -> v.countByAttribute(attribute, value));
    }

    @Override
    public List<String> attributeValues(IndexedAttribute attribute) {
        return read(v -> v.attributeValues(attribute));
    }

    @Override
    public List<Transaction> findFlagged() {
        return read(TransactionView::findFlagged);
    }

    @Override
    public int size() {
        return read(TransactionView::size);
    }

    @Override
    public Optional<LocalDateTime> minDate() {
        return read(TransactionView::minDate);
    }

    @Override
    public Optional<LocalDateTime> maxDate() {
        return read(TransactionView::maxDate);
    }

    @Override
    public Optional<LocalDateTime> loadedAt() {
        return read(TransactionView::loadedAt);
    }

    private <T> T withReadLock(Supplier<T> action) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return action.get();
        } finally {
            readLock.unlock();
        }
    }

    private <T> T withWriteLock(Supplier<T> action) {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            return action.get();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Unlocked view over the current indexes; only handed out under the read lock.
     */
    private class IndexView implements TransactionView {

        @Override
        public Optional<Transaction> findById(String id) {
            return Optional.ofNullable(indexes.get(id));
        }

        @Override
        public List<Transaction> findAll() {
            return indexes.all();
        }

        @Override
        public List<Transaction> findByAttribute(IndexedAttribute attribute, String value) {
            return indexes.byAttribute(attribute, value);
        }

        @Override
        public int countByAttribute(IndexedAttribute attribute, String value) {
            return indexes.countByAttribute(attribute, value);
        }

        @Override
        public List<String> attributeValues(IndexedAttribute attribute) {
            return indexes.attributeValues(attribute);
        }

        @Override
        public List<Transaction> findFlagged() {
            return indexes.flagged();
        }

        @Override
        public int size() {
            return indexes.size();
        }

        @Override
        public Optional<LocalDateTime> minDate() {
            return Optional.ofNullable(indexes.minDate());
        }

        @Override
        public Optional<LocalDateTime> maxDate() {
            return Optional.ofNullable(indexes.maxDate());
        }

        @Override
        public Optional<LocalDateTime> loadedAt() {
            return Optional.ofNullable(loadedAt);
        }
    }
}
