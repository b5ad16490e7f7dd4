package com.fintech.analytics.infrastructure.store;

import com.fintech.analytics.domain.model.Transaction;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Records plus every derived index. Not thread-safe; {@link TransactionStore} guards access.
 *
 * Index buckets are insertion-ordered sets so a delete is O(1) per index.
 * Empty buckets are dropped so an attribute value is listed only while it has live records.
 */
class TransactionIndexes {

    private final Map<String, Transaction> records = new LinkedHashMap<>();
    private final Map<IndexedAttribute, Map<String, Set<String>>> attributeIndexes =
            new EnumMap<>(IndexedAttribute.class);
    private final Set<String> fraudIds = new LinkedHashSet<>();

    private LocalDateTime minDate;
    private LocalDateTime maxDate;

    TransactionIndexes() {
        for (IndexedAttribute attribute : IndexedAttribute.values()) {
            attributeIndexes.put(attribute, new LinkedHashMap<>());
        }
    }

    void add(Transaction transaction) {
        Transaction previous = records.remove(transaction.getId());
        if (previous != null) {
            unindex(previous);
        }

        records.put(transaction.getId(), transaction);
        for (IndexedAttribute attribute : IndexedAttribute.values()) {
            attributeIndexes.get(attribute)
                    .computeIfAbsent(attribute.keyOf(transaction), key -> new LinkedHashSet<>())
                    .add(transaction.getId());
        }
        if (transaction.isFlagged()) {
            fraudIds.add(transaction.getId());
        }

        LocalDateTime date = transaction.getDate();
        if (minDate == null || date.isBefore(minDate)) {
            minDate = date;
        }
        if (maxDate == null || date.isAfter(maxDate)) {
            maxDate = date;
        }
    }

    /**
     * Date bounds are left as they are; they only ever widen.
     */
    Transaction remove(String id) {
        Transaction removed = records.remove(id);
        if (removed != null) {
            unindex(removed);
        }
        return removed;
    }

    private void unindex(Transaction transaction) {
        for (IndexedAttribute attribute : IndexedAttribute.values()) {
            Map<String, Set<String>> index = attributeIndexes.get(attribute);
            String key = attribute.keyOf(transaction);
            Set<String> ids = index.get(key);
            if (ids != null) {
                ids.remove(transaction.getId());
                if (ids.isEmpty()) {
                    index.remove(key);
                }
            }
        }
        fraudIds.remove(transaction.getId());
    }

    Transaction get(String id) {
        return records.get(id);
    }

    List<Transaction> all() {
        return new ArrayList<>(records.values());
    }

    List<Transaction> byAttribute(IndexedAttribute attribute, String value) {
        return resolve(attributeIndexes.get(attribute).getOrDefault(value, Collections.emptySet()));
    }

    int countByAttribute(IndexedAttribute attribute, String value) {
        return attributeIndexes.get(attribute).getOrDefault(value, Collections.emptySet()).size();
    }

    List<String> attributeValues(IndexedAttribute attribute) {
        return new ArrayList<>(attributeIndexes.get(attribute).keySet());
    }

    List<Transaction> flagged() {
        return resolve(fraudIds);
    }

    int size() {
        return records.size();
    }

    LocalDateTime minDate() {
        return minDate;
    }

    LocalDateTime maxDate() {
        return maxDate;
    }

    private List<Transaction> resolve(Set<String> ids) {
        List<Transaction> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            result.add(records.get(id));
        }
        return result;
    }
}
