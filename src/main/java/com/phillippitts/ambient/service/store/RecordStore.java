package com.phillippitts.ambient.service.store;

import java.util.List;
import java.util.function.Predicate;

/**
 * Persistence boundary for screen snapshots, audio sessions and context snapshots.
 *
 * <p>The default implementation is {@link InMemoryRecordStore}. A durable store can be
 * supplied as a {@code @Primary} bean.
 */
public interface RecordStore {

    /**
     * Stores an immutable record. Records are grouped by their runtime class.
     *
     * @param record record to store, never null
     */
    void save(Object record);

    /**
     * Returns stored records of the given type that satisfy the filter, newest first.
     *
     * @param type record class
     * @param filter predicate applied to each candidate
     * @param limit maximum number of results; values below 1 yield an empty list
     */
    <T> List<T> query(Class<T> type, Predicate<? super T> filter, int limit);

    default <T> List<T> latest(Class<T> type, int limit) {
        return query(type, r -> true, limit);
    }
}
