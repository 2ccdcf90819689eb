package com.phillippitts.ambient.service.store;

import com.phillippitts.ambient.config.properties.AmbientProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Bounded in-memory {@link RecordStore}. Keeps the newest {@code ambient.store.capacity}
 * records per type and evicts the oldest first.
 */
@Component
public class InMemoryRecordStore implements RecordStore {

    private final int capacity;
    private final Map<Class<?>, Deque<Object>> records = new HashMap<>();

    @Autowired
    public InMemoryRecordStore(AmbientProperties props) {
        this(props.getStore().getCapacity());
    }

    public InMemoryRecordStore(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized void save(Object record) {
        Objects.requireNonNull(record, "record");
        Deque<Object> bucket = records.computeIfAbsent(record.getClass(), k -> new ArrayDeque<>());
        bucket.addFirst(record);
        while (bucket.size() > capacity) {
            bucket.removeLast();
        }
    }

    @Override
    public synchronized <T> List<T> query(Class<T> type, Predicate<? super T> filter, int limit) {
        List<T> out = new ArrayList<>();
        Deque<Object> bucket = records.get(type);
        if (bucket == null || limit < 1) {
            return out;
        }
        Iterator<Object> it = bucket.iterator();
        while (it.hasNext() && out.size() < limit) {
            T candidate = type.cast(it.next());
            if (filter.test(candidate)) {
                out.add(candidate);
            }
        }
        return out;
    }
}
