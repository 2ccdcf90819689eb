package com.phillippitts.ambient.service.command;

import com.phillippitts.ambient.config.properties.CommandProperties;
import com.phillippitts.ambient.domain.CommandHistoryEntry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded in-memory log of executed commands, oldest first.
 */
@Component
public class CommandHistory {

    private final int capacity;
    private final Deque<CommandHistoryEntry> entries = new ArrayDeque<>();

    @Autowired
    public CommandHistory(CommandProperties props) {
        this(props.getHistorySize());
    }

    CommandHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    public synchronized void record(CommandHistoryEntry entry) {
        entries.addLast(entry);
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
    }

    /**
     * @return up to {@code limit} most recent entries, in the order they were recorded
     */
    public synchronized List<CommandHistoryEntry> recent(int limit) {
        List<CommandHistoryEntry> all = new ArrayList<>(entries);
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return List.copyOf(all.subList(from, all.size()));
    }

    public synchronized List<CommandHistoryEntry> all() {
        return List.copyOf(entries);
    }
}
