package io.hivemesh.delivery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-process view of dead-lettered messages, keyed by original message id. Oldest
 * entries are evicted once {@code capacity} is exceeded.
 */
public final class DeadLetterStore {
    public static final int DEFAULT_CAPACITY = 1_000;

    private final Map<String, DeadLetterEntry> entries;

    public DeadLetterStore() {
        this(DEFAULT_CAPACITY);
    }

    public DeadLetterStore(int capacity) {
        int safeCapacity = Math.max(1, capacity);
        this.entries = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, DeadLetterEntry> eldest) {
                return size() > safeCapacity;
            }
        };
    }

    public synchronized void record(DeadLetterEntry entry) {
        entries.remove(entry.messageId());
        entries.put(entry.messageId(), entry);
    }

    public synchronized Optional<DeadLetterEntry> find(String messageId) {
        return Optional.ofNullable(entries.get(messageId));
    }

    public synchronized List<DeadLetterEntry> newestFirst(int limit) {
        List<DeadLetterEntry> all = new ArrayList<>(entries.values());
        Collections.reverse(all);
        int safeLimit = limit <= 0 ? all.size() : Math.min(limit, all.size());
        return List.copyOf(all.subList(0, safeLimit));
    }

    public synchronized int size() {
        return entries.size();
    }
}
