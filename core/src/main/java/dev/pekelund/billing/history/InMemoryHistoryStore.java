package dev.pekelund.billing.history;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Non-persistent history used by tests and dry runs.
 */
public class InMemoryHistoryStore implements HistoryStore {

    private final ConcurrentMap<String, HistoryRecord> records = new ConcurrentHashMap<>();

    @Override
    public Map<String, HistoryRecord> loadAll() {
        return Collections.unmodifiableMap(new TreeMap<>(records));
    }

    @Override
    public Optional<HistoryRecord> find(String packetId) {
        return Optional.ofNullable(records.get(packetId));
    }

    @Override
    public boolean compareAndSet(String packetId, HistoryRecord expected, HistoryRecord replacement) {
        if (expected == null) {
            return records.putIfAbsent(packetId, replacement) == null;
        }
        return records.replace(packetId, expected, replacement);
    }

    @Override
    public boolean reset(String packetId) {
        return records.remove(packetId) != null;
    }

    @Override
    public void resetAll() {
        records.clear();
    }
}
