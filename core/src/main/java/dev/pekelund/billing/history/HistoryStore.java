package dev.pekelund.billing.history;

import java.util.Map;
import java.util.Optional;

/**
 * Persisted mapping from packet id to its last generation. Implementations must make
 * {@link #compareAndSet} atomic per key so concurrent runs never overwrite each other's update.
 */
public interface HistoryStore {

    /**
     * Reads the whole history; called once at the start of a run.
     */
    Map<String, HistoryRecord> loadAll();

    Optional<HistoryRecord> find(String packetId);

    /**
     * Replaces the record for {@code packetId} only if the stored record still equals
     * {@code expected} ({@code null} meaning "no record yet").
     *
     * @return {@code false} when another writer changed the record first
     */
    boolean compareAndSet(String packetId, HistoryRecord expected, HistoryRecord replacement);

    /**
     * Removes one record so the packet is generated again on the next run.
     *
     * @return {@code true} if a record was removed
     */
    boolean reset(String packetId);

    void resetAll();
}
