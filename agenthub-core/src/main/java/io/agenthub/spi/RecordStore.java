package io.agenthub.spi;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Uniform key/record store shared by every hub component.
 *
 * <p>Records are JSON-compatible field maps grouped into named collections. The store
 * owns no domain semantics. Implementations must behave identically: same results,
 * same errors, for the same sequence of calls. In particular {@link #putIfAbsent} and
 * {@link #replace} are atomic with respect to concurrent callers on the same key; the
 * components rely on them instead of application-level locks.
 *
 * <p>Infrastructure failures surface as {@link io.agenthub.StorageUnavailableException}.
 *
 * @see io.agenthub.store.InMemoryRecordStore
 */
public interface RecordStore {

    /**
     * Stores a record, overwriting any existing one.
     *
     * @param collection collection name
     * @param key        record key
     * @param record     record fields
     */
    void put(String collection, String key, Map<String, Object> record);

    /**
     * Reads a record.
     *
     * @param collection collection name
     * @param key        record key
     * @return the record, or empty if absent
     */
    Optional<Map<String, Object>> get(String collection, String key);

    /**
     * Stores a record only if the key is free.
     *
     * <p>Of any number of concurrent callers for the same key exactly one observes
     * {@code created == true}; all others receive the winner's record.
     *
     * @param collection collection name
     * @param key        record key
     * @param record     record fields
     * @return the stored record and whether this call created it
     */
    PutResult putIfAbsent(String collection, String key, Map<String, Object> record);

    /**
     * Atomically replaces a record if its current value equals {@code expected}.
     *
     * @param collection  collection name
     * @param key         record key
     * @param expected    the value the caller last read
     * @param replacement the new value
     * @return {@code true} if the record was replaced, {@code false} if it was absent
     *     or had changed
     */
    boolean replace(String collection, String key, Map<String, Object> expected,
        Map<String, Object> replacement);

    /**
     * Returns the records of a collection that match a predicate, in key order.
     *
     * @param collection collection name
     * @param predicate  filter applied to each record
     * @return matching records
     */
    List<Map<String, Object>> query(String collection, Predicate<Map<String, Object>> predicate);

    /**
     * Removes a record.
     *
     * @param collection collection name
     * @param key        record key
     * @return {@code true} if a record was removed
     */
    boolean delete(String collection, String key);

    /**
     * Lists keys of a collection starting with a prefix, in key order.
     *
     * @param collection collection name
     * @param prefix     key prefix, empty for all keys
     * @return matching keys
     */
    List<String> listKeys(String collection, String prefix);

    /**
     * Short identifier of the backend (e.g. "memory", "h2", "mysql", "postgresql").
     */
    String name();
}
