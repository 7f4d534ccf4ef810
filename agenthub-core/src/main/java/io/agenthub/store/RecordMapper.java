package io.agenthub.store;

import java.util.Map;

/**
 * Converts a domain record to and from the field map kept by a
 * {@link io.agenthub.spi.RecordStore}.
 *
 * @param <T> the domain type
 */
public interface RecordMapper<T> {

    /**
     * Key under which the value is stored in its collection.
     */
    String keyOf(T value);

    Map<String, Object> toRecord(T value);

    T fromRecord(Map<String, Object> record);
}
