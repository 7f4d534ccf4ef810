package io.agenthub.spi;

import java.util.Map;
import java.util.Objects;

/**
 * Outcome of {@link RecordStore#putIfAbsent}.
 *
 * @param record  the record now stored under the key: the caller's record when
 *                {@code created}, otherwise the one that was already there
 * @param created whether this call inserted the record
 */
public record PutResult(Map<String, Object> record, boolean created) {

  public PutResult {
    Objects.requireNonNull(record, "record");
  }
}
