/**
 * Record store implementations and typed helpers.
 *
 * <p>{@link io.agenthub.store.InMemoryRecordStore} is the default backend.
 * {@link io.agenthub.store.RetryingRecordStore} adds bounded retries for transient
 * infrastructure failures around any backend. Components work through
 * {@link io.agenthub.store.RecordCollection} with a {@link io.agenthub.store.RecordMapper}
 * per domain type.
 */
package io.agenthub.store;
