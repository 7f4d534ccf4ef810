package io.agenthub.jdbc;

import io.agenthub.spi.RecordStore;
import io.agenthub.store.InMemoryRecordStore;

/**
 * Runs the shared store behaviour against the in-memory backend, the reference the
 * relational stores are held to.
 */
class InMemoryRecordStoreContractTest extends AbstractRecordStoreContractTest {

    @Override
    RecordStore newStore() {
        return new InMemoryRecordStore();
    }
}
