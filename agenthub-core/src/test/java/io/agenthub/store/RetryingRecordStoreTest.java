package io.agenthub.store;

import io.agenthub.StorageUnavailableException;
import io.agenthub.spi.PutResult;
import io.agenthub.util.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryingRecordStoreTest {

    @Test
    void retriesUntilTheStoreRecovers() {
        FlakyStore flaky = new FlakyStore(2);
        RetryingRecordStore store = new RetryingRecordStore(flaky, RetryPolicy.NO_DELAY, 3);

        store.put("items", "k", Map.of("v", 1));

        assertEquals(3, flaky.calls.get());
        assertEquals(1L, store.get("items", "k").orElseThrow().get("v"));
    }

    @Test
    void propagatesLastFailureWhenAttemptsAreExhausted() {
        FlakyStore flaky = new FlakyStore(5);
        RetryingRecordStore store = new RetryingRecordStore(flaky, RetryPolicy.NO_DELAY, 3);

        StorageUnavailableException ex = assertThrows(StorageUnavailableException.class,
            () -> store.listKeys("items", ""));

        assertEquals(3, flaky.calls.get());
        assertTrue(ex.isRetryable());
    }

    @Test
    void doesNotRetryOtherExceptions() {
        FlakyStore flaky = new FlakyStore(0);
        RetryingRecordStore store = new RetryingRecordStore(flaky, RetryPolicy.NO_DELAY, 3);

        assertThrows(IllegalArgumentException.class, () -> store.get("BAD", "k"));
        assertEquals(1, flaky.calls.get());
    }

    @Test
    void exposesDelegate() {
        FlakyStore flaky = new FlakyStore(0);
        RetryingRecordStore store = new RetryingRecordStore(flaky, RetryPolicy.NO_DELAY, 1);

        assertSame(flaky, store.delegate());
        assertEquals("memory", store.name());
        assertThrows(IllegalArgumentException.class,
            () -> new RetryingRecordStore(flaky, RetryPolicy.NO_DELAY, 0));
    }

    /** Fails the first {@code failures} calls, then delegates to memory. */
    private static final class FlakyStore implements io.agenthub.spi.RecordStore {
        final AtomicInteger calls = new AtomicInteger();
        private final AtomicInteger failures;
        private final InMemoryRecordStore memory = new InMemoryRecordStore();

        FlakyStore(int failures) {
            this.failures = new AtomicInteger(failures);
        }

        private void maybeFail() {
            calls.incrementAndGet();
            if (failures.getAndDecrement() > 0) {
                throw new StorageUnavailableException("connection reset", null);
            }
        }

        @Override
        public void put(String collection, String key, Map<String, Object> record) {
            maybeFail();
            memory.put(collection, key, record);
        }

        @Override
        public java.util.Optional<Map<String, Object>> get(String collection, String key) {
            maybeFail();
            return memory.get(collection, key);
        }

        @Override
        public PutResult putIfAbsent(String collection, String key, Map<String, Object> record) {
            maybeFail();
            return memory.putIfAbsent(collection, key, record);
        }

        @Override
        public boolean replace(String collection, String key, Map<String, Object> expected,
                               Map<String, Object> replacement) {
            maybeFail();
            return memory.replace(collection, key, expected, replacement);
        }

        @Override
        public List<Map<String, Object>> query(String collection,
                                               java.util.function.Predicate<Map<String, Object>> predicate) {
            maybeFail();
            return memory.query(collection, predicate);
        }

        @Override
        public boolean delete(String collection, String key) {
            maybeFail();
            return memory.delete(collection, key);
        }

        @Override
        public List<String> listKeys(String collection, String prefix) {
            maybeFail();
            return memory.listKeys(collection, prefix);
        }

        @Override
        public String name() {
            return memory.name();
        }
    }
}
