package io.agenthub.store;

import io.agenthub.StorageUnavailableException;
import io.agenthub.spi.PutResult;
import io.agenthub.spi.RecordStore;
import io.agenthub.util.RetryPolicy;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decorator that retries {@link StorageUnavailableException} with backoff and
 * propagates the last failure once {@code maxAttempts} is exhausted.
 *
 * <p>A retried {@code putIfAbsent} whose first attempt reached the database before the
 * connection failed reports {@code created == false} with the caller's own record.
 * Components compare the returned record rather than trusting the flag alone where
 * that matters.
 */
public final class RetryingRecordStore implements RecordStore {
  private static final Logger logger = Logger.getLogger(RetryingRecordStore.class.getName());

  private final RecordStore delegate;
  private final RetryPolicy retryPolicy;
  private final int maxAttempts;

  public RetryingRecordStore(RecordStore delegate, RetryPolicy retryPolicy, int maxAttempts) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
    }
    this.maxAttempts = maxAttempts;
  }

  public RecordStore delegate() {
    return delegate;
  }

  @Override
  public String name() {
    return delegate.name();
  }

  @Override
  public void put(String collection, String key, Map<String, Object> record) {
    execute("put", () -> {
      delegate.put(collection, key, record);
      return null;
    });
  }

  @Override
  public Optional<Map<String, Object>> get(String collection, String key) {
    return execute("get", () -> delegate.get(collection, key));
  }

  @Override
  public PutResult putIfAbsent(String collection, String key, Map<String, Object> record) {
    return execute("putIfAbsent", () -> delegate.putIfAbsent(collection, key, record));
  }

  @Override
  public boolean replace(String collection, String key, Map<String, Object> expected,
      Map<String, Object> replacement) {
    return execute("replace", () -> delegate.replace(collection, key, expected, replacement));
  }

  @Override
  public List<Map<String, Object>> query(String collection, Predicate<Map<String, Object>> predicate) {
    return execute("query", () -> delegate.query(collection, predicate));
  }

  @Override
  public boolean delete(String collection, String key) {
    return execute("delete", () -> delegate.delete(collection, key));
  }

  @Override
  public List<String> listKeys(String collection, String prefix) {
    return execute("listKeys", () -> delegate.listKeys(collection, prefix));
  }

  private <T> T execute(String operation, Supplier<T> action) {
    int attempt = 1;
    while (true) {
      try {
        return action.get();
      } catch (StorageUnavailableException e) {
        if (attempt >= maxAttempts) {
          logger.log(Level.SEVERE, "Store " + delegate.name() + " " + operation
              + " failed after " + attempt + " attempts", e);
          throw e;
        }
        long delayMs = retryPolicy.computeDelayMs(attempt);
        logger.log(Level.WARNING, "Store " + delegate.name() + " " + operation
            + " failed (attempt " + attempt + "), retrying in " + delayMs + "ms", e);
        sleep(delayMs, e);
        attempt++;
      }
    }
  }

  private static void sleep(long delayMs, StorageUnavailableException cause) {
    if (delayMs <= 0) {
      return;
    }
    try {
      Thread.sleep(delayMs);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      cause.addSuppressed(ie);
      throw cause;
    }
  }
}
