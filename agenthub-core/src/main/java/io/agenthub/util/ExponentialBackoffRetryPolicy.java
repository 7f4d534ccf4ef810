package io.agenthub.util;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Doubles the delay after every failed attempt, starting at {@code baseDelayMs} and never
 * exceeding {@code maxDelayMs}. With jitter enabled the doubled delay is scaled by a random
 * factor in [0.5, 1.5) before the cap is applied, so concurrent retries against the same
 * homeserver or store spread out.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final boolean jitter;

  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, true);
  }

  private ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, boolean jitter) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  /**
   * Same bounds with deterministic delays: {@code min(maxDelayMs, baseDelayMs * 2^(attempts-1))}.
   */
  public ExponentialBackoffRetryPolicy withoutJitter() {
    return new ExponentialBackoffRetryPolicy(baseDelayMs, maxDelayMs, false);
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    long delay = baseDelayMs;
    for (int i = 1; i < attempts && delay < maxDelayMs; i++) {
      // halving the cap instead of doubling the delay avoids overflow
      delay = delay > maxDelayMs / 2 ? maxDelayMs : delay * 2;
    }
    if (!jitter) {
      return delay;
    }
    double factor = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
    return Math.min(maxDelayMs, (long) (delay * factor));
  }

  @Override
  public String toString() {
    return "ExponentialBackoffRetryPolicy[base=" + baseDelayMs + "ms, max=" + maxDelayMs
        + "ms, jitter=" + jitter + "]";
  }
}
