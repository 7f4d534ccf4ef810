package io.agenthub.util;

/**
 * Strategy for computing the delay before retrying a failed operation.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * Policy that retries immediately.
     */
    RetryPolicy NO_DELAY = attempts -> 0L;

    /**
     * Computes the delay in milliseconds before the next retry attempt.
     *
     * @param attempts the number of attempts so far (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempts);
}
