package io.agenthub.spi;

/**
 * Observability hook for exporting hub counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of deliveries that reached COMPLETED.
     */
    void incrementDeliveryCompleted();

    /**
     * Increments the count of deliveries that reached FAILED.
     */
    void incrementDeliveryFailed();

    /**
     * Increments the count of send attempts that failed and were retried.
     */
    void incrementDeliveryRetried();

    /**
     * Increments the count of send calls answered from an existing delivery record.
     */
    void incrementDeliveryDuplicate();

    /**
     * Increments the count of rooms created through the channel provisioner.
     */
    void incrementRoomCreated();

    /**
     * Increments the count of approval requests resolved for the first time.
     */
    void incrementApprovalResolved();

    /**
     * Increments the count of audit reports that could not be delivered.
     */
    default void incrementAuditFailed() {
    }

    /**
     * Increments the count of DIDs stored after chain registration.
     */
    default void incrementDidRegistered() {
    }

    /**
     * Increments the count of DID registrations abandoned after the last retry.
     */
    default void incrementDidFailed() {
    }

    /**
     * Records the time spent in the channel sender for a successful delivery.
     *
     * @param latencyMs latency in milliseconds (always non-negative)
     */
    default void recordDeliveryLatencyMs(long latencyMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementDeliveryCompleted() {
        }

        @Override
        public void incrementDeliveryFailed() {
        }

        @Override
        public void incrementDeliveryRetried() {
        }

        @Override
        public void incrementDeliveryDuplicate() {
        }

        @Override
        public void incrementRoomCreated() {
        }

        @Override
        public void incrementApprovalResolved() {
        }
    }
}
