package io.agenthub;

import io.agenthub.spi.MetricsExporter;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metrics exporter that counts every call, for assertions in tests.
 */
public class RecordingMetrics implements MetricsExporter {
    public final AtomicInteger deliveryCompleted = new AtomicInteger();
    public final AtomicInteger deliveryFailed = new AtomicInteger();
    public final AtomicInteger deliveryRetried = new AtomicInteger();
    public final AtomicInteger deliveryDuplicate = new AtomicInteger();
    public final AtomicInteger roomCreated = new AtomicInteger();
    public final AtomicInteger approvalResolved = new AtomicInteger();
    public final AtomicInteger auditFailed = new AtomicInteger();
    public final AtomicInteger didRegistered = new AtomicInteger();
    public final AtomicInteger didFailed = new AtomicInteger();

    @Override
    public void incrementDeliveryCompleted() {
        deliveryCompleted.incrementAndGet();
    }

    @Override
    public void incrementDeliveryFailed() {
        deliveryFailed.incrementAndGet();
    }

    @Override
    public void incrementDeliveryRetried() {
        deliveryRetried.incrementAndGet();
    }

    @Override
    public void incrementDeliveryDuplicate() {
        deliveryDuplicate.incrementAndGet();
    }

    @Override
    public void incrementRoomCreated() {
        roomCreated.incrementAndGet();
    }

    @Override
    public void incrementApprovalResolved() {
        approvalResolved.incrementAndGet();
    }

    @Override
    public void incrementAuditFailed() {
        auditFailed.incrementAndGet();
    }

    @Override
    public void incrementDidRegistered() {
        didRegistered.incrementAndGet();
    }

    @Override
    public void incrementDidFailed() {
        didFailed.incrementAndGet();
    }
}
