package io.agenthub.micrometer;

import io.agenthub.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code agenthub.delivery.completed} deliveries that reached COMPLETED</li>
 *   <li>{@code agenthub.delivery.failed} deliveries that reached FAILED</li>
 *   <li>{@code agenthub.delivery.retried} failed send attempts that were retried</li>
 *   <li>{@code agenthub.delivery.duplicate} sends answered from an existing record</li>
 *   <li>{@code agenthub.room.created} rooms created on the channel</li>
 *   <li>{@code agenthub.approval.resolved} approval requests resolved</li>
 *   <li>{@code agenthub.audit.failed} audit reports that could not be delivered</li>
 *   <li>{@code agenthub.did.registered} DIDs stored after chain registration</li>
 *   <li>{@code agenthub.did.failed} DID registrations abandoned</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code agenthub.delivery.latency} time spent in the channel sender per delivery</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter deliveryCompleted;
  private final Counter deliveryFailed;
  private final Counter deliveryRetried;
  private final Counter deliveryDuplicate;
  private final Counter roomCreated;
  private final Counter approvalResolved;
  private final Counter auditFailed;
  private final Counter didRegistered;
  private final Counter didFailed;
  private final Timer deliveryLatency;
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "agenthub"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "agenthub");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for several hubs sharing a registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "tenant_a.agenthub"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.deliveryCompleted = counter(namePrefix + ".delivery.completed", "Deliveries completed");
    this.deliveryFailed = counter(namePrefix + ".delivery.failed", "Deliveries failed after all attempts");
    this.deliveryRetried = counter(namePrefix + ".delivery.retried", "Send attempts retried");
    this.deliveryDuplicate = counter(namePrefix + ".delivery.duplicate", "Sends with an already known delivery id");
    this.roomCreated = counter(namePrefix + ".room.created", "Rooms created on the channel");
    this.approvalResolved = counter(namePrefix + ".approval.resolved", "Approval requests resolved");
    this.auditFailed = counter(namePrefix + ".audit.failed", "Audit reports not delivered");
    this.didRegistered = counter(namePrefix + ".did.registered", "DIDs stored after chain registration");
    this.didFailed = counter(namePrefix + ".did.failed", "DID registrations abandoned");
    this.deliveryLatency = Timer.builder(namePrefix + ".delivery.latency")
        .description("Time spent in the channel sender per completed delivery")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementDeliveryCompleted() {
    if (closed) return;
    deliveryCompleted.increment();
  }

  @Override
  public void incrementDeliveryFailed() {
    if (closed) return;
    deliveryFailed.increment();
  }

  @Override
  public void incrementDeliveryRetried() {
    if (closed) return;
    deliveryRetried.increment();
  }

  @Override
  public void incrementDeliveryDuplicate() {
    if (closed) return;
    deliveryDuplicate.increment();
  }

  @Override
  public void incrementRoomCreated() {
    if (closed) return;
    roomCreated.increment();
  }

  @Override
  public void incrementApprovalResolved() {
    if (closed) return;
    approvalResolved.increment();
  }

  @Override
  public void incrementAuditFailed() {
    if (closed) return;
    auditFailed.increment();
  }

  @Override
  public void incrementDidRegistered() {
    if (closed) return;
    didRegistered.increment();
  }

  @Override
  public void incrementDidFailed() {
    if (closed) return;
    didFailed.increment();
  }

  @Override
  public void recordDeliveryLatencyMs(long latencyMs) {
    if (closed) return;
    deliveryLatency.record(latencyMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(deliveryCompleted, deliveryFailed, deliveryRetried, deliveryDuplicate,
        roomCreated, approvalResolved, auditFailed, didRegistered, didFailed, deliveryLatency)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
