package io.agenthub.delivery;

import io.agenthub.DeliveryFailedException;
import io.agenthub.UnknownAgentException;
import io.agenthub.identity.IdentityRegistry;
import io.agenthub.model.AuditEvent;
import io.agenthub.model.DeliveryRecord;
import io.agenthub.model.DeliveryStatus;
import io.agenthub.room.RoomManager;
import io.agenthub.spi.AuditReporter;
import io.agenthub.spi.ChannelSender;
import io.agenthub.spi.CollaboratorException;
import io.agenthub.spi.MetricsExporter;
import io.agenthub.spi.RecordStore;
import io.agenthub.store.Fields;
import io.agenthub.store.RecordCollection;
import io.agenthub.store.RecordMapper;
import io.agenthub.translate.ChannelPayload;
import io.agenthub.translate.MessageContent;
import io.agenthub.translate.Translation;
import io.agenthub.translate.Translator;
import io.agenthub.util.DaemonThreadFactory;
import io.agenthub.util.ExponentialBackoffRetryPolicy;
import io.agenthub.util.Ids;
import io.agenthub.util.RetryPolicy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Routes a message to the receiver's room: resolve room, translate, record, send, audit.
 *
 * <p>The delivery id is the idempotency key. The first call stores a STARTED record with
 * {@code putIfAbsent} and is the only one that sends; a repeated call returns the
 * record's current status without sending again. Sends carry the delivery id as the
 * channel transaction id and a bounded timeout; timeouts and transient channel failures
 * are retried with backoff. The record always ends COMPLETED or FAILED.
 *
 * <p>A record still STARTED after the abandon window (by default {@code sendTimeout *
 * maxAttempts}) belongs to a sender that died or lost its store connection before writing
 * the outcome. The next call with that delivery id claims it with {@code replace} and sends
 * again under the same transaction id, which the channel deduplicates.
 *
 * <p>Concurrent sends to the same receiver are not ordered relative to each other.
 * Callers that need ordering must wait for one send to return before the next.
 */
public final class DeliveryPipeline implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DeliveryPipeline.class.getName());

  static final String DELIVERIES = "deliveries";

  static final RecordMapper<DeliveryRecord> MAPPER = new RecordMapper<>() {
    @Override
    public String keyOf(DeliveryRecord record) {
      return record.deliveryId();
    }

    @Override
    public Map<String, Object> toRecord(DeliveryRecord record) {
      return Fields.record(
          "deliveryId", record.deliveryId(),
          "sender", record.sender(),
          "receiver", record.receiver(),
          "roomId", record.roomId(),
          "status", record.status().name(),
          "attempts", record.attempts(),
          "channelEventId", record.channelEventId(),
          "lastError", record.lastError(),
          "startedAt", Fields.format(record.startedAt()),
          "updatedAt", Fields.format(record.updatedAt()));
    }

    @Override
    public DeliveryRecord fromRecord(Map<String, Object> record) {
      return new DeliveryRecord(
          Fields.string(record, "deliveryId"),
          Fields.string(record, "sender"),
          Fields.string(record, "receiver"),
          Fields.optionalString(record, "roomId"),
          Fields.enumValue(record, "status", DeliveryStatus.class),
          Fields.intValue(record, "attempts"),
          Fields.optionalString(record, "channelEventId"),
          Fields.optionalString(record, "lastError"),
          Fields.instant(record, "startedAt"),
          Fields.instant(record, "updatedAt"));
    }
  };

  private final RecordCollection<DeliveryRecord> deliveries;
  private final IdentityRegistry identityRegistry;
  private final RoomManager roomManager;
  private final Translator translator;
  private final ChannelSender channelSender;
  private final AuditReporter auditReporter;
  private final Executor auditExecutor;
  private final ExecutorService sendExecutor;
  private final boolean ownsSendExecutor;
  private final RetryPolicy retryPolicy;
  private final int maxAttempts;
  private final Duration sendTimeout;
  private final Duration abandonedAfter;
  private final Clock clock;
  private final MetricsExporter metrics;

  private DeliveryPipeline(Builder builder) {
    RecordStore store = Objects.requireNonNull(builder.store, "store");
    this.deliveries = new RecordCollection<>(store, DELIVERIES, MAPPER);
    this.identityRegistry = Objects.requireNonNull(builder.identityRegistry, "identityRegistry");
    this.roomManager = Objects.requireNonNull(builder.roomManager, "roomManager");
    this.translator = Objects.requireNonNull(builder.translator, "translator");
    this.channelSender = Objects.requireNonNull(builder.channelSender, "channelSender");
    this.auditReporter = builder.auditReporter != null ? builder.auditReporter : AuditReporter.NOOP;
    this.auditExecutor = builder.auditExecutor != null ? builder.auditExecutor : Runnable::run;
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(200, 10_000);
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.maxAttempts = builder.maxAttempts;
    this.sendTimeout = Objects.requireNonNull(builder.sendTimeout, "sendTimeout");
    if (sendTimeout.isNegative() || sendTimeout.isZero()) {
      throw new IllegalArgumentException("sendTimeout must be positive");
    }
    this.abandonedAfter = builder.abandonedAfter != null
        ? builder.abandonedAfter : sendTimeout.multipliedBy(maxAttempts);
    if (abandonedAfter.isNegative() || abandonedAfter.isZero()) {
      throw new IllegalArgumentException("abandonedAfter must be positive");
    }
    if (builder.sendExecutor != null) {
      this.sendExecutor = builder.sendExecutor;
      this.ownsSendExecutor = false;
    } else {
      this.sendExecutor = Executors.newCachedThreadPool(new DaemonThreadFactory("agenthub-send-"));
      this.ownsSendExecutor = true;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Delivers {@code content} from {@code sender} to {@code receiver}'s room.
   *
   * @param deliveryId idempotency key chosen by the caller
   * @param sender     sending agent id, or {@code null} for the hub itself
   * @return the delivery state; {@link DeliveryResult#duplicate()} marks a repeated id
   * @throws UnknownAgentException if the receiver is not registered or is revoked;
   *     nothing is recorded in that case
   * @throws io.agenthub.RoomProvisioningException if the receiver's room could not be created
   * @throws DeliveryFailedException if every send attempt failed; the record is FAILED
   */
  public DeliveryResult send(String deliveryId, String sender, String receiver, MessageContent content) {
    Ids.require(deliveryId, "deliveryId");
    Ids.require(receiver, "receiver");
    Objects.requireNonNull(content, "content");
    if (identityRegistry.findActiveAgent(receiver).isEmpty()) {
      throw new UnknownAgentException(receiver);
    }
    String senderLabel = sender == null ? DeliveryRecord.SYSTEM_SENDER : sender;

    Optional<DeliveryRecord> existing = deliveries.get(deliveryId);
    if (existing.isPresent() && !isAbandoned(existing.get())) {
      return duplicate(existing.get());
    }

    String roomId = existing.map(DeliveryRecord::roomId)
        .orElseGet(() -> roomManager.ensureRoomForAgent(receiver));
    Instant now = clock.instant();
    Translation<ChannelPayload> translation = translator.toChannelFormat(content);
    ChannelPayload payload = translation.value();
    if (roomManager.scopeKeyFor(receiver).startsWith(RoomManager.OWNER_SCOPE_PREFIX)) {
      payload = Translator.attributeSender(payload, senderLabel);
    }
    AuditEvent auditEvent = new AuditEvent(deliveryId, senderLabel, receiver, roomId, now);
    payload = Translator.injectAuditFields(payload, auditEvent);

    DeliveryRecord started;
    if (existing.isPresent()) {
      Optional<DeliveryRecord> claimed = claimAbandoned(existing.get(), now);
      if (claimed.isEmpty()) {
        return duplicate(deliveries.get(deliveryId).orElse(existing.get()));
      }
      started = claimed.get();
      logger.warning("Resuming delivery " + deliveryId + " left STARTED since "
          + existing.get().updatedAt());
    } else {
      started = DeliveryRecord.started(deliveryId, senderLabel, receiver, roomId, now);
      RecordCollection.Stored<DeliveryRecord> stored = deliveries.putIfAbsent(started);
      if (!stored.created() && !stored.value().equals(started)) {
        return duplicate(stored.value());
      }
    }

    DeliveryRecord completed = deliver(started, payload);
    report(auditEvent);
    return DeliveryResult.of(completed, false, translation.warnings());
  }

  public Optional<DeliveryRecord> status(String deliveryId) {
    return deliveries.get(Ids.require(deliveryId, "deliveryId"));
  }

  /**
   * Deliveries matching {@code query}, most recently started first.
   */
  public List<DeliveryRecord> query(DeliveryQuery query) {
    Objects.requireNonNull(query, "query");
    return deliveries.query(query::matches).stream()
        .sorted(Comparator.comparing(DeliveryRecord::startedAt).reversed()
            .thenComparing(DeliveryRecord::deliveryId))
        .limit(query.limit())
        .toList();
  }

  /**
   * Number of deliveries per status; every status is present.
   */
  public Map<DeliveryStatus, Long> summary() {
    Map<DeliveryStatus, Long> counts = new EnumMap<>(DeliveryStatus.class);
    for (DeliveryStatus status : DeliveryStatus.values()) {
      counts.put(status, 0L);
    }
    for (DeliveryRecord record : deliveries.all()) {
      counts.merge(record.status(), 1L, Long::sum);
    }
    return counts;
  }

  /**
   * A STARTED record untouched for longer than the abandon window was left behind by a
   * sender that crashed or could not write the outcome.
   */
  private boolean isAbandoned(DeliveryRecord record) {
    return record.status() == DeliveryStatus.STARTED
        && record.updatedAt().plus(abandonedAfter).isBefore(clock.instant());
  }

  private Optional<DeliveryRecord> claimAbandoned(DeliveryRecord record, Instant now) {
    if (!isAbandoned(record)) {
      return Optional.empty();
    }
    DeliveryRecord claimed = record.touched(now);
    return deliveries.replace(record, claimed) ? Optional.of(claimed) : Optional.empty();
  }

  private DeliveryResult duplicate(DeliveryRecord record) {
    metrics.incrementDeliveryDuplicate();
    logger.fine(() -> "Duplicate delivery " + record.deliveryId() + " in status " + record.status());
    return DeliveryResult.of(record, true, List.of());
  }

  private DeliveryRecord deliver(DeliveryRecord started, ChannelPayload payload) {
    String deliveryId = started.deliveryId();
    Exception lastFailure = null;
    int attempt = 1;
    while (true) {
      long startNanos = System.nanoTime();
      try {
        String eventId = sendOnce(started.roomId(), payload, deliveryId);
        metrics.recordDeliveryLatencyMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        DeliveryRecord completed = started.completed(attempt, eventId, clock.instant());
        finish(started, completed);
        metrics.incrementDeliveryCompleted();
        return completed;
      } catch (CollaboratorException e) {
        lastFailure = e;
        if (!e.isTransient() || attempt >= maxAttempts) {
          break;
        }
      } catch (RuntimeException e) {
        lastFailure = e;
        break;
      }
      long delayMs = retryPolicy.computeDelayMs(attempt);
      metrics.incrementDeliveryRetried();
      logger.log(Level.WARNING, "Delivery " + deliveryId + " attempt " + attempt
          + " failed, retrying in " + delayMs + "ms", lastFailure);
      if (!sleep(delayMs)) {
        break;
      }
      attempt++;
    }
    DeliveryRecord failed = started.failed(attempt, lastFailure.toString(), clock.instant());
    finish(started, failed);
    metrics.incrementDeliveryFailed();
    logger.log(Level.SEVERE, "Delivery " + deliveryId + " FAILED after " + attempt + " attempt(s)",
        lastFailure);
    throw new DeliveryFailedException(deliveryId, attempt, lastFailure);
  }

  private String sendOnce(String roomId, ChannelPayload payload, String transactionId)
      throws CollaboratorException {
    Future<String> future = sendExecutor.submit(() -> channelSender.send(roomId, payload, transactionId));
    try {
      return future.get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new CollaboratorException("Channel send timed out after " + sendTimeout.toMillis() + "ms", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof CollaboratorException collaboratorException) {
        throw collaboratorException;
      }
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      throw new CollaboratorException("Channel send failed", cause);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new CollaboratorException("Interrupted while sending", e, false);
    }
  }

  private void finish(DeliveryRecord started, DeliveryRecord terminal) {
    if (!deliveries.replace(started, terminal)) {
      // only the creator of a record updates it, so this means the record was edited externally
      logger.severe("Delivery record " + started.deliveryId() + " changed concurrently; overwriting with "
          + terminal.status());
      deliveries.put(terminal);
    }
  }

  private void report(AuditEvent event) {
    try {
      auditExecutor.execute(() -> {
        try {
          auditReporter.reportMessage(event);
        } catch (CollaboratorException | RuntimeException e) {
          metrics.incrementAuditFailed();
          logger.log(Level.WARNING, "Audit report failed for delivery " + event.messageId(), e);
        }
      });
    } catch (RejectedExecutionException e) {
      metrics.incrementAuditFailed();
      logger.log(Level.WARNING, "Audit report dropped for delivery " + event.messageId(), e);
    }
  }

  private static boolean sleep(long delayMs) {
    if (delayMs <= 0) {
      return true;
    }
    try {
      Thread.sleep(delayMs);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /**
   * Stops the send executor if this pipeline created it.
   */
  @Override
  public void close() {
    if (ownsSendExecutor) {
      sendExecutor.shutdownNow();
    }
  }

  /** Builder for {@link DeliveryPipeline}. */
  public static final class Builder {
    private RecordStore store;
    private IdentityRegistry identityRegistry;
    private RoomManager roomManager;
    private Translator translator;
    private ChannelSender channelSender;
    private AuditReporter auditReporter;
    private Executor auditExecutor;
    private ExecutorService sendExecutor;
    private RetryPolicy retryPolicy;
    private int maxAttempts = 5;
    private Duration sendTimeout = Duration.ofSeconds(10);
    private Duration abandonedAfter;
    private Clock clock;
    private MetricsExporter metrics;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder store(RecordStore store) {
      this.store = store;
      return this;
    }

    /** <b>Required.</b> */
    public Builder identityRegistry(IdentityRegistry identityRegistry) {
      this.identityRegistry = identityRegistry;
      return this;
    }

    /** <b>Required.</b> */
    public Builder roomManager(RoomManager roomManager) {
      this.roomManager = roomManager;
      return this;
    }

    /** <b>Required.</b> */
    public Builder translator(Translator translator) {
      this.translator = translator;
      return this;
    }

    /** <b>Required.</b> */
    public Builder channelSender(ChannelSender channelSender) {
      this.channelSender = channelSender;
      return this;
    }

    public Builder auditReporter(AuditReporter auditReporter) {
      this.auditReporter = auditReporter;
      return this;
    }

    /**
     * Runs audit reports. Optional. Defaults to the calling thread; the
     * {@link io.agenthub.AgentHub} composite supplies a background executor.
     */
    public Builder auditExecutor(Executor auditExecutor) {
      this.auditExecutor = auditExecutor;
      return this;
    }

    /**
     * Runs channel sends so that they can be timed out. Optional. Defaults to a cached
     * pool of daemon threads owned by the pipeline.
     */
    public Builder sendExecutor(ExecutorService sendExecutor) {
      this.sendExecutor = sendExecutor;
      return this;
    }

    /**
     * Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with
     * {@code baseDelayMs=200} and {@code maxDelayMs=10000}.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Optional. Defaults to {@code 5}. Must be &ge; 1.
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Upper bound for one channel send. Optional. Defaults to 10 seconds.
     */
    public Builder sendTimeout(Duration sendTimeout) {
      this.sendTimeout = sendTimeout;
      return this;
    }

    /**
     * Optional. How long a STARTED record may sit untouched before another call with the
     * same delivery id resumes it. Defaults to {@code sendTimeout * maxAttempts}.
     */
    public Builder abandonedAfter(Duration abandonedAfter) {
      this.abandonedAfter = abandonedAfter;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public DeliveryPipeline build() {
      return new DeliveryPipeline(this);
    }
  }
}
