package io.agenthub;

import io.agenthub.approval.ApprovalCoordinator;
import io.agenthub.delivery.DeliveryPipeline;
import io.agenthub.identity.IdentityRegistry;
import io.agenthub.identity.PresenceTracker;
import io.agenthub.identity.RegistryIdentityResolver;
import io.agenthub.room.RoomManager;
import io.agenthub.room.RoomPolicy;
import io.agenthub.spi.AuditReporter;
import io.agenthub.spi.ChainRegistrar;
import io.agenthub.spi.ChannelProvisioner;
import io.agenthub.spi.ChannelSender;
import io.agenthub.spi.MetricsExporter;
import io.agenthub.spi.PermissionInitializer;
import io.agenthub.spi.RecordStore;
import io.agenthub.store.RetryingRecordStore;
import io.agenthub.translate.IdentityResolver;
import io.agenthub.translate.Translator;
import io.agenthub.util.DaemonThreadFactory;
import io.agenthub.util.ExponentialBackoffRetryPolicy;
import io.agenthub.util.RetryPolicy;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the record store, identity registry, room manager,
 * translator, approval coordinator and delivery pipeline into a single
 * {@link AutoCloseable} unit owning their background threads.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (AgentHub hub = AgentHub.builder()
 *     .store(new InMemoryRecordStore())
 *     .channelProvisioner(matrix)
 *     .channelSender(matrix)
 *     .build()) {
 *   hub.identity().registerAgent(Initiator.HUMAN, "A1", Map.of());
 *   hub.deliveries().send("d-1", null, "A1", new MessageContent.Text("hi"));
 * }
 * }</pre>
 */
public final class AgentHub implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(AgentHub.class.getName());

  private final RecordStore store;
  private final IdentityRegistry identity;
  private final PresenceTracker presence;
  private final RoomManager rooms;
  private final Translator translator;
  private final ApprovalCoordinator approvals;
  private final DeliveryPipeline deliveries;
  private final DiscoveryDocument discovery;
  private final ScheduledExecutorService background;
  private final MetricsExporter metrics;
  private final long drainTimeoutMs;

  private AgentHub(Builder builder) {
    RecordStore base = Objects.requireNonNull(builder.store, "store");
    Objects.requireNonNull(builder.channelProvisioner, "channelProvisioner");
    Objects.requireNonNull(builder.channelSender, "channelSender");
    if (builder.storeMaxAttempts < 1) {
      throw new IllegalArgumentException("storeMaxAttempts must be >= 1");
    }
    if (builder.backgroundThreads < 1) {
      throw new IllegalArgumentException("backgroundThreads must be >= 1");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.store = builder.storeMaxAttempts > 1
        ? new RetryingRecordStore(base, new ExponentialBackoffRetryPolicy(100, 2_000), builder.storeMaxAttempts)
        : base;
    this.background = Executors.newScheduledThreadPool(builder.backgroundThreads,
        new DaemonThreadFactory("agenthub-background-"));

    this.identity = IdentityRegistry.builder()
        .store(store)
        .clock(clock)
        .chainRegistrar(builder.chainRegistrar)
        .permissionInitializer(builder.permissionInitializer)
        .maxDidAttempts(builder.maxDidAttempts)
        .didRetryPolicy(builder.didRetryPolicy)
        .metrics(metrics)
        .scheduler(background)
        .build();
    this.presence = new PresenceTracker(identity, store, clock, builder.presenceOfflineThreshold);
    this.rooms = RoomManager.builder()
        .store(store)
        .identityRegistry(identity)
        .provisioner(builder.channelProvisioner)
        .policy(builder.roomPolicy)
        .clock(clock)
        .provisioningTimeout(builder.roomProvisioningTimeout)
        .metrics(metrics)
        .build();
    IdentityResolver resolver = builder.identityResolver != null
        ? builder.identityResolver : new RegistryIdentityResolver(identity);
    this.translator = new Translator(resolver);
    AuditReporter auditReporter = builder.auditReporter != null ? builder.auditReporter : AuditReporter.NOOP;
    this.approvals = new ApprovalCoordinator(store, clock, auditReporter, background, metrics);
    this.deliveries = DeliveryPipeline.builder()
        .store(store)
        .identityRegistry(identity)
        .roomManager(rooms)
        .translator(translator)
        .channelSender(builder.channelSender)
        .auditReporter(auditReporter)
        .auditExecutor(background)
        .retryPolicy(builder.deliveryRetryPolicy)
        .maxAttempts(builder.deliveryMaxAttempts)
        .sendTimeout(builder.sendTimeout)
        .clock(clock)
        .metrics(metrics)
        .build();
    this.discovery = builder.matrixHomeserver == null ? null
        : new DiscoveryDocument(builder.matrixHomeserver, builder.apiBase, DiscoveryDocument.CURRENT_VERSION);
    logger.info("AgentHub started with store=" + store.name() + ", roomPolicy=" + rooms.policy());
  }

  public static Builder builder() {
    return new Builder();
  }

  public RecordStore store() {
    return store;
  }

  public IdentityRegistry identity() {
    return identity;
  }

  public PresenceTracker presence() {
    return presence;
  }

  public RoomManager rooms() {
    return rooms;
  }

  public Translator translator() {
    return translator;
  }

  public ApprovalCoordinator approvals() {
    return approvals;
  }

  public DeliveryPipeline deliveries() {
    return deliveries;
  }

  /**
   * @throws IllegalStateException if no homeserver URL was configured
   */
  public DiscoveryDocument discovery() {
    if (discovery == null) {
      throw new IllegalStateException("matrixHomeserver not configured");
    }
    return discovery;
  }

  /**
   * Stops the delivery pipeline, lets queued background work (audit reports, DID
   * registration) drain within the configured timeout, then closes the metrics exporter
   * if it is {@link AutoCloseable}.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      deliveries.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      identity.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    background.shutdown();
    try {
      if (!background.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; dropping pending background work");
        background.shutdownNow();
      }
    } catch (InterruptedException e) {
      background.shutdownNow();
      Thread.currentThread().interrupt();
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link AgentHub}. May be used once. */
  public static final class Builder {
    private RecordStore store;
    private ChannelProvisioner channelProvisioner;
    private ChannelSender channelSender;
    private ChainRegistrar chainRegistrar;
    private AuditReporter auditReporter;
    private PermissionInitializer permissionInitializer;
    private IdentityResolver identityResolver;
    private RoomPolicy roomPolicy = RoomPolicy.DEDICATED;
    private Clock clock;
    private MetricsExporter metrics;
    private RetryPolicy deliveryRetryPolicy;
    private int deliveryMaxAttempts = 5;
    private Duration sendTimeout = Duration.ofSeconds(10);
    private Duration roomProvisioningTimeout = Duration.ofSeconds(30);
    private RetryPolicy didRetryPolicy;
    private int maxDidAttempts = 5;
    private int storeMaxAttempts = 3;
    private Duration presenceOfflineThreshold = PresenceTracker.DEFAULT_OFFLINE_THRESHOLD;
    private int backgroundThreads = 2;
    private long drainTimeoutMs = 5000;
    private String matrixHomeserver;
    private String apiBase;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /** <b>Required.</b> The backend every component persists through. */
    public Builder store(RecordStore store) {
      this.store = store;
      return this;
    }

    /** <b>Required.</b> */
    public Builder channelProvisioner(ChannelProvisioner channelProvisioner) {
      this.channelProvisioner = channelProvisioner;
      return this;
    }

    /** <b>Required.</b> */
    public Builder channelSender(ChannelSender channelSender) {
      this.channelSender = channelSender;
      return this;
    }

    public Builder chainRegistrar(ChainRegistrar chainRegistrar) {
      this.chainRegistrar = chainRegistrar;
      return this;
    }

    public Builder auditReporter(AuditReporter auditReporter) {
      this.auditReporter = auditReporter;
      return this;
    }

    public Builder permissionInitializer(PermissionInitializer permissionInitializer) {
      this.permissionInitializer = permissionInitializer;
      return this;
    }

    /**
     * Optional. Defaults to {@link RegistryIdentityResolver} over the hub's registry.
     */
    public Builder identityResolver(IdentityResolver identityResolver) {
      this.identityResolver = identityResolver;
      return this;
    }

    public Builder roomPolicy(RoomPolicy roomPolicy) {
      this.roomPolicy = roomPolicy;
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

    public Builder deliveryRetryPolicy(RetryPolicy deliveryRetryPolicy) {
      this.deliveryRetryPolicy = deliveryRetryPolicy;
      return this;
    }

    public Builder deliveryMaxAttempts(int deliveryMaxAttempts) {
      this.deliveryMaxAttempts = deliveryMaxAttempts;
      return this;
    }

    public Builder sendTimeout(Duration sendTimeout) {
      this.sendTimeout = sendTimeout;
      return this;
    }

    public Builder roomProvisioningTimeout(Duration roomProvisioningTimeout) {
      this.roomProvisioningTimeout = roomProvisioningTimeout;
      return this;
    }

    public Builder didRetryPolicy(RetryPolicy didRetryPolicy) {
      this.didRetryPolicy = didRetryPolicy;
      return this;
    }

    public Builder maxDidAttempts(int maxDidAttempts) {
      this.maxDidAttempts = maxDidAttempts;
      return this;
    }

    /**
     * Attempts per store operation on {@link StorageUnavailableException}. Optional.
     * Defaults to {@code 3}; {@code 1} disables the retrying wrapper.
     */
    public Builder storeMaxAttempts(int storeMaxAttempts) {
      this.storeMaxAttempts = storeMaxAttempts;
      return this;
    }

    public Builder presenceOfflineThreshold(Duration presenceOfflineThreshold) {
      this.presenceOfflineThreshold = presenceOfflineThreshold;
      return this;
    }

    public Builder backgroundThreads(int backgroundThreads) {
      this.backgroundThreads = backgroundThreads;
      return this;
    }

    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Homeserver advertised by the discovery document.
     */
    public Builder matrixHomeserver(String matrixHomeserver) {
      this.matrixHomeserver = matrixHomeserver;
      return this;
    }

    public Builder apiBase(String apiBase) {
      this.apiBase = apiBase;
      return this;
    }

    /**
     * @throws IllegalStateException if called twice on the same builder
     */
    public AgentHub build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      return new AgentHub(this);
    }
  }
}
