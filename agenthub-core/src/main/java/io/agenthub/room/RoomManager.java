package io.agenthub.room;

import com.github.f4b6a3.ulid.UlidCreator;
import io.agenthub.RoomProvisioningException;
import io.agenthub.identity.IdentityRegistry;
import io.agenthub.model.Agent;
import io.agenthub.model.Room;
import io.agenthub.model.RoomState;
import io.agenthub.spi.ChannelProvisioner;
import io.agenthub.spi.CollaboratorException;
import io.agenthub.spi.MetricsExporter;
import io.agenthub.spi.RecordStore;
import io.agenthub.store.Fields;
import io.agenthub.store.RecordCollection;
import io.agenthub.store.RecordMapper;
import io.agenthub.util.ExponentialBackoffRetryPolicy;
import io.agenthub.util.Ids;
import io.agenthub.util.RetryPolicy;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Maps agents to channel rooms, creating each room at most once.
 *
 * <p>The first caller for a scope claims it by storing a PROVISIONING placeholder with
 * {@code putIfAbsent}; only the claimant calls the {@link ChannelProvisioner}. Other
 * callers re-read with backoff until the room is READY. If the claimant fails its
 * placeholder is removed and the next caller competes again. A placeholder older than
 * the provisioning timeout is considered abandoned (its claimant crashed) and taken over
 * with a compare-and-set.
 */
public final class RoomManager {
  private static final Logger logger = Logger.getLogger(RoomManager.class.getName());

  public static final String AGENT_SCOPE_PREFIX = "agent:";
  public static final String OWNER_SCOPE_PREFIX = "owner:";

  static final String ROOMS = "rooms";

  static final RecordMapper<Room> MAPPER = new RecordMapper<>() {
    @Override
    public String keyOf(Room room) {
      return room.scopeKey();
    }

    @Override
    public Map<String, Object> toRecord(Room room) {
      return Fields.record(
          "scopeKey", room.scopeKey(),
          "roomId", room.roomId(),
          "state", room.state().name(),
          "claimToken", room.claimToken(),
          "createdAt", Fields.format(room.createdAt()));
    }

    @Override
    public Room fromRecord(Map<String, Object> record) {
      return new Room(
          Fields.string(record, "scopeKey"),
          Fields.optionalString(record, "roomId"),
          Fields.enumValue(record, "state", RoomState.class),
          Fields.optionalString(record, "claimToken"),
          Fields.instant(record, "createdAt"));
    }
  };

  private final RecordCollection<Room> rooms;
  private final IdentityRegistry identityRegistry;
  private final ChannelProvisioner provisioner;
  private final RoomPolicy policy;
  private final Clock clock;
  private final Duration provisioningTimeout;
  private final RetryPolicy retryPolicy;
  private final int maxProvisionAttempts;
  private final String roomNamePrefix;
  private final MetricsExporter metrics;

  private RoomManager(Builder builder) {
    RecordStore store = Objects.requireNonNull(builder.store, "store");
    this.rooms = new RecordCollection<>(store, ROOMS, MAPPER);
    this.identityRegistry = Objects.requireNonNull(builder.identityRegistry, "identityRegistry");
    this.provisioner = Objects.requireNonNull(builder.provisioner, "provisioner");
    this.policy = Objects.requireNonNull(builder.policy, "policy");
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.provisioningTimeout = Objects.requireNonNull(builder.provisioningTimeout, "provisioningTimeout");
    if (provisioningTimeout.isNegative() || provisioningTimeout.isZero()) {
      throw new IllegalArgumentException("provisioningTimeout must be positive");
    }
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(50, 1_000);
    if (builder.maxProvisionAttempts < 1) {
      throw new IllegalArgumentException("maxProvisionAttempts must be >= 1");
    }
    this.maxProvisionAttempts = builder.maxProvisionAttempts;
    this.roomNamePrefix = Ids.require(builder.roomNamePrefix, "roomNamePrefix");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  public RoomPolicy policy() {
    return policy;
  }

  /**
   * Returns the room for the agent's scope, creating it on first use.
   *
   * @throws io.agenthub.UnknownAgentException if the agent is not registered
   * @throws RoomProvisioningException if the channel could not create the room
   */
  public String ensureRoomForAgent(String agentId) {
    return ensureRoom(scopeKeyOf(identityRegistry.requireAgent(agentId)));
  }

  /**
   * Scope key the agent's messages are routed to under the configured policy.
   */
  public String scopeKeyFor(String agentId) {
    return scopeKeyOf(identityRegistry.requireAgent(agentId));
  }

  /**
   * Returns the agent's room if it has been created, without creating it.
   */
  public Optional<String> findRoom(String agentId) {
    return rooms.get(scopeKeyFor(agentId)).filter(Room::isReady).map(Room::roomId);
  }

  public Optional<Room> findByScope(String scopeKey) {
    return rooms.get(scopeKey);
  }

  /**
   * Drops the mapping for a scope; the next use creates a new room. The channel room
   * itself is left alone.
   */
  public boolean forgetRoom(String scopeKey) {
    return rooms.delete(Ids.require(scopeKey, "scopeKey"));
  }

  String ensureRoom(String scopeKey) {
    int waits = 0;
    while (true) {
      Optional<Room> existing = rooms.get(scopeKey);
      if (existing.isPresent() && existing.get().isReady()) {
        return existing.get().roomId();
      }
      if (existing.isEmpty()) {
        Room claim = Room.placeholder(scopeKey, UlidCreator.getMonotonicUlid().toString(), clock.instant());
        RecordCollection.Stored<Room> stored = rooms.putIfAbsent(claim);
        if (stored.created() || stored.value().equals(claim)) {
          Optional<String> roomId = provision(claim);
          if (roomId.isPresent()) {
            return roomId.get();
          }
        }
        continue;
      }
      Room placeholder = existing.get();
      if (isStale(placeholder)) {
        Room takeover = Room.placeholder(scopeKey, UlidCreator.getMonotonicUlid().toString(), clock.instant());
        if (rooms.replace(placeholder, takeover)) {
          logger.warning("Taking over stale room placeholder for " + scopeKey);
          Optional<String> roomId = provision(takeover);
          if (roomId.isPresent()) {
            return roomId.get();
          }
        }
        continue;
      }
      pause(scopeKey, ++waits);
    }
  }

  private Optional<String> provision(Room claim) {
    String scopeKey = claim.scopeKey();
    String roomId;
    try {
      roomId = createWithRetry(scopeKey);
    } catch (CollaboratorException | RuntimeException e) {
      release(claim);
      logger.log(Level.SEVERE, "Room provisioning failed for " + scopeKey, e);
      throw new RoomProvisioningException(scopeKey, "Room provisioning failed for " + scopeKey, e);
    }
    if (rooms.replace(claim, claim.ready(roomId, clock.instant()))) {
      metrics.incrementRoomCreated();
      logger.info("Created room " + roomId + " for " + scopeKey);
      return Optional.of(roomId);
    }
    // our claim was taken over while the channel call was in flight
    logger.warning("Lost claim on " + scopeKey + "; channel room " + roomId + " is orphaned");
    return Optional.empty();
  }

  private String createWithRetry(String scopeKey) throws CollaboratorException {
    int attempt = 1;
    while (true) {
      try {
        String roomId = provisioner.createRoom(roomNamePrefix + ":" + scopeKey);
        if (roomId == null || roomId.isBlank()) {
          throw CollaboratorException.permanent("Channel returned no room id");
        }
        return roomId;
      } catch (CollaboratorException e) {
        if (!e.isTransient() || attempt >= maxProvisionAttempts) {
          throw e;
        }
        long delayMs = retryPolicy.computeDelayMs(attempt);
        logger.log(Level.WARNING, "Room creation for " + scopeKey + " failed (attempt "
            + attempt + "), retrying in " + delayMs + "ms", e);
        sleep(delayMs, scopeKey);
        attempt++;
      }
    }
  }

  private void release(Room claim) {
    try {
      if (rooms.get(claim.scopeKey()).filter(claim::equals).isPresent()) {
        rooms.delete(claim.scopeKey());
      }
    } catch (RuntimeException e) {
      // the placeholder expires through the provisioning timeout
      logger.log(Level.WARNING, "Could not release placeholder for " + claim.scopeKey(), e);
    }
  }

  private boolean isStale(Room placeholder) {
    return placeholder.state() == RoomState.PROVISIONING
        && placeholder.createdAt().plus(provisioningTimeout).isBefore(clock.instant());
  }

  private void pause(String scopeKey, int waits) {
    sleep(retryPolicy.computeDelayMs(waits), scopeKey);
  }

  private static void sleep(long delayMs, String scopeKey) {
    if (delayMs <= 0) {
      Thread.onSpinWait();
      return;
    }
    try {
      Thread.sleep(delayMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RoomProvisioningException(scopeKey, "Interrupted waiting for room " + scopeKey, e);
    }
  }

  private String scopeKeyOf(Agent agent) {
    if (policy == RoomPolicy.SHARED && agent.ownerId() != null) {
      return OWNER_SCOPE_PREFIX + agent.ownerId();
    }
    return AGENT_SCOPE_PREFIX + agent.agentId();
  }

  /** Builder for {@link RoomManager}. */
  public static final class Builder {
    private RecordStore store;
    private IdentityRegistry identityRegistry;
    private ChannelProvisioner provisioner;
    private RoomPolicy policy = RoomPolicy.DEDICATED;
    private Clock clock;
    private Duration provisioningTimeout = Duration.ofSeconds(30);
    private RetryPolicy retryPolicy;
    private int maxProvisionAttempts = 3;
    private String roomNamePrefix = "agenthub";
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
    public Builder provisioner(ChannelProvisioner provisioner) {
      this.provisioner = provisioner;
      return this;
    }

    /**
     * Optional. Defaults to {@link RoomPolicy#DEDICATED}.
     */
    public Builder policy(RoomPolicy policy) {
      this.policy = policy;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * How long a PROVISIONING placeholder is honoured before another caller may take
     * it over. Optional. Defaults to 30 seconds; keep it above the channel timeout.
     */
    public Builder provisioningTimeout(Duration provisioningTimeout) {
      this.provisioningTimeout = provisioningTimeout;
      return this;
    }

    /**
     * Backoff both for waiting on another caller's placeholder and between channel
     * retries. Optional. Defaults to 50ms doubling up to 1s.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder maxProvisionAttempts(int maxProvisionAttempts) {
      this.maxProvisionAttempts = maxProvisionAttempts;
      return this;
    }

    public Builder roomNamePrefix(String roomNamePrefix) {
      this.roomNamePrefix = roomNamePrefix;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public RoomManager build() {
      return new RoomManager(this);
    }
  }
}
