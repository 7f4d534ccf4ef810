package io.agenthub.identity;

import io.agenthub.UnknownAgentException;
import io.agenthub.model.Presence;
import io.agenthub.spi.RecordStore;
import io.agenthub.store.Fields;
import io.agenthub.store.RecordCollection;
import io.agenthub.store.RecordMapper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Tracks which registered agents are online. An agent counts as online while its
 * last heartbeat is younger than the offline threshold.
 */
public final class PresenceTracker {
  public static final Duration DEFAULT_OFFLINE_THRESHOLD = Duration.ofSeconds(120);
  static final String PRESENCE = "presence";

  static final RecordMapper<Presence> MAPPER = new RecordMapper<>() {
    @Override
    public String keyOf(Presence presence) {
      return presence.agentId();
    }

    @Override
    public Map<String, Object> toRecord(Presence presence) {
      return Fields.record(
          "agentId", presence.agentId(),
          "status", presence.status(),
          "lastSeen", Fields.format(presence.lastSeen()));
    }

    @Override
    public Presence fromRecord(Map<String, Object> record) {
      return new Presence(
          Fields.string(record, "agentId"),
          Fields.string(record, "status"),
          Fields.instant(record, "lastSeen"));
    }
  };

  private final IdentityRegistry registry;
  private final RecordCollection<Presence> presence;
  private final Clock clock;
  private final Duration offlineThreshold;

  public PresenceTracker(IdentityRegistry registry, RecordStore store, Clock clock, Duration offlineThreshold) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.presence = new RecordCollection<>(store, PRESENCE, MAPPER);
    this.clock = Objects.requireNonNull(clock, "clock");
    this.offlineThreshold = Objects.requireNonNull(offlineThreshold, "offlineThreshold");
    if (offlineThreshold.isNegative() || offlineThreshold.isZero()) {
      throw new IllegalArgumentException("offlineThreshold must be positive");
    }
  }

  /**
   * Marks an already registered agent online.
   *
   * @throws UnknownAgentException if the agent is not registered or is revoked
   */
  public Presence online(String agentId, String status) {
    requireActive(agentId);
    Presence current = new Presence(agentId, status == null || status.isBlank() ? "online" : status,
        clock.instant());
    presence.put(current);
    return current;
  }

  /**
   * Refreshes the last-seen time, and the status when given.
   */
  public Presence heartbeat(String agentId, String status) {
    requireActive(agentId);
    Instant now = clock.instant();
    String newStatus = status != null ? status
        : presence.get(agentId).map(Presence::status).orElse("online");
    Presence current = new Presence(agentId, newStatus, now);
    presence.put(current);
    return current;
  }

  public Optional<Presence> find(String agentId) {
    return presence.get(agentId);
  }

  public boolean isOnline(String agentId) {
    return presence.get(agentId).map(p -> p.isOnline(clock.instant(), offlineThreshold)).orElse(false);
  }

  public List<String> onlineAgents() {
    Instant now = clock.instant();
    List<String> online = new ArrayList<>();
    for (Presence p : presence.query(p -> p.isOnline(now, offlineThreshold))) {
      online.add(p.agentId());
    }
    return online;
  }

  private void requireActive(String agentId) {
    if (registry.findActiveAgent(agentId).isEmpty()) {
      throw new UnknownAgentException(agentId);
    }
  }
}
