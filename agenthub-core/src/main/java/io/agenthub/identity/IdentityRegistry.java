package io.agenthub.identity;

import com.github.f4b6a3.ulid.UlidCreator;
import io.agenthub.CycleDetectedException;
import io.agenthub.DuplicateAgentException;
import io.agenthub.IdentityConflictException;
import io.agenthub.InvalidPairingCodeException;
import io.agenthub.UnknownAgentException;
import io.agenthub.UnknownOwnerException;
import io.agenthub.model.Agent;
import io.agenthub.model.AgentStatus;
import io.agenthub.model.BindingChange;
import io.agenthub.model.Owner;
import io.agenthub.model.PairingCode;
import io.agenthub.model.RelationshipEdge;
import io.agenthub.spi.ChainRegistrar;
import io.agenthub.spi.CollaboratorException;
import io.agenthub.spi.MetricsExporter;
import io.agenthub.spi.PermissionInitializer;
import io.agenthub.spi.RecordStore;
import io.agenthub.store.Fields;
import io.agenthub.store.RecordCollection;
import io.agenthub.store.RecordMapper;
import io.agenthub.util.DaemonThreadFactory;
import io.agenthub.util.ExponentialBackoffRetryPolicy;
import io.agenthub.util.Ids;
import io.agenthub.util.RetryPolicy;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Registry of owners, agents, owner bindings and agent-to-agent relationships.
 *
 * <p>All state lives in the {@link RecordStore}. Creation races are settled by
 * {@code putIfAbsent}; updates are compare-and-set loops over {@code replace}, so the
 * registry holds no locks and several instances may share one store.
 *
 * <p>Chain registration and permission initialization run on a background scheduler
 * and never block the registering caller. Their results land in the store.
 */
public final class IdentityRegistry implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(IdentityRegistry.class.getName());

  static final String OWNERS = "owners";
  static final String AGENTS = "agents";
  static final String BINDING_CHANGES = "binding_changes";
  static final String EDGES = "agent_edges";
  static final String PAIRING_CODES = "pairing_codes";

  static final int PAIRING_CODE_LENGTH = 6;
  private static final String PAIRING_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

  static final RecordMapper<Owner> OWNER_MAPPER = new RecordMapper<>() {
    @Override
    public String keyOf(Owner owner) {
      return owner.ownerId();
    }

    @Override
    public Map<String, Object> toRecord(Owner owner) {
      return Fields.record(
          "ownerId", owner.ownerId(),
          "metadata", owner.metadata(),
          "createdAt", Fields.format(owner.createdAt()));
    }

    @Override
    public Owner fromRecord(Map<String, Object> record) {
      return new Owner(
          Fields.string(record, "ownerId"),
          Fields.stringMap(record, "metadata"),
          Fields.instant(record, "createdAt"));
    }
  };

  static final RecordMapper<Agent> AGENT_MAPPER = new RecordMapper<>() {
    @Override
    public String keyOf(Agent agent) {
      return agent.agentId();
    }

    @Override
    public Map<String, Object> toRecord(Agent agent) {
      return Fields.record(
          "agentId", agent.agentId(),
          "ownerId", agent.ownerId(),
          "did", agent.did(),
          "status", agent.status().name(),
          "metadata", agent.metadata(),
          "createdAt", Fields.format(agent.createdAt()),
          "updatedAt", Fields.format(agent.updatedAt()));
    }

    @Override
    public Agent fromRecord(Map<String, Object> record) {
      return new Agent(
          Fields.string(record, "agentId"),
          Fields.optionalString(record, "ownerId"),
          Fields.optionalString(record, "did"),
          Fields.enumValue(record, "status", AgentStatus.class),
          Fields.stringMap(record, "metadata"),
          Fields.instant(record, "createdAt"),
          Fields.instant(record, "updatedAt"));
    }
  };

  static final RecordMapper<BindingChange> BINDING_CHANGE_MAPPER = new RecordMapper<>() {
    @Override
    public String keyOf(BindingChange change) {
      throw new UnsupportedOperationException("binding changes are keyed on write");
    }

    @Override
    public Map<String, Object> toRecord(BindingChange change) {
      return Fields.record(
          "agentId", change.agentId(),
          "fromOwner", change.fromOwner(),
          "toOwner", change.toOwner(),
          "at", Fields.format(change.at()));
    }

    @Override
    public BindingChange fromRecord(Map<String, Object> record) {
      return new BindingChange(
          Fields.string(record, "agentId"),
          Fields.optionalString(record, "fromOwner"),
          Fields.optionalString(record, "toOwner"),
          Fields.instant(record, "at"));
    }
  };

  static final RecordMapper<RelationshipEdge> EDGE_MAPPER = new RecordMapper<>() {
    @Override
    public String keyOf(RelationshipEdge edge) {
      // length prefix keeps keys unambiguous whatever characters the ids contain
      return edge.parentAgentId().length() + ":" + edge.parentAgentId() + "/" + edge.childAgentId();
    }

    @Override
    public Map<String, Object> toRecord(RelationshipEdge edge) {
      return Fields.record(
          "parentAgentId", edge.parentAgentId(),
          "childAgentId", edge.childAgentId(),
          "createdAt", Fields.format(edge.createdAt()));
    }

    @Override
    public RelationshipEdge fromRecord(Map<String, Object> record) {
      return new RelationshipEdge(
          Fields.string(record, "parentAgentId"),
          Fields.string(record, "childAgentId"),
          Fields.instant(record, "createdAt"));
    }
  };

  static final RecordMapper<PairingCode> PAIRING_MAPPER = new RecordMapper<>() {
    @Override
    public String keyOf(PairingCode pairing) {
      return pairing.code();
    }

    @Override
    public Map<String, Object> toRecord(PairingCode pairing) {
      return Fields.record(
          "code", pairing.code(),
          "ownerId", pairing.ownerId(),
          "agentDisplayName", pairing.agentDisplayName(),
          "createdAt", Fields.format(pairing.createdAt()),
          "expiresAt", Fields.format(pairing.expiresAt()));
    }

    @Override
    public PairingCode fromRecord(Map<String, Object> record) {
      return new PairingCode(
          Fields.string(record, "code"),
          Fields.string(record, "ownerId"),
          Fields.optionalString(record, "agentDisplayName"),
          Fields.instant(record, "createdAt"),
          Fields.instant(record, "expiresAt"));
    }
  };

  private final RecordStore store;
  private final RecordCollection<Owner> owners;
  private final RecordCollection<Agent> agents;
  private final RecordCollection<RelationshipEdge> edges;
  private final RecordCollection<PairingCode> pairingCodes;
  private final SecureRandom random = new SecureRandom();
  private final Clock clock;
  private final ChainRegistrar chainRegistrar;
  private final PermissionInitializer permissionInitializer;
  private final RetryPolicy didRetryPolicy;
  private final int maxDidAttempts;
  private final MetricsExporter metrics;
  private final ScheduledExecutorService scheduler;
  private final boolean ownsScheduler;

  private IdentityRegistry(Builder builder) {
    this.store = Objects.requireNonNull(builder.store, "store");
    this.owners = new RecordCollection<>(store, OWNERS, OWNER_MAPPER);
    this.agents = new RecordCollection<>(store, AGENTS, AGENT_MAPPER);
    this.edges = new RecordCollection<>(store, EDGES, EDGE_MAPPER);
    this.pairingCodes = new RecordCollection<>(store, PAIRING_CODES, PAIRING_MAPPER);
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.chainRegistrar = builder.chainRegistrar;
    this.permissionInitializer = builder.permissionInitializer != null
        ? builder.permissionInitializer : PermissionInitializer.NOOP;
    this.didRetryPolicy = builder.didRetryPolicy != null
        ? builder.didRetryPolicy : new ExponentialBackoffRetryPolicy(500, 60_000);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.maxDidAttempts < 1) {
      throw new IllegalArgumentException("maxDidAttempts must be >= 1");
    }
    this.maxDidAttempts = builder.maxDidAttempts;
    if (builder.scheduler != null) {
      this.scheduler = builder.scheduler;
      this.ownsScheduler = false;
    } else {
      this.scheduler = Executors.newSingleThreadScheduledExecutor(
          new DaemonThreadFactory("agenthub-identity-"));
      this.ownsScheduler = true;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  // ---- owners ----

  /**
   * Registers an owner. Repeating the call with identical metadata returns the
   * existing owner.
   *
   * @throws IdentityConflictException if the owner exists with different metadata
   */
  public Owner registerOwner(String ownerId, Map<String, String> metadata) {
    Ids.requireIdentity(ownerId, "ownerId");
    Owner candidate = new Owner(ownerId, metadata, clock.instant());
    RecordCollection.Stored<Owner> stored = owners.putIfAbsent(candidate);
    if (!stored.created() && !stored.value().metadata().equals(candidate.metadata())) {
      throw new IdentityConflictException(ownerId);
    }
    return stored.value();
  }

  /**
   * Ids too long to have been registered are reported missing.
   */
  public Optional<Owner> findOwner(String ownerId) {
    Ids.require(ownerId, "ownerId");
    return Ids.isIdentity(ownerId) ? owners.get(ownerId) : Optional.empty();
  }

  /**
   * Finds the owner carrying {@code key=value} in its metadata, e.g. an IM user id.
   */
  public Optional<Owner> findOwnerByMetadata(String key, String value) {
    return owners.query(o -> value.equals(o.metadata().get(key))).stream().findFirst();
  }

  // ---- agents ----

  /**
   * Registers an unbound agent on behalf of a human. The agent is ACTIVE on return;
   * chain registration and permission initialization follow in the background.
   *
   * @throws IllegalArgumentException if the initiator is not {@link Initiator#HUMAN}
   * @throws DuplicateAgentException if the agent id is taken
   */
  public Agent registerAgent(Initiator initiator, String agentId, Map<String, String> metadata) {
    return registerAgent(initiator, agentId, null, metadata);
  }

  /**
   * Registers an agent already bound to {@code ownerId}.
   *
   * @throws UnknownOwnerException if {@code ownerId} is given but not registered
   */
  public Agent registerAgent(Initiator initiator, String agentId, String ownerId,
      Map<String, String> metadata) {
    if (initiator != Initiator.HUMAN) {
      throw new IllegalArgumentException("Agents can only be registered by a human, got: " + initiator);
    }
    Agent agent = create(agentId, ownerId, AgentStatus.ACTIVE, metadata);
    onActivated(agent);
    return agent;
  }

  /**
   * Reserves an agent id awaiting human confirmation. The agent stays PENDING until
   * {@link #activate(String)}.
   */
  public Agent reserveAgent(String agentId, Map<String, String> metadata) {
    return create(agentId, null, AgentStatus.PENDING, metadata);
  }

  /**
   * Confirms a PENDING agent. Activating an ACTIVE agent is a no-op.
   *
   * @throws UnknownAgentException if the agent does not exist or is revoked
   */
  public Agent activate(String agentId) {
    Agent before = requireAgent(agentId);
    if (before.status() == AgentStatus.REVOKED) {
      throw new UnknownAgentException(agentId, "Agent is revoked: " + agentId);
    }
    Agent after = update(agentId, agent -> agent.status() == AgentStatus.PENDING
        ? agent.withStatus(AgentStatus.ACTIVE, clock.instant()) : agent);
    if (before.status() == AgentStatus.PENDING) {
      onActivated(after);
    }
    return after;
  }

  /**
   * Revokes an agent permanently. Its records are kept.
   */
  public Agent revoke(String agentId) {
    Agent revoked = update(agentId, agent -> agent.status() == AgentStatus.REVOKED
        ? agent : agent.withStatus(AgentStatus.REVOKED, clock.instant()));
    logger.info("Agent revoked: " + agentId);
    return revoked;
  }

  /**
   * Ids too long to have been registered are reported missing.
   */
  public Optional<Agent> findAgent(String agentId) {
    Ids.require(agentId, "agentId");
    return Ids.isIdentity(agentId) ? agents.get(agentId) : Optional.empty();
  }

  /**
   * Returns the agent if it exists and is not revoked.
   */
  public Optional<Agent> findActiveAgent(String agentId) {
    return findAgent(agentId).filter(a -> a.status() != AgentStatus.REVOKED);
  }

  public Agent requireAgent(String agentId) {
    return findAgent(agentId).orElseThrow(() -> new UnknownAgentException(agentId));
  }

  /**
   * Finds the agent carrying {@code key=value} in its metadata.
   */
  public Optional<Agent> findAgentByMetadata(String key, String value) {
    return agents.query(a -> value.equals(a.metadata().get(key))).stream().findFirst();
  }

  public List<Agent> agents() {
    return agents.all();
  }

  // ---- pairing ----

  /**
   * Issues a single-use code a human hands to an agent so it can register itself
   * already bound to {@code ownerId}.
   *
   * @param ttl how long the code stays valid, must be positive
   * @throws UnknownOwnerException if the owner does not exist
   */
  public PairingCode createPairingCode(String ownerId, Duration ttl) {
    return createPairingCode(ownerId, ttl, null);
  }

  /**
   * @param agentDisplayName optional, shown to the human while confirming
   */
  public PairingCode createPairingCode(String ownerId, Duration ttl, String agentDisplayName) {
    Objects.requireNonNull(ttl, "ttl");
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
    if (findOwner(ownerId).isEmpty()) {
      throw new UnknownOwnerException(ownerId);
    }
    Instant now = clock.instant();
    while (true) {
      PairingCode candidate = new PairingCode(newPairingCode(), ownerId, agentDisplayName, now, now.plus(ttl));
      if (pairingCodes.putIfAbsent(candidate).created()) {
        logger.fine(() -> "Pairing code issued for ownerId=" + ownerId + ", expires " + candidate.expiresAt());
        return candidate;
      }
    }
  }

  /**
   * Looks up a pending code. Expired codes are still returned until purged or submitted.
   */
  public Optional<PairingCode> findPairingCode(String code) {
    String normalized = normalizePairingCode(code);
    return normalized == null ? Optional.empty() : pairingCodes.get(normalized);
  }

  public Agent submitPairingCode(String code, String agentId) {
    return submitPairingCode(code, agentId, Map.of());
  }

  /**
   * Consumes a pairing code and registers {@code agentId} ACTIVE and bound to the
   * code's owner. The code is matched ignoring case and surrounding blanks. Each code
   * registers at most one agent; a code whose registration fails is put back.
   *
   * @throws InvalidPairingCodeException if the code is unknown, already used or expired
   * @throws DuplicateAgentException if the agent id is taken
   */
  public Agent submitPairingCode(String code, String agentId, Map<String, String> metadata) {
    Ids.requireIdentity(agentId, "agentId");
    String normalized = normalizePairingCode(code);
    if (normalized == null) {
      throw new InvalidPairingCodeException(String.valueOf(code), false);
    }
    PairingCode pairing = pairingCodes.get(normalized)
        .orElseThrow(() -> new InvalidPairingCodeException(normalized, false));
    if (pairing.isExpired(clock.instant())) {
      pairingCodes.delete(normalized);
      throw new InvalidPairingCodeException(normalized, true);
    }
    if (!pairingCodes.delete(normalized)) {
      throw new InvalidPairingCodeException(normalized, false);
    }
    Agent agent;
    try {
      agent = create(agentId, pairing.ownerId(), AgentStatus.ACTIVE, metadata);
    } catch (RuntimeException e) {
      pairingCodes.putIfAbsent(pairing);
      throw e;
    }
    logger.info("Agent " + agentId + " paired with ownerId=" + pairing.ownerId());
    onActivated(agent);
    return agent;
  }

  /**
   * Deletes every code past its expiry.
   *
   * @return the number of codes removed
   */
  public int purgeExpiredPairingCodes() {
    Instant now = clock.instant();
    int removed = 0;
    for (PairingCode pairing : pairingCodes.query(p -> p.isExpired(now))) {
      if (pairingCodes.delete(pairing.code())) {
        removed++;
      }
    }
    return removed;
  }

  // ---- bindings ----

  /**
   * Binds an agent to an owner, replacing any previous binding.
   *
   * @throws UnknownOwnerException if the owner does not exist
   * @throws UnknownAgentException if the agent does not exist or is revoked
   */
  public Agent bind(String ownerId, String agentId) {
    if (findOwner(ownerId).isEmpty()) {
      throw new UnknownOwnerException(ownerId);
    }
    return rebind(agentId, ownerId);
  }

  /**
   * Clears the agent's owner. Unbinding an unbound agent is a no-op.
   */
  public Agent unbind(String agentId) {
    return rebind(agentId, null);
  }

  public List<Agent> agentsOf(String ownerId) {
    Ids.require(ownerId, "ownerId");
    return agents.query(a -> ownerId.equals(a.ownerId()));
  }

  public Optional<Owner> ownerOf(String agentId) {
    Agent agent = requireAgent(agentId);
    return agent.ownerId() == null ? Optional.empty() : owners.get(agent.ownerId());
  }

  /**
   * Ownership history of an agent, oldest first.
   */
  public List<BindingChange> bindingHistory(String agentId) {
    Ids.require(agentId, "agentId");
    List<BindingChange> history = new ArrayList<>();
    for (Map<String, Object> record : store.query(BINDING_CHANGES,
        r -> agentId.equals(r.get("agentId")))) {
      history.add(BINDING_CHANGE_MAPPER.fromRecord(record));
    }
    history.sort(Comparator.comparing(BindingChange::at));
    return history;
  }

  // ---- relationships ----

  /**
   * Records that {@code parentAgentId} delegates to {@code childAgentId}. Registering an
   * existing edge again is a no-op.
   *
   * @throws UnknownAgentException if either agent does not exist
   * @throws CycleDetectedException if the edge would close a cycle
   */
  public RelationshipEdge registerSubAgent(String parentAgentId, String childAgentId) {
    requireAgent(parentAgentId);
    requireAgent(childAgentId);
    if (parentAgentId.equals(childAgentId) || reachable(childAgentId, parentAgentId)) {
      throw new CycleDetectedException(parentAgentId, childAgentId);
    }
    RelationshipEdge edge = new RelationshipEdge(parentAgentId, childAgentId, clock.instant());
    RecordCollection.Stored<RelationshipEdge> stored = edges.putIfAbsent(edge);
    if (stored.created() && reachable(childAgentId, parentAgentId)) {
      // a concurrent edge closed the loop between our check and insert
      edges.delete(EDGE_MAPPER.keyOf(edge));
      throw new CycleDetectedException(parentAgentId, childAgentId);
    }
    return stored.value();
  }

  public List<String> childrenOf(String agentId) {
    Ids.require(agentId, "agentId");
    List<String> children = new ArrayList<>();
    for (RelationshipEdge edge : edges.query(e -> agentId.equals(e.parentAgentId()))) {
      children.add(edge.childAgentId());
    }
    return children;
  }

  public List<String> parentsOf(String agentId) {
    Ids.require(agentId, "agentId");
    List<String> parents = new ArrayList<>();
    for (RelationshipEdge edge : edges.query(e -> agentId.equals(e.childAgentId()))) {
      parents.add(edge.parentAgentId());
    }
    return parents;
  }

  /**
   * Breadth-first summary of every agent reachable from {@code rootAgentId}.
   */
  public ChainSummary chainSummary(String rootAgentId) {
    requireAgent(rootAgentId);
    Map<String, List<RelationshipEdge>> byParent = edgesByParent();
    List<String> members = new ArrayList<>();
    List<RelationshipEdge> traversed = new ArrayList<>();
    Set<String> visited = new HashSet<>();
    visited.add(rootAgentId);
    Deque<String> frontier = new ArrayDeque<>();
    frontier.add(rootAgentId);
    int depth = 0;
    while (!frontier.isEmpty()) {
      Deque<String> next = new ArrayDeque<>();
      for (String current : frontier) {
        for (RelationshipEdge edge : byParent.getOrDefault(current, List.of())) {
          traversed.add(edge);
          if (visited.add(edge.childAgentId())) {
            members.add(edge.childAgentId());
            next.add(edge.childAgentId());
          }
        }
      }
      if (!next.isEmpty()) {
        depth++;
      }
      frontier = next;
    }
    return new ChainSummary(rootAgentId, members, traversed, depth);
  }

  public AgentRelationships relationships(String agentId) {
    Agent agent = requireAgent(agentId);
    return new AgentRelationships(agentId, agent.ownerId(), parentsOf(agentId),
        childrenOf(agentId), chainSummary(agentId));
  }

  // ---- chain identifiers ----

  /**
   * Registers the agent with the chain service in the background and stores the
   * returned DID. Transient failures are retried with backoff up to the configured
   * number of attempts; after that the DID stays unset.
   *
   * @return completes with the stored DID, or empty if registration was abandoned
   * @throws UnknownAgentException if the agent does not exist
   */
  public CompletableFuture<Optional<String>> refreshDid(String agentId) {
    Agent agent = requireAgent(agentId);
    CompletableFuture<Optional<String>> result = new CompletableFuture<>();
    if (chainRegistrar == null) {
      result.complete(Optional.ofNullable(agent.did()));
      return result;
    }
    scheduler.execute(() -> attemptDid(agentId, 1, result));
    return result;
  }

  private void attemptDid(String agentId, int attempt, CompletableFuture<Optional<String>> result) {
    try {
      Agent agent = requireAgent(agentId);
      if (agent.did() != null) {
        result.complete(Optional.of(agent.did()));
        return;
      }
      String did = chainRegistrar.registerDid(agentId, agent.ownerId());
      Agent updated = update(agentId, a -> a.did() != null ? a : a.withDid(did, clock.instant()));
      metrics.incrementDidRegistered();
      result.complete(Optional.ofNullable(updated.did()));
    } catch (CollaboratorException e) {
      if (e.isTransient() && attempt < maxDidAttempts) {
        long delayMs = didRetryPolicy.computeDelayMs(attempt);
        logger.log(Level.WARNING, "DID registration failed for agentId=" + agentId
            + " (attempt " + attempt + "), retrying in " + delayMs + "ms", e);
        scheduler.schedule(() -> attemptDid(agentId, attempt + 1, result), delayMs, TimeUnit.MILLISECONDS);
        return;
      }
      metrics.incrementDidFailed();
      logger.log(Level.SEVERE, "DID registration abandoned for agentId=" + agentId
          + " after " + attempt + " attempts", e);
      result.complete(Optional.empty());
    } catch (RuntimeException e) {
      metrics.incrementDidFailed();
      logger.log(Level.SEVERE, "DID registration failed for agentId=" + agentId, e);
      result.completeExceptionally(e);
    }
  }

  // ---- internals ----

  private Agent create(String agentId, String ownerId, AgentStatus status, Map<String, String> metadata) {
    Ids.requireIdentity(agentId, "agentId");
    if (ownerId != null && findOwner(ownerId).isEmpty()) {
      throw new UnknownOwnerException(ownerId);
    }
    Instant now = clock.instant();
    Agent agent = new Agent(agentId, ownerId, null, status, metadata, now, now);
    RecordCollection.Stored<Agent> stored = agents.putIfAbsent(agent);
    // a retried insert that had already landed reads back our own record
    if (!stored.created() && !stored.value().equals(agent)) {
      throw new DuplicateAgentException(agentId);
    }
    if (ownerId != null) {
      appendBindingChange(newBindingChangeKey(), agentId, null, ownerId, now);
    }
    return stored.value();
  }

  private void onActivated(Agent agent) {
    refreshDid(agent.agentId());
    scheduler.execute(() -> {
      try {
        permissionInitializer.agentRegistered(agent.agentId(), agent.ownerId());
      } catch (CollaboratorException | RuntimeException e) {
        logger.log(Level.WARNING, "Permission initialization failed for agentId=" + agent.agentId(), e);
      }
    });
  }

  private Agent rebind(String agentId, String ownerId) {
    Ids.require(agentId, "agentId");
    while (true) {
      Agent current = requireAgent(agentId);
      if (current.status() == AgentStatus.REVOKED) {
        throw new UnknownAgentException(agentId, "Agent is revoked: " + agentId);
      }
      if (Objects.equals(current.ownerId(), ownerId)) {
        return current;
      }
      Instant now = clock.instant();
      Agent next = current.withOwner(ownerId, now);
      String changeKey = newBindingChangeKey();
      if (agents.replace(current, next)) {
        appendBindingChange(changeKey, agentId, current.ownerId(), ownerId, now);
        logger.fine(() -> "Agent " + agentId + " bound " + current.ownerId() + " -> " + ownerId);
        return next;
      }
    }
  }

  private Agent update(String agentId, UnaryOperator<Agent> change) {
    while (true) {
      Agent current = requireAgent(agentId);
      Agent next = change.apply(current);
      if (next.equals(current) || agents.replace(current, next)) {
        return next;
      }
    }
  }

  private String newPairingCode() {
    char[] code = new char[PAIRING_CODE_LENGTH];
    for (int i = 0; i < code.length; i++) {
      code[i] = PAIRING_ALPHABET.charAt(random.nextInt(PAIRING_ALPHABET.length()));
    }
    return new String(code);
  }

  private static String normalizePairingCode(String code) {
    if (code == null) {
      return null;
    }
    String normalized = code.trim().toUpperCase(Locale.ROOT);
    if (normalized.length() != PAIRING_CODE_LENGTH) {
      return null;
    }
    for (int i = 0; i < normalized.length(); i++) {
      if (PAIRING_ALPHABET.indexOf(normalized.charAt(i)) < 0) {
        return null;
      }
    }
    return normalized;
  }

  // monotonic ids keep same-instant changes in write order
  private static String newBindingChangeKey() {
    return UlidCreator.getMonotonicUlid().toString();
  }

  private void appendBindingChange(String key, String agentId, String fromOwner, String toOwner,
      Instant at) {
    BindingChange change = new BindingChange(agentId, fromOwner, toOwner, at);
    store.put(BINDING_CHANGES, key, BINDING_CHANGE_MAPPER.toRecord(change));
  }

  private boolean reachable(String from, String target) {
    Map<String, List<RelationshipEdge>> byParent = edgesByParent();
    Set<String> visited = new HashSet<>();
    Deque<String> queue = new ArrayDeque<>();
    queue.add(from);
    while (!queue.isEmpty()) {
      String current = queue.poll();
      if (current.equals(target)) {
        return true;
      }
      if (visited.add(current)) {
        for (RelationshipEdge edge : byParent.getOrDefault(current, List.of())) {
          queue.add(edge.childAgentId());
        }
      }
    }
    return false;
  }

  private Map<String, List<RelationshipEdge>> edgesByParent() {
    Map<String, List<RelationshipEdge>> byParent = new HashMap<>();
    for (RelationshipEdge edge : edges.all()) {
      byParent.computeIfAbsent(edge.parentAgentId(), k -> new ArrayList<>()).add(edge);
    }
    return byParent;
  }

  /**
   * Stops the background scheduler if this registry created it. Pending DID retries
   * are abandoned; the DID stays unset and can be refreshed again later.
   */
  @Override
  public void close() {
    if (!ownsScheduler) {
      return;
    }
    scheduler.shutdown();
    try {
      if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
        scheduler.shutdownNow();
      }
    } catch (InterruptedException e) {
      scheduler.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link IdentityRegistry}. */
  public static final class Builder {
    private RecordStore store;
    private Clock clock;
    private ChainRegistrar chainRegistrar;
    private PermissionInitializer permissionInitializer;
    private RetryPolicy didRetryPolicy;
    private int maxDidAttempts = 5;
    private MetricsExporter metrics;
    private ScheduledExecutorService scheduler;

    private Builder() {}

    /**
     * <b>Required.</b>
     */
    public Builder store(RecordStore store) {
      this.store = store;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Optional. Without a registrar, agents never receive a DID.
     */
    public Builder chainRegistrar(ChainRegistrar chainRegistrar) {
      this.chainRegistrar = chainRegistrar;
      return this;
    }

    public Builder permissionInitializer(PermissionInitializer permissionInitializer) {
      this.permissionInitializer = permissionInitializer;
      return this;
    }

    /**
     * Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with
     * {@code baseDelayMs=500} and {@code maxDelayMs=60000}.
     */
    public Builder didRetryPolicy(RetryPolicy didRetryPolicy) {
      this.didRetryPolicy = didRetryPolicy;
      return this;
    }

    /**
     * Optional. Defaults to {@code 5}. Must be &ge; 1.
     */
    public Builder maxDidAttempts(int maxDidAttempts) {
      this.maxDidAttempts = maxDidAttempts;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Optional. Runs DID registration and permission initialization. When absent
     * the registry creates a single daemon thread and shuts it down on close.
     */
    public Builder scheduler(ScheduledExecutorService scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    public IdentityRegistry build() {
      return new IdentityRegistry(this);
    }
  }
}
