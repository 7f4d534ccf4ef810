package io.agenthub.identity;

import io.agenthub.model.Agent;
import io.agenthub.translate.IdentityResolver;
import io.agenthub.util.Ids;

import java.util.Objects;
import java.util.Optional;

/**
 * Resolves identities from registry metadata. Owners and agents carry their IM user
 * id under {@value #IM_USER_ID} and their channel user id under {@value #MATRIX_USER_ID}.
 * An agent id is also accepted as a native reference.
 */
public final class RegistryIdentityResolver implements IdentityResolver {
  public static final String IM_USER_ID = "im_user_id";
  public static final String MATRIX_USER_ID = "matrix_user_id";

  private final IdentityRegistry registry;

  public RegistryIdentityResolver(IdentityRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  @Override
  public Optional<String> toChannelId(String nativeId) {
    if (!Ids.isIdentity(nativeId)) {
      // mentions of any length reach here; ids that cannot be registered pass through
      return Optional.empty();
    }
    Optional<String> byAgentId = registry.findAgent(nativeId)
        .map(a -> a.metadata().get(MATRIX_USER_ID));
    if (byAgentId.isPresent()) {
      return byAgentId;
    }
    Optional<String> byAgent = registry.findAgentByMetadata(IM_USER_ID, nativeId)
        .map(a -> a.metadata().get(MATRIX_USER_ID));
    if (byAgent.isPresent()) {
      return byAgent;
    }
    return registry.findOwnerByMetadata(IM_USER_ID, nativeId)
        .map(o -> o.metadata().get(MATRIX_USER_ID));
  }

  @Override
  public Optional<String> toNativeId(String channelId) {
    if (channelId == null || channelId.isBlank()) {
      return Optional.empty();
    }
    Optional<Agent> agent = registry.findAgentByMetadata(MATRIX_USER_ID, channelId);
    if (agent.isPresent()) {
      String imUserId = agent.get().metadata().get(IM_USER_ID);
      return Optional.of(imUserId != null ? imUserId : agent.get().agentId());
    }
    return registry.findOwnerByMetadata(MATRIX_USER_ID, channelId)
        .map(o -> o.metadata().get(IM_USER_ID));
  }
}
