package io.agenthub.spi;

/**
 * Notifies the audit service that an agent finished registration so it can grant
 * the owner's default permissions.
 */
@FunctionalInterface
public interface PermissionInitializer {

    PermissionInitializer NOOP = (agentId, ownerId) -> { };

    void agentRegistered(String agentId, String ownerId) throws CollaboratorException;
}
