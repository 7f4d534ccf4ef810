package io.agenthub.spi;

import java.util.Map;
import java.util.Optional;

/**
 * Client of the chain-registration service that issues decentralized identifiers.
 */
public interface ChainRegistrar {

    /**
     * Registers an agent on chain.
     *
     * @param agentId the agent id
     * @param ownerId the bound owner, may be {@code null}
     * @return the issued DID
     * @throws CollaboratorException if registration failed
     */
    String registerDid(String agentId, String ownerId) throws CollaboratorException;

    /**
     * Looks up a DID document.
     *
     * @param did the identifier
     * @return the document fields, empty if the service does not know the DID
     * @throws CollaboratorException if the lookup failed
     */
    Optional<Map<String, Object>> lookupDid(String did) throws CollaboratorException;
}
