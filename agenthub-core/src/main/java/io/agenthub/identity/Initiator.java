package io.agenthub.identity;

/**
 * Who started an agent registration.
 */
public enum Initiator {
  /** An owner registering an agent through a trusted surface. */
  HUMAN,
  /** An agent registering itself. Not accepted by {@link IdentityRegistry#registerAgent}. */
  AGENT
}
