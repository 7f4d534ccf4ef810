/**
 * AgentHub: a message and identity hub between an enterprise IM platform and Matrix.
 *
 * <p>{@link io.agenthub.AgentHub} wires the components; the unchecked
 * {@link io.agenthub.AgentHubException} hierarchy is what callers catch.
 */
package io.agenthub;
