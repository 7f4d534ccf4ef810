/**
 * Owners, agents, bindings, relationship chains and presence.
 */
package io.agenthub.identity;
