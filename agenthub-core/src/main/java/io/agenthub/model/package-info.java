/**
 * Immutable domain records persisted through the record store, plus the transient
 * {@link io.agenthub.model.AuditEvent}.
 */
package io.agenthub.model;
