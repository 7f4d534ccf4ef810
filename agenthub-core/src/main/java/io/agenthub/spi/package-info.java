/**
 * Service provider interfaces: the record store every component persists through,
 * and the external collaborators the hub calls (channel provisioning and sending,
 * chain registration, audit reporting, permission initialization, metrics).
 *
 * <p>Core ships {@link io.agenthub.store.InMemoryRecordStore} and HTTP clients in
 * {@link io.agenthub.http}; relational stores live in the {@code agenthub-jdbc} module.
 */
package io.agenthub.spi;
