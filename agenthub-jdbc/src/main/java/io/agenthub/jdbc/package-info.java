/**
 * Relational record stores.
 *
 * <p>{@link io.agenthub.jdbc.JdbcRecordStore} keeps every collection in one table keyed by
 * {@code (collection, record_key)}. The SQL that differs between databases lives in
 * {@link io.agenthub.jdbc.spi.Dialect} implementations, discovered with
 * {@link java.util.ServiceLoader}. Built in: H2 (in-memory and file), MySQL, PostgreSQL.
 */
package io.agenthub.jdbc;
