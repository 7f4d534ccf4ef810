/**
 * Service provider interfaces of the JDBC record store.
 */
package io.agenthub.jdbc.spi;
