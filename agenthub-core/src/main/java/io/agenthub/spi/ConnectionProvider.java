package io.agenthub.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections to the relational record stores.
 *
 * <p>Callers are responsible for closing the returned connection. Implementations
 * backed by a pool must be safe for concurrent use.
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Obtains a connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
