package io.agenthub.jdbc;

import io.agenthub.StorageUnavailableException;
import io.agenthub.jdbc.dialect.H2Dialect;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcRecordStoreTest {

    private final JdbcDataSource dataSource = newDataSource();

    private static JdbcDataSource newDataSource() {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:jdbc_store_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        return ds;
    }

    @Test
    void dialectIsDetectedFromConnection() {
        JdbcRecordStore store = JdbcRecordStore.builder().dataSource(dataSource).build();

        assertInstanceOf(H2Dialect.class, store.dialect());
        assertEquals("h2", store.name());
        assertEquals(TableNames.DEFAULT_TABLE, store.tableName());
    }

    @Test
    void builderRequiresConnectionSource() {
        assertThrows(NullPointerException.class, () -> JdbcRecordStore.builder().build());
    }

    @Test
    void builderRejectsUnsafeTableName() {
        assertThrows(IllegalArgumentException.class, () -> JdbcRecordStore.builder()
            .dataSource(dataSource)
            .dialect(new H2Dialect())
            .tableName("records; DROP TABLE x")
            .build());
    }

    @Test
    void createSchemaIsRepeatable() {
        JdbcRecordStore store = JdbcRecordStore.builder()
            .dataSource(dataSource)
            .tableName("hub_records")
            .createSchema(true)
            .build();

        store.createSchema();
        store.put("items", "k", Map.of("v", 1));

        assertEquals(1L, store.get("items", "k").orElseThrow().get("v"));
    }

    @Test
    void revisionAdvancesOnEveryWrite() throws SQLException {
        JdbcRecordStore store = JdbcRecordStore.builder().dataSource(dataSource).createSchema(true).build();

        store.putIfAbsent("items", "k", Map.of("v", 1));
        store.put("items", "k", Map.of("v", 2));
        store.replace("items", "k", Map.of("v", 2), Map.of("v", 3));

        assertEquals(3L, revisionOf("items", "k"));
    }

    @Test
    void missingTableSurfacesAsStorageUnavailable() {
        JdbcRecordStore store = JdbcRecordStore.builder().dataSource(dataSource).build();

        StorageUnavailableException ex = assertThrows(StorageUnavailableException.class,
            () -> store.get("items", "k"));
        assertInstanceOf(SQLException.class, ex.getCause());
        assertTrue(ex.isRetryable());
    }

    @Test
    void connectionFailureSurfacesAsStorageUnavailable() {
        JdbcRecordStore store = JdbcRecordStore.builder()
            .connectionProvider(() -> {
                throw new SQLException("pool exhausted");
            })
            .dialect(new H2Dialect())
            .build();

        assertThrows(StorageUnavailableException.class, () -> store.put("items", "k", Map.of()));
    }

    @Test
    void likeWildcardsInPrefixAreEscaped() {
        assertEquals("a!%b!_c!!", JdbcRecordStore.escapeLike("a%b_c!"));
        assertEquals("plain", JdbcRecordStore.escapeLike("plain"));
    }

    private long revisionOf(String collection, String key) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT revision FROM agenthub_record WHERE collection = '"
                 + collection + "' AND record_key = '" + key + "'")) {
            assertTrue(rs.next());
            return rs.getLong(1);
        }
    }
}
