package io.agenthub.jdbc;

import io.agenthub.spi.RecordStore;
import org.junit.jupiter.api.BeforeAll;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.sql.Statement;

@DockerAvailable
@Testcontainers
class MySqlHubScenarioIntegrationTest extends AbstractHubScenarioTest {

    @Container
    static final MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
        .withDatabaseName("agenthub_scenarios");

    private static SimpleDataSource dataSource;

    @BeforeAll
    static void initDataSource() {
        dataSource = new SimpleDataSource(mysql.getJdbcUrl(), mysql.getUsername(), mysql.getPassword());
    }

    @Override
    RecordStore newStore() throws Exception {
        JdbcRecordStore store = JdbcRecordStore.builder()
            .dataSource(dataSource)
            .createSchema(true)
            .build();
        try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
            st.execute("TRUNCATE TABLE " + store.tableName());
        }
        return store;
    }
}
