package io.agenthub.jdbc;

import io.agenthub.spi.RecordStore;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

class H2FileHubScenarioTest extends AbstractHubScenarioTest {

    @TempDir
    Path dir;

    @Override
    RecordStore newStore() {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:file:" + dir.resolve("scenarios").toAbsolutePath());
        return JdbcRecordStore.builder()
            .dataSource(ds)
            .createSchema(true)
            .build();
    }
}
