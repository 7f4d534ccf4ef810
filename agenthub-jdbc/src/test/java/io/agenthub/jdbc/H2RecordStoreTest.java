package io.agenthub.jdbc;

import io.agenthub.spi.RecordStore;
import org.h2.jdbcx.JdbcDataSource;

import java.util.UUID;

class H2RecordStoreTest extends AbstractRecordStoreContractTest {

    @Override
    RecordStore newStore() {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:records_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        return JdbcRecordStore.builder()
            .dataSource(ds)
            .createSchema(true)
            .build();
    }
}
