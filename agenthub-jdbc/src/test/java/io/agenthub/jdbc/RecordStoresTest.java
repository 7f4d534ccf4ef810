package io.agenthub.jdbc;

import io.agenthub.StorageUnavailableException;
import io.agenthub.spi.RecordStore;
import io.agenthub.store.InMemoryRecordStore;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RecordStoresTest {

    @TempDir
    Path dir;

    @Test
    void memoryOpensInMemoryStore() {
        assertInstanceOf(InMemoryRecordStore.class, RecordStores.open(new StorageSettings.Memory()));
    }

    @Test
    void embeddedFileOpensH2FileStore() {
        StorageSettings.EmbeddedFile settings = new StorageSettings.EmbeddedFile(dir.resolve("hub"));
        RecordStore store = RecordStores.open(settings);
        store.put("owners", "O1", Map.of("owner_id", "O1"));

        RecordStore reopened = RecordStores.open(settings);

        assertEquals("h2", reopened.name());
        assertEquals("O1", reopened.get("owners", "O1").orElseThrow().get("owner_id"));
    }

    @Test
    void relationalVariantUsesItsOwnDialect() {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:stores_" + System.nanoTime() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");

        JdbcRecordStore store = assertInstanceOf(JdbcRecordStore.class,
            RecordStores.open(new StorageSettings.Postgres(ds), "hub_records"));

        assertEquals("postgresql", store.name());
        assertEquals("hub_records", store.tableName());
    }

    @Test
    void unreachableDatabaseFailsInsteadOfFallingBack() {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:file:" + dir.resolve("missing").toAbsolutePath() + ";IFEXISTS=TRUE");

        assertThrows(StorageUnavailableException.class,
            () -> RecordStores.open(new StorageSettings.MySql(ds)));
    }
}
