package io.recordstore.jdbc;

import io.recordstore.jdbc.store.AbstractJdbcRecordStore;
import io.recordstore.jdbc.store.PostgresRecordStore;
import org.junit.jupiter.api.BeforeAll;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;

@DockerAvailable
@Testcontainers
class PostgresRecordStoreIntegrationTest extends AbstractRecordStoreIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("oidc_store_test");

    private static final PostgresRecordStore store = new PostgresRecordStore();
    private static DataSource dataSource;

    @BeforeAll
    static void createSchema() {
        dataSource = new DriverManagerDataSource(
                postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        RecordSchema.create(new DataSourceConnectionProvider(dataSource), store, REGISTRY);
    }

    @Override
    DataSource dataSource() {
        return dataSource;
    }

    @Override
    AbstractJdbcRecordStore store() {
        return store;
    }
}
