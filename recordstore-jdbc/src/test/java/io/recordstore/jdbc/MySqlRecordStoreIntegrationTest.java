package io.recordstore.jdbc;

import io.recordstore.jdbc.store.AbstractJdbcRecordStore;
import io.recordstore.jdbc.store.MySqlRecordStore;
import org.junit.jupiter.api.BeforeAll;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;

@DockerAvailable
@Testcontainers
class MySqlRecordStoreIntegrationTest extends AbstractRecordStoreIntegrationTest {

    @Container
    static final MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
            .withDatabaseName("oidc_store_test")
            .withUrlParam("connectionTimeZone", "UTC");

    private static final MySqlRecordStore store = new MySqlRecordStore();
    private static DataSource dataSource;

    @BeforeAll
    static void createSchema() {
        dataSource = new DriverManagerDataSource(mysql.getJdbcUrl(), mysql.getUsername(), mysql.getPassword());
        RecordSchema.create(new DataSourceConnectionProvider(dataSource), store, REGISTRY);
        // idempotent on MySQL as well
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
