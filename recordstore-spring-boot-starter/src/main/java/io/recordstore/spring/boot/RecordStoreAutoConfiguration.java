package io.recordstore.spring.boot;

import io.recordstore.RecordStorage;
import io.recordstore.jdbc.DataSourceConnectionProvider;
import io.recordstore.jdbc.RecordSchema;
import io.recordstore.jdbc.purge.JdbcExpiredRecordPurgers;
import io.recordstore.jdbc.store.AbstractJdbcRecordStore;
import io.recordstore.jdbc.store.JdbcRecordStores;
import io.recordstore.model.RecordTypeRegistry;
import io.recordstore.spi.ConnectionProvider;
import io.recordstore.spi.ExpiredRecordPurger;
import io.recordstore.spi.MetricsExporter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the record store.
 *
 * <p>Wires up a {@link RecordStorage} composite from a {@link DataSource} and
 * {@link RecordStoreProperties}. The database is detected from the JDBC URL; with
 * {@code recordstore.initialize-schema=true} missing tables are created at startup.
 *
 * @see RecordStoreProperties
 * @see RecordStoreMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(RecordStorage.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(RecordStoreProperties.class)
public class RecordStoreAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public RecordTypeRegistry recordTypeRegistry(RecordStoreProperties props) {
        return RecordTypeRegistry.oidcDefaults(props.getNamespacePrefix());
    }

    @Bean
    @ConditionalOnMissingBean
    public AbstractJdbcRecordStore recordStore(DataSource dataSource) {
        return JdbcRecordStores.detect(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(ExpiredRecordPurger.class)
    public ExpiredRecordPurger expiredRecordPurger(AbstractJdbcRecordStore recordStore) {
        return JdbcExpiredRecordPurgers.forStore(recordStore);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public RecordStorage recordStorage(RecordStoreProperties props,
                                       ConnectionProvider connectionProvider,
                                       AbstractJdbcRecordStore recordStore,
                                       ExpiredRecordPurger purger,
                                       RecordTypeRegistry registry,
                                       ObjectProvider<MetricsExporter> metricsProvider) {
        if (props.isInitializeSchema()) {
            RecordSchema.create(connectionProvider, recordStore, registry);
        }

        RecordStoreProperties.Purge purge = props.getPurge();
        var builder = RecordStorage.builder()
                .connectionProvider(connectionProvider)
                .recordStore(recordStore)
                .purger(purger)
                .registry(registry)
                .purgeThreshold(purge.getThreshold())
                .purgeCooldown(purge.getCooldown())
                .sweepTimeout(purge.getSweepTimeout())
                .purgeBatchSize(purge.getBatchSize())
                .purgeParallelism(purge.getParallelism());
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        return builder.build();
    }
}
