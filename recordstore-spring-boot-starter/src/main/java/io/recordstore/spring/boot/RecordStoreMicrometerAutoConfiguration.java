package io.recordstore.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.recordstore.micrometer.MicrometerMetricsExporter;
import io.recordstore.spi.MetricsExporter;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code recordstore.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link RecordStoreAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the {@link io.recordstore.RecordStorage} composite.
 */
@AutoConfiguration(before = RecordStoreAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "recordstore.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(RecordStoreProperties.class)
public class RecordStoreMicrometerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(MetricsExporter.class)
    public MicrometerMetricsExporter micrometerMetricsExporter(
            MeterRegistry meterRegistry, RecordStoreProperties props) {
        return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
    }
}
