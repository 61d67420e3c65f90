package io.recordstore.spring.boot;

import io.recordstore.model.RecordTypeRegistry;
import io.recordstore.purge.PurgeScheduler;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the record store.
 *
 * @see RecordStoreAutoConfiguration
 */
@ConfigurationProperties(prefix = "recordstore")
public class RecordStoreProperties {

    /**
     * Prefix prepended to every table name.
     */
    private String namespacePrefix = RecordTypeRegistry.DEFAULT_NAMESPACE_PREFIX;

    /**
     * Create missing record tables at startup.
     */
    private boolean initializeSchema = false;

    private final Purge purge = new Purge();
    private final Metrics metrics = new Metrics();

    public String getNamespacePrefix() {
        return namespacePrefix;
    }

    public void setNamespacePrefix(String namespacePrefix) {
        this.namespacePrefix = namespacePrefix;
    }

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }

    public Purge getPurge() {
        return purge;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Purge {
        private int threshold = PurgeScheduler.DEFAULT_THRESHOLD;
        private Duration cooldown = PurgeScheduler.DEFAULT_COOLDOWN;
        private Duration sweepTimeout = PurgeScheduler.DEFAULT_SWEEP_TIMEOUT;
        private int batchSize = 500;
        private int parallelism = 4;

        public int getThreshold() {
            return threshold;
        }

        public void setThreshold(int threshold) {
            this.threshold = threshold;
        }

        public Duration getCooldown() {
            return cooldown;
        }

        public void setCooldown(Duration cooldown) {
            this.cooldown = cooldown;
        }

        public Duration getSweepTimeout() {
            return sweepTimeout;
        }

        public void setSweepTimeout(Duration sweepTimeout) {
            this.sweepTimeout = sweepTimeout;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getParallelism() {
            return parallelism;
        }

        public void setParallelism(int parallelism) {
            this.parallelism = parallelism;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "recordstore";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
