/**
 * Micrometer bridge for {@link io.recordstore.spi.MetricsExporter}.
 *
 * @see io.recordstore.micrometer.MicrometerMetricsExporter
 */
package io.recordstore.micrometer;
