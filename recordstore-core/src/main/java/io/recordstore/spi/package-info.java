/**
 * Service Provider Interfaces (SPI) for plugging storage and observability into the record store.
 *
 * @see io.recordstore.spi.ConnectionProvider
 * @see io.recordstore.spi.RecordStore
 * @see io.recordstore.spi.ExpiredRecordPurger
 * @see io.recordstore.spi.MetricsExporter
 */
package io.recordstore.spi;
