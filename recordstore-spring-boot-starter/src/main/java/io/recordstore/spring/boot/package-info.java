/**
 * Spring Boot auto-configuration for the record store.
 *
 * <p>Binds {@code recordstore.*} properties and exposes a {@link io.recordstore.RecordStorage}
 * bean backed by the application {@link javax.sql.DataSource}.
 *
 * @see io.recordstore.spring.boot.RecordStoreAutoConfiguration
 * @see io.recordstore.spring.boot.RecordStoreProperties
 */
package io.recordstore.spring.boot;
