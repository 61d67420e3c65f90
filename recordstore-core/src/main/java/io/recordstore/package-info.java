/**
 * Keyed persistence for the records of an OpenID Connect provider.
 *
 * <h2>Core Design</h2>
 * <p>Each logical record type (a {@linkplain io.recordstore.model.RecordType session, access
 * token, client...}) lives in its own namespace, one table per type. Volatile types carry an
 * expiration instant; a row past its expiration is invisible to every lookup, whether or not
 * it has been deleted yet. Durable types never expire.
 *
 * <p>Expired rows are removed by a write-driven sweep: every committed upsert is counted by
 * the {@linkplain io.recordstore.purge.PurgeScheduler purge scheduler}, and once the count
 * reaches a threshold a sweep runs on a worker thread, followed by a cooldown that absorbs
 * further triggers.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>recordstore-core</b>: adapters, registry, purge scheduling, SPI</li>
 *   <li><b>recordstore-jdbc</b>: JDBC store and purger hierarchy (H2, MySQL, PostgreSQL)</li>
 *   <li><b>recordstore-micrometer</b>: optional Micrometer metrics bridge</li>
 *   <li><b>recordstore-spring-boot-starter</b>: Spring Boot auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var store        = JdbcRecordStores.detect(dataSource);
 * var connProvider = new DataSourceConnectionProvider(dataSource);
 * RecordSchema.create(connProvider, store, RecordTypeRegistry.oidcDefaults());
 *
 * try (RecordStorage storage = RecordStorage.builder()
 *     .connectionProvider(connProvider)
 *     .recordStore(store)
 *     .purger(JdbcExpiredRecordPurgers.forStore(store))
 *     .build()) {
 *
 *     RecordAdapter codes = storage.adapter("AuthorizationCode");
 *     codes.upsert("code-1", Map.of("grantId", "g1"), 60);
 *     codes.consume("code-1");
 *     codes.find("code-1");   // payload now carries "consumed"
 * }
 * }</pre>
 *
 * @see io.recordstore.RecordStorage
 * @see io.recordstore.RecordAdapter
 */
package io.recordstore;
