/**
 * Record types, stored rows and query objects.
 *
 * @see io.recordstore.model.RecordTypeRegistry
 * @see io.recordstore.model.StoredRecord
 */
package io.recordstore.model;
