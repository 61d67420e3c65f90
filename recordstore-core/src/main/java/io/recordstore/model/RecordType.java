package io.recordstore.model;

import java.util.Objects;

/**
 * A logical record type and the physical namespace (table) that backs it.
 *
 * @param name      logical name used by callers, e.g. {@code AccessToken}
 * @param namespace physical namespace, e.g. {@code oidc_access_token}
 * @param expiring  {@code true} for volatile types subject to expiration and purge
 */
public record RecordType(String name, String namespace, boolean expiring) {

    public RecordType {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(namespace, "namespace");
    }

    /**
     * Returns {@code true} if this type is never purged.
     */
    public boolean durable() {
        return !expiring;
    }
}
