package io.recordstore.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Immutable mapping from logical record type name to {@link RecordType}.
 *
 * <p>The namespace of a type is its name converted to snake case, prefixed with a
 * configurable namespace prefix ({@code AccessToken} becomes {@code oidc_access_token}
 * with the default prefix). The builder rejects duplicate names, namespace collisions
 * and namespaces that are not valid SQL identifiers.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * RecordTypeRegistry registry = RecordTypeRegistry.oidcDefaults();
 * RecordType session = registry.get("Session");   // oidc_session, volatile
 * RecordType client = registry.get("Client");     // oidc_client, durable
 * }</pre>
 */
public final class RecordTypeRegistry {
    public static final String DEFAULT_NAMESPACE_PREFIX = "oidc_";

    /** The long-lived registration type. */
    public static final String CLIENT = "Client";

    /** Types issued and discarded during OpenID Connect flows, all volatile. */
    public static final List<String> OIDC_VOLATILE_TYPES = List.of(
            "Session",
            "AccessToken",
            "AuthorizationCode",
            "RefreshToken",
            "ClientCredentials",
            "InitialAccessToken",
            "RegistrationAccessToken",
            "DeviceCode",
            "Interaction",
            "ReplayDetection",
            "PushedAuthorizationRequest",
            "Grant",
            "BackchannelAuthenticationRequest");

    private static final Pattern IDENTIFIER = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

    private final Map<String, RecordType> byName;
    private final List<RecordType> expiringTypes;

    private RecordTypeRegistry(Map<String, RecordType> byName) {
        this.byName = Collections.unmodifiableMap(byName);
        List<RecordType> expiring = new ArrayList<>();
        for (RecordType type : byName.values()) {
            if (type.expiring()) {
                expiring.add(type);
            }
        }
        this.expiringTypes = List.copyOf(expiring);
    }

    /**
     * Registry of OpenID Connect provider types with the default namespace prefix.
     */
    public static RecordTypeRegistry oidcDefaults() {
        return oidcDefaults(DEFAULT_NAMESPACE_PREFIX);
    }

    /**
     * Registry of OpenID Connect provider types: {@value #CLIENT} is durable, every
     * type in {@link #OIDC_VOLATILE_TYPES} is volatile.
     *
     * @param namespacePrefix prefix for every namespace, may be empty
     */
    public static RecordTypeRegistry oidcDefaults(String namespacePrefix) {
        Builder builder = builder().namespacePrefix(namespacePrefix);
        OIDC_VOLATILE_TYPES.forEach(builder::expiring);
        return builder.durable(CLIENT).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up a type by logical name.
     *
     * @throws IllegalArgumentException if the name is not registered
     */
    public RecordType get(String name) {
        Objects.requireNonNull(name, "name");
        RecordType type = byName.get(name);
        if (type == null) {
            throw new IllegalArgumentException("Unknown record type: " + name +
                    ". Registered: " + byName.keySet());
        }
        return type;
    }

    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    /** All registered types in registration order. */
    public List<RecordType> all() {
        return List.copyOf(byName.values());
    }

    /** Types subject to expiration and purge, in registration order. */
    public List<RecordType> expiringTypes() {
        return expiringTypes;
    }

    /**
     * Converts a logical type name to snake case: {@code PushedAuthorizationRequest}
     * becomes {@code pushed_authorization_request}, {@code HTTPServer} becomes
     * {@code http_server}.
     */
    static String toSnakeCase(String name) {
        StringBuilder out = new StringBuilder(name.length() + 8);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '-' || c == ' ' || c == '.') {
                c = '_';
            }
            if (Character.isUpperCase(c) && i > 0) {
                char prev = name.charAt(i - 1);
                boolean nextIsLower = i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1));
                if (Character.isLowerCase(prev) || Character.isDigit(prev)
                        || (Character.isUpperCase(prev) && nextIsLower)) {
                    if (out.length() > 0 && out.charAt(out.length() - 1) != '_') {
                        out.append('_');
                    }
                }
            }
            out.append(Character.toLowerCase(c));
        }
        return out.toString();
    }

    /** Builder for {@link RecordTypeRegistry}. */
    public static final class Builder {
        private String namespacePrefix = DEFAULT_NAMESPACE_PREFIX;
        private final Map<String, Boolean> types = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Sets the prefix prepended to every namespace.
         *
         * <p>Optional. Defaults to {@value RecordTypeRegistry#DEFAULT_NAMESPACE_PREFIX}.
         */
        public Builder namespacePrefix(String namespacePrefix) {
            this.namespacePrefix = Objects.requireNonNull(namespacePrefix, "namespacePrefix");
            return this;
        }

        /** Registers a volatile type. */
        public Builder expiring(String name) {
            return add(name, true);
        }

        /** Registers a durable type. */
        public Builder durable(String name) {
            return add(name, false);
        }

        private Builder add(String name, boolean expiring) {
            Objects.requireNonNull(name, "name");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Record type name must not be blank");
            }
            if (types.putIfAbsent(name, expiring) != null) {
                throw new IllegalArgumentException("Duplicate record type: " + name);
            }
            return this;
        }

        /**
         * @throws IllegalArgumentException if no type is registered, two types map to the
         *     same namespace, or a namespace is not a valid SQL identifier
         */
        public RecordTypeRegistry build() {
            if (types.isEmpty()) {
                throw new IllegalArgumentException("At least one record type is required");
            }
            Map<String, RecordType> byName = new LinkedHashMap<>();
            Map<String, String> ownerByNamespace = new HashMap<>();
            for (Map.Entry<String, Boolean> entry : types.entrySet()) {
                String name = entry.getKey();
                String namespace = namespacePrefix + toSnakeCase(name);
                if (!IDENTIFIER.matcher(namespace).matches()) {
                    throw new IllegalArgumentException(
                            "Invalid namespace " + namespace + " derived from type " + name);
                }
                String owner = ownerByNamespace.putIfAbsent(namespace, name);
                if (owner != null) {
                    throw new IllegalArgumentException("Types " + owner + " and " + name +
                            " both map to namespace " + namespace);
                }
                byName.put(name, new RecordType(name, namespace, entry.getValue()));
            }
            return new RecordTypeRegistry(byName);
        }
    }
}
