/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.lookup;

import org.opensearch.common.settings.Settings;
import org.opensearch.common.settings.SettingsException;
import org.opensearch.common.unit.TimeValue;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration of {@code aliasByPostgres}, read from a YAML file.
 *
 * <pre>{@code
 * enabled: true
 * database:
 *   hosts:
 *     url: jdbc:postgresql://localhost:5432/inventory
 *     username: graphite
 *     password: secret
 *     max_connections: 4
 *     acquire_timeout: 2s
 *     key_string:
 *       by_host:
 *         var_name: var
 *         query_string: select owner from hosts where name = var0
 *         match_string: ".*"
 * }</pre>
 *
 * @param enabled whether the function is registered
 * @param databases database name to connection settings
 */
public record AliasByPostgresConfig(boolean enabled, Map<String, Database> databases) {

    static final int DEFAULT_MAX_CONNECTIONS = 4;
    static final TimeValue DEFAULT_ACQUIRE_TIMEOUT = TimeValue.timeValueSeconds(5);

    public AliasByPostgresConfig {
        databases = Collections.unmodifiableMap(new LinkedHashMap<>(databases));
    }

    /**
     * A database and the lookups defined on it.
     *
     * @param url JDBC url
     * @param username user name, may be null
     * @param password password, may be null
     * @param maxConnections bound on concurrently checked out connections
     * @param acquireTimeout longest wait for a connection
     * @param keyStrings lookup name to lookup
     */
    public record Database(
        String url,
        String username,
        String password,
        int maxConnections,
        TimeValue acquireTimeout,
        Map<String, KeyString> keyStrings
    ) {
        public Database {
            Objects.requireNonNull(url, "url cannot be null");
            keyStrings = Collections.unmodifiableMap(new LinkedHashMap<>(keyStrings));
        }
    }

    /**
     * A lookup query.
     *
     * @param varName placeholder prefix; {@code <varName><i>} is bound to the i-th selected node
     * @param queryString SQL returning the alias in its first column
     * @param matchString regular expression an alias must contain to be used
     */
    public record KeyString(String varName, String queryString, String matchString) {
    }

    public static AliasByPostgresConfig load(Path path) throws IOException {
        return fromSettings(Settings.builder().loadFromPath(path).build());
    }

    /**
     * @throws SettingsException when a database has no url or a lookup has no query
     */
    public static AliasByPostgresConfig fromSettings(Settings settings) {
        boolean enabled = settings.getAsBoolean("enabled", false);
        Map<String, Database> databases = new LinkedHashMap<>();
        for (Map.Entry<String, Settings> entry : settings.getGroups("database").entrySet()) {
            databases.put(entry.getKey(), database(entry.getKey(), entry.getValue()));
        }
        return new AliasByPostgresConfig(enabled, databases);
    }

    private static Database database(String name, Settings settings) {
        String url = settings.get("url");
        if (url == null || url.isEmpty()) {
            throw new SettingsException("database [" + name + "] has no url");
        }
        Map<String, KeyString> keyStrings = new LinkedHashMap<>();
        for (Map.Entry<String, Settings> entry : settings.getGroups("key_string").entrySet()) {
            Settings key = entry.getValue();
            String query = key.get("query_string");
            if (query == null || query.isEmpty()) {
                throw new SettingsException("key_string [" + entry.getKey() + "] of database [" + name + "] has no query_string");
            }
            keyStrings.put(entry.getKey(), new KeyString(key.get("var_name", "var"), query, key.get("match_string", ".*")));
        }
        return new Database(
            url,
            settings.get("username"),
            settings.get("password"),
            settings.getAsInt("max_connections", DEFAULT_MAX_CONNECTIONS),
            settings.getAsTime("acquire_timeout", DEFAULT_ACQUIRE_TIMEOUT),
            keyStrings
        );
    }
}
