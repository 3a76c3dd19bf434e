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
import org.opensearch.test.OpenSearchTestCase;

import java.io.IOException;

public class AliasByPostgresConfigTests extends OpenSearchTestCase {

    public void testLoadsYamlFile() throws IOException {
        // Act
        AliasByPostgresConfig config = AliasByPostgresConfig.load(getDataPath("alias_by_postgres.yml"));

        // Assert
        assertTrue(config.enabled());
        AliasByPostgresConfig.Database database = config.databases().get("inventory");
        assertEquals("jdbc:postgresql://localhost:5432/inventory", database.url());
        assertEquals("graphite", database.username());
        assertEquals("secret", database.password());
        assertEquals(2, database.maxConnections());
        assertEquals(TimeValue.timeValueMillis(250), database.acquireTimeout());
        AliasByPostgresConfig.KeyString key = database.keyStrings().get("by_host");
        assertEquals("node", key.varName());
        assertEquals("select owner from hosts where dc = node0 and name = node1", key.queryString());
        assertEquals("^team", key.matchString());
    }

    public void testDefaults() {
        // Arrange
        Settings settings = Settings.builder()
            .put("database.hosts.url", "jdbc:postgresql://db/hosts")
            .put("database.hosts.key_string.owner.query_string", "select owner from hosts where name = var0")
            .build();

        // Act
        AliasByPostgresConfig config = AliasByPostgresConfig.fromSettings(settings);

        // Assert
        assertFalse(config.enabled());
        AliasByPostgresConfig.Database database = config.databases().get("hosts");
        assertNull(database.username());
        assertEquals(AliasByPostgresConfig.DEFAULT_MAX_CONNECTIONS, database.maxConnections());
        assertEquals(AliasByPostgresConfig.DEFAULT_ACQUIRE_TIMEOUT, database.acquireTimeout());
        assertEquals(
            new AliasByPostgresConfig.KeyString("var", "select owner from hosts where name = var0", ".*"),
            database.keyStrings().get("owner")
        );
    }

    public void testDatabaseWithoutUrlIsRejected() {
        // Arrange
        Settings settings = Settings.builder().put("enabled", true).put("database.hosts.username", "graphite").build();

        // Act
        SettingsException e = expectThrows(SettingsException.class, () -> AliasByPostgresConfig.fromSettings(settings));

        // Assert
        assertEquals("database [hosts] has no url", e.getMessage());
    }

    public void testLookupWithoutQueryIsRejected() {
        // Arrange
        Settings settings = Settings.builder()
            .put("database.hosts.url", "jdbc:postgresql://db/hosts")
            .put("database.hosts.key_string.owner.var_name", "v")
            .build();

        // Act
        SettingsException e = expectThrows(SettingsException.class, () -> AliasByPostgresConfig.fromSettings(settings));

        // Assert
        assertEquals("key_string [owner] of database [hosts] has no query_string", e.getMessage());
    }
}
