/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.lookup;

import org.opensearch.graphite.query.function.EngineConfig;
import org.opensearch.graphite.query.function.FunctionRegistration;
import org.opensearch.test.OpenSearchTestCase;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;

import static org.mockito.Mockito.mock;

public class AliasByPostgresProviderTests extends OpenSearchTestCase {

    private final List<AliasByPostgresConfig.Database> connected = new ArrayList<>();

    private final AliasByPostgresProvider provider = new AliasByPostgresProvider(database -> {
        connected.add(database);
        return () -> mock(Connection.class);
    });

    public void testNoConfigFileDisablesFunction() {
        // Act
        FunctionRegistration registration = provider.create(EngineConfig.defaultConfig());

        // Assert
        assertTrue(registration.isDisabled());
        assertEquals("aliasByPostgres", registration.getDisabledName());
        assertEquals("no config file specified", registration.getDisabledReason());
    }

    public void testUnreadableConfigDisablesFunction() {
        // Arrange
        Path missing = createTempDir().resolve("missing.yml");

        // Act
        FunctionRegistration registration = provider.create(config(missing));

        // Assert
        assertTrue(registration.isDisabled());
        assertTrue(registration.getDisabledReason().startsWith("failed to read config file: "));
    }

    public void testInvalidConfigDisablesFunction() throws Exception {
        // Arrange
        Path file = createTempDir().resolve("alias.yml");
        Files.write(file, "enabled: true\ndatabase:\n  hosts:\n    username: graphite\n".getBytes(StandardCharsets.UTF_8));

        // Act
        FunctionRegistration registration = provider.create(config(file));

        // Assert
        assertTrue(registration.isDisabled());
        assertEquals("failed to read config file: database [hosts] has no url", registration.getDisabledReason());
    }

    public void testDisabledInConfig() throws Exception {
        // Arrange
        Path file = createTempDir().resolve("alias.yml");
        Files.write(file, "enabled: false\n".getBytes(StandardCharsets.UTF_8));

        // Act
        FunctionRegistration registration = provider.create(config(file));

        // Assert
        assertTrue(registration.isDisabled());
        assertEquals("disabled in config", registration.getDisabledReason());
        assertTrue(connected.isEmpty());
    }

    public void testEnabledConfigRegistersFunction() throws Exception {
        // Act
        FunctionRegistration registration = provider.create(config(getDataPath("alias_by_postgres.yml")));

        // Assert
        assertFalse(registration.isDisabled());
        assertEquals(1, registration.getFunctions().size());
        assertEquals("aliasByPostgres", registration.getFunctions().get(0).name());
        assertEquals(1, connected.size());
        assertEquals("jdbc:postgresql://localhost:5432/inventory", connected.get(0).url());
        ((AliasByPostgresFunction) registration.getFunctions().get(0).function()).close();
    }

    private static EngineConfig config(Path path) {
        return new EngineConfig(false, false, false, false, path.toString());
    }
}
