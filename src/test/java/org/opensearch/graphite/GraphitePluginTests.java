/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite;

import org.opensearch.common.settings.Settings;
import org.opensearch.graphite.rest.RestGraphiteFunctionsAction;
import org.opensearch.rest.RestHandler;
import org.opensearch.test.OpenSearchTestCase;

import java.io.IOException;
import java.util.List;
import java.util.Map;

public class GraphitePluginTests extends OpenSearchTestCase {

    public void testDeclaresSettings() throws IOException {
        // Arrange
        try (GraphitePlugin plugin = new GraphitePlugin(Settings.EMPTY)) {
            // Assert
            assertEquals(
                List.of(
                    GraphitePlugin.NUDGE_START_TIME,
                    GraphitePlugin.USE_BUCKETS_HIGHEST_TIMESTAMP,
                    GraphitePlugin.EXTRAPOLATE_POINTS,
                    GraphitePlugin.SCALE_TO_COMMON_STEP,
                    GraphitePlugin.ALIAS_BY_POSTGRES_CONFIG
                ),
                plugin.getSettings()
            );
        }
    }

    public void testDefaultsLeaveLookupDisabled() throws IOException {
        // Act
        try (GraphitePlugin plugin = new GraphitePlugin(Settings.EMPTY)) {
            // Assert
            assertEquals(Map.of("aliasByPostgres", "no config file specified"), plugin.getRegistry().disabledFunctions());
            assertTrue(plugin.getRegistry().contains("sumSeries"));
        }
    }

    public void testSettingsAreRead() {
        // Arrange
        Settings settings = Settings.builder()
            .put("graphite.consolidation.nudge_start_time", true)
            .put("graphite.fetch.scale_to_common_step", true)
            .put("graphite.functions.alias_by_postgres.config", "/etc/graphite/alias.yml")
            .build();

        // Assert
        assertTrue(GraphitePlugin.NUDGE_START_TIME.get(settings));
        assertFalse(GraphitePlugin.USE_BUCKETS_HIGHEST_TIMESTAMP.get(settings));
        assertTrue(GraphitePlugin.SCALE_TO_COMMON_STEP.get(settings));
        assertEquals("/etc/graphite/alias.yml", GraphitePlugin.ALIAS_BY_POSTGRES_CONFIG.get(settings));
    }

    public void testRegistersRestHandler() throws IOException {
        // Act
        try (GraphitePlugin plugin = new GraphitePlugin(Settings.EMPTY)) {
            List<RestHandler> handlers = plugin.getRestHandlers(Settings.EMPTY, null, null, null, null, null, null);

            // Assert
            assertEquals(1, handlers.size());
            assertTrue(handlers.get(0) instanceof RestGraphiteFunctionsAction);
        }
    }
}
