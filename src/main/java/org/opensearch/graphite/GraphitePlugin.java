/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite;

import org.opensearch.cluster.metadata.IndexNameExpressionResolver;
import org.opensearch.cluster.node.DiscoveryNodes;
import org.opensearch.common.settings.ClusterSettings;
import org.opensearch.common.settings.IndexScopedSettings;
import org.opensearch.common.settings.Setting;
import org.opensearch.common.settings.Settings;
import org.opensearch.common.settings.SettingsFilter;
import org.opensearch.graphite.lang.graphite.function.BuiltinFunctions;
import org.opensearch.graphite.query.function.EngineConfig;
import org.opensearch.graphite.query.function.FunctionRegistry;
import org.opensearch.graphite.rest.RestGraphiteFunctionsAction;
import org.opensearch.plugins.ActionPlugin;
import org.opensearch.plugins.Plugin;
import org.opensearch.rest.RestController;
import org.opensearch.rest.RestHandler;

import java.io.IOException;
import java.util.List;
import java.util.function.Supplier;

/**
 * Plugin exposing the Graphite function engine
 */
public class GraphitePlugin extends Plugin implements ActionPlugin {

    /**
     * Align consolidation buckets to epoch multiples of the bucket width.
     */
    public static final Setting<Boolean> NUDGE_START_TIME = Setting.boolSetting(
        "graphite.consolidation.nudge_start_time",
        false,
        Setting.Property.NodeScope
    );

    /**
     * Label consolidated points with the last timestamp of their bucket.
     */
    public static final Setting<Boolean> USE_BUCKETS_HIGHEST_TIMESTAMP = Setting.boolSetting(
        "graphite.consolidation.use_buckets_highest_timestamp",
        false,
        Setting.Property.NodeScope
    );

    /**
     * Interpolate coarser series to the finest step when aligning.
     */
    public static final Setting<Boolean> EXTRAPOLATE_POINTS = Setting.boolSetting(
        "graphite.align.extrapolate_points",
        false,
        Setting.Property.NodeScope
    );

    /**
     * Bring fetched series of one request to their least common step.
     */
    public static final Setting<Boolean> SCALE_TO_COMMON_STEP = Setting.boolSetting(
        "graphite.fetch.scale_to_common_step",
        false,
        Setting.Property.NodeScope
    );

    /**
     * Path of the aliasByPostgres YAML config; empty leaves the function disabled.
     */
    public static final Setting<String> ALIAS_BY_POSTGRES_CONFIG = Setting.simpleString(
        "graphite.functions.alias_by_postgres.config",
        "",
        Setting.Property.NodeScope
    );

    private final FunctionRegistry registry;

    public GraphitePlugin(Settings settings) {
        this.registry = BuiltinFunctions.registry(EngineConfig.fromSettings(settings));
    }

    public FunctionRegistry getRegistry() {
        return registry;
    }

    @Override
    public List<Setting<?>> getSettings() {
        return List.of(NUDGE_START_TIME, USE_BUCKETS_HIGHEST_TIMESTAMP, EXTRAPOLATE_POINTS, SCALE_TO_COMMON_STEP, ALIAS_BY_POSTGRES_CONFIG);
    }

    @Override
    public List<RestHandler> getRestHandlers(
        Settings settings,
        RestController restController,
        ClusterSettings clusterSettings,
        IndexScopedSettings indexScopedSettings,
        SettingsFilter settingsFilter,
        IndexNameExpressionResolver indexNameExpressionResolver,
        Supplier<DiscoveryNodes> nodesInCluster
    ) {
        return List.of(new RestGraphiteFunctionsAction(registry));
    }

    @Override
    public void close() throws IOException {
        registry.close();
    }
}
