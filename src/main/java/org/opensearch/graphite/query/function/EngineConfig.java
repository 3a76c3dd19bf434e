/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.function;

import org.opensearch.common.settings.Settings;
import org.opensearch.graphite.GraphitePlugin;
import org.opensearch.graphite.query.aggregator.SeriesAggregator;
import org.opensearch.graphite.query.align.SeriesAligner;
import org.opensearch.graphite.query.consolidation.ConsolidationPolicy;
import org.opensearch.graphite.query.consolidation.Consolidator;

import java.util.Objects;

/**
 * Engine wide switches, captured once when the engine is built and threaded into the components that need them.
 *
 * <h2>Settings:</h2>
 * <p>Read from the node settings declared in {@link GraphitePlugin}:</p>
 * <ul>
 *   <li>{@link GraphitePlugin#NUDGE_START_TIME}</li>
 *   <li>{@link GraphitePlugin#USE_BUCKETS_HIGHEST_TIMESTAMP}</li>
 *   <li>{@link GraphitePlugin#EXTRAPOLATE_POINTS}</li>
 *   <li>{@link GraphitePlugin#SCALE_TO_COMMON_STEP}</li>
 *   <li>{@link GraphitePlugin#ALIAS_BY_POSTGRES_CONFIG}</li>
 * </ul>
 *
 * @param nudgeStartTimeOnAggregation align consolidation buckets to epoch multiples of the bucket width
 * @param useBucketsHighestTimestampOnAggregation label consolidated points with the last timestamp of their bucket
 * @param extrapolatePoints interpolate coarser series to the finest step when aligning
 * @param scaleToCommonStep bring fetched series of one request to their least common step
 * @param aliasByPostgresConfig path of the aliasByPostgres YAML config, empty when unset
 */
public record EngineConfig(
    boolean nudgeStartTimeOnAggregation,
    boolean useBucketsHighestTimestampOnAggregation,
    boolean extrapolatePoints,
    boolean scaleToCommonStep,
    String aliasByPostgresConfig
) {

    public EngineConfig {
        Objects.requireNonNull(aliasByPostgresConfig, "aliasByPostgresConfig cannot be null, use an empty string");
    }

    public static EngineConfig fromSettings(Settings settings) {
        return new EngineConfig(
            GraphitePlugin.NUDGE_START_TIME.get(settings),
            GraphitePlugin.USE_BUCKETS_HIGHEST_TIMESTAMP.get(settings),
            GraphitePlugin.EXTRAPOLATE_POINTS.get(settings),
            GraphitePlugin.SCALE_TO_COMMON_STEP.get(settings),
            GraphitePlugin.ALIAS_BY_POSTGRES_CONFIG.get(settings)
        );
    }

    /**
     * Every switch off, no optional function configured.
     */
    public static EngineConfig defaultConfig() {
        return new EngineConfig(false, false, false, false, "");
    }

    public ConsolidationPolicy consolidationPolicy() {
        return new ConsolidationPolicy(nudgeStartTimeOnAggregation, useBucketsHighestTimestampOnAggregation);
    }

    public SeriesAligner aligner() {
        return new SeriesAligner(extrapolatePoints);
    }

    public SeriesAggregator aggregator() {
        return new SeriesAggregator(aligner());
    }

    public Consolidator consolidator() {
        return new Consolidator(consolidationPolicy());
    }
}
