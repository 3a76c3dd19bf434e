/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.lang.graphite.function;

import org.opensearch.graphite.lookup.AliasByPostgresProvider;
import org.opensearch.graphite.query.aggregator.SeriesAggregator;
import org.opensearch.graphite.query.align.SeriesAligner;
import org.opensearch.graphite.query.function.EngineConfig;
import org.opensearch.graphite.query.function.FunctionProvider;
import org.opensearch.graphite.query.function.FunctionRegistry;

/**
 * Registers every built-in function family.
 */
public final class BuiltinFunctions {

    private BuiltinFunctions() {}

    public static FunctionRegistry registry(EngineConfig config) {
        return registry(config, new AliasByPostgresProvider());
    }

    /**
     * @param aliasByPostgres provider of the optional lookup function, replaceable in tests
     */
    public static FunctionRegistry registry(EngineConfig config, FunctionProvider aliasByPostgres) {
        return register(FunctionRegistry.builder(), config).register(aliasByPostgres, config).build();
    }

    public static FunctionRegistry.Builder register(FunctionRegistry.Builder builder, EngineConfig config) {
        SeriesAligner aligner = config.aligner();
        SeriesAggregator aggregator = config.aggregator();

        // combining
        builder.register(AggregateFunction.registration(aggregator))
            .register(CountSeriesFunction.NAME, new CountSeriesFunction(aligner))
            .register(DiffSeriesFunction.NAME, new DiffSeriesFunction(aligner))
            .register(PercentileOfSeriesFunction.NAME, new PercentileOfSeriesFunction(aggregator))
            .register(HeatMapFunction.NAME, new HeatMapFunction())
            .register(CountValuesFunction.NAME, new CountValuesFunction());

        // filtering and sorting
        builder.register(HighestLowestFunction.registration())
            .register(PearsonFunction.NAME, new PearsonFunction(aligner))
            .register(PearsonClosestFunction.NAME, new PearsonClosestFunction())
            .register(FallbackSeriesFunction.NAME, new FallbackSeriesFunction());

        // windows and forecasting
        builder.register(MovingWindowFunction.registration())
            .register(ExponentialMovingAverageFunction.registration())
            .register(StdevFunction.NAME, new StdevFunction())
            .register(HoltWintersFunction.registration());

        // time
        builder.register(TimeShiftFunction.NAME, new TimeShiftFunction())
            .register(TimeShiftByMetricFunction.NAME, new TimeShiftByMetricFunction());

        // transforms and naming
        return builder.register(ScaleFunction.NAME, new ScaleFunction())
            .register(OffsetFunction.NAME, new OffsetFunction())
            .register(AbsoluteFunction.NAME, new AbsoluteFunction())
            .register(ConsolidateByFunction.NAME, new ConsolidateByFunction())
            .register(AliasFunction.NAME, new AliasFunction())
            .register(AliasByNodeFunction.registration());
    }
}
