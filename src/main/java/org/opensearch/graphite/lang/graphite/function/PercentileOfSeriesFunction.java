/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.lang.graphite.function;

import org.opensearch.graphite.core.model.MetricData;
import org.opensearch.graphite.core.model.MetricRequest;
import org.opensearch.graphite.lang.graphite.expr.Expr;
import org.opensearch.graphite.query.aggregator.SeriesAggregator;
import org.opensearch.graphite.query.function.Evaluator;
import org.opensearch.graphite.query.function.FunctionDescription;
import org.opensearch.graphite.query.function.FunctionParam;
import org.opensearch.graphite.query.function.FunctionType;
import org.opensearch.graphite.query.function.GraphiteFunction;
import org.opensearch.graphite.query.function.QueryContext;
import org.opensearch.graphite.query.function.SeriesArgs;
import org.opensearch.graphite.query.utils.PercentileUtils;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@code percentileOfSeries(seriesList, n, interpolate=False)}: the n-th percentile of the present values at
 * every index.
 */
public class PercentileOfSeriesFunction implements GraphiteFunction {

    public static final String NAME = "percentileOfSeries";

    private final SeriesAggregator aggregator;

    public PercentileOfSeriesFunction(SeriesAggregator aggregator) {
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator cannot be null");
    }

    @Override
    public List<MetricData> evaluate(
        Evaluator evaluator,
        QueryContext ctx,
        Expr expr,
        long from,
        long until,
        Map<MetricRequest, List<MetricData>> values
    ) {
        List<MetricData> series = SeriesArgs.firstSeriesArg(evaluator, ctx, expr, from, until, values);
        double percent = expr.floatArg(1);
        boolean interpolate = expr.boolNamedOrPosArgDefault("interpolate", 2, false);
        return aggregator.aggregate(NAME, expr.rawArgs(), series, present -> PercentileUtils.percentile(present, percent, interpolate));
    }

    @Override
    public Map<String, FunctionDescription> description() {
        return Map.of(
            NAME,
            FunctionDescription.builder(NAME, "percentileOfSeries(seriesList, n, interpolate=False)")
                .description(
                    "percentileOfSeries returns a single series which is composed of the n-percentile values taken "
                        + "across a wildcard series at each point. Unless interpolate is set to True, percentile values "
                        + "are actual values contained in one of the supplied series."
                )
                .group("Combine")
                .param(FunctionParam.seriesList())
                .param(FunctionParam.of("n", FunctionType.INTEGER).required())
                .param(FunctionParam.of("interpolate", FunctionType.BOOLEAN).defaultValue(false))
                .aggregated()
                .nameChange()
                .valuesChange()
                .build()
        );
    }
}
