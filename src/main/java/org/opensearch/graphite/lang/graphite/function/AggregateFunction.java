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
import org.opensearch.graphite.query.consolidation.ConsolidationFunctions;
import org.opensearch.graphite.query.consolidation.ValueReducer;
import org.opensearch.graphite.query.function.Evaluator;
import org.opensearch.graphite.query.function.FunctionDescription;
import org.opensearch.graphite.query.function.FunctionParam;
import org.opensearch.graphite.query.function.FunctionRegistration;
import org.opensearch.graphite.query.function.FunctionType;
import org.opensearch.graphite.query.function.GraphiteFunction;
import org.opensearch.graphite.query.function.QueryContext;
import org.opensearch.graphite.query.function.SeriesArgs;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Cross-series aggregation: {@code aggregate(seriesList, func, xFilesFactor)} and the shortcuts
 * {@code sumSeries}, {@code averageSeries}, {@code maxSeries}, {@code minSeries}, {@code stddevSeries},
 * {@code rangeOfSeries}, {@code multiplySeries} with their short aliases {@code sum} and {@code avg}.
 *
 * <p>The shortcuts take any number of series lists. Arguments that resolve to nothing are dropped and left out of
 * the result name. At every index only present values are reduced; an index without any is absent.</p>
 */
public class AggregateFunction implements GraphiteFunction {

    public static final String AGGREGATE = "aggregate";

    /** Shortcut name to reducer name. */
    private static final Map<String, String> SHORTCUTS;

    static {
        Map<String, String> shortcuts = new LinkedHashMap<>();
        shortcuts.put("sumSeries", "sum");
        shortcuts.put("sum", "sum");
        shortcuts.put("averageSeries", "average");
        shortcuts.put("avg", "average");
        shortcuts.put("maxSeries", "max");
        shortcuts.put("minSeries", "min");
        shortcuts.put("stddevSeries", "stddev");
        shortcuts.put("rangeOfSeries", "range");
        shortcuts.put("multiplySeries", "multiply");
        SHORTCUTS = shortcuts;
    }

    private final SeriesAggregator aggregator;

    public AggregateFunction(SeriesAggregator aggregator) {
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator cannot be null");
    }

    public static FunctionRegistration registration(SeriesAggregator aggregator) {
        AggregateFunction function = new AggregateFunction(aggregator);
        String[] names = new String[SHORTCUTS.size() + 1];
        names[0] = AGGREGATE;
        int i = 1;
        for (String name : SHORTCUTS.keySet()) {
            names[i++] = name;
        }
        return FunctionRegistration.registered(function, names);
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
        if (AGGREGATE.equals(expr.target())) {
            return aggregate(evaluator, ctx, expr, from, until, values);
        }
        SeriesArgs.Resolved resolved = SeriesArgs.seriesArgsAndRemoveNonExisting(evaluator, ctx, expr, from, until, values);
        ValueReducer reducer = ConsolidationFunctions.forName(SHORTCUTS.get(expr.target()));
        return aggregator.aggregate(expr.target(), resolved.expr().rawArgs(), resolved.series(), reducer);
    }

    private List<MetricData> aggregate(
        Evaluator evaluator,
        QueryContext ctx,
        Expr expr,
        long from,
        long until,
        Map<MetricRequest, List<MetricData>> values
    ) {
        String func = expr.stringArg(1);
        ValueReducer base = ConsolidationFunctions.forName(func);
        double xFilesFactor = expr.floatNamedOrPosArgDefault("xFilesFactor", 2, 0);
        List<MetricData> series = SeriesArgs.firstSeriesArg(evaluator, ctx, expr, from, until, values);
        if (series.isEmpty()) {
            return List.of();
        }

        int total = series.size();
        ValueReducer reducer = base;
        if (xFilesFactor > 0) {
            reducer = present -> (double) present.length / total < xFilesFactor ? Double.NaN : base.reduce(present);
        }
        String name = shortcutFor(func);
        return aggregator.aggregate(name, expr.arg(0).toString(), series, reducer);
    }

    private static String shortcutFor(String func) {
        switch (func) {
            case "average":
            case "avg":
                return "averageSeries";
            case "rangeOf":
                return "rangeOfSeries";
            default:
                return func + "Series";
        }
    }

    @Override
    public Map<String, FunctionDescription> description() {
        Map<String, FunctionDescription> result = new LinkedHashMap<>();
        result.put(
            AGGREGATE,
            FunctionDescription.builder(AGGREGATE, "aggregate(seriesList, func, xFilesFactor=None)")
                .description(
                    "Aggregate series using the specified function.\n\n"
                        + "This function can be used with aggregation functions average, median, sum, min, max, diff, "
                        + "stddev, count, range, multiply and last."
                )
                .group("Combine")
                .param(FunctionParam.seriesList())
                .param(
                    FunctionParam.of("func", FunctionType.AGG_FUNC)
                        .required()
                        .options(ConsolidationFunctions.AVAILABLE_SUMMARIZERS.toArray())
                )
                .param(FunctionParam.of("xFilesFactor", FunctionType.FLOAT))
                .aggregated()
                .nameChange()
                .valuesChange()
                .build()
        );
        for (Map.Entry<String, String> shortcut : SHORTCUTS.entrySet()) {
            String name = shortcut.getKey();
            result.put(
                name,
                FunctionDescription.builder(name, name + "(*seriesLists)")
                    .description(
                        "Takes one metric or a wildcard seriesList. Draws the "
                            + shortcut.getValue()
                            + " of all metrics passed at each time.\n\n"
                            + "This is an alias for aggregate with aggregation "
                            + shortcut.getValue()
                            + "."
                    )
                    .group("Combine")
                    .param(FunctionParam.of("seriesLists", FunctionType.SERIES_LIST).required().multiple())
                    .aggregated()
                    .nameChange()
                    .valuesChange()
                    .build()
            );
        }
        return result;
    }
}
