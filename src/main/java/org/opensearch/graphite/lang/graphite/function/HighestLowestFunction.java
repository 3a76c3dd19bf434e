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
import org.opensearch.graphite.query.consolidation.ConsolidationFunctions;
import org.opensearch.graphite.query.function.Evaluator;
import org.opensearch.graphite.query.function.FunctionDescription;
import org.opensearch.graphite.query.function.FunctionParam;
import org.opensearch.graphite.query.function.FunctionRegistration;
import org.opensearch.graphite.query.function.FunctionType;
import org.opensearch.graphite.query.function.GraphiteFunction;
import org.opensearch.graphite.query.function.QueryContext;
import org.opensearch.graphite.query.function.SeriesArgs;
import org.opensearch.graphite.query.utils.SeriesHeap;
import org.opensearch.graphite.query.utils.SeriesScalars;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Top and bottom N selection by a per series scalar.
 *
 * <ul>
 *   <li>{@code highest(seriesList, n=1, func='average')}, {@code lowest(seriesList, n=1, func='average')}</li>
 *   <li>{@code highestAverage}, {@code highestCurrent}, {@code highestMax}: the {@code n} largest, descending;
 *   series whose key is NaN are never selected</li>
 *   <li>{@code lowestAverage}, {@code lowestCurrent}: the {@code n} smallest, ascending; every input is returned
 *   unchanged when there are fewer than {@code n}</li>
 * </ul>
 */
public class HighestLowestFunction implements GraphiteFunction {

    public static final String HIGHEST = "highest";
    public static final String LOWEST = "lowest";

    public static FunctionRegistration registration() {
        return FunctionRegistration.registered(
            new HighestLowestFunction(),
            HIGHEST,
            LOWEST,
            "highestAverage",
            "highestCurrent",
            "highestMax",
            "lowestAverage",
            "lowestCurrent"
        );
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
        String name = expr.target();
        List<MetricData> series = SeriesArgs.firstSeriesArg(evaluator, ctx, expr, from, until, values);
        int n;
        ToDoubleFunction<MetricData> key;
        switch (name) {
            case HIGHEST:
            case LOWEST: {
                n = expr.intNamedOrPosArgDefault("n", 1, 1);
                String func = expr.stringNamedOrPosArgDefault("func", 2, "average");
                key = SeriesScalars.byName(func);
                break;
            }
            case "highestAverage":
            case "lowestAverage":
                n = expr.intNamedOrPosArgDefault("n", 1, 1);
                key = SeriesScalars::average;
                break;
            case "highestCurrent":
            case "lowestCurrent":
                n = expr.intNamedOrPosArgDefault("n", 1, 1);
                key = SeriesScalars::current;
                break;
            case "highestMax":
                n = expr.intNamedOrPosArgDefault("n", 1, 1);
                key = SeriesScalars::max;
                break;
            default:
                throw new IllegalStateException("unexpected function " + name);
        }
        if (name.startsWith(HIGHEST)) {
            return SeriesHeap.highest(series, n, key);
        }
        return SeriesHeap.lowest(series, n, key);
    }

    @Override
    public Map<String, FunctionDescription> description() {
        Map<String, FunctionDescription> result = new LinkedHashMap<>();
        for (String name : List.of(HIGHEST, LOWEST)) {
            result.put(
                name,
                FunctionDescription.builder(name, name + "(seriesList, n=1, func='average')")
                    .description(
                        "Takes one metric or a wildcard seriesList followed by an integer N and an aggregation function. "
                            + "Out of all metrics passed, draws only the N metrics with the "
                            + (HIGHEST.equals(name) ? "highest" : "lowest")
                            + " aggregated value over the time period specified."
                    )
                    .group("Filter Series")
                    .param(FunctionParam.seriesList())
                    .param(FunctionParam.of("n", FunctionType.INTEGER).defaultValue(1))
                    .param(
                        FunctionParam.of("func", FunctionType.AGG_FUNC)
                            .defaultValue("average")
                            .options(ConsolidationFunctions.AVAILABLE_SUMMARIZERS.toArray())
                    )
                    .build()
            );
        }
        describeShortcut(result, "highestAverage", "the N metrics with the highest average value for the time period specified");
        describeShortcut(result, "highestCurrent", "the N metrics with the highest value at the end of the time period specified");
        describeShortcut(result, "highestMax", "the N metrics with the highest maximum value in the time period specified");
        describeShortcut(result, "lowestAverage", "the bottom N metrics with the lowest average value for the time period specified");
        describeShortcut(result, "lowestCurrent", "the N metrics with the lowest value at the end of the time period specified");
        return result;
    }

    private static void describeShortcut(Map<String, FunctionDescription> result, String name, String what) {
        result.put(
            name,
            FunctionDescription.builder(name, name + "(seriesList, n)")
                .description(
                    "Takes one metric or a wildcard seriesList followed by an integer N. Out of all metrics passed, draws only "
                        + what
                        + "."
                )
                .group("Filter Series")
                .param(FunctionParam.seriesList())
                .param(FunctionParam.of("n", FunctionType.INTEGER).required())
                .build()
        );
    }
}
