/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.lang.graphite.function;

import org.opensearch.graphite.common.ErrorKind;
import org.opensearch.graphite.common.GraphiteFunctionException;
import org.opensearch.graphite.core.model.MetricData;
import org.opensearch.graphite.core.model.MetricRequest;
import org.opensearch.graphite.lang.graphite.expr.Expr;
import org.opensearch.graphite.query.consolidation.ConsolidationFunctions;
import org.opensearch.graphite.query.function.Evaluator;
import org.opensearch.graphite.query.function.FunctionDescription;
import org.opensearch.graphite.query.function.FunctionParam;
import org.opensearch.graphite.query.function.FunctionType;
import org.opensearch.graphite.query.function.GraphiteFunction;
import org.opensearch.graphite.query.function.QueryContext;
import org.opensearch.graphite.query.function.SeriesArgs;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@code consolidateBy(seriesList, consolidationFunc)}: picks the reducer used when the series is later
 * consolidated to fit the requested number of points. Values are unchanged.
 */
public class ConsolidateByFunction implements GraphiteFunction {

    public static final String NAME = "consolidateBy";

    @Override
    public List<MetricData> evaluate(
        Evaluator evaluator,
        QueryContext ctx,
        Expr expr,
        long from,
        long until,
        Map<MetricRequest, List<MetricData>> values
    ) {
        List<MetricData> args = SeriesArgs.firstSeriesArg(evaluator, ctx, expr, from, until, values);
        String func = expr.stringArg(1);
        if (!ConsolidationFunctions.isValid(func)) {
            throw GraphiteFunctionException.of(ErrorKind.INVALID_ARGUMENT, "unknown consolidation function " + func);
        }
        List<MetricData> result = new ArrayList<>(args.size());
        for (MetricData series : args) {
            String name = NAME + "(" + series.getName() + ",'" + func + "')";
            result.add(series.toBuilder().name(name).consolidationFunc(func).build());
        }
        return result;
    }

    @Override
    public Map<String, FunctionDescription> description() {
        return Map.of(
            NAME,
            FunctionDescription.builder(NAME, "consolidateBy(seriesList, consolidationFunc)")
                .description(
                    "Takes one metric or a wildcard seriesList and a consolidation function name. When a graph is drawn "
                        + "where width of the graph size in pixels is smaller than the number of datapoints to be graphed, "
                        + "Graphite consolidates the values to to prevent line overlap. This function changes how the "
                        + "values are consolidated."
                )
                .group("Special")
                .param(FunctionParam.seriesList())
                .param(
                    FunctionParam.of("consolidationFunc", FunctionType.STRING)
                        .required()
                        .options("sum", "average", "avg", "avg_zero", "median", "min", "max", "first", "last")
                )
                .nameChange()
                .build()
        );
    }
}
