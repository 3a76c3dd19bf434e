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
 * {@code alias(seriesList, newName)}: renames every series; tags are kept.
 */
public class AliasFunction implements GraphiteFunction {

    public static final String NAME = "alias";

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
        String newName = expr.stringArg(1);
        List<MetricData> result = new ArrayList<>(args.size());
        for (MetricData series : args) {
            result.add(series.withName(newName));
        }
        return result;
    }

    @Override
    public Map<String, FunctionDescription> description() {
        return Map.of(
            NAME,
            FunctionDescription.builder(NAME, "alias(seriesList, newName)")
                .description(
                    "Takes one metric or a wildcard seriesList and a string in quotes. Prints the string instead of the "
                        + "metric name in the legend."
                )
                .group("Alias")
                .param(FunctionParam.seriesList())
                .param(FunctionParam.of("newName", FunctionType.STRING).required())
                .nameChange()
                .build()
        );
    }
}
