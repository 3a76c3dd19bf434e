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
import org.opensearch.graphite.query.align.SeriesAligner;
import org.opensearch.graphite.query.function.Evaluator;
import org.opensearch.graphite.query.function.FunctionDescription;
import org.opensearch.graphite.query.function.FunctionParam;
import org.opensearch.graphite.query.function.FunctionType;
import org.opensearch.graphite.query.function.GraphiteFunction;
import org.opensearch.graphite.query.function.QueryContext;
import org.opensearch.graphite.query.function.SeriesArgs;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@code countSeries(*seriesLists)}: a line at the number of series found, over the aligned range of the inputs.
 */
public class CountSeriesFunction implements GraphiteFunction {

    public static final String NAME = "countSeries";

    private final SeriesAligner aligner;

    public CountSeriesFunction(SeriesAligner aligner) {
        this.aligner = Objects.requireNonNull(aligner, "aligner cannot be null");
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
        SeriesArgs.Resolved resolved = SeriesArgs.seriesArgsAndRemoveNonExisting(evaluator, ctx, expr, from, until, values);
        List<MetricData> aligned = aligner.align(resolved.series());
        MetricData first = aligned.get(0);
        int length = 0;
        for (MetricData series : aligned) {
            length = Math.max(length, series.size());
        }
        double[] counts = new double[length];
        Arrays.fill(counts, aligned.size());
        MetricData result = MetricData.builder(NAME + "(" + resolved.expr().rawArgs() + ")")
            .startTime(first.getStartTime())
            .stepTime(first.getStepTime())
            .values(counts)
            .consolidationFunc(first.getConsolidationFunc())
            .xFilesFactor(first.getXFilesFactor())
            .build();
        return List.of(result);
    }

    @Override
    public Map<String, FunctionDescription> description() {
        return Map.of(
            NAME,
            FunctionDescription.builder(NAME, "countSeries(*seriesLists)")
                .description("Draws a horizontal line representing the number of nodes found in the seriesList.")
                .group("Combine")
                .param(FunctionParam.of("seriesLists", FunctionType.SERIES_LIST).multiple())
                .aggregated()
                .nameChange()
                .valuesChange()
                .build()
        );
    }
}
