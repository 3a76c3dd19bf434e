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

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@code diffSeries(*seriesLists)}: the first series minus every other series.
 *
 * <p>A result index is absent exactly when the minuend is absent there; absent subtrahends count as zero.
 * Arguments resolving to nothing are dropped from the computation and from the result name.</p>
 */
public class DiffSeriesFunction implements GraphiteFunction {

    public static final String NAME = "diffSeries";

    private final SeriesAligner aligner;

    public DiffSeriesFunction(SeriesAligner aligner) {
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
        MetricData minuend = aligned.get(0);

        int length = minuend.size();
        double[] result = new double[length];
        boolean[] absent = new boolean[length];
        for (int i = 0; i < length; i++) {
            if (minuend.isAbsent(i)) {
                result[i] = Double.NaN;
                absent[i] = true;
                continue;
            }
            double value = minuend.getValue(i);
            for (int s = 1; s < aligned.size(); s++) {
                MetricData subtrahend = aligned.get(s);
                if (i < subtrahend.size() && !subtrahend.isAbsent(i)) {
                    value -= subtrahend.getValue(i);
                }
            }
            result[i] = value;
        }

        String name = NAME + "(" + resolved.expr().rawArgs() + ")";
        return List.of(MetricData.builder(name)
            .startTime(minuend.getStartTime())
            .stopTime(minuend.getStopTime())
            .stepTime(minuend.getStepTime())
            .values(result, absent)
            .consolidationFunc(minuend.getConsolidationFunc())
            .xFilesFactor(minuend.getXFilesFactor())
            .build());
    }

    @Override
    public Map<String, FunctionDescription> description() {
        return Map.of(
            NAME,
            FunctionDescription.builder(NAME, "diffSeries(*seriesLists)")
                .description(
                    "Subtracts series 2 through n from series 1.\n\n"
                        + "This is an alias for aggregate with aggregation diff."
                )
                .group("Combine")
                .param(FunctionParam.of("seriesLists", FunctionType.SERIES_LIST).required().multiple())
                .aggregated()
                .nameChange()
                .valuesChange()
                .build()
        );
    }
}
