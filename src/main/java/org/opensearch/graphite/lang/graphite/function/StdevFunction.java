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
import org.opensearch.graphite.query.function.Evaluator;
import org.opensearch.graphite.query.function.FunctionDescription;
import org.opensearch.graphite.query.function.FunctionParam;
import org.opensearch.graphite.query.function.FunctionType;
import org.opensearch.graphite.query.function.GraphiteFunction;
import org.opensearch.graphite.query.function.QueryContext;
import org.opensearch.graphite.query.function.SeriesArgs;
import org.opensearch.graphite.query.utils.WindowedStats;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@code stdev(seriesList, points, windowTolerance=0.1)}: rolling population standard deviation over the last
 * {@code points} samples.
 *
 * <p>An index is absent when its own sample is absent, or when the window is past its warm-up of
 * {@code (1 - windowTolerance) * points} samples and holds fewer present samples than that.</p>
 */
public class StdevFunction implements GraphiteFunction {

    public static final String NAME = "stdev";

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
        int points = expr.intArg(1);
        if (points <= 0) {
            throw GraphiteFunctionException.of(ErrorKind.INVALID_ARGUMENT, "points must be positive, got " + points);
        }
        double windowTolerance = expr.floatNamedOrPosArgDefault("windowTolerance", 2, 0.1);
        int minLen = (int) ((1 - windowTolerance) * points);

        List<MetricData> result = new ArrayList<>(args.size());
        for (MetricData series : args) {
            WindowedStats window = new WindowedStats(points);
            double[] out = new double[series.size()];
            for (int i = 0; i < series.size(); i++) {
                double v = series.valueOrNaN(i);
                window.push(v);
                if (Double.isNaN(v) || (i >= minLen && window.len() < minLen)) {
                    out[i] = Double.NaN;
                } else {
                    out[i] = window.stdev();
                }
            }
            String name = NAME + "(" + series.getName() + "," + points + ")";
            result.add(series.toBuilder().name(name).tag(NAME, Integer.toString(points)).values(out).build());
        }
        return result;
    }

    @Override
    public Map<String, FunctionDescription> description() {
        return Map.of(
            NAME,
            FunctionDescription.builder(NAME, "stdev(seriesList, points, windowTolerance=0.1)")
                .description(
                    "Takes one metric or a wildcard seriesList followed by an integer N. Draw the Standard Deviation "
                        + "of all metrics passed for the past N datapoints. If the ratio of null points in the window is "
                        + "greater than windowTolerance, skip the calculation."
                )
                .group("Calculate")
                .param(FunctionParam.seriesList())
                .param(FunctionParam.of("points", FunctionType.INTEGER).required())
                .param(FunctionParam.of("windowTolerance", FunctionType.FLOAT).defaultValue(0.1))
                .nameChange()
                .valuesChange()
                .build()
        );
    }
}
