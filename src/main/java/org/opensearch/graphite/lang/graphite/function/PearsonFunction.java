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
import org.opensearch.graphite.query.align.SeriesAligner;
import org.opensearch.graphite.query.function.Evaluator;
import org.opensearch.graphite.query.function.FunctionDescription;
import org.opensearch.graphite.query.function.FunctionParam;
import org.opensearch.graphite.query.function.FunctionType;
import org.opensearch.graphite.query.function.GraphiteFunction;
import org.opensearch.graphite.query.function.QueryContext;
import org.opensearch.graphite.query.function.SeriesArgs;
import org.opensearch.graphite.query.utils.Correlation;
import org.opensearch.graphite.query.utils.WindowedStats;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@code pearson(seriesA, seriesB, windowSize)}: rolling Pearson correlation of two single series.
 *
 * <p>An index where either series is absent enters both windows as missing. The first {@code windowSize - 1}
 * indices are absent, as is every index whose window has zero variance.</p>
 */
public class PearsonFunction implements GraphiteFunction {

    public static final String NAME = "pearson";

    private final SeriesAligner aligner;

    public PearsonFunction(SeriesAligner aligner) {
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
        List<MetricData> first = SeriesArgs.firstSeriesArg(evaluator, ctx, expr, from, until, values);
        if (expr.argsLength() < 2) {
            throw new GraphiteFunctionException(ErrorKind.MISSING_TIMESERIES);
        }
        List<MetricData> second = SeriesArgs.seriesArg(evaluator, ctx, expr.arg(1), from, until, values);
        if (first.size() != 1 || second.size() != 1) {
            throw new GraphiteFunctionException(ErrorKind.WILDCARD_NOT_ALLOWED);
        }
        int windowSize = expr.intArg(2);
        if (windowSize <= 0) {
            throw GraphiteFunctionException.of(ErrorKind.INVALID_ARGUMENT, "windowSize must be positive, got " + windowSize);
        }

        List<MetricData> aligned = aligner.align(List.of(first.get(0), second.get(0)));
        MetricData a = aligned.get(0);
        MetricData b = aligned.get(1);

        WindowedStats windowA = new WindowedStats(windowSize);
        WindowedStats windowB = new WindowedStats(windowSize);
        int length = a.size();
        double[] result = new double[length];
        boolean[] absent = new boolean[length];
        for (int i = 0; i < length; i++) {
            boolean missing = a.isAbsent(i) || i >= b.size() || b.isAbsent(i);
            windowA.push(missing ? Double.NaN : a.getValue(i));
            windowB.push(missing ? Double.NaN : b.getValue(i));
            double correlation = i >= windowSize - 1 ? Correlation.pearson(windowA, windowB) : Double.NaN;
            result[i] = correlation;
            absent[i] = Double.isNaN(correlation);
        }

        String name = NAME + "(" + a.getName() + "," + b.getName() + "," + windowSize + ")";
        return List.of(a.toBuilder().name(name).tag(MetricData.NAME_TAG, name).values(result, absent).build());
    }

    @Override
    public Map<String, FunctionDescription> description() {
        return Map.of(
            NAME,
            FunctionDescription.builder(NAME, "pearson(seriesList, seriesList, windowSize)")
                .description(
                    "Implementation of Pearson product-moment correlation coefficient (PMCC) function(s). "
                        + "Computes the rolling correlation of two series over windowSize points."
                )
                .group("Transform")
                .module("graphite.render.functions.custom")
                .param(FunctionParam.of("seriesList", FunctionType.SERIES_LIST).required())
                .param(FunctionParam.of("seriesList", FunctionType.SERIES_LIST).required())
                .param(FunctionParam.of("windowSize", FunctionType.INTEGER).required())
                .nameChange()
                .valuesChange()
                .build()
        );
    }
}
