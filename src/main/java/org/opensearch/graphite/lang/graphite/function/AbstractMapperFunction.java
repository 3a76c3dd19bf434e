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
import org.opensearch.graphite.query.function.GraphiteFunction;
import org.opensearch.graphite.query.function.QueryContext;
import org.opensearch.graphite.query.function.SeriesArgs;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * Base class for functions that transform every present sample of every series independently.
 *
 * <p>Template method: {@link #evaluate} resolves the first argument, asks {@link #mapper(Expr)} for the per-value
 * transformation and {@link #resultName(Expr, MetricData)} for the new name. Absent samples stay absent; the time
 * range and series count are preserved.</p>
 */
public abstract class AbstractMapperFunction implements GraphiteFunction {

    protected AbstractMapperFunction() {
        // Default constructor
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
        List<MetricData> args = SeriesArgs.firstSeriesArg(evaluator, ctx, expr, from, until, values);
        DoubleUnaryOperator mapper = mapper(expr);
        List<MetricData> result = new ArrayList<>(args.size());
        for (MetricData series : args) {
            int size = series.size();
            double[] mapped = new double[size];
            boolean[] absent = series.getAbsent();
            for (int i = 0; i < size; i++) {
                mapped[i] = absent[i] ? Double.NaN : mapper.applyAsDouble(series.getValue(i));
            }
            result.add(series.toBuilder().name(resultName(expr, series)).values(mapped, absent).build());
        }
        return result;
    }

    /**
     * Transformation applied to each present value, built once per call from the arguments.
     */
    protected abstract DoubleUnaryOperator mapper(Expr expr);

    /**
     * Name of the series derived from {@code series}.
     */
    protected abstract String resultName(Expr expr, MetricData series);
}
