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

import java.util.List;
import java.util.Map;

/**
 * {@code fallbackSeries(seriesList, fallback)}: the series list, or the fallback when it matched nothing.
 *
 * <p>Either side may fail to resolve; the call fails only when both do, with the fallback's error.</p>
 */
public class FallbackSeriesFunction implements GraphiteFunction {

    public static final String NAME = "fallbackSeries";

    @Override
    public List<MetricData> evaluate(
        Evaluator evaluator,
        QueryContext ctx,
        Expr expr,
        long from,
        long until,
        Map<MetricRequest, List<MetricData>> values
    ) {
        if (expr.argsLength() < 2) {
            throw new GraphiteFunctionException(ErrorKind.MISSING_TIMESERIES);
        }
        List<MetricData> series = List.of();
        GraphiteFunctionException seriesError = null;
        try {
            series = SeriesArgs.seriesArg(evaluator, ctx, expr.arg(0), from, until, values);
        } catch (GraphiteFunctionException e) {
            seriesError = e;
        }
        if (!series.isEmpty()) {
            return series;
        }
        try {
            return SeriesArgs.seriesArg(evaluator, ctx, expr.arg(1), from, until, values);
        } catch (GraphiteFunctionException e) {
            if (seriesError != null) {
                e.addSuppressed(seriesError);
            }
            throw e;
        }
    }

    @Override
    public Map<String, FunctionDescription> description() {
        return Map.of(
            NAME,
            FunctionDescription.builder(NAME, "fallbackSeries(seriesList, fallback)")
                .description(
                    "Takes a wildcard seriesList, and a second fallback metric. If the wildcard does not match any series, "
                        + "draws the fallback metric."
                )
                .group("Special")
                .param(FunctionParam.seriesList())
                .param(FunctionParam.of("fallback", FunctionType.SERIES_LIST).required())
                .build()
        );
    }
}
