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
import org.opensearch.graphite.query.function.QueryContext;
import org.opensearch.graphite.query.function.SeriesArgs;

import java.util.List;
import java.util.Map;

/**
 * History that a windowed function reads before {@code from}, resolved from its {@code windowSize} argument.
 *
 * @param previewSeconds length of the history in seconds
 * @param argString the window as rendered in result names, intervals in double quotes
 * @param values bindings that include the history
 */
record PreviewWindow(long previewSeconds, String argString, Map<MetricRequest, List<MetricData>> values) {

    long start(long from) {
        return from - previewSeconds;
    }

    /**
     * Resolve argument 1 of {@code expr}. A point count is converted with the largest step of the series, and the
     * first argument is fetched again with the extra history.
     */
    static PreviewWindow resolve(
        Evaluator evaluator,
        QueryContext ctx,
        Expr expr,
        long from,
        long until,
        Map<MetricRequest, List<MetricData>> values
    ) {
        Expr windowArg = expr.arg(1);
        if (windowArg.isString()) {
            String interval = expr.stringArg(1);
            long seconds = Math.abs(expr.intervalArg(1, 1));
            return new PreviewWindow(seconds, "\"" + interval + "\"", values);
        }

        int points = expr.intArg(1);
        if (points < 0) {
            throw GraphiteFunctionException.of(ErrorKind.INVALID_ARGUMENT, "windowSize must not be negative, got " + points);
        }
        long maxStep = 0;
        for (MetricData series : SeriesArgs.firstSeriesArg(evaluator, ctx, expr, from, until, values)) {
            maxStep = Math.max(maxStep, series.getStepTime());
        }
        long preview = maxStep * points;
        Map<MetricRequest, List<MetricData>> refetched = evaluator.fetch(ctx, List.of(expr.arg(0)), from - preview, until, values);
        return new PreviewWindow(preview, Integer.toString(points), refetched);
    }
}
