/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.function;

import org.opensearch.graphite.common.ErrorKind;
import org.opensearch.graphite.common.GraphiteFunctionException;
import org.opensearch.graphite.core.model.MetricData;
import org.opensearch.graphite.core.model.MetricRequest;
import org.opensearch.graphite.lang.graphite.expr.Expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Resolution of series arguments through an {@link Evaluator}.
 */
public final class SeriesArgs {

    private SeriesArgs() {
        // Utility class
    }

    /**
     * Series and the call they were resolved for. When some arguments resolved to nothing, {@code expr} is a copy
     * of the call whose raw arguments list only the series that were found.
     *
     * @param expr the call, possibly with rewritten raw arguments
     * @param series the resolved series
     */
    public record Resolved(Expr expr, List<MetricData> series) {
    }

    /**
     * Evaluate a single series argument.
     *
     * @throws GraphiteFunctionException with {@link ErrorKind#MISSING_TIMESERIES} when the argument is a literal
     */
    public static List<MetricData> seriesArg(
        Evaluator evaluator,
        QueryContext ctx,
        Expr arg,
        long from,
        long until,
        Map<MetricRequest, List<MetricData>> values
    ) {
        if (!arg.isName() && !arg.isFunc()) {
            throw GraphiteFunctionException.of(ErrorKind.MISSING_TIMESERIES, arg.toString());
        }
        return evaluator.eval(ctx, arg, from, until, values);
    }

    /**
     * Evaluate the first positional argument of {@code expr} as a series list.
     */
    public static List<MetricData> firstSeriesArg(
        Evaluator evaluator,
        QueryContext ctx,
        Expr expr,
        long from,
        long until,
        Map<MetricRequest, List<MetricData>> values
    ) {
        if (expr.argsLength() == 0) {
            throw new GraphiteFunctionException(ErrorKind.MISSING_TIMESERIES);
        }
        return seriesArg(evaluator, ctx, expr.arg(0), from, until, values);
    }

    /**
     * Evaluate several series arguments and concatenate the results. Arguments whose series do not exist are
     * skipped.
     *
     * @throws GraphiteFunctionException with {@link ErrorKind#SERIES_DOES_NOT_EXIST} when nothing was found
     */
    public static List<MetricData> seriesArgs(
        Evaluator evaluator,
        QueryContext ctx,
        List<Expr> args,
        long from,
        long until,
        Map<MetricRequest, List<MetricData>> values
    ) {
        List<MetricData> result = new ArrayList<>();
        for (Expr arg : args) {
            try {
                result.addAll(seriesArg(evaluator, ctx, arg, from, until, values));
            } catch (GraphiteFunctionException e) {
                if (!e.is(ErrorKind.SERIES_DOES_NOT_EXIST)) {
                    throw e;
                }
            }
        }
        if (result.isEmpty()) {
            throw new GraphiteFunctionException(ErrorKind.SERIES_DOES_NOT_EXIST);
        }
        return result;
    }

    /**
     * Evaluate every positional argument of {@code expr}, dropping those that resolved to nothing. When fewer series
     * than arguments were found, the raw arguments of the returned call list the names of the series found.
     */
    public static Resolved seriesArgsAndRemoveNonExisting(
        Evaluator evaluator,
        QueryContext ctx,
        Expr expr,
        long from,
        long until,
        Map<MetricRequest, List<MetricData>> values
    ) {
        List<MetricData> series = seriesArgs(evaluator, ctx, expr.args(), from, until, values);
        if (series.size() < expr.argsLength()) {
            String names = series.stream().map(MetricData::getName).collect(Collectors.joining(","));
            return new Resolved(expr.withRawArgs(names), series);
        }
        return new Resolved(expr, series);
    }
}
