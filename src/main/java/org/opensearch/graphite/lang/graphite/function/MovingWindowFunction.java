/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.lang.graphite.function;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.graphite.common.ErrorKind;
import org.opensearch.graphite.common.GraphiteFunctionException;
import org.opensearch.graphite.core.model.MetricData;
import org.opensearch.graphite.core.model.MetricRequest;
import org.opensearch.graphite.lang.graphite.expr.Expr;
import org.opensearch.graphite.query.function.Evaluator;
import org.opensearch.graphite.query.function.FunctionDescription;
import org.opensearch.graphite.query.function.FunctionParam;
import org.opensearch.graphite.query.function.FunctionRegistration;
import org.opensearch.graphite.query.function.FunctionType;
import org.opensearch.graphite.query.function.GraphiteFunction;
import org.opensearch.graphite.query.function.QueryContext;
import org.opensearch.graphite.query.function.SeriesArgs;
import org.opensearch.graphite.query.utils.WindowedStats;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Moving window reducers: {@code movingAverage}, {@code movingSum}, {@code movingMin}, {@code movingMax} and
 * {@code movingMedian}, each called as {@code movingX(seriesList, windowSize, xFilesFactor=None)}.
 *
 * <h2>Window:</h2>
 * <p>{@code windowSize} is either a number of points or an interval string. The function reads the window that
 * precedes {@code from}: a point window is fetched again with {@code step * points} of history, an interval
 * window is already part of the leaf requests (see {@link Expr#metrics(long, long)}).</p>
 *
 * <h2>Output:</h2>
 * <p>The value at a timestamp reduces the {@code windowPoints} samples before it, the sample itself excluded.
 * The output starts where the preview window ends. A window holding no present sample, or fewer than
 * {@code xFilesFactor} of its capacity, is absent.</p>
 */
public class MovingWindowFunction implements GraphiteFunction {

    private static final Logger logger = LogManager.getLogger(MovingWindowFunction.class);

    private static final Map<String, ToDoubleFunction<WindowedStats>> REDUCERS;

    static {
        Map<String, ToDoubleFunction<WindowedStats>> reducers = new LinkedHashMap<>();
        reducers.put("movingAverage", WindowedStats::mean);
        reducers.put("movingSum", WindowedStats::sum);
        reducers.put("movingMin", WindowedStats::min);
        reducers.put("movingMax", WindowedStats::max);
        reducers.put("movingMedian", WindowedStats::median);
        REDUCERS = reducers;
    }

    public static FunctionRegistration registration() {
        return FunctionRegistration.registered(new MovingWindowFunction(), REDUCERS.keySet().toArray(new String[0]));
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
        ToDoubleFunction<WindowedStats> reducer = REDUCERS.get(expr.target());
        if (reducer == null) {
            throw GraphiteFunctionException.of(ErrorKind.UNKNOWN_FUNCTION, expr.target());
        }
        if (expr.argsLength() < 2) {
            throw GraphiteFunctionException.of(ErrorKind.MISSING_ARGUMENT, "windowSize");
        }
        PreviewWindow window = PreviewWindow.resolve(evaluator, ctx, expr, from, until, values);
        double xFilesFactorArg = expr.floatNamedOrPosArgDefault("xFilesFactor", 2, Double.NaN);

        List<MetricData> args = SeriesArgs.firstSeriesArg(evaluator, ctx, expr, window.start(from), until, window.values());
        List<MetricData> result = new ArrayList<>(args.size());
        for (MetricData series : args) {
            double xFilesFactor = Double.isNaN(xFilesFactorArg) ? series.getXFilesFactor() : xFilesFactorArg;
            result.add(apply(expr.target(), series, window, reducer, xFilesFactor));
        }
        return result;
    }

    private static MetricData apply(
        String function,
        MetricData series,
        PreviewWindow window,
        ToDoubleFunction<WindowedStats> reducer,
        double xFilesFactor
    ) {
        String name = function + "(" + series.getName() + "," + window.argString() + ")";
        int windowPoints = (int) (window.previewSeconds() / series.getStepTime());
        MetricData.Builder builder = series.toBuilder().name(name).tag(function, Integer.toString(windowPoints));

        if (windowPoints <= 0) {
            logger.debug("Window {} is shorter than the step of {}, emitting absent values", window.argString(), series.getName());
            double[] empty = new double[series.size()];
            Arrays.fill(empty, Double.NaN);
            return builder.values(empty).build();
        }

        int length = Math.max(0, series.size() - windowPoints);
        double[] out = new double[length];
        WindowedStats stats = new WindowedStats(windowPoints);
        for (int i = 0; i < series.size(); i++) {
            if (i >= windowPoints) {
                int present = stats.len();
                if (present == 0 || (double) present / windowPoints < xFilesFactor) {
                    out[i - windowPoints] = Double.NaN;
                } else {
                    out[i - windowPoints] = reducer.applyAsDouble(stats);
                }
            }
            stats.push(series.valueOrNaN(i));
        }
        return builder.startTime(series.getStartTime() + windowPoints * series.getStepTime())
            .stopTime(series.getStopTime())
            .values(out)
            .build();
    }

    @Override
    public Map<String, FunctionDescription> description() {
        Map<String, FunctionDescription> result = new LinkedHashMap<>();
        for (String name : REDUCERS.keySet()) {
            String what = name.substring("moving".length()).toLowerCase(Locale.ROOT);
            result.put(
                name,
                FunctionDescription.builder(name, name + "(seriesList, windowSize, xFilesFactor=None)")
                    .description(
                        "Graphs the moving "
                            + what
                            + " of a metric (or metrics) over a fixed number of past points, or a time interval.\n\n"
                            + "Takes one metric or a wildcard seriesList followed by a number N of datapoints or a quoted "
                            + "string with a length of time like '1hour' or '5min'."
                    )
                    .group("Calculate")
                    .param(FunctionParam.seriesList())
                    .param(
                        FunctionParam.of("windowSize", FunctionType.INT_OR_INTERVAL)
                            .required()
                            .suggestions(5, 7, 10, "1min", "5min", "10min", "30min", "1hour")
                    )
                    .param(FunctionParam.of("xFilesFactor", FunctionType.FLOAT))
                    .nameChange()
                    .valuesChange()
                    .build()
            );
        }
        return result;
    }
}
