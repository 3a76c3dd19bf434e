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
import org.opensearch.graphite.query.consolidation.ConsolidationFunctions;
import org.opensearch.graphite.query.function.Evaluator;
import org.opensearch.graphite.query.function.FunctionDescription;
import org.opensearch.graphite.query.function.FunctionParam;
import org.opensearch.graphite.query.function.FunctionRegistration;
import org.opensearch.graphite.query.function.FunctionType;
import org.opensearch.graphite.query.function.GraphiteFunction;
import org.opensearch.graphite.query.function.QueryContext;
import org.opensearch.graphite.query.function.SeriesArgs;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code exponentialMovingAverage(seriesList, windowSize)} and its short form {@code ewma}.
 *
 * <p>With {@code n} the window in points, the smoothing constant is {@code 2 / (n + 1)}. The first output is the
 * simple mean of the {@code n} points of history before {@code from} (0 when they are all absent); every later
 * output is {@code c * value + (1 - c) * previous}. An absent input yields an absent output and leaves the running
 * average untouched. Outputs are rounded to six decimals.</p>
 */
public class ExponentialMovingAverageFunction implements GraphiteFunction {

    public static final String NAME = "exponentialMovingAverage";
    public static final String SHORT_NAME = "ewma";

    private static final double ROUNDING = 1e6;

    public static FunctionRegistration registration() {
        return FunctionRegistration.registered(new ExponentialMovingAverageFunction(), NAME, SHORT_NAME);
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
        if (expr.argsLength() < 2) {
            throw GraphiteFunctionException.of(ErrorKind.MISSING_ARGUMENT, "windowSize");
        }
        PreviewWindow window = PreviewWindow.resolve(evaluator, ctx, expr, from, until, values);
        if (window.previewSeconds() < 1) {
            throw GraphiteFunctionException.of(ErrorKind.INVALID_ARGUMENT, "invalid window size " + window.argString());
        }

        List<MetricData> args = SeriesArgs.firstSeriesArg(evaluator, ctx, expr, window.start(from), until, window.values());
        List<MetricData> result = new ArrayList<>(args.size());
        for (MetricData series : args) {
            int windowPoints = (int) Math.max(1, window.previewSeconds() / series.getStepTime());
            double[] out = smooth(series.valuesWithNaN(), windowPoints);
            String name = expr.target() + "(" + series.getName() + "," + window.argString() + ")";
            result.add(
                series.toBuilder()
                    .name(name)
                    .tag(expr.target(), window.argString())
                    .startTime(series.getStartTime() + window.previewSeconds())
                    .deriveStopTime()
                    .values(out)
                    .build()
            );
        }
        return result;
    }

    static double[] smooth(double[] input, int windowPoints) {
        if (windowPoints > input.length) {
            return new double[] { round(ConsolidationFunctions.mean(input)) };
        }
        double constant = 2.0 / (windowPoints + 1);
        double ema = ConsolidationFunctions.mean(Arrays.copyOfRange(input, 0, windowPoints));
        if (Double.isNaN(ema)) {
            ema = 0;
        }

        double[] out = new double[input.length - windowPoints + 1];
        out[0] = round(ema);
        for (int i = windowPoints; i < input.length; i++) {
            double v = input[i];
            if (Double.isNaN(v)) {
                out[i - windowPoints + 1] = Double.NaN;
                continue;
            }
            ema = constant * v + (1 - constant) * ema;
            out[i - windowPoints + 1] = round(ema);
        }
        return out;
    }

    /**
     * Round half away from zero to six decimals; NaN and infinities pass through.
     */
    static double round(double v) {
        if (Double.isNaN(v) || Double.isInfinite(v)) {
            return v;
        }
        return Math.signum(v) * Math.floor(Math.abs(v) * ROUNDING + 0.5) / ROUNDING;
    }

    @Override
    public Map<String, FunctionDescription> description() {
        Map<String, FunctionDescription> result = new LinkedHashMap<>();
        for (String name : List.of(NAME, SHORT_NAME)) {
            result.put(
                name,
                FunctionDescription.builder(name, name + "(seriesList, windowSize)")
                    .description(
                        "Takes a series of values and a window size and produces an exponential moving average utilizing "
                            + "the following formula:\n\n ema(current) = constant * (Current Value) + (1 - constant) * "
                            + "ema(previous)\n The Constant is calculated as:\n constant = 2 / (windowSize + 1)\n The first "
                            + "period EMA uses a simple moving average for its value."
                    )
                    .group("Calculate")
                    .param(FunctionParam.seriesList())
                    .param(FunctionParam.of("windowSize", FunctionType.INT_OR_INTERVAL).required().suggestions(5, 10, "1min", "5min"))
                    .nameChange()
                    .valuesChange()
                    .build()
            );
        }
        return result;
    }
}
