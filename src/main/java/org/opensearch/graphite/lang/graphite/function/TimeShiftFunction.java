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
import org.opensearch.graphite.query.function.FunctionDescription;
import org.opensearch.graphite.query.function.FunctionParam;
import org.opensearch.graphite.query.function.FunctionType;
import org.opensearch.graphite.query.function.GraphiteFunction;
import org.opensearch.graphite.query.function.QueryContext;
import org.opensearch.graphite.query.function.SeriesArgs;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * {@code timeShift(seriesList, timeShift, resetEnd=true)}: draws the series as it was at another time.
 *
 * <p>An unsigned shift points to the past. The argument is evaluated over the shifted window and its timestamps
 * moved back into the requested one. With {@code resetEnd} the result is cut at {@code until}.</p>
 */
public class TimeShiftFunction implements GraphiteFunction {

    public static final String NAME = "timeShift";

    @Override
    public List<MetricData> evaluate(
        Evaluator evaluator,
        QueryContext ctx,
        Expr expr,
        long from,
        long until,
        Map<MetricRequest, List<MetricData>> values
    ) {
        long offset = expr.intervalArg(1, -1);
        boolean resetEnd = expr.boolNamedOrPosArgDefault("resetEnd", 2, true);
        List<MetricData> args = SeriesArgs.firstSeriesArg(evaluator, ctx, expr, from + offset, until + offset, values);

        List<MetricData> result = new ArrayList<>(args.size());
        for (MetricData series : args) {
            long start = series.getStartTime() - offset;
            long stop = series.getStopTime() - offset;
            if (resetEnd && stop > until) {
                stop = until;
            }
            int length = (int) ((stop - start) / series.getStepTime());
            if (length < 0) {
                continue;
            }
            length = Math.min(length, series.size());
            String name = NAME + "(" + series.getName() + ",'" + offset + "'," + resetEnd + ")";
            result.add(
                series.toBuilder()
                    .name(name)
                    .startTime(start)
                    .stopTime(stop)
                    .values(Arrays.copyOf(series.getValues(), length), Arrays.copyOf(series.getAbsent(), length))
                    .build()
            );
        }
        return result;
    }

    @Override
    public Map<String, FunctionDescription> description() {
        return Map.of(
            NAME,
            FunctionDescription.builder(NAME, "timeShift(seriesList, timeShift, resetEnd=True, alignDST=False)")
                .description(
                    "Takes one metric or a wildcard seriesList, followed by a quoted string with the length of time "
                        + "(See from / until in the render_api_ for examples of time formats).\n\n"
                        + "Draws the selected metrics shifted in time. If no sign is given, a minus sign ( - ) is implied "
                        + "which will shift the metric back in time. If a plus sign ( + ) is given, the metric will be "
                        + "shifted forward in time."
                )
                .group("Transform")
                .param(FunctionParam.seriesList())
                .param(FunctionParam.of("timeShift", FunctionType.INTERVAL).required().suggestions("1h", "6h", "12h", "1d", "2d", "7d"))
                .param(FunctionParam.of("resetEnd", FunctionType.BOOLEAN).defaultValue(true))
                .nameChange()
                .build()
        );
    }
}
