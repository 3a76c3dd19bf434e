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
import org.opensearch.graphite.query.function.GraphiteFunction;
import org.opensearch.graphite.query.function.QueryContext;
import org.opensearch.graphite.query.function.SeriesArgs;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * {@code heatMap(seriesList)}: differences between neighbouring series after ordering them by size.
 *
 * <p>Every series is weighted by the sum of its values at the first five indices where all series are present,
 * and the series are stably sorted by ascending weight. For {@code N} sorted series the result holds {@code N - 1}
 * series {@code a[i] - a[i-1]}, absent wherever either side is. Works well on a list of incrementing counters
 * rendered as a heat map.</p>
 */
public class HeatMapFunction implements GraphiteFunction {

    public static final String NAME = "heatMap";

    static final int WEIGHT_POINTS = 5;

    @Override
    public List<MetricData> evaluate(
        Evaluator evaluator,
        QueryContext ctx,
        Expr expr,
        long from,
        long until,
        Map<MetricRequest, List<MetricData>> values
    ) {
        List<MetricData> series = SeriesArgs.firstSeriesArg(evaluator, ctx, expr, from, until, values);
        validateNeighbours(series);
        List<MetricData> sorted = sortByWeight(series);

        List<MetricData> result = new ArrayList<>(Math.max(0, sorted.size() - 1));
        for (int i = 1; i < sorted.size(); i++) {
            MetricData curr = sorted.get(i);
            MetricData prev = sorted.get(i - 1);
            int points = curr.size();
            double[] diff = new double[points];
            boolean[] absent = new boolean[points];
            for (int j = 0; j < points; j++) {
                if (curr.isAbsent(j) || prev.isAbsent(j)) {
                    absent[j] = true;
                    diff[j] = Double.NaN;
                } else {
                    diff[j] = curr.getValue(j) - prev.getValue(j);
                }
            }
            result.add(
                MetricData.builder(NAME + "(" + curr.getName() + "," + prev.getName() + ")")
                    .tags(curr.getTags())
                    .startTime(curr.getStartTime())
                    .stopTime(curr.getStopTime())
                    .stepTime(curr.getStepTime())
                    .values(diff, absent)
                    .build()
            );
        }
        return result;
    }

    static void validateNeighbours(List<MetricData> series) {
        if (series.isEmpty()) {
            return;
        }
        MetricData first = series.get(0);
        for (int i = 1; i < series.size(); i++) {
            MetricData other = series.get(i);
            if (first.getStartTime() != other.getStartTime()) {
                throw mismatch("start time", first.getStartTime(), other.getStartTime());
            }
            if (first.getStopTime() != other.getStopTime()) {
                throw mismatch("stop time", first.getStopTime(), other.getStopTime());
            }
            if (first.getStepTime() != other.getStepTime()) {
                throw mismatch("step", first.getStepTime(), other.getStepTime());
            }
            if (first.size() != other.size()) {
                throw mismatch("values quantity", first.size(), other.size());
            }
        }
    }

    private static GraphiteFunctionException mismatch(String what, long expected, long actual) {
        return GraphiteFunctionException.of(ErrorKind.INVALID_ARGUMENT, what + " differs: " + expected + "!=" + actual);
    }

    /**
     * Stable ascending sort by the weight of the first jointly present samples.
     */
    static List<MetricData> sortByWeight(List<MetricData> series) {
        int count = series.size();
        if (count < 2) {
            return series;
        }
        double[] weights = new double[count];
        int found = 0;
        int size = series.get(0).size();
        for (int i = 0; i < size && found < WEIGHT_POINTS; i++) {
            boolean absent = false;
            for (int j = 0; j < count && !absent; j++) {
                absent = series.get(j).isAbsent(i);
            }
            if (absent) {
                continue;
            }
            for (int j = 0; j < count; j++) {
                weights[j] += series.get(j).getValue(i);
            }
            found++;
        }

        List<Integer> order = new ArrayList<>(count);
        for (int j = 0; j < count; j++) {
            order.add(j);
        }
        order.sort(Comparator.comparingDouble(j -> weights[j]));
        List<MetricData> sorted = new ArrayList<>(count);
        for (int j : order) {
            sorted.add(series.get(j));
        }
        return sorted;
    }

    @Override
    public Map<String, FunctionDescription> description() {
        return Map.of(
            NAME,
            FunctionDescription.builder(NAME, "heatMap(seriesList)")
                .description(
                    "Compute heat-map like result based on a values of a metric.\n\nAll metrics are assigned weights, "
                        + "based on the sum of their first 5 values and then sorted based on that. After that for the "
                        + "sorted metrics, diff with the previous one will be computed.\n\nAssuming seriesList has N series "
                        + "in total (sorted by sum of the first 5 values): (a[1], a[2], ..., a[N]). Then heatMap will output "
                        + "N-1 series: (a[2] - a[1], a[3] - a[2], ..., a[N] - a[N-1])."
                )
                .group("Transform")
                .param(FunctionParam.seriesList())
                .aggregated()
                .nameChange()
                .valuesChange()
                .build()
        );
    }
}
