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
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@code countValues(seriesList, valuesLimit=32)}: one series per distinct value, counting at every index how many
 * input series hold that value.
 *
 * <p>Values are bucketed by their integer part. When more than {@code valuesLimit} distinct buckets show up the
 * result is a single all-zero series named {@value #LIMIT_EXCEEDED_NAME}.</p>
 */
public class CountValuesFunction implements GraphiteFunction {

    public static final String NAME = "countValues";
    public static final String LIMIT_EXCEEDED_NAME = "error.too.many.values.limit.reached";

    static final int DEFAULT_VALUES_LIMIT = 32;

    private static final Logger logger = LogManager.getLogger(CountValuesFunction.class);

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
        int valuesLimit = expr.intNamedOrPosArgDefault("valuesLimit", 1, DEFAULT_VALUES_LIMIT);
        if (args.isEmpty()) {
            return List.of();
        }

        MetricData base = args.get(0);
        int length = base.size();
        Map<Long, double[]> counts = new TreeMap<>();
        for (MetricData series : args) {
            int points = Math.min(length, series.size());
            for (int bucket = 0; bucket < points; bucket++) {
                if (series.isAbsent(bucket) || Double.isNaN(series.getValue(bucket))) {
                    continue;
                }
                long key = (long) series.getValue(bucket);
                double[] count = counts.get(key);
                if (count == null) {
                    if (counts.size() >= valuesLimit) {
                        logger.debug("More than {} distinct values in {}", valuesLimit, expr);
                        return List.of(base.toBuilder().name(LIMIT_EXCEEDED_NAME).values(new double[length]).build());
                    }
                    count = new double[length];
                    counts.put(key, count);
                }
                count[bucket]++;
            }
        }

        List<MetricData> result = new ArrayList<>(counts.size());
        for (Map.Entry<Long, double[]> entry : counts.entrySet()) {
            result.add(base.toBuilder().name(Long.toString(entry.getKey())).values(entry.getValue()).build());
        }
        return result;
    }

    @Override
    public Map<String, FunctionDescription> description() {
        return Map.of(
            NAME,
            FunctionDescription.builder(NAME, "countValues(seriesList, valuesLimit=32)")
                .description(
                    "Draws line for each unique value in the seriesList. Each line displays count of the value in "
                        + "current bucket."
                )
                .group("Combine")
                .param(FunctionParam.seriesList())
                .param(FunctionParam.of("valuesLimit", FunctionType.INTEGER).defaultValue(DEFAULT_VALUES_LIMIT))
                .aggregated()
                .nameChange()
                .valuesChange()
                .build()
        );
    }
}
