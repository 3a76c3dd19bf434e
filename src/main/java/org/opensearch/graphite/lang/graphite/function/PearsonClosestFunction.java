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
import org.opensearch.graphite.query.utils.Correlation;
import org.opensearch.graphite.query.utils.IndexedValue;
import org.opensearch.graphite.query.utils.SeriesHeap;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@code pearsonClosest(series, seriesList, n, direction='abs')}: the {@code n} series most correlated with a
 * single reference series.
 *
 * <p>Directions: {@code abs} ranks by absolute correlation, {@code pos} keeps only positive correlations and
 * {@code neg} only negative ones. Candidates of a different length or with an undefined correlation are
 * skipped.</p>
 */
public class PearsonClosestFunction implements GraphiteFunction {

    public static final String NAME = "pearsonClosest";

    @Override
    public List<MetricData> evaluate(
        Evaluator evaluator,
        QueryContext ctx,
        Expr expr,
        long from,
        long until,
        Map<MetricRequest, List<MetricData>> values
    ) {
        if (expr.argsLength() > 4) {
            throw new GraphiteFunctionException(ErrorKind.TOO_MANY_ARGUMENTS);
        }
        List<MetricData> ref = SeriesArgs.firstSeriesArg(evaluator, ctx, expr, from, until, values);
        if (ref.size() != 1) {
            throw new GraphiteFunctionException(ErrorKind.WILDCARD_NOT_ALLOWED);
        }
        if (expr.argsLength() < 2) {
            throw new GraphiteFunctionException(ErrorKind.MISSING_TIMESERIES);
        }
        List<MetricData> compare = SeriesArgs.seriesArg(evaluator, ctx, expr.arg(1), from, until, values);
        int n = expr.intArg(2);
        String direction = expr.stringNamedOrPosArgDefault("direction", 3, "abs");
        if (!"abs".equals(direction) && !"pos".equals(direction) && !"neg".equals(direction)) {
            throw GraphiteFunctionException.of(ErrorKind.INVALID_ARGUMENT, "direction must be one of: pos, neg, abs");
        }

        double[] refValues = ref.get(0).valuesWithNaN();
        SeriesHeap heap = new SeriesHeap(compare.size());
        for (int i = 0; i < compare.size(); i++) {
            double[] candidate = compare.get(i).valuesWithNaN();
            if (candidate.length != refValues.length) {
                continue;
            }
            double value = Correlation.pearson(refValues, candidate);
            // ascending heap order puts the strongest correlation first
            if (Double.isNaN(value)) {
                continue;
            } else if ("abs".equals(direction)) {
                value = -Math.abs(value);
            } else if ("pos".equals(direction) && value >= 0) {
                value = -value;
            } else if (!("neg".equals(direction) && value <= 0)) {
                continue;
            }
            heap.push(new IndexedValue(i, value));
        }

        int count = Math.min(Math.max(n, 0), heap.size());
        List<MetricData> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            result.add(compare.get(heap.pop().index()));
        }
        return result;
    }

    @Override
    public Map<String, FunctionDescription> description() {
        return Map.of(
            NAME,
            FunctionDescription.builder(NAME, "pearsonClosest(series, seriesList, n, direction='abs')")
                .description(
                    "Return the n series in seriesList with closest Pearson score to the first series argument. "
                        + "direction may be abs (default, either sign), pos (positive correlation only) or neg "
                        + "(negative correlation only)."
                )
                .group("Filter Series")
                .module("graphite.render.functions.custom")
                .param(FunctionParam.of("series", FunctionType.SERIES_LIST).required())
                .param(FunctionParam.of("seriesList", FunctionType.SERIES_LIST).required())
                .param(FunctionParam.of("n", FunctionType.INTEGER).required())
                .param(FunctionParam.of("direction", FunctionType.STRING).defaultValue("abs").options("abs", "pos", "neg"))
                .build()
        );
    }
}
