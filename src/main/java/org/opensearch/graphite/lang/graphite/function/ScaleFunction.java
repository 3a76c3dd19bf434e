/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.lang.graphite.function;

import org.opensearch.graphite.core.model.MetricData;
import org.opensearch.graphite.lang.graphite.expr.Expr;
import org.opensearch.graphite.query.function.FunctionDescription;
import org.opensearch.graphite.query.function.FunctionParam;
import org.opensearch.graphite.query.function.FunctionType;

import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * {@code scale(seriesList, factor)}.
 */
public class ScaleFunction extends AbstractMapperFunction {

    public static final String NAME = "scale";

    @Override
    protected DoubleUnaryOperator mapper(Expr expr) {
        double factor = expr.floatArg(1);
        return v -> v * factor;
    }

    @Override
    protected String resultName(Expr expr, MetricData series) {
        return NAME + "(" + series.getName() + "," + expr.arg(1) + ")";
    }

    @Override
    public Map<String, FunctionDescription> description() {
        return Map.of(
            NAME,
            FunctionDescription.builder(NAME, "scale(seriesList, factor)")
                .description(
                    "Takes one metric or a wildcard seriesList followed by a constant, and multiplies the datapoint "
                        + "by the constant provided at each point."
                )
                .group("Transform")
                .param(FunctionParam.seriesList())
                .param(FunctionParam.of("factor", FunctionType.FLOAT).required())
                .nameChange()
                .valuesChange()
                .build()
        );
    }
}
