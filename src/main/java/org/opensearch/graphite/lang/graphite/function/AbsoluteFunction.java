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

import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * {@code absolute(seriesList)}.
 */
public class AbsoluteFunction extends AbstractMapperFunction {

    public static final String NAME = "absolute";

    @Override
    protected DoubleUnaryOperator mapper(Expr expr) {
        return Math::abs;
    }

    @Override
    protected String resultName(Expr expr, MetricData series) {
        return NAME + "(" + series.getName() + ")";
    }

    @Override
    public Map<String, FunctionDescription> description() {
        return Map.of(
            NAME,
            FunctionDescription.builder(NAME, "absolute(seriesList)")
                .description(
                    "Takes one metric or a wildcard seriesList and applies the mathematical abs function to each "
                        + "datapoint transforming it to its absolute value."
                )
                .group("Transform")
                .param(FunctionParam.seriesList())
                .nameChange()
                .valuesChange()
                .build()
        );
    }
}
