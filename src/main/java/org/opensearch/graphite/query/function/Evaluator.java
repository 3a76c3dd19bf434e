/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.function;

import org.opensearch.graphite.core.model.MetricData;
import org.opensearch.graphite.core.model.MetricRequest;
import org.opensearch.graphite.lang.graphite.expr.Expr;

import java.util.List;
import java.util.Map;

/**
 * Evaluates expression trees. Functions depend on this interface to resolve their arguments and never on a
 * concrete evaluator.
 */
public interface Evaluator {

    /**
     * Evaluate {@code expr} over {@code [from, until)} against already fetched bindings.
     */
    List<MetricData> eval(QueryContext ctx, Expr expr, long from, long until, Map<MetricRequest, List<MetricData>> values);

    /**
     * Fetch every leaf request of {@code exprs} missing from {@code values}.
     *
     * @return bindings holding {@code values} plus the newly fetched series
     */
    Map<MetricRequest, List<MetricData>> fetch(
        QueryContext ctx,
        List<Expr> exprs,
        long from,
        long until,
        Map<MetricRequest, List<MetricData>> values
    );
}
