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
 * Contract implemented by every Graphite function.
 *
 * <p>A call receives the function node, the requested window and the complete fetch bindings. It must be
 * referentially transparent over those inputs: the same arguments give the same series. Implementations are
 * shared by concurrent queries and keep no mutable state outside explicitly owned, thread safe resources such as
 * connection pools.</p>
 *
 * <p>Input series are read-only. Results are new {@link MetricData} instances with freshly allocated buffers and
 * are owned by the caller. An empty result is valid and means that nothing matched.</p>
 */
public interface GraphiteFunction {

    /**
     * @return ordering constraint relative to other functions, {@link FunctionOrder#ANY} for nearly all
     */
    default FunctionOrder order() {
        return FunctionOrder.ANY;
    }

    /**
     * Evaluate the function.
     *
     * @param evaluator evaluator used to resolve argument sub-expressions
     * @param ctx per query deadline and cancellation
     * @param expr the function node
     * @param from window start, epoch seconds inclusive
     * @param until window end, epoch seconds exclusive
     * @param values fetch bindings for every leaf request
     * @return result series, possibly empty
     * @throws org.opensearch.graphite.common.GraphiteFunctionException on malformed arguments or missing series
     */
    List<MetricData> evaluate(
        Evaluator evaluator,
        QueryContext ctx,
        Expr expr,
        long from,
        long until,
        Map<MetricRequest, List<MetricData>> values
    );

    /**
     * @return metadata keyed by every name this implementation handles
     */
    Map<String, FunctionDescription> description();
}
