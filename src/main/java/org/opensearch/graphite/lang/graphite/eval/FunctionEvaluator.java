/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.lang.graphite.eval;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.graphite.common.ErrorKind;
import org.opensearch.graphite.common.GraphiteFunctionException;
import org.opensearch.graphite.core.model.MetricData;
import org.opensearch.graphite.core.model.MetricRequest;
import org.opensearch.graphite.lang.graphite.expr.Expr;
import org.opensearch.graphite.query.align.SeriesAligner;
import org.opensearch.graphite.query.function.EngineConfig;
import org.opensearch.graphite.query.function.Evaluator;
import org.opensearch.graphite.query.function.FunctionRegistry;
import org.opensearch.graphite.query.function.GraphiteFunction;
import org.opensearch.graphite.query.function.QueryContext;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Evaluator walking an expression tree and dispatching function nodes through a {@link FunctionRegistry}.
 *
 * <h2>Node evaluation:</h2>
 * <ul>
 *   <li><strong>Name:</strong> the series bound to {@code (pattern, from, until)}, empty when unbound</li>
 *   <li><strong>Constant:</strong> a single point series spanning the whole window</li>
 *   <li><strong>Function:</strong> registry lookup, then the function itself; failures are prefixed with
 *   {@code function=<name>:}</li>
 * </ul>
 *
 * <p>The evaluator holds no per query state and may be shared by concurrent queries.</p>
 */
public class FunctionEvaluator implements Evaluator {

    private static final Logger logger = LogManager.getLogger(FunctionEvaluator.class);

    private final FunctionRegistry registry;
    private final SeriesFetcher fetcher;
    private final EngineConfig config;

    public FunctionEvaluator(FunctionRegistry registry, SeriesFetcher fetcher, EngineConfig config) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    public FunctionRegistry getRegistry() {
        return registry;
    }

    @Override
    public List<MetricData> eval(QueryContext ctx, Expr expr, long from, long until, Map<MetricRequest, List<MetricData>> values) {
        switch (expr.type()) {
            case NAME: {
                List<MetricData> bound = values.get(new MetricRequest(expr.target(), from, until));
                return bound == null ? List.of() : bound;
            }
            case CONST: {
                MetricData constant = MetricData.builder(expr.toString())
                    .startTime(from)
                    .stopTime(until)
                    .stepTime(Math.max(1, until - from))
                    .values(new double[] { expr.floatValue() })
                    .build();
                return List.of(constant);
            }
            case FUNC:
                return evalFunction(ctx, expr, from, until, values);
            default:
                throw GraphiteFunctionException.of(ErrorKind.MISSING_TIMESERIES, "unexpected literal " + expr);
        }
    }

    private List<MetricData> evalFunction(
        QueryContext ctx,
        Expr expr,
        long from,
        long until,
        Map<MetricRequest, List<MetricData>> values
    ) {
        String name = expr.target();
        if (expr.argsLength() == 0 && expr.namedArgs().isEmpty()) {
            throw GraphiteFunctionException.withFunction(name, new GraphiteFunctionException(ErrorKind.MISSING_ARGUMENT));
        }
        GraphiteFunction function = registry.get(name);
        if (function == null) {
            String reason = registry.disabledFunctions().get(name);
            String detail = reason == null ? name : name + " (disabled: " + reason + ")";
            throw GraphiteFunctionException.of(ErrorKind.UNKNOWN_FUNCTION, detail);
        }
        ctx.ensureActive("evaluation of " + name);
        try {
            return function.evaluate(this, ctx, expr, from, until, values);
        } catch (GraphiteFunctionException e) {
            throw GraphiteFunctionException.withFunction(name, e);
        }
    }

    @Override
    public Map<MetricRequest, List<MetricData>> fetch(
        QueryContext ctx,
        List<Expr> exprs,
        long from,
        long until,
        Map<MetricRequest, List<MetricData>> values
    ) {
        Set<MetricRequest> missing = new LinkedHashSet<>();
        for (Expr expr : exprs) {
            for (MetricRequest request : expr.metrics(from, until)) {
                if (!values.containsKey(request)) {
                    missing.add(request);
                }
            }
        }
        Map<MetricRequest, List<MetricData>> result = new HashMap<>(values);
        if (missing.isEmpty()) {
            return result;
        }

        ctx.ensureActive("fetch");
        Map<MetricRequest, List<MetricData>> fetched = fetcher.fetch(ctx, missing);
        logger.debug("Fetched {} of {} requested patterns", fetched.size(), missing.size());
        for (MetricRequest request : missing) {
            List<MetricData> series = fetched.getOrDefault(request, List.of());
            if (config.scaleToCommonStep() && series.size() > 1) {
                series = SeriesAligner.scaleToCommonStep(series);
            }
            result.put(request, series);
        }
        return result;
    }

    /**
     * Fetch the leaves of {@code expr}, evaluate it and consolidate the result to the context's
     * {@link QueryContext#getMaxDataPoints()}.
     */
    public List<MetricData> fetchAndEval(QueryContext ctx, Expr expr, long from, long until) {
        Map<MetricRequest, List<MetricData>> values = fetch(ctx, List.of(expr), from, until, Map.of());
        List<MetricData> result = eval(ctx, expr, from, until, values);
        if (ctx.getMaxDataPoints() > 0) {
            config.consolidator().consolidate(result, ctx.getMaxDataPoints());
        }
        return result;
    }
}
