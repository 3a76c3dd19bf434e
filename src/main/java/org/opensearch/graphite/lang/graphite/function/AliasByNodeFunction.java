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
import org.opensearch.graphite.core.utils.MetricPaths;
import org.opensearch.graphite.lang.graphite.expr.Expr;
import org.opensearch.graphite.lang.graphite.expr.NodeOrTag;
import org.opensearch.graphite.query.function.Evaluator;
import org.opensearch.graphite.query.function.FunctionDescription;
import org.opensearch.graphite.query.function.FunctionParam;
import org.opensearch.graphite.query.function.FunctionRegistration;
import org.opensearch.graphite.query.function.FunctionType;
import org.opensearch.graphite.query.function.GraphiteFunction;
import org.opensearch.graphite.query.function.QueryContext;
import org.opensearch.graphite.query.function.SeriesArgs;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code aliasByNode(seriesList, *nodes)} and {@code aliasByTags(seriesList, *tags)}.
 *
 * <p>Each argument after the series list is a node index into the metric path, negative counting from the end,
 * or a tag name. The selected parts are joined with dots and become both the display name and the {@code name}
 * tag. A missing node or tag contributes an empty part.</p>
 */
public class AliasByNodeFunction implements GraphiteFunction {

    public static final String BY_NODE = "aliasByNode";
    public static final String BY_TAGS = "aliasByTags";

    public static FunctionRegistration registration() {
        return FunctionRegistration.registered(new AliasByNodeFunction(), BY_NODE, BY_TAGS);
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
        List<MetricData> args = SeriesArgs.firstSeriesArg(evaluator, ctx, expr, from, until, values);
        List<NodeOrTag> nodesOrTags = expr.nodeOrTagArgs(1, false);
        List<MetricData> result = new ArrayList<>(args.size());
        for (MetricData series : args) {
            result.add(series.withNameAndTag(MetricPaths.aggregationKey(series.getName(), series.getTags(), nodesOrTags)));
        }
        return result;
    }

    @Override
    public Map<String, FunctionDescription> description() {
        Map<String, FunctionDescription> result = new LinkedHashMap<>();
        result.put(
            BY_NODE,
            FunctionDescription.builder(BY_NODE, "aliasByNode(seriesList, *nodes)")
                .description(
                    "Takes a seriesList and applies an alias derived from one or more \"node\" portion/s of the target "
                        + "name or tags. Node indices are 0 indexed.\n\nEach node may be an integer referencing a node in "
                        + "the series name or a string identifying a tag."
                )
                .group("Alias")
                .param(FunctionParam.seriesList())
                .param(FunctionParam.of("nodes", FunctionType.NODE_OR_TAG).required().multiple())
                .nameChange()
                .nameTagChange()
                .build()
        );
        result.put(
            BY_TAGS,
            FunctionDescription.builder(BY_TAGS, "aliasByTags(seriesList, *tags)")
                .description("Takes a seriesList and applies an alias derived from one or more tags")
                .group("Alias")
                .param(FunctionParam.seriesList())
                .param(FunctionParam.of("tags", FunctionType.NODE_OR_TAG).required().multiple())
                .nameChange()
                .nameTagChange()
                .build()
        );
        return result;
    }
}
