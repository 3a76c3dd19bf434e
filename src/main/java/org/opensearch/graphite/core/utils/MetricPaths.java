/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.core.utils;

import org.opensearch.graphite.lang.graphite.expr.NodeOrTag;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Helpers for dotted Graphite metric paths.
 */
public final class MetricPaths {

    private MetricPaths() {
        // Utility class
    }

    /**
     * Extract the metric path from a series name that may be wrapped in function calls or carry tags, e.g.
     * {@code movingAverage(a.b.c,5)} gives {@code a.b.c} and {@code a.b;dc=x} gives {@code a.b}.
     */
    public static String extractMetric(String name) {
        String path = name;
        int open = path.lastIndexOf('(');
        if (open >= 0) {
            path = path.substring(open + 1);
            int end = 0;
            while (end < path.length() && path.charAt(end) != ',' && path.charAt(end) != ')') {
                end++;
            }
            path = path.substring(0, end).trim();
        }
        int tags = path.indexOf(';');
        return tags >= 0 ? path.substring(0, tags) : path;
    }

    public static String[] nodes(String path) {
        return path.split("\\.", -1);
    }

    /**
     * Join the nodes and tags selected by {@code nodesOrTags} with dots.
     */
    public static String aggregationKey(String name, Map<String, String> tags, List<NodeOrTag> nodesOrTags) {
        String[] nodes = nodes(extractMetric(name));
        List<String> parts = new ArrayList<>(nodesOrTags.size());
        for (NodeOrTag nodeOrTag : nodesOrTags) {
            parts.add(nodeOrTag.resolve(nodes, tags));
        }
        return String.join(".", parts);
    }
}
