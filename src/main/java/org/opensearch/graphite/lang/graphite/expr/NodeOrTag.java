/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.lang.graphite.expr;

import org.opensearch.graphite.core.model.MetricData;

import java.util.Map;

/**
 * A node index or a tag name, as accepted by {@code aliasByNode}, {@code aliasByTags} and similar functions.
 *
 * @param node path node index, negative values count from the end; ignored for tags
 * @param tag tag name, or {@code null} for a node index
 */
public record NodeOrTag(int node, String tag) {

    public static NodeOrTag ofNode(int node) {
        return new NodeOrTag(node, null);
    }

    public static NodeOrTag ofTag(String tag) {
        return new NodeOrTag(0, tag);
    }

    public boolean isTag() {
        return tag != null;
    }

    /**
     * Resolve against a metric path and its tags.
     *
     * @param nodes the metric path split on {@code .}
     * @param tags the series tags
     * @return the node or tag value, empty if it does not exist
     */
    public String resolve(String[] nodes, Map<String, String> tags) {
        if (isTag()) {
            if (MetricData.NAME_TAG.equals(tag)) {
                return String.join(".", nodes);
            }
            return tags.getOrDefault(tag, "");
        }
        int index = node < 0 ? nodes.length + node : node;
        if (index < 0 || index >= nodes.length) {
            return "";
        }
        return nodes[index];
    }

    @Override
    public String toString() {
        return isTag() ? "'" + tag + "'" : Integer.toString(node);
    }
}
