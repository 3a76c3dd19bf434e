/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.core.utils;

import org.opensearch.graphite.lang.graphite.expr.NodeOrTag;
import org.opensearch.test.OpenSearchTestCase;

import java.util.List;
import java.util.Map;

public class MetricPathsTests extends OpenSearchTestCase {

    public void testExtractMetricUnwrapsFunctionsAndTags() {
        // Assert
        assertEquals("a.b.c", MetricPaths.extractMetric("a.b.c"));
        assertEquals("a.b.c", MetricPaths.extractMetric("movingAverage(a.b.c,5)"));
        assertEquals("a.b.c", MetricPaths.extractMetric("alias(scale(a.b.c,2),'x')"));
        assertEquals("a.b", MetricPaths.extractMetric("a.b;dc=east"));
    }

    public void testNodesKeepEmptySegments() {
        // Assert
        assertArrayEquals(new String[] { "a", "", "c" }, MetricPaths.nodes("a..c"));
    }

    public void testAggregationKeyJoinsNodesAndTags() {
        // Arrange
        List<NodeOrTag> selectors = List.of(NodeOrTag.ofNode(0), NodeOrTag.ofTag("dc"), NodeOrTag.ofNode(-1), NodeOrTag.ofNode(9));

        // Act
        String key = MetricPaths.aggregationKey("scale(web.host1.cpu,2)", Map.of("dc", "east"), selectors);

        // Assert
        assertEquals("web.east.cpu.", key);
    }

    public void testNameTagResolvesToWholePath() {
        // Act
        String key = MetricPaths.aggregationKey("web.host1.cpu", Map.of(), List.of(NodeOrTag.ofTag("name")));

        // Assert
        assertEquals("web.host1.cpu", key);
    }
}
