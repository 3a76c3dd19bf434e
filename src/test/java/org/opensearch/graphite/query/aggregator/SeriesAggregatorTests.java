/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.aggregator;

import org.opensearch.graphite.core.model.MetricData;
import org.opensearch.graphite.query.align.SeriesAligner;
import org.opensearch.graphite.query.consolidation.ConsolidationFunctions;
import org.opensearch.test.OpenSearchTestCase;

import java.util.List;

import static org.opensearch.graphite.utils.GraphiteTestUtils.assertValues;

public class SeriesAggregatorTests extends OpenSearchTestCase {

    private final SeriesAggregator aggregator = new SeriesAggregator(new SeriesAligner(false));

    public void testSumSkipsAbsentValues() {
        // Arrange
        MetricData a = MetricData.of("a", 0, 10, Double.NaN, 1.0);
        MetricData b = MetricData.of("b", 0, 10, 2.0, Double.NaN);

        // Act
        List<MetricData> result = aggregator.aggregate("sumSeries", "a,b", List.of(a, b), ConsolidationFunctions.forName("sum"));

        // Assert
        assertEquals(1, result.size());
        assertEquals("sumSeries(a,b)", result.get(0).getName());
        assertValues(result.get(0), 2.0, 1.0);
    }

    public void testIndexWithoutValuesStaysAbsent() {
        // Arrange
        MetricData a = MetricData.of("a", 0, 10, Double.NaN, 1.0);
        MetricData b = MetricData.of("b", 0, 10, Double.NaN, 3.0);

        // Act
        List<MetricData> result = aggregator.aggregate("maxSeries", "a,b", List.of(a, b), ConsolidationFunctions.forName("max"));

        // Assert
        assertTrue(result.get(0).isAbsent(0));
        assertValues(result.get(0), Double.NaN, 3.0);
    }

    public void testPadsSeriesToCommonRange() {
        // Arrange
        MetricData a = MetricData.of("a", 0, 10, 1.0, 1.0);
        MetricData b = MetricData.of("b", 10, 10, 5.0, 5.0);

        // Act
        List<MetricData> result = aggregator.aggregate("sumSeries", "a,b", List.of(a, b), ConsolidationFunctions.forName("sum"));

        // Assert
        MetricData sum = result.get(0);
        assertEquals(0, sum.getStartTime());
        assertEquals(30, sum.getStopTime());
        assertValues(sum, 1.0, 6.0, 5.0);
    }

    public void testEmptyInput() {
        // Act
        List<MetricData> result = aggregator.aggregate("sumSeries", "", List.of(), ConsolidationFunctions.forName("sum"));

        // Assert
        assertTrue(result.isEmpty());
    }
}
