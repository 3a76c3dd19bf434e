/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.consolidation;

import org.opensearch.graphite.core.model.MetricData;
import org.opensearch.test.OpenSearchTestCase;

import java.util.List;

public class ConsolidatorTests extends OpenSearchTestCase {

    public void testConsolidateSetsValuesPerPoint() {
        // Arrange
        MetricData series = MetricData.of("a", 0, 10, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
        Consolidator consolidator = new Consolidator(ConsolidationPolicy.defaultPolicy());

        // Act
        consolidator.consolidate(List.of(series), 5);

        // Assert
        assertEquals(2, series.getValuesPerPoint());
        ConsolidatedValues view = series.getConsolidatedValues();
        assertEquals(0, view.startTime());
        assertEquals(20, view.stepTime());
        assertArrayEquals(new double[] { 1.5, 3.5, 5.5, 7.5, 9.5 }, view.values(), 1e-9);
    }

    public void testSeriesThatFitIsLeftAlone() {
        // Arrange
        MetricData series = MetricData.of("a", 0, 10, 1, 2, 3);

        // Act
        new Consolidator(ConsolidationPolicy.defaultPolicy()).consolidate(List.of(series), 5);

        // Assert
        assertEquals(1, series.getValuesPerPoint());
        assertEquals(3, series.getConsolidatedValues().size());
    }

    public void testNudgeDropsLeadingPartialBucket() {
        // Arrange
        MetricData series = MetricData.of("a", 10, 10, 1, 2, 3, 4, 5, 6);
        ConsolidationPolicy nudge = new ConsolidationPolicy(true, false);

        // Act
        ConsolidatedValues view = Consolidator.bucketize(series, 3, nudge, ConsolidationFunctions.forName("avg"));

        // Assert
        assertEquals(30, view.startTime());
        assertEquals(30, view.stepTime());
        assertArrayEquals(new double[] { 4.0, 6.0 }, view.values(), 1e-9);
    }

    public void testNudgeKeepsBucketStartingWithinFirstStep() {
        // Arrange
        MetricData series = MetricData.of("a", 5, 10, 1, 2, 3, 4, 5, 6);
        ConsolidationPolicy nudge = new ConsolidationPolicy(true, false);

        // Act
        ConsolidatedValues view = Consolidator.bucketize(series, 3, nudge, ConsolidationFunctions.forName("avg"));

        // Assert
        assertEquals(0, view.startTime());
        assertArrayEquals(new double[] { 2.0, 5.0 }, view.values(), 1e-9);
    }

    public void testNudgeKeepsBucketsStableWhenWindowSlides() {
        // Arrange
        ConsolidationPolicy nudge = new ConsolidationPolicy(true, false);
        MetricData earlier = MetricData.of("a", 10, 10, 1, 2, 3, 4, 5, 6);
        MetricData later = MetricData.of("a", 20, 10, 2, 3, 4, 5, 6, 7);

        // Act
        ConsolidatedValues first = Consolidator.bucketize(earlier, 3, nudge, ConsolidationFunctions.forName("avg"));
        ConsolidatedValues second = Consolidator.bucketize(later, 3, nudge, ConsolidationFunctions.forName("avg"));

        // Assert
        assertEquals(first.startTime(), second.startTime());
        assertEquals(first.values()[0], second.values()[0], 1e-9);
    }

    public void testHighestTimestampLabelsBucketEnd() {
        // Arrange
        MetricData series = MetricData.of("a", 0, 10, 1, 2, 3, 4);
        ConsolidationPolicy highest = new ConsolidationPolicy(false, true);

        // Act
        ConsolidatedValues view = Consolidator.bucketize(series, 2, highest, ConsolidationFunctions.forName("avg"));

        // Assert
        assertEquals(10, view.startTime());
        assertArrayEquals(new double[] { 1.5, 3.5 }, view.values(), 1e-9);
    }

    public void testAbsentBucketStaysAbsent() {
        // Arrange
        MetricData series = MetricData.of("a", 0, 10, Double.NaN, Double.NaN, 3, 4);

        // Act
        ConsolidatedValues view = Consolidator.bucketize(
            series,
            2,
            ConsolidationPolicy.defaultPolicy(),
            ConsolidationFunctions.forName("sum")
        );

        // Assert
        assertTrue(view.absent()[0]);
        assertFalse(view.absent()[1]);
        assertEquals(7.0, view.values()[1], 1e-9);
    }
}
