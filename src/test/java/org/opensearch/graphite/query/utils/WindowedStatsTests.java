/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.utils;

import org.opensearch.test.OpenSearchTestCase;

public class WindowedStatsTests extends OpenSearchTestCase {

    public void testRunningStatisticsEvictOldest() {
        // Arrange
        WindowedStats stats = new WindowedStats(3);

        // Act
        stats.push(1);
        stats.push(2);
        stats.push(3);
        double fullMean = stats.mean();
        stats.push(4);

        // Assert
        assertEquals(2.0, fullMean, 1e-9);
        assertEquals(9.0, stats.sum(), 1e-9);
        assertEquals(3.0, stats.mean(), 1e-9);
        assertEquals(3, stats.len());
        assertEquals(4.0, stats.max(), 1e-9);
        assertEquals(2.0, stats.min(), 1e-9);
    }

    public void testNaNOccupiesSlotWithoutContributing() {
        // Arrange
        WindowedStats stats = new WindowedStats(3);

        // Act
        stats.push(1);
        stats.push(Double.NaN);
        stats.push(3);

        // Assert
        assertEquals(2, stats.len());
        assertEquals(3, stats.filled());
        assertEquals(2.0, stats.mean(), 1e-9);
        assertEquals(4.0 / 3, stats.meanZero(), 1e-9);
    }

    public void testStdevIsPopulationStdev() {
        // Arrange
        WindowedStats stats = new WindowedStats(3);
        stats.push(1);
        stats.push(2);
        stats.push(3);

        // Act
        double stdev = stats.stdev();

        // Assert
        assertEquals(Math.sqrt(6) / 3, stdev, 1e-12);
    }

    public void testEmptyWindow() {
        // Arrange
        WindowedStats stats = new WindowedStats(2);

        // Assert
        assertEquals(0, stats.len());
        assertEquals(0.0, stats.stdev(), 0);
        assertTrue(Double.isNaN(stats.max()));
    }

    public void testResetClearsState() {
        // Arrange
        WindowedStats stats = new WindowedStats(2);
        stats.push(5);
        stats.push(Double.NaN);

        // Act
        stats.reset();
        stats.push(1);

        // Assert
        assertEquals(1, stats.len());
        assertEquals(1.0, stats.sum(), 1e-9);
    }

    public void testCapacityMustBePositive() {
        // Assert
        expectThrows(IllegalArgumentException.class, () -> new WindowedStats(0));
    }
}
