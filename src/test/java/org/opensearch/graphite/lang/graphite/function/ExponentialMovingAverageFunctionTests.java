/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.lang.graphite.function;

import org.opensearch.graphite.core.model.MetricData;
import org.opensearch.graphite.lang.graphite.expr.Expr;
import org.opensearch.test.OpenSearchTestCase;

import java.util.List;
import java.util.Map;

import static org.opensearch.graphite.utils.GraphiteTestUtils.assertValues;
import static org.opensearch.graphite.utils.GraphiteTestUtils.eval;

public class ExponentialMovingAverageFunctionTests extends OpenSearchTestCase {

    public void testSmoothStartsFromWindowMean() {
        // Act
        double[] result = ExponentialMovingAverageFunction.smooth(new double[] { 1, 2, 3, 4, 5 }, 2);

        // Assert
        assertArrayEquals(new double[] { 1.5, 2.5, 3.5, 4.5 }, result, 1e-9);
    }

    public void testSmoothSkipsMissingSamples() {
        // Act
        double[] result = ExponentialMovingAverageFunction.smooth(new double[] { 1, 2, Double.NaN, 4 }, 2);

        // Assert
        assertEquals(3, result.length);
        assertEquals(1.5, result[0], 1e-9);
        assertTrue(Double.isNaN(result[1]));
        assertEquals(3.166667, result[2], 1e-9);
    }

    public void testWindowLongerThanSeriesGivesMean() {
        // Act
        double[] result = ExponentialMovingAverageFunction.smooth(new double[] { 1, 2, 3 }, 5);

        // Assert
        assertArrayEquals(new double[] { 2.0 }, result, 1e-9);
    }

    public void testRoundsHalfAwayFromZero() {
        // Assert
        assertEquals(1.234568, ExponentialMovingAverageFunction.round(1.23456789), 1e-12);
        assertEquals(-1.234568, ExponentialMovingAverageFunction.round(-1.23456789), 1e-12);
        assertTrue(Double.isNaN(ExponentialMovingAverageFunction.round(Double.NaN)));
    }

    public void testEwmaIsAliasOfExponentialMovingAverage() {
        // Arrange
        Map<String, List<MetricData>> data = Map.of("a", List.of(MetricData.of("a", 0, 10, 1, 2, 3, 4, 5)));

        // Act
        MetricData full = eval(Expr.func("exponentialMovingAverage", Expr.name("a"), Expr.constant(2)), 20, 50, data).get(0);
        MetricData shortName = eval(Expr.func("ewma", Expr.name("a"), Expr.constant(2)), 20, 50, data).get(0);

        // Assert
        assertEquals("exponentialMovingAverage(a,2)", full.getName());
        assertEquals("ewma(a,2)", shortName.getName());
        assertEquals("2", shortName.getTags().get("ewma"));
        assertEquals(20, full.getStartTime());
        assertValues(full, 1.5, 2.5, 3.5, 4.5);
        assertValues(shortName, 1.5, 2.5, 3.5, 4.5);
    }
}
