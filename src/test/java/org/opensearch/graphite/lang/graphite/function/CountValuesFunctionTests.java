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

public class CountValuesFunctionTests extends OpenSearchTestCase {

    private static final Map<String, List<MetricData>> DATA = Map.of(
        "v.*",
        List.of(MetricData.of("v.a", 0, 10, 1, 2, 1), MetricData.of("v.b", 0, 10, 1.7, Double.NaN, 3))
    );

    public void testCountsDistinctValuesPerBucket() {
        // Act
        List<MetricData> result = eval(Expr.func("countValues", Expr.name("v.*")), 0, 30, DATA);

        // Assert
        assertEquals(3, result.size());
        assertEquals("1", result.get(0).getName());
        assertValues(result.get(0), 2, 0, 1);
        assertEquals("2", result.get(1).getName());
        assertValues(result.get(1), 0, 1, 0);
        assertEquals("3", result.get(2).getName());
        assertValues(result.get(2), 0, 0, 1);
        assertEquals(0, result.get(0).getStartTime());
        assertEquals(10, result.get(0).getStepTime());
    }

    public void testTooManyValuesGivesSingleErrorSeries() {
        // Act
        List<MetricData> result = eval(Expr.func("countValues", Expr.name("v.*"), Expr.constant(2)), 0, 30, DATA);

        // Assert
        assertEquals(1, result.size());
        assertEquals(CountValuesFunction.LIMIT_EXCEEDED_NAME, result.get(0).getName());
        assertValues(result.get(0), 0, 0, 0);
    }

    public void testValuesBeyondIntRangeKeepDistinctKeys() {
        // Arrange
        Map<String, List<MetricData>> data = Map.of(
            "big.*",
            List.of(MetricData.of("big.x", 0, 10, 3e9), MetricData.of("big.y", 0, 10, 5e9), MetricData.of("big.z", 0, 10, 3e9))
        );

        // Act
        List<MetricData> result = eval(Expr.func("countValues", Expr.name("big.*")), 0, 10, data);

        // Assert
        assertEquals(2, result.size());
        assertEquals("3000000000", result.get(0).getName());
        assertValues(result.get(0), 2);
        assertEquals("5000000000", result.get(1).getName());
        assertValues(result.get(1), 1);
    }

    public void testNoSeriesGivesNothing() {
        // Act
        List<MetricData> result = eval(Expr.func("countValues", Expr.name("missing.*")), 0, 30, DATA);

        // Assert
        assertTrue(result.isEmpty());
    }
}
