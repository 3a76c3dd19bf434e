/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.lang.graphite.function;

import org.opensearch.graphite.common.ErrorKind;
import org.opensearch.graphite.common.GraphiteFunctionException;
import org.opensearch.graphite.core.model.MetricData;
import org.opensearch.graphite.lang.graphite.expr.Expr;
import org.opensearch.test.OpenSearchTestCase;

import java.util.List;
import java.util.Map;

import static org.opensearch.graphite.utils.GraphiteTestUtils.assertValues;
import static org.opensearch.graphite.utils.GraphiteTestUtils.eval;

public class HeatMapFunctionTests extends OpenSearchTestCase {

    public void testDiffsNeighboursOrderedByWeight() {
        // Arrange
        Map<String, List<MetricData>> data = Map.of(
            "h.*",
            List.of(
                MetricData.of("h.a3", 0, 10, 6, 6, 6),
                MetricData.of("h.a1", 0, 10, 1, 1, 1),
                MetricData.of("h.a2", 0, 10, 3, Double.NaN, 3)
            )
        );

        // Act
        List<MetricData> result = eval(Expr.func("heatMap", Expr.name("h.*")), 0, 30, data);

        // Assert
        assertEquals(2, result.size());
        assertEquals("heatMap(h.a2,h.a1)", result.get(0).getName());
        assertValues(result.get(0), 2, Double.NaN, 2);
        assertEquals("heatMap(h.a3,h.a2)", result.get(1).getName());
        assertValues(result.get(1), 3, Double.NaN, 3);
    }

    public void testSingleSeriesGivesNothing() {
        // Arrange
        Map<String, List<MetricData>> data = Map.of("h.*", List.of(MetricData.of("h.a1", 0, 10, 1, 1)));

        // Act
        List<MetricData> result = eval(Expr.func("heatMap", Expr.name("h.*")), 0, 20, data);

        // Assert
        assertTrue(result.isEmpty());
    }

    public void testMisalignedSeriesAreRejected() {
        // Arrange
        Map<String, List<MetricData>> data = Map.of(
            "h.*",
            List.of(MetricData.of("h.a1", 0, 10, 1, 1), MetricData.of("h.a2", 10, 10, 1, 1))
        );

        // Act
        GraphiteFunctionException e = expectThrows(
            GraphiteFunctionException.class,
            () -> eval(Expr.func("heatMap", Expr.name("h.*")), 0, 30, data)
        );

        // Assert
        assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind());
        assertTrue(e.getMessage().contains("start time differs: 0!=10"));
    }
}
