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

public class CombineFunctionsTests extends OpenSearchTestCase {

    private static final Map<String, List<MetricData>> DATA = Map.of(
        "a",
        List.of(MetricData.of("a", 0, 10, Double.NaN, 1.0)),
        "b",
        List.of(MetricData.of("b", 0, 10, 2.0, Double.NaN)),
        "c.*",
        List.of(
            MetricData.of("c.x", 0, 10, 1.0, 10.0),
            MetricData.of("c.y", 0, 10, 3.0, Double.NaN),
            MetricData.of("c.z", 0, 10, 2.0, 20.0)
        ),
        "x",
        List.of(MetricData.of("x", 0, 10, 10.0, Double.NaN, 5.0)),
        "y",
        List.of(MetricData.of("y", 0, 10, 1.0, 1.0, Double.NaN))
    );

    public void testSumSeriesExcludesAbsentValues() {
        // Act
        List<MetricData> result = eval(Expr.func("sumSeries", Expr.name("a"), Expr.name("b")), 0, 20, DATA);

        // Assert
        assertEquals(1, result.size());
        assertEquals("sumSeries(a,b)", result.get(0).getName());
        assertValues(result.get(0), 2.0, 1.0);
    }

    public void testMissingArgumentIsDroppedFromName() {
        // Act
        List<MetricData> result = eval(Expr.func("sumSeries", Expr.name("a"), Expr.name("missing")), 0, 20, DATA);

        // Assert
        assertEquals("sumSeries(a)", result.get(0).getName());
        assertValues(result.get(0), Double.NaN, 1.0);
    }

    public void testNothingToAggregate() {
        // Act
        GraphiteFunctionException e = expectThrows(
            GraphiteFunctionException.class,
            () -> eval(Expr.func("sumSeries", Expr.name("missing")), 0, 20, DATA)
        );

        // Assert
        assertEquals(ErrorKind.SERIES_DOES_NOT_EXIST, e.getKind());
        assertTrue(e.getMessage().startsWith("function=sumSeries"));
    }

    public void testAggregateNamesResultAfterShortcut() {
        // Act
        List<MetricData> result = eval(Expr.func("aggregate", Expr.name("c.*"), Expr.string("average")), 0, 20, DATA);

        // Assert
        assertEquals("averageSeries(c.*)", result.get(0).getName());
        assertValues(result.get(0), 2.0, 15.0);
    }

    public void testAggregateAppliesXFilesFactor() {
        // Arrange
        Expr expr = Expr.func("aggregate", Expr.name("c.*"), Expr.string("sum"), Expr.constant(0.6));

        // Act
        List<MetricData> result = eval(expr, 0, 20, DATA);

        // Assert
        assertEquals("sumSeries(c.*)", result.get(0).getName());
        assertValues(result.get(0), 6.0, 30.0);
    }

    public void testAggregateXFilesFactorRejectsSparseIndex() {
        // Arrange
        Expr expr = Expr.func("aggregate", Expr.name("c.*"), Expr.string("sum"), Expr.constant(0.8));

        // Act
        List<MetricData> result = eval(expr, 0, 20, DATA);

        // Assert
        assertValues(result.get(0), 6.0, Double.NaN);
    }

    public void testPercentileOfSeries() {
        // Act
        List<MetricData> result = eval(Expr.func("percentileOfSeries", Expr.name("c.*"), Expr.constant(50)), 0, 20, DATA);

        // Assert
        assertEquals("percentileOfSeries(c.*,50)", result.get(0).getName());
        assertValues(result.get(0), 2.0, 20.0);
    }

    public void testCountSeries() {
        // Act
        List<MetricData> result = eval(Expr.func("countSeries", Expr.name("c.*")), 0, 20, DATA);

        // Assert
        assertEquals("countSeries(c.*)", result.get(0).getName());
        assertValues(result.get(0), 3.0, 3.0);
    }

    public void testDiffSeriesKeepsMinuendAbsence() {
        // Act
        List<MetricData> result = eval(Expr.func("diffSeries", Expr.name("x"), Expr.name("y")), 0, 30, DATA);

        // Assert
        assertEquals("diffSeries(x,y)", result.get(0).getName());
        assertValues(result.get(0), 9.0, Double.NaN, 5.0);
        assertTrue(result.get(0).isAbsent(1));
    }

    public void testHighestByFunction() {
        // Act
        List<MetricData> result = eval(Expr.func("highest", Expr.name("c.*"), Expr.constant(1), Expr.string("max")), 0, 20, DATA);

        // Assert
        assertEquals(1, result.size());
        assertEquals("c.z", result.get(0).getName());
    }

    public void testLowestCurrent() {
        // Act
        List<MetricData> result = eval(Expr.func("lowestCurrent", Expr.name("c.*"), Expr.constant(2)), 0, 20, DATA);

        // Assert
        assertEquals(2, result.size());
        assertEquals("c.y", result.get(0).getName());
        assertEquals("c.x", result.get(1).getName());
    }
}
