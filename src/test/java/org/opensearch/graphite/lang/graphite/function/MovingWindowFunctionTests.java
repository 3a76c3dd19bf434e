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

public class MovingWindowFunctionTests extends OpenSearchTestCase {

    private static final Map<String, List<MetricData>> DATA = Map.of(
        "a",
        List.of(MetricData.of("a", 0, 10, 1, 2, 3, 4, 5)),
        "gaps",
        List.of(MetricData.of("gaps", 0, 10, 1, Double.NaN, Double.NaN, 4, 5))
    );

    public void testMovingAverageWithPointCount() {
        // Act
        List<MetricData> result = eval(Expr.func("movingAverage", Expr.name("a"), Expr.constant(2)), 20, 50, DATA);

        // Assert
        MetricData series = result.get(0);
        assertEquals("movingAverage(a,2)", series.getName());
        assertEquals("2", series.getTags().get("movingAverage"));
        assertEquals(20, series.getStartTime());
        assertEquals(50, series.getStopTime());
        assertValues(series, 1.5, 2.5, 3.5);
    }

    public void testMovingSumWithInterval() {
        // Act
        List<MetricData> result = eval(Expr.func("movingSum", Expr.name("a"), Expr.string("20s")), 20, 50, DATA);

        // Assert
        MetricData series = result.get(0);
        assertEquals("movingSum(a,\"20s\")", series.getName());
        assertValues(series, 3.0, 5.0, 7.0);
    }

    public void testMovingMaxMinMedian() {
        // Act
        MetricData max = eval(Expr.func("movingMax", Expr.name("a"), Expr.constant(3)), 30, 50, DATA).get(0);
        MetricData min = eval(Expr.func("movingMin", Expr.name("a"), Expr.constant(3)), 30, 50, DATA).get(0);
        MetricData median = eval(Expr.func("movingMedian", Expr.name("a"), Expr.constant(3)), 30, 50, DATA).get(0);

        // Assert
        assertValues(max, 3.0, 4.0);
        assertValues(min, 1.0, 2.0);
        assertValues(median, 2.0, 3.0);
    }

    public void testXFilesFactorRequiresEnoughPresentSamples() {
        // Act
        MetricData lenient = eval(Expr.func("movingAverage", Expr.name("gaps"), Expr.constant(2), Expr.constant(0.5)), 20, 50, DATA)
            .get(0);
        MetricData strict = eval(Expr.func("movingAverage", Expr.name("gaps"), Expr.constant(2), Expr.constant(0.6)), 20, 50, DATA)
            .get(0);

        // Assert
        assertValues(lenient, 1.0, Double.NaN, 4.0);
        assertValues(strict, Double.NaN, Double.NaN, Double.NaN);
    }

    public void testWindowShorterThanStepGivesAbsentValues() {
        // Act
        MetricData series = eval(Expr.func("movingAverage", Expr.name("a"), Expr.string("5s")), 10, 50, DATA).get(0);

        // Assert
        assertEquals(5, series.size());
        assertFalse(series.hasPresentValues());
    }

    public void testNegativeWindowIsRejected() {
        // Arrange
        Expr expr = Expr.func("movingAverage", Expr.name("a"), Expr.constant(-1));

        // Act
        GraphiteFunctionException e = expectThrows(GraphiteFunctionException.class, () -> eval(expr, 0, 50, DATA));

        // Assert
        assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind());
    }
}
