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

public class TimeShiftFunctionTests extends OpenSearchTestCase {

    public void testShiftsSeriesIntoRequestedWindow() {
        // Arrange
        Map<String, List<MetricData>> data = Map.of("a", List.of(MetricData.of("a", 0, 10, 1, 2, 3, 4, 5, 6)));

        // Act
        List<MetricData> result = eval(Expr.func("timeShift", Expr.name("a"), Expr.string("1min")), 60, 120, data);

        // Assert
        MetricData series = result.get(0);
        assertEquals("timeShift(a,'-60',true)", series.getName());
        assertEquals(60, series.getStartTime());
        assertEquals(120, series.getStopTime());
        assertValues(series, 1, 2, 3, 4, 5, 6);
    }

    public void testResetEndTruncatesAtUntil() {
        // Arrange
        Map<String, List<MetricData>> data = Map.of("a", List.of(MetricData.of("a", 0, 10, 1, 2, 3, 4, 5, 6, 7, 8)));

        // Act
        MetricData reset = eval(Expr.func("timeShift", Expr.name("a"), Expr.string("1min")), 60, 120, data).get(0);
        MetricData kept = eval(Expr.func("timeShift", Expr.name("a"), Expr.string("1min"), Expr.bool(false)), 60, 120, data).get(0);

        // Assert
        assertEquals(120, reset.getStopTime());
        assertValues(reset, 1, 2, 3, 4, 5, 6);
        assertEquals("timeShift(a,'-60',false)", kept.getName());
        assertEquals(140, kept.getStopTime());
        assertEquals(8, kept.size());
    }

    public void testExplicitSignShiftsForward() {
        // Arrange
        Map<String, List<MetricData>> data = Map.of("a", List.of(MetricData.of("a", 100, 10, 1, 2)));

        // Act
        MetricData series = eval(Expr.func("timeShift", Expr.name("a"), Expr.string("+20s"), Expr.bool(false)), 80, 100, data).get(0);

        // Assert
        assertEquals(80, series.getStartTime());
        assertEquals(100, series.getStopTime());
    }
}
