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

public class StdevFunctionTests extends OpenSearchTestCase {

    private static final Map<String, List<MetricData>> DATA = Map.of(
        "a",
        List.of(MetricData.of("a", 0, 10, 1, 2, 3, 4)),
        "gaps",
        List.of(MetricData.of("gaps", 0, 10, 1, Double.NaN, Double.NaN, Double.NaN, 5))
    );

    public void testRollingStdev() {
        // Act
        MetricData series = eval(Expr.func("stdev", Expr.name("a"), Expr.constant(3)), 0, 40, DATA).get(0);

        // Assert
        assertEquals("stdev(a,3)", series.getName());
        assertEquals("3", series.getTags().get("stdev"));
        assertValues(series, 0.0, 0.5, Math.sqrt(6) / 3, Math.sqrt(6) / 3);
    }

    public void testSparseWindowIsAbsent() {
        // Act
        MetricData series = eval(Expr.func("stdev", Expr.name("gaps"), Expr.constant(3)), 0, 50, DATA).get(0);

        // Assert
        assertValues(series, 0.0, Double.NaN, Double.NaN, Double.NaN, Double.NaN);
    }

    public void testPointsMustBePositive() {
        // Act
        GraphiteFunctionException e = expectThrows(
            GraphiteFunctionException.class,
            () -> eval(Expr.func("stdev", Expr.name("a"), Expr.constant(0)), 0, 40, DATA)
        );

        // Assert
        assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind());
    }
}
