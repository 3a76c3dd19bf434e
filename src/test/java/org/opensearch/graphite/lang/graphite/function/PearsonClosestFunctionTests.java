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
import java.util.Set;
import java.util.stream.Collectors;

import static org.opensearch.graphite.utils.GraphiteTestUtils.eval;

public class PearsonClosestFunctionTests extends OpenSearchTestCase {

    private static final Map<String, List<MetricData>> DATA = Map.of(
        "ref",
        List.of(MetricData.of("ref", 0, 10, 1, 2, 3, 4)),
        "c.*",
        List.of(
            MetricData.of("c.up", 0, 10, 2, 4, 6, 8),
            MetricData.of("c.down", 0, 10, 4, 3, 2, 1),
            MetricData.of("c.noisy", 0, 10, 1, 3, 2, 4),
            MetricData.of("c.short", 0, 10, 1, 2, 3)
        )
    );

    public void testPositiveDirectionOrdersByStrength() {
        // Act
        List<MetricData> result = eval(closest(2, "pos"), 0, 40, DATA);

        // Assert
        assertEquals(List.of("c.up", "c.noisy"), names(result));
    }

    public void testNegativeDirectionKeepsOnlyNegativeCorrelations() {
        // Act
        List<MetricData> result = eval(closest(5, "neg"), 0, 40, DATA);

        // Assert
        assertEquals(List.of("c.down"), names(result));
    }

    public void testAbsoluteDirectionSkipsMismatchedLengths() {
        // Act
        List<MetricData> result = eval(closest(10, "abs"), 0, 40, DATA);

        // Assert
        assertEquals(3, result.size());
        assertEquals("c.noisy", result.get(2).getName());
        assertEquals(Set.of("c.up", "c.down"), Set.copyOf(names(result.subList(0, 2))));
    }

    public void testUnknownDirectionIsRejected() {
        // Act
        GraphiteFunctionException e = expectThrows(GraphiteFunctionException.class, () -> eval(closest(1, "up"), 0, 40, DATA));

        // Assert
        assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind());
    }

    public void testWildcardReferenceIsRejected() {
        // Act
        GraphiteFunctionException e = expectThrows(
            GraphiteFunctionException.class,
            () -> eval(Expr.func("pearsonClosest", Expr.name("c.*"), Expr.name("ref"), Expr.constant(1)), 0, 40, DATA)
        );

        // Assert
        assertEquals(ErrorKind.WILDCARD_NOT_ALLOWED, e.getKind());
    }

    private static Expr closest(int n, String direction) {
        return Expr.func("pearsonClosest", Expr.name("ref"), Expr.name("c.*"), Expr.constant(n), Expr.string(direction));
    }

    private static List<String> names(List<MetricData> series) {
        return series.stream().map(MetricData::getName).collect(Collectors.toList());
    }
}
