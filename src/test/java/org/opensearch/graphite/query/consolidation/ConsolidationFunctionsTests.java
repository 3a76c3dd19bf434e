/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.consolidation;

import org.opensearch.graphite.common.ErrorKind;
import org.opensearch.graphite.common.GraphiteFunctionException;
import org.opensearch.test.OpenSearchTestCase;

public class ConsolidationFunctionsTests extends OpenSearchTestCase {

    public void testReducersIgnoreNaN() {
        // Arrange
        double[] values = { 1.0, Double.NaN, 3.0 };

        // Assert
        assertEquals(4.0, ConsolidationFunctions.forName("sum").reduce(values), 1e-9);
        assertEquals(2.0, ConsolidationFunctions.forName("avg").reduce(values), 1e-9);
        assertEquals(3.0, ConsolidationFunctions.forName("max").reduce(values), 1e-9);
        assertEquals(1.0, ConsolidationFunctions.forName("min").reduce(values), 1e-9);
        assertEquals(2.0, ConsolidationFunctions.forName("count").reduce(values), 1e-9);
    }

    public void testAllNaNGivesNaN() {
        // Assert
        assertTrue(Double.isNaN(ConsolidationFunctions.forName("sum").reduce(new double[] { Double.NaN, Double.NaN })));
        assertTrue(Double.isNaN(ConsolidationFunctions.forName("max").reduce(new double[] { Double.NaN })));
    }

    public void testNamesAreCaseInsensitive() {
        // Assert
        assertTrue(ConsolidationFunctions.isValid("SUM"));
        assertTrue(ConsolidationFunctions.isValid("maximum"));
        assertTrue(ConsolidationFunctions.isValid("p99.9"));
        assertFalse(ConsolidationFunctions.isValid("bogus"));
        assertFalse(ConsolidationFunctions.isValid(null));
    }

    public void testUnknownNameIsInvalidArgument() {
        // Act
        GraphiteFunctionException e = expectThrows(GraphiteFunctionException.class, () -> ConsolidationFunctions.forName("bogus"));

        // Assert
        assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind());
    }

    public void testSummarizeValuesAppliesXFilesFactor() {
        // Arrange
        double[] values = { 1.0, Double.NaN, Double.NaN, Double.NaN };

        // Assert
        assertTrue(Double.isNaN(ConsolidationFunctions.summarizeValues("sum", values, 0.5f)));
        assertEquals(1.0, ConsolidationFunctions.summarizeValues("sum", values, 0.25f), 1e-9);
        assertTrue(Double.isNaN(ConsolidationFunctions.summarizeValues("sum", new double[0], 0f)));
    }
}
