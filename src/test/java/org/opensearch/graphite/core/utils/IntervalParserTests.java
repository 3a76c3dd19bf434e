/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.core.utils;

import org.opensearch.graphite.common.ErrorKind;
import org.opensearch.graphite.common.GraphiteFunctionException;
import org.opensearch.test.OpenSearchTestCase;

public class IntervalParserTests extends OpenSearchTestCase {

    public void testUnitsAndDefaultSign() {
        // Assert
        assertEquals(30, IntervalParser.parseSeconds("30", 1));
        assertEquals(-300, IntervalParser.parseSeconds("5min", -1));
        assertEquals(3600, IntervalParser.parseSeconds("1h", 1));
        assertEquals(2 * 86400, IntervalParser.parseSeconds("2d", 1));
        assertEquals(7 * 86400, IntervalParser.parseSeconds("1w", 1));
        assertEquals(30 * 86400, IntervalParser.parseSeconds("1mon", 1));
        assertEquals(365 * 86400, IntervalParser.parseSeconds("1y", 1));
    }

    public void testExplicitSignOverridesDefault() {
        // Assert
        assertEquals(-60, IntervalParser.parseSeconds("-1min", 1));
        assertEquals(60, IntervalParser.parseSeconds("+1min", -1));
    }

    public void testCompoundInterval() {
        // Assert
        assertEquals(5400, IntervalParser.parseSeconds("1h30min", 1));
        assertEquals(-5400, IntervalParser.parseSeconds("-1h30min", 1));
    }

    public void testUnknownUnitIsBadType() {
        // Act
        GraphiteFunctionException e = expectThrows(GraphiteFunctionException.class, () -> IntervalParser.parseSeconds("5parsecs", 1));

        // Assert
        assertEquals(ErrorKind.BAD_TYPE, e.getKind());
    }

    public void testMalformedIntervalIsBadType() {
        // Assert
        for (String interval : new String[] { "", "-", "h" }) {
            GraphiteFunctionException e = expectThrows(GraphiteFunctionException.class, () -> IntervalParser.parseSeconds(interval, 1));
            assertEquals(interval, ErrorKind.BAD_TYPE, e.getKind());
        }
    }
}
