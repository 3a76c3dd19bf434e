/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.serde;

import org.opensearch.common.xcontent.XContentFactory;
import org.opensearch.core.common.bytes.BytesReference;
import org.opensearch.core.xcontent.ToXContent;
import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.graphite.common.ErrorKind;
import org.opensearch.graphite.common.GraphiteFunctionException;
import org.opensearch.graphite.core.model.MetricData;
import org.opensearch.test.OpenSearchTestCase;

import java.io.IOException;
import java.util.List;

import static org.opensearch.graphite.utils.GraphiteTestUtils.assertValues;

public class MetricDataFormatsTests extends OpenSearchTestCase {

    public void testJsonRoundTrip() throws IOException {
        // Arrange
        List<MetricData> series = List.of(
            MetricData.of("a.b;dc=east", 60, 10, 1, Double.NaN, 3.5),
            MetricData.of("c", 0, 5, 7)
        );

        // Act
        List<MetricData> parsed = MetricDataFormats.parseJson(toJson(series));

        // Assert
        assertEquals(series, parsed);
    }

    public void testJsonStepFallsBackToTimestamps() {
        // Act
        List<MetricData> parsed = MetricDataFormats.parseJson(
            "[{\"target\":\"a\",\"datapoints\":[[1,100],[null,130],[2,160]]},{\"target\":\"b\",\"datapoints\":[[4,10]]}]"
        );

        // Assert
        MetricData a = parsed.get(0);
        assertEquals(100, a.getStartTime());
        assertEquals(30, a.getStepTime());
        assertEquals(190, a.getStopTime());
        assertValues(a, 1, Double.NaN, 2);
        assertEquals(1, parsed.get(1).getStepTime());
    }

    public void testMalformedJsonIsInvalidArgument() {
        // Assert
        assertInvalid(() -> MetricDataFormats.parseJson("{\"target\":\"a\"}"));
        assertInvalid(() -> MetricDataFormats.parseJson("[{\"datapoints\":[]}]"));
        assertInvalid(() -> MetricDataFormats.parseJson("[{\"target\":\"a\",\"datapoints\":[[1]]}]"));
        assertInvalid(() -> MetricDataFormats.parseJson("[1]"));
    }

    public void testRawRoundTripKeepsCommasInNames() {
        // Arrange
        List<MetricData> series = List.of(MetricData.of("sumSeries(a,b)", 0, 10, 1, Double.NaN, 2.5));

        // Act
        String raw = MetricDataFormats.toRaw(series);
        List<MetricData> parsed = MetricDataFormats.parseRaw(raw);

        // Assert
        assertEquals("sumSeries(a,b),0,30,10|1,None,2.5\n", raw);
        assertEquals(series, parsed);
    }

    public void testMalformedRawIsInvalidArgument() {
        // Assert
        assertInvalid(() -> MetricDataFormats.parseRaw("a,0,30,10"));
        assertInvalid(() -> MetricDataFormats.parseRaw("a,0,30|1"));
        assertInvalid(() -> MetricDataFormats.parseRaw("a,0,x,10|1"));
        assertInvalid(() -> MetricDataFormats.parseRaw("a,0,30,10|1,y"));
    }

    public void testCsvQuotesNamesAndLeavesAbsentEmpty() {
        // Arrange
        List<MetricData> series = List.of(MetricData.of("x\"y", 0, 60, 1, Double.NaN));

        // Act
        String csv = MetricDataFormats.toCsv(series);

        // Assert
        assertEquals("\"x\"\"y\",1970-01-01 00:00:00,1\n\"x\"\"y\",1970-01-01 00:01:00,\n", csv);
    }

    private static String toJson(List<MetricData> series) throws IOException {
        try (XContentBuilder builder = XContentFactory.jsonBuilder()) {
            builder.startArray();
            for (MetricData s : series) {
                s.toXContent(builder, ToXContent.EMPTY_PARAMS);
            }
            builder.endArray();
            return BytesReference.bytes(builder).utf8ToString();
        }
    }

    private static void assertInvalid(ThrowingRunnable runnable) {
        GraphiteFunctionException e = expectThrows(GraphiteFunctionException.class, runnable);
        assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind());
    }
}
