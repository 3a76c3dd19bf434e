/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.utils;

import org.opensearch.graphite.core.model.MetricData;
import org.opensearch.test.OpenSearchTestCase;

import java.util.List;
import java.util.NoSuchElementException;

public class SeriesHeapTests extends OpenSearchTestCase {

    private static final List<MetricData> SERIES = List.of(
        MetricData.of("three", 0, 1, 3),
        MetricData.of("none", 0, 1, Double.NaN),
        MetricData.of("five", 0, 1, 5),
        MetricData.of("one", 0, 1, 1)
    );

    public void testHighestSkipsNaNAndSortsDescending() {
        // Act
        List<MetricData> result = SeriesHeap.highest(SERIES, 2, s -> s.valueOrNaN(0));

        // Assert
        assertEquals(2, result.size());
        assertEquals("five", result.get(0).getName());
        assertEquals("three", result.get(1).getName());
    }

    public void testHighestWithMoreRequestedThanAvailable() {
        // Act
        List<MetricData> result = SeriesHeap.highest(SERIES, 10, s -> s.valueOrNaN(0));

        // Assert
        assertEquals(3, result.size());
        assertEquals("one", result.get(2).getName());
    }

    public void testLowestSortsAscending() {
        // Act
        List<MetricData> result = SeriesHeap.lowest(SERIES.subList(2, 4), 2, s -> s.valueOrNaN(0));

        // Assert
        assertEquals("one", result.get(0).getName());
        assertEquals("five", result.get(1).getName());
    }

    public void testLowestReturnsInputWhenTooFew() {
        // Act
        List<MetricData> result = SeriesHeap.lowest(SERIES, 5, s -> s.valueOrNaN(0));

        // Assert
        assertSame(SERIES, result);
    }

    public void testNonPositiveCountSelectsNothing() {
        // Assert
        assertTrue(SeriesHeap.highest(SERIES, 0, s -> s.valueOrNaN(0)).isEmpty());
        assertTrue(SeriesHeap.lowest(SERIES, -1, s -> s.valueOrNaN(0)).isEmpty());
    }

    public void testPopOrderAndEmptyHeapGuard() {
        // Arrange
        SeriesHeap heap = new SeriesHeap(1);
        heap.push(new IndexedValue(0, 2));
        heap.push(new IndexedValue(1, -1));
        heap.push(new IndexedValue(2, 2));

        // Act
        IndexedValue first = heap.pop();
        IndexedValue second = heap.pop();
        IndexedValue third = heap.pop();

        // Assert
        assertEquals(1, first.index());
        assertEquals(0, second.index());
        assertEquals(2, third.index());
        assertTrue(heap.isEmpty());
        expectThrows(NoSuchElementException.class, heap::pop);
        expectThrows(NoSuchElementException.class, heap::peek);
    }
}
