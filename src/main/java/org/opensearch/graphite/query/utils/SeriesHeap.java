/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.utils;

import org.opensearch.graphite.core.model.MetricData;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.ToDoubleFunction;

/**
 * Binary min-heap of {@link IndexedValue}, used to pick the top or bottom N series by a scalar key.
 *
 * <h2>Selection contract:</h2>
 * <ul>
 *   <li>{@link #lowest(List, int, ToDoubleFunction)}: when there are fewer series than requested every input is
 *   returned in input order; otherwise the {@code n} series with the smallest keys, ascending.</li>
 *   <li>{@link #highest(List, int, ToDoubleFunction)}: series whose key is NaN are skipped; the {@code n} series
 *   with the largest keys, descending. A bounded heap of size {@code n} keeps memory at O(n).</li>
 * </ul>
 */
public final class SeriesHeap {

    private IndexedValue[] items;
    private int size;

    public SeriesHeap(int initialCapacity) {
        this.items = new IndexedValue[Math.max(1, initialCapacity)];
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public void push(IndexedValue item) {
        if (size == items.length) {
            items = Arrays.copyOf(items, items.length * 2);
        }
        items[size] = item;
        siftUp(size);
        size++;
    }

    /**
     * @return the smallest item without removing it
     */
    public IndexedValue peek() {
        if (size == 0) {
            throw new NoSuchElementException("heap is empty");
        }
        return items[0];
    }

    /**
     * Remove and return the smallest item.
     */
    public IndexedValue pop() {
        IndexedValue top = peek();
        size--;
        items[0] = items[size];
        items[size] = null;
        if (size > 0) {
            siftDown(0);
        }
        return top;
    }

    /**
     * Replace the smallest item, keeping the heap size.
     */
    public void replaceTop(IndexedValue item) {
        peek();
        items[0] = item;
        siftDown(0);
    }

    private void siftUp(int i) {
        IndexedValue item = items[i];
        while (i > 0) {
            int parent = (i - 1) >>> 1;
            if (items[parent].compareTo(item) <= 0) {
                break;
            }
            items[i] = items[parent];
            i = parent;
        }
        items[i] = item;
    }

    private void siftDown(int i) {
        IndexedValue item = items[i];
        int half = size >>> 1;
        while (i < half) {
            int child = 2 * i + 1;
            int right = child + 1;
            if (right < size && items[right].compareTo(items[child]) < 0) {
                child = right;
            }
            if (item.compareTo(items[child]) <= 0) {
                break;
            }
            items[i] = items[child];
            i = child;
        }
        items[i] = item;
    }

    /**
     * Select the {@code n} series with the smallest key.
     *
     * @param series candidates
     * @param n number of series to keep
     * @param key scalar extracted from every series
     * @return selected series, ascending by key, or every input if there are fewer than {@code n}
     */
    public static List<MetricData> lowest(List<MetricData> series, int n, ToDoubleFunction<MetricData> key) {
        if (n <= 0) {
            return List.of();
        }
        if (series.size() < n) {
            return series;
        }
        SeriesHeap heap = new SeriesHeap(series.size());
        for (int i = 0; i < series.size(); i++) {
            heap.push(new IndexedValue(i, key.applyAsDouble(series.get(i))));
        }
        List<MetricData> result = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            result.add(series.get(heap.pop().index()));
        }
        return result;
    }

    /**
     * Select the {@code n} series with the largest key, skipping series whose key is NaN.
     *
     * @param series candidates
     * @param n number of series to keep
     * @param key scalar extracted from every series
     * @return selected series, descending by key
     */
    public static List<MetricData> highest(List<MetricData> series, int n, ToDoubleFunction<MetricData> key) {
        if (n <= 0) {
            return List.of();
        }
        SeriesHeap heap = new SeriesHeap(n);
        for (int i = 0; i < series.size(); i++) {
            double value = key.applyAsDouble(series.get(i));
            if (Double.isNaN(value)) {
                continue;
            }
            IndexedValue item = new IndexedValue(i, value);
            if (heap.size() < n) {
                heap.push(item);
            } else if (value > heap.peek().value()) {
                heap.replaceTop(item);
            }
        }
        MetricData[] result = new MetricData[heap.size()];
        for (int i = result.length - 1; i >= 0; i--) {
            result[i] = series.get(heap.pop().index());
        }
        return Arrays.asList(result);
    }
}
