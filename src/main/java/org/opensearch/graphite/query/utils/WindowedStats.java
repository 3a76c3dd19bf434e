/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.utils;

import org.opensearch.graphite.query.consolidation.ConsolidationFunctions;

import java.util.Arrays;

/**
 * Fixed-capacity ring buffer with running statistics over the most recent samples.
 *
 * <p>{@link #push(double)} evicts the oldest sample once the buffer is full and updates the running sum, sum of
 * squares and NaN count in O(1). NaN marks a missing sample: it occupies a slot but does not contribute.</p>
 *
 * <p>{@link #stdev()} is the population standard deviation computed with Graphite's single pass formula
 * {@code sqrt(n*sumsq - sum^2) / n}.</p>
 *
 * <p>Not thread safe; each function call owns its buffers.</p>
 */
public class WindowedStats {

    private final double[] data;
    private int head;
    private int length;
    private double sum;
    private double sumsq;
    private int nans;

    /**
     * @param capacity number of samples in the window, must be positive
     */
    public WindowedStats(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("window capacity must be positive, got " + capacity);
        }
        this.data = new double[capacity];
    }

    public int capacity() {
        return data.length;
    }

    public void reset() {
        Arrays.fill(data, 0);
        head = 0;
        length = 0;
        sum = 0;
        sumsq = 0;
        nans = 0;
    }

    /**
     * Append a sample, evicting the oldest one when the window is full.
     *
     * @param value the sample, NaN for a missing one
     */
    public void push(double value) {
        double old = data[head];
        length++;
        data[head] = value;
        head++;
        if (head >= data.length) {
            head = 0;
        }

        if (!Double.isNaN(old)) {
            sum -= old;
            sumsq -= old * old;
        } else {
            nans--;
        }

        if (!Double.isNaN(value)) {
            sum += value;
            sumsq += value * value;
        } else {
            nans++;
        }
    }

    /**
     * @return number of non-NaN samples currently in the window
     */
    public int len() {
        if (length < data.length) {
            return length - nans;
        }
        return data.length - nans;
    }

    /**
     * @return number of slots filled so far, capped at the capacity
     */
    public int filled() {
        return Math.min(length, data.length);
    }

    public double sum() {
        return sum;
    }

    public double sumOfSquares() {
        return sumsq;
    }

    /**
     * Population standard deviation, 0 for an empty window.
     */
    public double stdev() {
        int l = len();
        if (l == 0) {
            return 0;
        }
        double n = l;
        return Math.sqrt(n * sumsq - (sum * sum)) / n;
    }

    /**
     * Mean of the non-NaN samples; NaN for an empty window.
     */
    public double mean() {
        return sum / len();
    }

    /**
     * Mean over the whole capacity, missing samples counting as zero.
     */
    public double meanZero() {
        return sum / data.length;
    }

    public double median() {
        return PercentileUtils.percentile(window(), 50, true);
    }

    public double max() {
        double result = Double.NaN;
        for (double v : window()) {
            if (!Double.isNaN(v) && (Double.isNaN(result) || v > result)) {
                result = v;
            }
        }
        return result;
    }

    public double min() {
        double result = Double.NaN;
        for (double v : window()) {
            if (!Double.isNaN(v) && (Double.isNaN(result) || v < result)) {
                result = v;
            }
        }
        return result;
    }

    public double count() {
        return len();
    }

    /**
     * Oldest sample minus every other non-NaN sample in the window.
     */
    public double diff() {
        double[] window = window();
        if (window.length == 0) {
            return Double.NaN;
        }
        double result = window[0];
        for (int i = 1; i < window.length; i++) {
            if (!Double.isNaN(window[i])) {
                result -= window[i];
            }
        }
        return result;
    }

    public double range() {
        double max = max();
        return Double.isNaN(max) ? Double.NaN : max - min();
    }

    /**
     * Product of the non-NaN samples; NaN for an empty window.
     */
    public double multiply() {
        return len() == 0 ? Double.NaN : ConsolidationFunctions.multiply(window());
    }

    /**
     * @return the most recently pushed sample
     */
    public double last() {
        if (head == 0) {
            return data[data.length - 1];
        }
        return data[head - 1];
    }

    /**
     * @return false if the window holds only NaN samples
     */
    public boolean isNonNull() {
        return len() > 0;
    }

    /**
     * @return the filled part of the window, oldest first
     */
    double[] window() {
        int filled = filled();
        double[] result = new double[filled];
        int start = length < data.length ? 0 : head;
        for (int i = 0; i < filled; i++) {
            result[i] = data[(start + i) % data.length];
        }
        return result;
    }
}
