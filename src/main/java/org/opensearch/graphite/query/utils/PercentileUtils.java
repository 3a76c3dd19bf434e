/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.utils;

/**
 * Order statistics over raw value arrays.
 *
 * <p>{@link #percentile(double[], double, boolean)} uses partial selection instead of a full sort: only the
 * {@code ceil(k) + 1} smallest values are moved to the front of a scratch copy, which is O(n) on average.
 * NaN values are ignored by every method in this class.</p>
 *
 * <h2>Interpolation:</h2>
 * <p>The rank is {@code k = (n - 1) * percent / 100}. When {@code k} is integral, or interpolation is
 * disabled, the value at rank {@code ceil(k)} is returned. Otherwise the result is
 * {@code top * r + secondTop * (1 - r)} where {@code r} is the fractional part of {@code k}, {@code top} is the
 * value at rank {@code ceil(k)} and {@code secondTop} the value just below it.</p>
 */
public final class PercentileUtils {

    private PercentileUtils() {
        // Utility class
    }

    /**
     * Calculate the percentile of the given values.
     *
     * @param data values, NaN entries are ignored; the array is not modified
     * @param percent percentile in [0, 100]
     * @param interpolate interpolate between the two closest ranks
     * @return the percentile, or NaN when there is no value or {@code percent} is out of range
     */
    public static double percentile(double[] data, double percent, boolean interpolate) {
        if (data == null || percent < 0 || percent > 100 || Double.isNaN(percent)) {
            return Double.NaN;
        }
        double[] filtered = withoutNaN(data);
        int n = filtered.length;
        if (n == 0) {
            return Double.NaN;
        }
        if (n == 1) {
            return filtered[0];
        }

        double k = ((n - 1) * percent) / 100;
        int length = (int) Math.ceil(k) + 1;

        selectSmallest(filtered, length);
        double top = Double.NEGATIVE_INFINITY;
        double secondTop = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < length; i++) {
            double val = filtered[i];
            if (val > top) {
                secondTop = top;
                top = val;
            } else if (val > secondTop) {
                secondTop = val;
            }
        }

        double remainder = k - (long) k;
        if (remainder == 0 || !interpolate) {
            return top;
        }
        return (top * remainder) + (secondTop * (1 - remainder));
    }

    /**
     * Median with interpolation.
     */
    public static double median(double[] data) {
        return percentile(data, 50, true);
    }

    /**
     * Mean of the non-NaN values, NaN if there are none.
     */
    public static double average(double[] data) {
        double sum = 0;
        int count = 0;
        for (double v : data) {
            if (Double.isNaN(v)) {
                continue;
            }
            sum += v;
            count++;
        }
        return count == 0 ? Double.NaN : sum / count;
    }

    /**
     * Population variance of the non-NaN values computed in two passes, NaN if there are none.
     */
    public static double variance(double[] data) {
        double mean = average(data);
        if (Double.isNaN(mean)) {
            return mean;
        }
        double squareSum = 0;
        int count = 0;
        for (double v : data) {
            if (Double.isNaN(v)) {
                continue;
            }
            squareSum += (mean - v) * (mean - v);
            count++;
        }
        return squareSum / count;
    }

    private static double[] withoutNaN(double[] data) {
        int count = 0;
        for (double v : data) {
            if (!Double.isNaN(v)) {
                count++;
            }
        }
        double[] result = new double[count];
        int i = 0;
        for (double v : data) {
            if (!Double.isNaN(v)) {
                result[i++] = v;
            }
        }
        return result;
    }

    /**
     * Rearrange {@code values} so that its first {@code count} entries are the {@code count} smallest, in no
     * particular order.
     */
    static void selectSmallest(double[] values, int count) {
        if (count <= 0 || count >= values.length) {
            return;
        }
        int target = count - 1;
        int left = 0;
        int right = values.length - 1;
        while (left < right) {
            int pivotIndex = partition(values, left, right, medianOfThree(values, left, right));
            if (pivotIndex == target) {
                return;
            } else if (pivotIndex < target) {
                left = pivotIndex + 1;
            } else {
                right = pivotIndex - 1;
            }
        }
    }

    private static int medianOfThree(double[] values, int left, int right) {
        int mid = left + (right - left) / 2;
        double a = values[left];
        double b = values[mid];
        double c = values[right];
        if ((a <= b && b <= c) || (c <= b && b <= a)) {
            return mid;
        }
        if ((b <= a && a <= c) || (c <= a && a <= b)) {
            return left;
        }
        return right;
    }

    private static int partition(double[] values, int left, int right, int pivotIndex) {
        double pivot = values[pivotIndex];
        swap(values, pivotIndex, right);
        int store = left;
        for (int i = left; i < right; i++) {
            if (values[i] < pivot) {
                swap(values, store, i);
                store++;
            }
        }
        swap(values, right, store);
        return store;
    }

    private static void swap(double[] values, int i, int j) {
        double tmp = values[i];
        values[i] = values[j];
        values[j] = tmp;
    }
}
