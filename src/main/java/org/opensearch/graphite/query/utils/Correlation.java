/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.utils;

/**
 * Pearson product-moment correlation over paired samples.
 */
public final class Correlation {

    private Correlation() {
        // Utility class
    }

    /**
     * Pearson correlation of two equally sized arrays. Pairs where either value is NaN are skipped.
     *
     * @return the coefficient in {@code [-1, 1]}, NaN when either side has zero variance or no pair is complete
     * @throws IllegalArgumentException if the arrays differ in length
     */
    public static double pearson(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("pearson needs arrays of equal length, got " + a.length + " and " + b.length);
        }
        double sumA = 0;
        double sumB = 0;
        int n = 0;
        for (int i = 0; i < a.length; i++) {
            if (!Double.isNaN(a[i]) && !Double.isNaN(b[i])) {
                sumA += a[i];
                sumB += b[i];
                n++;
            }
        }
        if (n == 0) {
            return Double.NaN;
        }
        double meanA = sumA / n;
        double meanB = sumB / n;

        double numerator = 0;
        double sumAA = 0;
        double sumBB = 0;
        for (int i = 0; i < a.length; i++) {
            if (!Double.isNaN(a[i]) && !Double.isNaN(b[i])) {
                double da = a[i] - meanA;
                double db = b[i] - meanB;
                numerator += da * db;
                sumAA += da * da;
                sumBB += db * db;
            }
        }
        double denominator = Math.sqrt(sumAA) * Math.sqrt(sumBB);
        if (denominator == 0) {
            return Double.NaN;
        }
        return numerator / denominator;
    }

    /**
     * Pearson correlation of the current contents of two windows of the same capacity.
     */
    public static double pearson(WindowedStats a, WindowedStats b) {
        return pearson(a.window(), b.window());
    }
}
