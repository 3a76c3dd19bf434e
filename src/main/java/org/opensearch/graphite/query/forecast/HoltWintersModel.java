/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.forecast;

/**
 * Additive triple exponential smoothing as done by Graphite's Holt-Winters functions.
 *
 * <h2>Parameters:</h2>
 * <ul>
 *   <li>level and seasonal smoothing {@code alpha = gamma = 0.1}</li>
 *   <li>trend smoothing {@code beta = 0.0035}</li>
 *   <li>season length {@code seasonality / step} samples</li>
 * </ul>
 *
 * <h2>Missing samples:</h2>
 * <p>A NaN sample resets the level to unknown, zeroes the trend, seasonal and deviation terms, emits the pending
 * prediction and leaves no prediction for the next sample. The next present sample restarts the level from its
 * own value.</p>
 */
public final class HoltWintersModel {

    public static final double ALPHA = 0.1;
    public static final double BETA = 0.0035;
    public static final double GAMMA = 0.1;

    /** Default season length in seconds. */
    public static final long DEFAULT_SEASONALITY = 86400L;

    private HoltWintersModel() {
        // Utility class
    }

    /**
     * Predictions and deviations, one per input sample; NaN where there is none.
     */
    public record Analysis(double[] predictions, double[] deviations) {
    }

    /**
     * Lower and upper confidence bands, one per input sample; NaN where there is no prediction.
     */
    public record Bands(double[] lower, double[] upper) {
    }

    /**
     * Run the model over {@code series}.
     *
     * @param series samples, NaN for missing ones
     * @param step seconds between samples
     * @param seasonality season length in seconds
     */
    public static Analysis analyze(double[] series, long step, long seasonality) {
        int seasonLength = (int) Math.max(1, seasonality / step);
        int n = series.length;
        double[] intercepts = new double[n];
        double[] slopes = new double[n];
        double[] seasonals = new double[n];
        double[] predictions = new double[n];
        double[] deviations = new double[n];

        double nextPrediction = Double.NaN;
        for (int i = 0; i < n; i++) {
            double actual = series[i];
            if (Double.isNaN(actual)) {
                intercepts[i] = Double.NaN;
                slopes[i] = 0;
                seasonals[i] = 0;
                predictions[i] = nextPrediction;
                deviations[i] = 0;
                nextPrediction = Double.NaN;
                continue;
            }

            double lastIntercept;
            double lastSlope;
            double prediction;
            if (i == 0) {
                lastIntercept = actual;
                lastSlope = 0;
                prediction = actual;
            } else {
                lastIntercept = Double.isNaN(intercepts[i - 1]) ? actual : intercepts[i - 1];
                lastSlope = slopes[i - 1];
                prediction = nextPrediction;
            }

            double lastSeasonal = lastSeason(seasonals, i, seasonLength);
            double nextLastSeasonal = lastSeason(seasonals, i + 1, seasonLength);
            double lastSeasonalDev = lastSeason(deviations, i, seasonLength);

            double intercept = ALPHA * (actual - lastSeasonal) + (1 - ALPHA) * (lastIntercept + lastSlope);
            double slope = BETA * (intercept - lastIntercept) + (1 - BETA) * lastSlope;
            double seasonal = GAMMA * (actual - intercept) + (1 - GAMMA) * lastSeasonal;
            double known = Double.isNaN(prediction) ? 0 : prediction;
            double deviation = GAMMA * Math.abs(actual - known) + (1 - GAMMA) * lastSeasonalDev;

            nextPrediction = intercept + slope + nextLastSeasonal;
            intercepts[i] = intercept;
            slopes[i] = slope;
            seasonals[i] = seasonal;
            predictions[i] = prediction;
            deviations[i] = deviation;
        }
        return new Analysis(predictions, deviations);
    }

    /**
     * Confidence bands {@code prediction +- delta * deviation}.
     */
    public static Bands confidenceBands(double[] series, long step, long seasonality, double delta) {
        Analysis analysis = analyze(series, step, seasonality);
        int n = series.length;
        double[] lower = new double[n];
        double[] upper = new double[n];
        for (int i = 0; i < n; i++) {
            double prediction = analysis.predictions()[i];
            double deviation = analysis.deviations()[i];
            if (Double.isNaN(prediction) || Double.isNaN(deviation)) {
                lower[i] = Double.NaN;
                upper[i] = Double.NaN;
                continue;
            }
            double scaled = deviation * delta;
            lower[i] = prediction - scaled;
            upper[i] = prediction + scaled;
        }
        return new Bands(lower, upper);
    }

    // only the first season falls back to 0
    private static double lastSeason(double[] values, int i, int seasonLength) {
        int j = i - seasonLength;
        return j >= 0 ? values[j] : 0;
    }
}
