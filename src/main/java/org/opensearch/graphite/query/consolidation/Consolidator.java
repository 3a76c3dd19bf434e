/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.consolidation;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.graphite.core.model.MetricData;

import java.util.List;
import java.util.Objects;

/**
 * Reduces the resolution of result series so that they fit in a caller supplied number of points.
 *
 * <h2>Bucket count:</h2>
 * <p>Over the overall time range {@code [min(start), max(stop))} of all results, a series with step {@code s}
 * has {@code floor(range / s)} points. When that exceeds {@code maxDataPoints} the series gets
 * {@code valuesPerPoint = ceil(points / maxDataPoints)} and is later read in buckets of that many raw
 * samples, the trailing partial bucket included.</p>
 *
 * <h2>Bucket placement:</h2>
 * <ul>
 *   <li><strong>Nudge:</strong> with {@link ConsolidationPolicy#nudgeStartTime()} the first bucket boundary is a
 *   multiple of the bucket width in epoch time. Samples before the first complete bucket are dropped, never
 *   merged into the next bucket, so sliding windows over the same data yield the same buckets.</li>
 *   <li><strong>Highest timestamp:</strong> with {@link ConsolidationPolicy#useBucketsHighestTimestamp()} each point
 *   is labelled with the timestamp of the last sample of its bucket.</li>
 * </ul>
 */
public class Consolidator {

    private static final Logger logger = LogManager.getLogger(Consolidator.class);

    private final ConsolidationPolicy policy;

    public Consolidator(ConsolidationPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
    }

    public ConsolidationPolicy getPolicy() {
        return policy;
    }

    /**
     * Set the consolidation factor on every series whose point count over the shared range exceeds
     * {@code maxDataPoints}. Series that already fit are left untouched.
     *
     * @param results series about to be serialized
     * @param maxDataPoints maximum number of points per series
     */
    public void consolidate(List<MetricData> results, int maxDataPoints) {
        if (results == null || results.isEmpty() || maxDataPoints <= 0) {
            return;
        }
        long startTime = results.get(0).getStartTime();
        long stopTime = results.get(0).getStopTime();
        for (MetricData series : results) {
            startTime = Math.min(startTime, series.getStartTime());
            stopTime = Math.max(stopTime, series.getStopTime());
        }

        long timeRange = stopTime - startTime;
        if (timeRange <= 0) {
            return;
        }

        for (MetricData series : results) {
            double numberOfDataPoints = Math.floor((double) timeRange / series.getStepTime());
            if (numberOfDataPoints > maxDataPoints) {
                int valuesPerPoint = (int) Math.ceil(numberOfDataPoints / maxDataPoints);
                logger.debug("Consolidating series={} valuesPerPoint={}", series.getName(), valuesPerPoint);
                series.setValuesPerPoint(valuesPerPoint, policy);
            }
        }
    }

    /**
     * Compute the consolidated view of a series.
     *
     * @param series the raw series
     * @param valuesPerPoint raw samples per bucket
     * @param policy bucket placement policy
     * @param reducer bucket reducer
     * @return consolidated values, a copy of the raw values when {@code valuesPerPoint <= 1}
     */
    public static ConsolidatedValues bucketize(MetricData series, int valuesPerPoint, ConsolidationPolicy policy, ValueReducer reducer) {
        int size = series.size();
        long step = series.getStepTime();
        if (valuesPerPoint <= 1) {
            double[] values = new double[size];
            boolean[] absent = new boolean[size];
            for (int i = 0; i < size; i++) {
                absent[i] = series.isAbsent(i);
                values[i] = absent[i] ? Double.NaN : series.getValue(i);
            }
            return new ConsolidatedValues(series.getStartTime(), step, values, absent);
        }

        long bucketWidth = step * valuesPerPoint;
        int first = 0;
        long firstTimestamp = series.getStartTime();
        long label = firstTimestamp;
        if (policy.nudgeStartTime()) {
            long offset = Math.floorMod(firstTimestamp, bucketWidth);
            if (offset >= step) {
                // leading bucket is partial: skip to the next boundary
                first = (int) Math.min(size, (bucketWidth - offset + step - 1) / step);
                firstTimestamp += first * step;
                offset = Math.floorMod(firstTimestamp, bucketWidth);
            }
            // an offset below one step still covers the whole bucket, so it is kept and labelled at the boundary
            label = firstTimestamp - offset;
        }
        if (policy.useBucketsHighestTimestamp()) {
            label = firstTimestamp + (valuesPerPoint - 1) * step;
        }

        int remaining = size - first;
        int buckets = (remaining + valuesPerPoint - 1) / valuesPerPoint;
        double[] values = new double[buckets];
        boolean[] absent = new boolean[buckets];
        for (int b = 0; b < buckets; b++) {
            int from = first + b * valuesPerPoint;
            int to = Math.min(size, from + valuesPerPoint);
            double[] bucket = new double[to - from];
            for (int i = from; i < to; i++) {
                bucket[i - from] = series.isAbsent(i) ? Double.NaN : series.getValue(i);
            }
            double reduced = reducer.reduce(bucket);
            values[b] = reduced;
            absent[b] = Double.isNaN(reduced);
        }
        return new ConsolidatedValues(label, bucketWidth, values, absent);
    }
}
