/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.align;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.graphite.core.model.MetricData;
import org.opensearch.graphite.query.consolidation.ConsolidationFunctions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Brings series with different start, stop and step onto a common timeline before they are combined.
 *
 * <p>{@link #align(List)} pads every series with absent samples up to the overall {@code [minStart, maxStop)}
 * range. When extrapolation is enabled, series coarser than the finest step are first resampled to that step
 * by linear interpolation between consecutive samples.</p>
 *
 * <p>Inputs are never modified: padded series are new instances, series that already span the common range
 * are returned as the same instance, and the output keeps the input order. Aligning an aligned list is a
 * no-op.</p>
 */
public class SeriesAligner {

    private static final Logger logger = LogManager.getLogger(SeriesAligner.class);

    private final boolean extrapolatePoints;

    /**
     * @param extrapolatePoints resample coarse series to the finest step before padding
     */
    public SeriesAligner(boolean extrapolatePoints) {
        this.extrapolatePoints = extrapolatePoints;
    }

    public boolean isExtrapolatePoints() {
        return extrapolatePoints;
    }

    /**
     * Align the given series to a common start and stop.
     *
     * @param series series to align
     * @return aligned series, in input order
     */
    public List<MetricData> align(List<MetricData> series) {
        if (series == null || series.isEmpty()) {
            return series;
        }
        List<MetricData> working = series;
        if (extrapolatePoints) {
            working = extrapolate(series);
        }

        long minStart = working.get(0).getStartTime();
        long maxStop = working.get(0).getStopTime();
        for (MetricData s : working) {
            minStart = Math.min(minStart, s.getStartTime());
            maxStop = Math.max(maxStop, s.getStopTime());
        }

        List<MetricData> result = new ArrayList<>(working.size());
        for (MetricData s : working) {
            result.add(pad(s, minStart, maxStop));
        }
        return result;
    }

    private static MetricData pad(MetricData series, long minStart, long maxStop) {
        long step = series.getStepTime();
        int left = series.getStartTime() > minStart ? (int) ((series.getStartTime() - minStart) / step) : 0;
        int right = maxStop > series.getStopTime() ? (int) ((maxStop - series.getStopTime()) / step) : 0;
        if (left == 0 && right == 0 && series.getStartTime() == minStart && series.getStopTime() == maxStop) {
            return series;
        }

        int size = series.size();
        double[] values = new double[left + size + right];
        boolean[] absent = new boolean[values.length];
        Arrays.fill(values, Double.NaN);
        Arrays.fill(absent, true);
        for (int i = 0; i < size; i++) {
            values[left + i] = series.getValue(i);
            absent[left + i] = series.isAbsent(i);
        }
        return series.toBuilder().values(values, absent).startTime(minStart).stopTime(maxStop).build();
    }

    private List<MetricData> extrapolate(List<MetricData> series) {
        long minStep = series.get(0).getStepTime();
        for (MetricData s : series) {
            minStep = Math.min(minStep, s.getStepTime());
        }
        List<MetricData> result = new ArrayList<>(series.size());
        for (MetricData s : series) {
            if (s.getStepTime() > minStep && s.size() > 0) {
                logger.debug("Extrapolating series={} from step={} to step={}", s.getName(), s.getStepTime(), minStep);
                result.add(interpolate(s, minStep));
            } else {
                result.add(s);
            }
        }
        return result;
    }

    /**
     * Resample a series to a finer step, interpolating linearly between consecutive present samples.
     * Points after the last sample, or after a sample whose successor is absent, repeat that sample.
     */
    static MetricData interpolate(MetricData series, long targetStep) {
        long start = series.getStartTime();
        long step = series.getStepTime();
        int size = series.size();
        int newSize = (int) Math.ceil((double) (series.getStopTime() - start) / targetStep);
        double[] values = new double[newSize];
        boolean[] absent = new boolean[newSize];
        for (int j = 0; j < newSize; j++) {
            long offset = j * targetStep;
            int idx = (int) (offset / step);
            if (idx >= size || series.isAbsent(idx)) {
                values[j] = Double.NaN;
                absent[j] = true;
                continue;
            }
            double current = series.getValue(idx);
            double fraction = (double) (offset - idx * step) / step;
            if (fraction > 0 && idx + 1 < size && !series.isAbsent(idx + 1)) {
                current += (series.getValue(idx + 1) - current) * fraction;
            }
            values[j] = current;
        }
        return series.toBuilder().values(values, absent).stepTime(targetStep).stopTime(start + newSize * targetStep).build();
    }

    /**
     * Rescale every series to the least common multiple of all steps. Samples are combined with each series'
     * consolidation function and xFilesFactor; the start is moved back to a multiple of the common step.
     *
     * @param series series to rescale
     * @return rescaled series, in input order
     */
    public static List<MetricData> scaleToCommonStep(List<MetricData> series) {
        if (series == null || series.isEmpty()) {
            return series;
        }
        long commonStep = commonStep(series);
        List<MetricData> result = new ArrayList<>(series.size());
        for (MetricData s : series) {
            if (s.getStepTime() == commonStep) {
                result.add(s);
                continue;
            }
            result.add(scaleToStep(s, commonStep));
        }
        return result;
    }

    private static MetricData scaleToStep(MetricData series, long commonStep) {
        long step = series.getStepTime();
        int stepFactor = (int) (commonStep / step);
        long newStart = series.getStartTime() - Math.floorMod(series.getStartTime(), commonStep);
        int leading = (int) ((series.getStartTime() - newStart) / step);

        int padded = leading + series.size();
        int newSize = padded == 0 ? 0 : 1 + (padded - 1) / stepFactor;
        double[] raw = new double[newSize * stepFactor];
        Arrays.fill(raw, Double.NaN);
        for (int i = 0; i < series.size(); i++) {
            raw[leading + i] = series.valueOrNaN(i);
        }

        double[] values = new double[newSize];
        for (int b = 0; b < newSize; b++) {
            double[] batch = Arrays.copyOfRange(raw, b * stepFactor, (b + 1) * stepFactor);
            values[b] = ConsolidationFunctions.summarizeValues(series.getConsolidationFunc(), batch, series.getXFilesFactor());
        }
        return series.toBuilder()
            .values(values)
            .startTime(newStart)
            .stepTime(commonStep)
            .stopTime(newStart + newSize * commonStep)
            .resetValuesPerPoint()
            .build();
    }

    /**
     * @return the least common multiple of all steps
     */
    public static long commonStep(List<MetricData> series) {
        long[] steps = new long[series.size()];
        for (int i = 0; i < steps.length; i++) {
            steps[i] = series.get(i).getStepTime();
        }
        return lcm(steps);
    }

    /**
     * Greatest common divisor, Euclid's algorithm.
     */
    public static long gcd(long a, long b) {
        while (b != 0) {
            long t = b;
            b = a % b;
            a = t;
        }
        return a;
    }

    /**
     * Least common multiple of the arguments; 0 for none.
     */
    public static long lcm(long... args) {
        if (args.length == 0) {
            return 0;
        }
        long lcm = args[0];
        for (int i = 1; i < args.length; i++) {
            lcm = lcm / gcd(lcm, args[i]) * args[i];
        }
        return lcm;
    }

    /**
     * @return the number of buckets of {@code bucketSize} seconds needed to cover {@code [start, stop)}
     */
    public static long getBuckets(long start, long stop, long bucketSize) {
        return (long) Math.ceil((double) (stop - start) / bucketSize);
    }

    /**
     * Move {@code start} back to the closest day, hour or minute boundary, picking the largest unit not
     * exceeding {@code bucketSize}.
     */
    public static long alignStartToInterval(long start, long bucketSize) {
        for (long unit : new long[] { 86400, 3600, 60 }) {
            if (bucketSize >= unit) {
                return start - start % unit;
            }
        }
        return start;
    }

    /**
     * Align start down and stop up to multiples of {@code bucketSize}.
     *
     * @return {@code [alignedStart, alignedStop]}
     */
    public static long[] alignToBucketSize(long start, long stop, long bucketSize) {
        long alignedStart = start - Math.floorMod(start, bucketSize);
        long alignedStop = stop - Math.floorMod(stop, bucketSize);
        if (alignedStop != stop) {
            alignedStop += bucketSize;
        }
        return new long[] { alignedStart, alignedStop };
    }
}
