/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.aggregator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.graphite.core.model.MetricData;
import org.opensearch.graphite.query.align.SeriesAligner;
import org.opensearch.graphite.query.consolidation.ValueReducer;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Combines many series into one, index by index.
 *
 * <p>Inputs are aligned first. At every index the reducer sees only the present values of that index;
 * an index where no series has a value is absent in the result and the reducer is not called. The result
 * is named {@code <function>(<raw arguments>)} and carries the step and consolidation function of the
 * first input.</p>
 */
public class SeriesAggregator {

    private static final Logger logger = LogManager.getLogger(SeriesAggregator.class);

    private final SeriesAligner aligner;

    public SeriesAggregator(SeriesAligner aligner) {
        this.aligner = Objects.requireNonNull(aligner, "aligner cannot be null");
    }

    public SeriesAligner getAligner() {
        return aligner;
    }

    /**
     * Aggregate {@code series} with {@code reducer}.
     *
     * @param functionName name used in the result name
     * @param rawArgs argument text used in the result name
     * @param series inputs; an empty list yields an empty result
     * @param reducer reducer applied to the present values of each index
     * @return a list holding the single aggregated series, or an empty list
     */
    public List<MetricData> aggregate(String functionName, String rawArgs, List<MetricData> series, ValueReducer reducer) {
        if (series == null || series.isEmpty()) {
            return List.of();
        }
        List<MetricData> aligned = aligner.align(series);
        MetricData first = aligned.get(0);

        int length = 0;
        for (MetricData s : aligned) {
            length = Math.max(length, s.size());
        }

        double[] values = new double[length];
        double[] scratch = new double[aligned.size()];
        for (int i = 0; i < length; i++) {
            int present = 0;
            for (MetricData s : aligned) {
                if (i < s.size() && !s.isAbsent(i)) {
                    scratch[present++] = s.getValue(i);
                }
            }
            if (present == 0) {
                values[i] = Double.NaN;
                continue;
            }
            double[] presentValues = present == scratch.length ? scratch.clone() : Arrays.copyOf(scratch, present);
            values[i] = reducer.reduce(presentValues);
        }

        String name = functionName + "(" + rawArgs + ")";
        logger.debug("Aggregated {} series into {}", aligned.size(), name);
        MetricData result = MetricData.builder(name)
            .startTime(first.getStartTime())
            .stepTime(first.getStepTime())
            .values(values)
            .consolidationFunc(first.getConsolidationFunc())
            .xFilesFactor(first.getXFilesFactor())
            .build();
        return List.of(result);
    }
}
