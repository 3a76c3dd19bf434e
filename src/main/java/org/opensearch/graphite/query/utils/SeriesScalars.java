/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.utils;

import org.opensearch.graphite.core.model.MetricData;
import org.opensearch.graphite.query.consolidation.ConsolidationFunctions;
import org.opensearch.graphite.query.consolidation.ValueReducer;

import java.util.function.ToDoubleFunction;

/**
 * Scalar keys computed from a whole series, used to rank and filter series. Absent samples never contribute.
 */
public final class SeriesScalars {

    private SeriesScalars() {
        // Utility class
    }

    /**
     * Mean of the present samples, NaN if there are none.
     */
    public static double average(MetricData series) {
        return ConsolidationFunctions.mean(series.valuesWithNaN());
    }

    /**
     * Last present sample, NaN if there is none.
     */
    public static double current(MetricData series) {
        int last = series.lastPresentIndex();
        return last < 0 ? Double.NaN : series.getValue(last);
    }

    public static double max(MetricData series) {
        return ConsolidationFunctions.max(series.valuesWithNaN());
    }

    public static double min(MetricData series) {
        return ConsolidationFunctions.min(series.valuesWithNaN());
    }

    public static double sum(MetricData series) {
        return ConsolidationFunctions.sum(series.valuesWithNaN());
    }

    /**
     * Key extractor for a consolidation function name such as {@code average}, {@code current} or {@code p90}.
     */
    public static ToDoubleFunction<MetricData> byName(String func) {
        ValueReducer reducer = ConsolidationFunctions.forName(func);
        return series -> reducer.reduce(series.valuesWithNaN());
    }
}
