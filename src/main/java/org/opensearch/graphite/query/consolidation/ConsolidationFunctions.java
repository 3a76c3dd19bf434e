/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.consolidation;

import org.opensearch.graphite.common.ErrorKind;
import org.opensearch.graphite.common.GraphiteFunctionException;
import org.opensearch.graphite.query.utils.PercentileUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Named reducers used for consolidation, {@code consolidateBy}, {@code aggregate} and step scaling.
 *
 * <p>Every reducer ignores NaN inputs and returns NaN when no value contributes. Besides the fixed names,
 * percentile reducers are available as {@code pNN} or {@code pNN.N} (e.g. {@code p50}, {@code p99.9}).</p>
 */
public final class ConsolidationFunctions {

    private static final Pattern PERCENTILE_NAME = Pattern.compile("p([0-9]*[.])?[0-9]+");

    private static final Map<String, ValueReducer> REDUCERS;

    /** Names accepted by {@code summarize}-style functions, in documentation order. */
    public static final List<String> AVAILABLE_SUMMARIZERS = List.of(
        "sum",
        "total",
        "avg",
        "average",
        "avg_zero",
        "max",
        "min",
        "last",
        "current",
        "first",
        "range",
        "rangeOf",
        "median",
        "multiply",
        "diff",
        "count",
        "stddev"
    );

    static {
        Map<String, ValueReducer> reducers = new LinkedHashMap<>();
        reducers.put("average", ConsolidationFunctions::mean);
        reducers.put("avg", ConsolidationFunctions::mean);
        reducers.put("avg_zero", ConsolidationFunctions::meanZero);
        reducers.put("count", ConsolidationFunctions::count);
        reducers.put("diff", ConsolidationFunctions::diff);
        reducers.put("max", ConsolidationFunctions::max);
        reducers.put("maximum", ConsolidationFunctions::max);
        reducers.put("median", PercentileUtils::median);
        reducers.put("min", ConsolidationFunctions::min);
        reducers.put("minimum", ConsolidationFunctions::min);
        reducers.put("multiply", ConsolidationFunctions::multiply);
        reducers.put("range", ConsolidationFunctions::range);
        reducers.put("rangeOf", ConsolidationFunctions::range);
        reducers.put("sum", ConsolidationFunctions::sum);
        reducers.put("total", ConsolidationFunctions::sum);
        reducers.put("stddev", ConsolidationFunctions::stddev);
        reducers.put("first", ConsolidationFunctions::first);
        reducers.put("last", ConsolidationFunctions::last);
        reducers.put("current", ConsolidationFunctions::last);
        REDUCERS = Collections.unmodifiableMap(reducers);
    }

    private ConsolidationFunctions() {
        // Utility class
    }

    /**
     * Look up a reducer by name. Matching of the fixed names is case insensitive except for {@code rangeOf}.
     *
     * @param name reducer name
     * @return the reducer
     * @throws GraphiteFunctionException with {@link ErrorKind#INVALID_ARGUMENT} for unknown names
     */
    public static ValueReducer forName(String name) {
        if (name == null) {
            throw GraphiteFunctionException.of(ErrorKind.INVALID_ARGUMENT, "invalid consolidation null");
        }
        ValueReducer reducer = REDUCERS.get(name);
        if (reducer == null) {
            reducer = REDUCERS.get(name.toLowerCase(Locale.ROOT));
        }
        if (reducer != null) {
            return reducer;
        }
        if (PERCENTILE_NAME.matcher(name).matches()) {
            double percent = Double.parseDouble(name.substring(1));
            return values -> PercentileUtils.percentile(values, percent, true);
        }
        throw GraphiteFunctionException.of(ErrorKind.INVALID_ARGUMENT, "invalid consolidation " + name);
    }

    /**
     * @return true if {@link #forName(String)} would accept the name
     */
    public static boolean isValid(String name) {
        if (name == null) {
            return false;
        }
        return REDUCERS.containsKey(name)
            || REDUCERS.containsKey(name.toLowerCase(Locale.ROOT))
            || PERCENTILE_NAME.matcher(name).matches();
    }

    /**
     * @return the fixed reducer names
     */
    public static List<String> availableNames() {
        return List.copyOf(REDUCERS.keySet());
    }

    /**
     * Apply a named reducer, returning NaN if the share of non-NaN values is below {@code xFilesFactor}.
     */
    public static double summarizeValues(String name, double[] values, float xFilesFactor) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double result = forName(name).reduce(values);
        if (xFilesFactor > 0 && (float) countPresent(values) / values.length < xFilesFactor) {
            return Double.NaN;
        }
        return result;
    }

    public static double sum(double[] values) {
        double sum = 0;
        boolean absent = true;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                sum += v;
                absent = false;
            }
        }
        return absent ? Double.NaN : sum;
    }

    public static double mean(double[] values) {
        return PercentileUtils.average(values);
    }

    /**
     * Mean where NaN values count as zero; NaN only if every value is NaN.
     */
    public static double meanZero(double[] values) {
        double sum = 0;
        int present = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                sum += v;
                present++;
            }
        }
        return present == 0 ? Double.NaN : sum / values.length;
    }

    public static double max(double[] values) {
        double max = Double.NEGATIVE_INFINITY;
        boolean absent = true;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                absent = false;
                if (v > max) {
                    max = v;
                }
            }
        }
        return absent ? Double.NaN : max;
    }

    public static double min(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        boolean absent = true;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                absent = false;
                if (v < min) {
                    min = v;
                }
            }
        }
        return absent ? Double.NaN : min;
    }

    public static double first(double[] values) {
        for (double v : values) {
            if (!Double.isNaN(v)) {
                return v;
            }
        }
        return Double.NaN;
    }

    public static double last(double[] values) {
        for (int i = values.length - 1; i >= 0; i--) {
            if (!Double.isNaN(values[i])) {
                return values[i];
            }
        }
        return Double.NaN;
    }

    public static double count(double[] values) {
        int count = countPresent(values);
        return count == 0 ? Double.NaN : count;
    }

    /**
     * First value minus every following present value. NaN when the first value is NaN.
     */
    public static double diff(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double result = values[0];
        for (int i = 1; i < values.length; i++) {
            if (!Double.isNaN(values[i])) {
                result -= values[i];
            }
        }
        return result;
    }

    public static double range(double[] values) {
        double max = max(values);
        return Double.isNaN(max) ? Double.NaN : max - min(values);
    }

    public static double multiply(double[] values) {
        double result = 1.0;
        boolean absent = true;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                result *= v;
                absent = false;
            }
        }
        return absent ? Double.NaN : result;
    }

    public static double stddev(double[] values) {
        return Math.sqrt(PercentileUtils.variance(values));
    }

    private static int countPresent(double[] values) {
        int count = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                count++;
            }
        }
        return count;
    }
}
