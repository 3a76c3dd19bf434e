/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.lang.graphite.function;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.graphite.common.ErrorKind;
import org.opensearch.graphite.common.GraphiteFunctionException;
import org.opensearch.graphite.core.model.MetricData;
import org.opensearch.graphite.core.model.MetricRequest;
import org.opensearch.graphite.lang.graphite.expr.Expr;
import org.opensearch.graphite.query.function.Evaluator;
import org.opensearch.graphite.query.function.FunctionDescription;
import org.opensearch.graphite.query.function.FunctionParam;
import org.opensearch.graphite.query.function.FunctionType;
import org.opensearch.graphite.query.function.GraphiteFunction;
import org.opensearch.graphite.query.function.QueryContext;
import org.opensearch.graphite.query.function.SeriesArgs;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code timeShiftByMetric(seriesList, markSource, versionRankIndex)}: aligns metrics of different release
 * versions on the deployment time of their version.
 *
 * <h2>Marks:</h2>
 * <p>Every series of {@code markSource} names a version {@code <major>_<minor>} in its last node and has a
 * present sample at the time that version was rolled out. The newest minor of every major is a leading mark;
 * at least two leading marks are required.</p>
 *
 * <h2>Shift:</h2>
 * <p>A leading mark {@code k} positions behind the newest one shifts its metrics {@code k * step} seconds
 * forward. A metric carries its version in node {@code versionRankIndex} of its name, either the full
 * {@code major_minor} token or just the major. Metrics with no matching mark are dropped.</p>
 */
public class TimeShiftByMetricFunction implements GraphiteFunction {

    public static final String NAME = "timeShiftByMetric";

    private static final Logger logger = LogManager.getLogger(TimeShiftByMetricFunction.class);

    private static final Pattern MARK_PATTERN = Pattern.compile("(\\d+)_(\\d+)");

    private static final Comparator<VersionMark> NEWEST_FIRST = Comparator.comparingInt(VersionMark::major)
        .thenComparingInt(VersionMark::minor)
        .reversed();

    /**
     * A deployment mark.
     *
     * @param token the version node, e.g. {@code 1_3}
     * @param position index of the last present sample
     */
    record VersionMark(String token, int position, int major, int minor) {
    }

    @Override
    public List<MetricData> evaluate(
        Evaluator evaluator,
        QueryContext ctx,
        Expr expr,
        long from,
        long until,
        Map<MetricRequest, List<MetricData>> values
    ) {
        List<MetricData> metrics = SeriesArgs.firstSeriesArg(evaluator, ctx, expr, from, until, values);
        if (expr.argsLength() < 2) {
            throw new GraphiteFunctionException(ErrorKind.MISSING_TIMESERIES);
        }
        List<MetricData> marks = SeriesArgs.seriesArg(evaluator, ctx, expr.arg(1), from, until, values);
        int versionRank = expr.intArg(2);

        long step = validate(metrics, marks);
        List<VersionMark> leading = leadingMarks(marks);
        Map<String, Long> offsets = offsets(leading, step);
        logger.debug("Resolved version offsets {}", offsets);
        return shift(metrics, versionRank, offsets);
    }

    /**
     * Check both data sets and return their common step.
     */
    static long validate(List<MetricData> metrics, List<MetricData> marks) {
        checkDataSetSize("metrics", metrics);
        checkDataSetSize("marks", marks);

        int pointsQty = -1;
        long step = -1;
        List<MetricData> all = new ArrayList<>(metrics);
        all.addAll(marks);
        for (MetricData series : all) {
            if (pointsQty == -1) {
                pointsQty = series.size();
                if (pointsQty == 0) {
                    throw GraphiteFunctionException.of(ErrorKind.EMPTY_SERIES, series.getName());
                }
                step = series.getStepTime();
            } else if (pointsQty != series.size()) {
                throw GraphiteFunctionException.of(
                    ErrorKind.MISMATCHED_SERIES_LENGTH,
                    "length of values for series " + series.getName() + " differs from others"
                );
            } else if (step != series.getStepTime()) {
                throw GraphiteFunctionException.of(
                    ErrorKind.MISMATCHED_SERIES_LENGTH,
                    "step of series " + series.getName() + " differs from others"
                );
            }
        }
        return step;
    }

    private static void checkDataSetSize(String name, List<MetricData> dataSet) {
        if (dataSet.size() < 2) {
            throw new GraphiteFunctionException(
                ErrorKind.TOO_FEW_DATASETS,
                "bad data: need at least 2 " + name + " data sets to process, got " + dataSet.size()
            );
        }
    }

    /**
     * Newest mark of every major version, newest first.
     */
    static List<VersionMark> leadingMarks(List<MetricData> marks) {
        List<VersionMark> versions = new ArrayList<>(marks.size());
        for (MetricData mark : marks) {
            String token = lastNode(mark.getNameTag());
            Matcher matcher = MARK_PATTERN.matcher(token);
            if (!matcher.find()) {
                continue;
            }
            int position = mark.lastPresentIndex();
            if (position < 0) {
                continue;
            }
            versions.add(new VersionMark(token, position, Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2))));
        }

        versions.sort(NEWEST_FIRST);
        List<VersionMark> leading = new ArrayList<>();
        for (VersionMark version : versions) {
            if (leading.isEmpty() || leading.get(leading.size() - 1).major() != version.major()) {
                leading.add(version);
            }
        }
        if (leading.size() < 2) {
            throw new GraphiteFunctionException(
                ErrorKind.TOO_FEW_MARKS,
                "bad data: could not find 2 marks, only " + leading.size() + " found"
            );
        }
        return leading;
    }

    /**
     * Offset in seconds of every leading mark, keyed by mark token in newest first order.
     */
    static Map<String, Long> offsets(List<VersionMark> leading, long step) {
        int topPosition = leading.get(0).position();
        Map<String, Long> result = new LinkedHashMap<>();
        for (VersionMark version : leading) {
            result.put(version.token(), (topPosition - version.position()) * step);
        }
        return result;
    }

    private static List<MetricData> shift(List<MetricData> metrics, int versionRank, Map<String, Long> offsets) {
        List<MetricData> result = new ArrayList<>(metrics.size());
        for (MetricData metric : metrics) {
            String[] nodes = metric.getNameTag().split("\\.", -1);
            if (versionRank < 0 || versionRank >= nodes.length) {
                continue;
            }
            Long offset = lookup(offsets, nodes[versionRank]);
            if (offset == null) {
                logger.debug("No version mark for {}, dropping it", metric.getName());
                continue;
            }
            result.add(
                metric.toBuilder()
                    .name(NAME + "(" + metric.getName() + ")")
                    .startTime(metric.getStartTime() + offset)
                    .stopTime(metric.getStopTime() + offset)
                    .build()
            );
        }
        return result;
    }

    private static Long lookup(Map<String, Long> offsets, String token) {
        Long exact = offsets.get(token);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<String, Long> entry : offsets.entrySet()) {
            if (entry.getKey().startsWith(token + "_")) {
                return entry.getValue();
            }
        }
        for (Map.Entry<String, Long> entry : offsets.entrySet()) {
            if (entry.getKey().startsWith(token)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static String lastNode(String name) {
        int dot = name.lastIndexOf('.');
        return dot < 0 ? name : name.substring(dot + 1);
    }

    @Override
    public Map<String, FunctionDescription> description() {
        return Map.of(
            NAME,
            FunctionDescription.builder(NAME, "timeShiftByMetric(seriesList, markSource, versionRankIndex)")
                .description(
                    "Takes a seriesList with wildcard in versionRankIndex rank and applies shift to the closest version "
                        + "from markSource"
                )
                .group("Transform")
                .param(FunctionParam.seriesList())
                .param(FunctionParam.of("markSource", FunctionType.SERIES_LIST).required())
                .param(FunctionParam.of("versionRankIndex", FunctionType.INTEGER).required())
                .nameChange()
                .valuesChange()
                .build()
        );
    }
}
