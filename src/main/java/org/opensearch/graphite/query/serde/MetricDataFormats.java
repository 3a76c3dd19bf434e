/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.serde;

import org.opensearch.common.xcontent.json.JsonXContent;
import org.opensearch.core.xcontent.DeprecationHandler;
import org.opensearch.core.xcontent.NamedXContentRegistry;
import org.opensearch.core.xcontent.XContentParser;
import org.opensearch.graphite.common.ErrorKind;
import org.opensearch.graphite.common.GraphiteFunctionException;
import org.opensearch.graphite.core.model.MetricData;
import org.opensearch.graphite.query.consolidation.ConsolidatedValues;

import java.io.IOException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Text renderings of series beside the JSON of {@link MetricData#toXContent}.
 *
 * <h2>Formats:</h2>
 * <ul>
 *   <li>JSON: a list of {@code {"target", "datapoints", "tags", "step"}} objects, parsed back by {@link #parseJson}</li>
 *   <li>CSV: one {@code "name",yyyy-MM-dd HH:mm:ss,value} line per point in UTC, write only</li>
 *   <li>raw: {@code name,start,stop,step|v1,None,...} per series, {@code None} marking absent points</li>
 * </ul>
 *
 * <p>CSV and raw output use the consolidated view of each series.</p>
 */
public final class MetricDataFormats {

    public static final String RAW_ABSENT = "None";

    private static final DateTimeFormatter CSV_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT)
        .withZone(ZoneOffset.UTC);

    private MetricDataFormats() {}

    /**
     * Parse a JSON array of rendered series. A series without a {@code step} field takes the distance of its first two
     * timestamps, or one second when it has fewer points.
     *
     * @throws GraphiteFunctionException {@link ErrorKind#INVALID_ARGUMENT} on malformed input
     */
    public static List<MetricData> parseJson(String json) {
        List<Object> items;
        try (
            XContentParser parser = JsonXContent.jsonXContent.createParser(
                NamedXContentRegistry.EMPTY,
                DeprecationHandler.THROW_UNSUPPORTED_OPERATION,
                json
            )
        ) {
            if (parser.nextToken() != XContentParser.Token.START_ARRAY) {
                throw GraphiteFunctionException.of(ErrorKind.INVALID_ARGUMENT, "expected a JSON array of series");
            }
            items = parser.list();
        } catch (IOException e) {
            throw new GraphiteFunctionException(ErrorKind.INVALID_ARGUMENT, "malformed series JSON", e);
        }
        List<MetricData> result = new ArrayList<>(items.size());
        for (Object item : items) {
            if (!(item instanceof Map)) {
                throw GraphiteFunctionException.of(ErrorKind.INVALID_ARGUMENT, "expected a series object, got " + item);
            }
            result.add(parseSeries((Map<?, ?>) item));
        }
        return result;
    }

    private static MetricData parseSeries(Map<?, ?> object) {
        Object target = object.get("target");
        if (!(target instanceof String)) {
            throw GraphiteFunctionException.of(ErrorKind.INVALID_ARGUMENT, "series without target");
        }
        Object rawPoints = object.get("datapoints");
        List<?> points = rawPoints instanceof List ? (List<?>) rawPoints : List.of();
        double[] values = new double[points.size()];
        boolean[] absent = new boolean[points.size()];
        long[] timestamps = new long[points.size()];
        for (int i = 0; i < points.size(); i++) {
            if (!(points.get(i) instanceof List) || ((List<?>) points.get(i)).size() != 2) {
                throw GraphiteFunctionException.of(ErrorKind.INVALID_ARGUMENT, "datapoint must be [value, timestamp]");
            }
            List<?> point = (List<?>) points.get(i);
            if (point.get(0) == null) {
                values[i] = Double.NaN;
                absent[i] = true;
            } else {
                values[i] = ((Number) point.get(0)).doubleValue();
            }
            timestamps[i] = ((Number) point.get(1)).longValue();
        }

        long step;
        if (object.get("step") instanceof Number) {
            step = ((Number) object.get("step")).longValue();
        } else {
            step = timestamps.length > 1 ? timestamps[1] - timestamps[0] : 1;
        }
        long start = timestamps.length > 0 ? timestamps[0] : 0;

        MetricData.Builder builder = MetricData.builder((String) target)
            .startTime(start)
            .stepTime(step)
            .values(values, absent)
            .deriveStopTime();
        if (object.get("tags") instanceof Map) {
            for (Map.Entry<?, ?> tag : ((Map<?, ?>) object.get("tags")).entrySet()) {
                builder.tag(String.valueOf(tag.getKey()), String.valueOf(tag.getValue()));
            }
        }
        return builder.build();
    }

    public static String toCsv(List<MetricData> series) {
        StringBuilder out = new StringBuilder();
        for (MetricData s : series) {
            String quoted = "\"" + s.getName().replace("\"", "\"\"") + "\"";
            ConsolidatedValues view = s.getConsolidatedValues();
            for (int i = 0; i < view.size(); i++) {
                out.append(quoted).append(',').append(CSV_TIME.format(Instant.ofEpochSecond(view.timestampAt(i)))).append(',');
                if (!view.absent()[i]) {
                    out.append(formatValue(view.values()[i]));
                }
                out.append('\n');
            }
        }
        return out.toString();
    }

    public static String toRaw(List<MetricData> series) {
        StringBuilder out = new StringBuilder();
        for (MetricData s : series) {
            ConsolidatedValues view = s.getConsolidatedValues();
            long stop = view.startTime() + view.size() * view.stepTime();
            out.append(s.getName()).append(',').append(view.startTime()).append(',').append(stop).append(',').append(view.stepTime());
            out.append('|');
            for (int i = 0; i < view.size(); i++) {
                if (i > 0) {
                    out.append(',');
                }
                out.append(view.absent()[i] ? RAW_ABSENT : formatValue(view.values()[i]));
            }
            out.append('\n');
        }
        return out.toString();
    }

    /**
     * Parse lines written by {@link #toRaw}. Names may contain commas, the header is split from the right.
     *
     * @throws GraphiteFunctionException {@link ErrorKind#INVALID_ARGUMENT} on a malformed line
     */
    public static List<MetricData> parseRaw(String raw) {
        List<MetricData> result = new ArrayList<>();
        for (String line : raw.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            int bar = line.lastIndexOf('|');
            if (bar < 0) {
                throw GraphiteFunctionException.of(ErrorKind.INVALID_ARGUMENT, "raw line without '|': " + line);
            }
            String header = line.substring(0, bar);
            int stepComma = header.lastIndexOf(',');
            int stopComma = stepComma <= 0 ? -1 : header.lastIndexOf(',', stepComma - 1);
            int startComma = stopComma <= 0 ? -1 : header.lastIndexOf(',', stopComma - 1);
            if (startComma < 0) {
                throw GraphiteFunctionException.of(ErrorKind.INVALID_ARGUMENT, "raw header needs name,start,stop,step: " + header);
            }
            try {
                long start = Long.parseLong(header.substring(startComma + 1, stopComma));
                long stop = Long.parseLong(header.substring(stopComma + 1, stepComma));
                long step = Long.parseLong(header.substring(stepComma + 1));
                String body = line.substring(bar + 1);
                String[] tokens = body.isEmpty() ? new String[0] : body.split(",", -1);
                double[] values = new double[tokens.length];
                boolean[] absent = new boolean[tokens.length];
                for (int i = 0; i < tokens.length; i++) {
                    if (RAW_ABSENT.equals(tokens[i])) {
                        values[i] = Double.NaN;
                        absent[i] = true;
                    } else {
                        values[i] = Double.parseDouble(tokens[i]);
                    }
                }
                result.add(
                    MetricData.builder(header.substring(0, startComma))
                        .startTime(start)
                        .stopTime(stop)
                        .stepTime(step)
                        .values(values, absent)
                        .build()
                );
            } catch (NumberFormatException e) {
                throw new GraphiteFunctionException(ErrorKind.INVALID_ARGUMENT, "malformed raw line: " + line, e);
            }
        }
        return result;
    }

    private static String formatValue(double v) {
        if (v == Math.rint(v) && !Double.isInfinite(v) && Math.abs(v) < 1e15) {
            return Long.toString((long) v);
        }
        return Double.toString(v);
    }
}
